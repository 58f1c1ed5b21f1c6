package com.example.kbassist.index;

import com.example.kbassist.model.Fragment;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Baseline index: keeps fragments in insertion order and scans every fragment of the
 * requested scope on each search. A read/write lock gives single-writer, many-reader access.
 */
@Slf4j
public class ExhaustiveVectorIndex implements VectorIndex {

    private final int dimension;
    private final List<Fragment> entries = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ExhaustiveVectorIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public int store(List<Fragment> fragments) {
        List<Fragment> accepted = VectorMath.indexable(fragments, dimension);
        if (accepted.isEmpty()) {
            return 0;
        }
        lock.writeLock().lock();
        try {
            for (Fragment fragment : accepted) {
                entries.add(VectorMath.detached(fragment));
            }
            log.debug("Stored {} fragments, index size {}", accepted.size(), entries.size());
            return accepted.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Fragment> search(float[] queryVector, String scopeId, int topK) {
        VectorMath.requireDimension("query vector", queryVector, dimension);
        VectorMath.requireTopK(topK);

        lock.readLock().lock();
        try {
            List<RankedFragment> ranked = new ArrayList<>();
            for (int position = 0; position < entries.size(); position++) {
                Fragment fragment = entries.get(position);
                if (!fragment.getKnowledgeBaseId().equals(scopeId)) {
                    continue;
                }
                ranked.add(new RankedFragment(fragment, VectorMath.squaredL2(queryVector, fragment.getEmbedding()), position));
            }
            return ranked.stream()
                    .sorted(RankedFragment.NEAREST_FIRST)
                    .limit(topK)
                    .map(entry -> VectorMath.detached(entry.fragment()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int deleteByDocument(String documentId) {
        return removeIf(fragment -> fragment.getDocumentId() != null && fragment.getDocumentId().equals(documentId));
    }

    @Override
    public int deleteByScope(String scopeId) {
        return removeIf(fragment -> fragment.getKnowledgeBaseId().equals(scopeId));
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private int removeIf(Predicate<Fragment> doomed) {
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.removeIf(doomed);
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
