package com.example.kbassist.index;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.example.kbassist.model.Fragment;
import com.example.kbassist.model.FragmentMetadata;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Index backed by a LangChain4j {@link InMemoryEmbeddingStore}.
 *
 * <p>The store is never mutated after it is published. Every write builds a new
 * {@link Snapshot} (fragment arena, store, generation number) from the surviving fragments and
 * swaps it in atomically, so a concurrent search always runs against one complete generation.
 * Store entries are keyed by their arena position; scope filtering uses the
 * {@code knowledge_base_id} segment metadata and candidates are re-ranked by exact squared L2.
 */
@Slf4j
public class LangChain4jVectorIndex implements VectorIndex {

    private final int dimension;
    private final AtomicReference<Snapshot> active;
    private final ReentrantLock writeLock = new ReentrantLock();

    public LangChain4jVectorIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.active = new AtomicReference<>(Snapshot.build(0, List.of()));
    }

    @Override
    public int store(List<Fragment> fragments) {
        List<Fragment> accepted = VectorMath.indexable(fragments, dimension);
        if (accepted.isEmpty()) {
            return 0;
        }
        writeLock.lock();
        try {
            Snapshot current = active.get();
            List<Fragment> next = new ArrayList<>(current.fragments().size() + accepted.size());
            next.addAll(current.fragments());
            for (Fragment fragment : accepted) {
                next.add(VectorMath.detached(fragment));
            }
            publish(Snapshot.build(current.generation() + 1, next));
            return accepted.size();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Fragment> search(float[] queryVector, String scopeId, int topK) {
        VectorMath.requireDimension("query vector", queryVector, dimension);
        VectorMath.requireTopK(topK);

        Snapshot snapshot = active.get();
        if (snapshot.fragments().isEmpty() || scopeId == null) {
            return List.of();
        }

        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(Embedding.from(queryVector))
                .maxResults(snapshot.fragments().size())
                .minScore(0.0)
                .filter(metadataKey(FragmentMetadata.KNOWLEDGE_BASE_ID).isEqualTo(scopeId))
                .build();

        List<EmbeddingMatch<TextSegment>> matches = snapshot.store().search(request).matches();
        return matches.stream()
                .map(match -> {
                    int position = Integer.parseInt(match.embeddingId());
                    Fragment fragment = snapshot.fragments().get(position);
                    return new RankedFragment(
                            fragment, VectorMath.squaredL2(queryVector, fragment.getEmbedding()), position);
                })
                .sorted(RankedFragment.NEAREST_FIRST)
                .limit(topK)
                .map(ranked -> VectorMath.detached(ranked.fragment()))
                .toList();
    }

    @Override
    public int deleteByDocument(String documentId) {
        return rebuildWithout(fragment -> fragment.getDocumentId() != null && fragment.getDocumentId().equals(documentId));
    }

    @Override
    public int deleteByScope(String scopeId) {
        return rebuildWithout(fragment -> fragment.getKnowledgeBaseId().equals(scopeId));
    }

    @Override
    public int size() {
        return active.get().fragments().size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    long generation() {
        return active.get().generation();
    }

    private int rebuildWithout(Predicate<Fragment> doomed) {
        writeLock.lock();
        try {
            Snapshot current = active.get();
            List<Fragment> survivors = current.fragments().stream().filter(doomed.negate()).toList();
            int removed = current.fragments().size() - survivors.size();
            if (removed > 0) {
                publish(Snapshot.build(current.generation() + 1, survivors));
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    private void publish(Snapshot next) {
        active.set(next);
        log.debug("Published index generation {} with {} fragments", next.generation(), next.fragments().size());
    }

    private record Snapshot(long generation, List<Fragment> fragments, InMemoryEmbeddingStore<TextSegment> store) {

        static Snapshot build(long generation, List<Fragment> fragments) {
            InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
            if (!fragments.isEmpty()) {
                List<String> ids = new ArrayList<>(fragments.size());
                List<Embedding> embeddings = new ArrayList<>(fragments.size());
                List<TextSegment> segments = new ArrayList<>(fragments.size());
                for (int position = 0; position < fragments.size(); position++) {
                    Fragment fragment = fragments.get(position);
                    ids.add(Integer.toString(position));
                    embeddings.add(Embedding.from(fragment.getEmbedding().clone()));
                    // the segment only carries what the filter needs; text stays in the arena
                    segments.add(TextSegment.from(fragment.getId(),
                            new Metadata().put(FragmentMetadata.KNOWLEDGE_BASE_ID, fragment.getKnowledgeBaseId())));
                }
                store.addAll(ids, embeddings, segments);
            }
            return new Snapshot(generation, List.copyOf(fragments), store);
        }
    }
}
