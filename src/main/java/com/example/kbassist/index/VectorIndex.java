package com.example.kbassist.index;

import com.example.kbassist.model.Fragment;
import java.util.List;

/**
 * Similarity search over fragment embeddings, partitioned by knowledge base.
 *
 * <p>All vectors held by one index share the dimension fixed at construction. Implementations
 * are safe for concurrent searches; {@link #store}, {@link #deleteByDocument} and
 * {@link #deleteByScope} exclude each other and searches never observe a half-applied
 * mutation.
 */
public interface VectorIndex {

    /**
     * Appends every fragment that carries an embedding; fragments without one are skipped.
     * Storing the same fragment id twice keeps both entries.
     *
     * @return number of fragments actually stored
     * @throws VectorDimensionException if an embedding has the wrong dimension; nothing is stored
     */
    int store(List<Fragment> fragments);

    /**
     * Returns up to {@code topK} fragments of {@code scopeId}, nearest first by squared L2 distance.
     *
     * @throws VectorDimensionException if the query vector has the wrong dimension
     */
    List<Fragment> search(float[] queryVector, String scopeId, int topK);

    /** @return number of fragments removed */
    int deleteByDocument(String documentId);

    /** @return number of fragments removed */
    int deleteByScope(String scopeId);

    int size();

    int dimension();
}
