package com.example.kbassist.index;

import com.example.kbassist.model.Fragment;
import java.util.List;
import java.util.Objects;

final class VectorMath {

    private VectorMath() {}

    static double squaredL2(float[] left, float[] right) {
        double sum = 0;
        for (int i = 0; i < left.length; i++) {
            double diff = (double) left[i] - right[i];
            sum += diff * diff;
        }
        return sum;
    }

    static void requireDimension(String what, float[] vector, int dimension) {
        Objects.requireNonNull(vector, what);
        if (vector.length != dimension) {
            throw new VectorDimensionException(what, dimension, vector.length);
        }
    }

    /** Validates the whole batch up front so a bad vector never leaves a partial write behind. */
    static List<Fragment> indexable(List<Fragment> fragments, int dimension) {
        if (fragments == null || fragments.isEmpty()) {
            return List.of();
        }
        List<Fragment> accepted = fragments.stream()
                .filter(Objects::nonNull)
                .filter(Fragment::hasEmbedding)
                .toList();
        for (Fragment fragment : accepted) {
            requireText("fragment id", fragment.getId());
            requireText("knowledge base id of fragment " + fragment.getId(), fragment.getKnowledgeBaseId());
            requireDimension("embedding of fragment " + fragment.getId(), fragment.getEmbedding(), dimension);
        }
        return accepted;
    }

    /** Copy whose embedding array is not shared with the index. */
    static Fragment detached(Fragment fragment) {
        return fragment.toBuilder().embedding(fragment.getEmbedding().clone()).build();
    }

    static void requireTopK(int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
    }

    static void requireText(String what, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
    }
}
