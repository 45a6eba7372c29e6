package com.knowledgeengine.common.similarity;

import java.util.Set;

/** Сходство дискретных множеств (используется для сопоставления концептов) */
public final class SetSimilarity {

    private SetSimilarity() {
    }

    /**
     * Jaccard similarity {@code |A ∩ B| / |A ∪ B|}.
     * Two empty sets give 0.0 rather than an undefined ratio.
     */
    public static double jaccard(Set<?> first, Set<?> second) {
        if (first.isEmpty() && second.isEmpty()) {
            return 0.0;
        }

        Set<?> smaller = first.size() <= second.size() ? first : second;
        Set<?> larger = smaller == first ? second : first;

        int intersection = 0;
        for (Object element : smaller) {
            if (larger.contains(element)) {
                intersection++;
            }
        }
        int union = first.size() + second.size() - intersection;
        return (double) intersection / union;
    }
}
