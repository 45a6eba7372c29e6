package com.knowledgeengine.common.similarity;

import com.knowledgeengine.common.model.ScoredDocument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Deterministic ordering of scored documents: descending score, then ascending id.
 */
public final class Ranking {

    public static final Comparator<ScoredDocument> BY_SCORE_DESC_THEN_ID =
        Comparator.comparingDouble(ScoredDocument::score).reversed()
            .thenComparingLong(ScoredDocument::documentId);

    private Ranking() {
    }

    /**
     * Select the best {@code k} candidates without sorting the whole list.
     * The heap keeps the worst retained candidate on top so it can be evicted.
     */
    public static List<ScoredDocument> topK(Iterable<ScoredDocument> candidates, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }

        PriorityQueue<ScoredDocument> heap = new PriorityQueue<>(Math.min(k, 1024) + 1, BY_SCORE_DESC_THEN_ID.reversed());
        for (ScoredDocument candidate : candidates) {
            heap.offer(candidate);
            if (heap.size() > k) {
                heap.poll();
            }
        }

        List<ScoredDocument> result = new ArrayList<>(heap);
        result.sort(BY_SCORE_DESC_THEN_ID);
        return result;
    }
}
