package com.knowledgeengine.common.similarity;

import com.knowledgeengine.common.model.ScoredDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RankingTest {

    @Test
    void ordersByDescendingScoreThenAscendingId() {
        List<ScoredDocument> candidates = List.of(
                new ScoredDocument(7, 0.5),
                new ScoredDocument(3, 0.9),
                new ScoredDocument(5, 0.5),
                new ScoredDocument(1, 0.0)
        );

        List<ScoredDocument> top = Ranking.topK(candidates, 10);

        assertThat(top).extracting(ScoredDocument::documentId).containsExactly(3L, 5L, 7L, 1L);
    }

    @Test
    void keepsOnlyTopK() {
        List<ScoredDocument> candidates = List.of(
                new ScoredDocument(4, 0.2),
                new ScoredDocument(2, 0.2),
                new ScoredDocument(9, 0.8),
                new ScoredDocument(6, 0.2)
        );

        List<ScoredDocument> top = Ranking.topK(candidates, 2);

        // tie at 0.2 is resolved by the lowest id
        assertThat(top).extracting(ScoredDocument::documentId).containsExactly(9L, 2L);
    }

    @Test
    void rejectsNonPositiveK() {
        assertThrows(IllegalArgumentException.class, () -> Ranking.topK(List.of(), 0));
    }

    @Test
    void emptyInputGivesEmptyResult() {
        assertThat(Ranking.topK(List.of(), 3)).isEmpty();
    }
}
