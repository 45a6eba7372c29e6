package com.knowledgeengine.common.similarity;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SetSimilarityTest {

    @Test
    void identicalSetsHaveSimilarityOne() {
        Set<String> concepts = Set.of("python", "fastapi", "docker");
        assertEquals(1.0, SetSimilarity.jaccard(concepts, Set.of("docker", "python", "fastapi")));
    }

    @Test
    void disjointSetsHaveSimilarityZero() {
        assertEquals(0.0, SetSimilarity.jaccard(Set.of("python"), Set.of("rust", "cargo")));
    }

    @Test
    void twoEmptySetsAreDefinedAsZero() {
        assertEquals(0.0, SetSimilarity.jaccard(Set.of(), Set.of()));
    }

    @Test
    void emptyAgainstNonEmptyIsZero() {
        assertEquals(0.0, SetSimilarity.jaccard(Set.of(), Set.of("python")));
    }

    @Test
    void partialOverlap() {
        // {python, fastapi} vs {python, flask}: 1 shared of 3 distinct
        assertEquals(1.0 / 3.0, SetSimilarity.jaccard(Set.of("python", "fastapi"), Set.of("python", "flask")), 1e-12);
    }

    @Test
    void isSymmetric() {
        Set<String> a = Set.of("a", "b", "c", "d");
        Set<String> b = Set.of("c", "d", "e");
        assertEquals(SetSimilarity.jaccard(a, b), SetSimilarity.jaccard(b, a));
        assertEquals(2.0 / 5.0, SetSimilarity.jaccard(a, b), 1e-12);
    }
}
