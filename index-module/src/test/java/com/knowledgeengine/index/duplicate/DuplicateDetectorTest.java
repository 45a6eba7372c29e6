package com.knowledgeengine.index.duplicate;

import com.knowledgeengine.common.model.DuplicateGroup;
import com.knowledgeengine.common.model.ScoredDocument;
import com.knowledgeengine.index.IndexSettings;
import com.knowledgeengine.index.TfIdfVectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DuplicateDetectorTest {

    private static final String PYTHON = "python asyncio event loop tutorial";
    private static final String RUST = "rust ownership borrow checker";

    private TfIdfVectorIndex index;
    private DuplicateDetector detector;

    @BeforeEach
    void setUp() {
        index = new TfIdfVectorIndex(IndexSettings.defaults());
        detector = new DuplicateDetector(index);
    }

    private static List<Long> primaries(List<DuplicateGroup> groups) {
        return groups.stream().map(DuplicateGroup::primaryDocumentId).toList();
    }

    private static List<Long> duplicateIds(DuplicateGroup group) {
        return group.duplicates().stream().map(ScoredDocument::documentId).toList();
    }

    @Test
    void identicalDocumentsFormOneGroupEach() {
        index.addBatch(List.of(0L, 1L, 2L, 3L, 4L),
                List.of(PYTHON, PYTHON, RUST, RUST, "gardening tomatoes in spring"));

        List<DuplicateGroup> groups = detector.findDuplicates();

        assertEquals(List.of(0L, 2L), primaries(groups));
        assertEquals(List.of(1L), duplicateIds(groups.get(0)));
        assertEquals(List.of(3L), duplicateIds(groups.get(1)));
        assertThat(groups.get(0).duplicates().get(0).score()).isGreaterThanOrEqualTo(0.85);
        assertEquals(2, groups.get(0).groupSize());
    }

    @Test
    void largerGroupsComeFirst() {
        index.addBatch(List.of(0L, 1L, 2L, 3L, 4L), List.of(PYTHON, PYTHON, RUST, RUST, RUST));

        List<DuplicateGroup> groups = detector.findDuplicates();

        assertEquals(List.of(2L, 0L), primaries(groups));
        assertEquals(List.of(3L, 4L), duplicateIds(groups.get(0)));
        assertEquals(3, groups.get(0).groupSize());
    }

    @Test
    void limitStopsTheScan() {
        index.addBatch(List.of(0L, 1L, 2L, 3L, 4L), List.of(PYTHON, PYTHON, RUST, RUST, RUST));

        List<DuplicateGroup> groups = detector.findDuplicates(DuplicateDetector.DEFAULT_SIMILARITY_THRESHOLD, 1);

        assertEquals(List.of(0L), primaries(groups));
    }

    @Test
    void thresholdExcludesLooseMatches() {
        // cosine of these two is about 0.6
        index.addBatch(List.of(0L, 1L), List.of("python asyncio event loop", "python asyncio event guide"));

        assertTrue(detector.findDuplicates().isEmpty());

        List<DuplicateGroup> loose = detector.findDuplicates(0.5, 10);
        assertEquals(List.of(0L), primaries(loose));
        assertEquals(List.of(1L), duplicateIds(loose.get(0)));
    }

    @Test
    void fewerThanTwoDocumentsHaveNoDuplicates() {
        assertTrue(detector.findDuplicates().isEmpty());

        index.add(0, PYTHON);
        assertTrue(detector.findDuplicates().isEmpty());
    }

    @Test
    void removedDocumentsAreNotReported() {
        index.addBatch(List.of(0L, 1L, 2L), List.of(PYTHON, PYTHON, RUST));
        index.remove(1);

        assertTrue(detector.findDuplicates().isEmpty());
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> detector.findDuplicates(1.5, 10));
        assertThrows(IllegalArgumentException.class, () -> detector.findDuplicates(Double.NaN, 10));
        assertThrows(IllegalArgumentException.class, () -> detector.findDuplicates(0.85, 0));
    }
}
