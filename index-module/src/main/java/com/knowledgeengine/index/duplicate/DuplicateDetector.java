package com.knowledgeengine.index.duplicate;

import com.knowledgeengine.common.model.DuplicateGroup;
import com.knowledgeengine.common.model.ScoredDocument;
import com.knowledgeengine.index.VectorIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ищет почти одинаковые документы по сходству их строк в индексе.
 *
 * <p>Documents are scanned in insertion order. Each document not yet grouped becomes the
 * primary of a group holding its ungrouped neighbours whose similarity reaches the
 * threshold. A document belongs to at most one group.
 */
@Slf4j
@RequiredArgsConstructor
public class DuplicateDetector {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;
    public static final int DEFAULT_LIMIT = 100;

    /** Соседей на документ */
    static final int CANDIDATES_PER_DOCUMENT = 20;

    private final VectorIndex vectorIndex;

    /**
     * @param similarityThreshold minimum cosine similarity, in [0, 1]
     * @param limit maximum number of groups, at least 1
     * @return groups, largest first; equal sizes keep scan order
     */
    public List<DuplicateGroup> findDuplicates(double similarityThreshold, int limit) {
        if (!(similarityThreshold >= 0.0 && similarityThreshold <= 1.0)) {
            throw new IllegalArgumentException("Similarity threshold must be in [0, 1], got " + similarityThreshold);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1, got " + limit);
        }

        List<Long> documentIds = vectorIndex.documentIds();
        if (documentIds.size() < 2) {
            return List.of();
        }
        int candidates = Math.min(CANDIDATES_PER_DOCUMENT, documentIds.size() - 1);

        List<DuplicateGroup> groups = new ArrayList<>();
        Set<Long> grouped = new HashSet<>();
        for (Long primaryId : documentIds) {
            if (grouped.contains(primaryId)) {
                continue;
            }
            List<ScoredDocument> duplicates = new ArrayList<>();
            for (ScoredDocument similar : vectorIndex.findSimilar(primaryId, candidates)) {
                if (similar.score() >= similarityThreshold && grouped.add(similar.documentId())) {
                    duplicates.add(similar);
                }
            }
            if (duplicates.isEmpty()) {
                continue;
            }
            grouped.add(primaryId);
            groups.add(new DuplicateGroup(primaryId, duplicates));
            if (groups.size() >= limit) {
                break;
            }
        }

        groups.sort(Comparator.comparingInt(DuplicateGroup::groupSize).reversed());
        log.debug("Found {} duplicate groups among {} documents (threshold {})",
                groups.size(), documentIds.size(), similarityThreshold);
        return groups;
    }

    public List<DuplicateGroup> findDuplicates() {
        return findDuplicates(DEFAULT_SIMILARITY_THRESHOLD, DEFAULT_LIMIT);
    }
}
