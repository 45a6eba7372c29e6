package com.knowledgeengine.index.rebuild;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides when the index must re-derive its vocabulary.
 * Each add, update or remove records one mutation. Once the count since the last
 * rebuild reaches the threshold the policy switches to {@link RebuildMode#PENDING_REBUILD}
 * and stays there until {@link #rebuilt()} is called.
 */
@Slf4j
@Getter
public class RebuildPolicy {

    private final int threshold;
    private RebuildMode mode = RebuildMode.INCREMENTAL;
    private int mutationsSinceRebuild;

    public RebuildPolicy(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Rebuild threshold must be at least 1, got " + threshold);
        }
        this.threshold = threshold;
    }

    public void recordMutation() {
        mutationsSinceRebuild++;
        if (mode == RebuildMode.INCREMENTAL && mutationsSinceRebuild >= threshold) {
            mode = RebuildMode.PENDING_REBUILD;
            log.debug("Rebuild threshold {} reached, switching to {}", threshold, mode);
        }
    }

    /**
     * @param corpusWasEmpty the corpus held no documents before the current write
     */
    public boolean shouldRebuild(boolean corpusWasEmpty) {
        return corpusWasEmpty || mode == RebuildMode.PENDING_REBUILD;
    }

    public void rebuilt() {
        mutationsSinceRebuild = 0;
        mode = RebuildMode.INCREMENTAL;
    }
}
