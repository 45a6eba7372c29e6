package com.knowledgeengine.index;

import lombok.Builder;

/**
 * Tunables of a {@link TfIdfVectorIndex}.
 *
 * @param rebuildThreshold mutations since the last rebuild that schedule the next one
 */
@Builder
public record IndexSettings(int rebuildThreshold) {

    public static final int DEFAULT_REBUILD_THRESHOLD = 100;

    public IndexSettings {
        if (rebuildThreshold < 1) {
            throw new IllegalArgumentException("Rebuild threshold must be at least 1");
        }
    }

    public static IndexSettings defaults() {
        return new IndexSettings(DEFAULT_REBUILD_THRESHOLD);
    }
}
