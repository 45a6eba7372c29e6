package com.knowledgeengine.main.knowledgebase;

import com.knowledgeengine.clustering.ClusteringEngine;
import com.knowledgeengine.index.VectorIndex;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Index and clusters of one knowledge base, guarded by a single read/write lock.
 * Every mutation runs under the write lock, so readers never see a half-rebuilt vocabulary.
 */
@Getter
@RequiredArgsConstructor
public class KnowledgeBase {

    private final String id;
    private final VectorIndex vectorIndex;
    private final ClusteringEngine clusteringEngine;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
