package com.knowledgeengine.main.knowledgebase;

import com.knowledgeengine.clustering.ClusteringEngine;
import com.knowledgeengine.clustering.ClusteringSettings;
import com.knowledgeengine.index.IndexSettings;
import com.knowledgeengine.index.TfIdfVectorIndex;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class KnowledgeBaseFactory {

    private final IndexSettings indexSettings;
    private final ClusteringSettings clusteringSettings;

    public KnowledgeBase create(String knowledgeBaseId) {
        return new KnowledgeBase(
                knowledgeBaseId,
                new TfIdfVectorIndex(indexSettings),
                new ClusteringEngine(clusteringSettings));
    }
}
