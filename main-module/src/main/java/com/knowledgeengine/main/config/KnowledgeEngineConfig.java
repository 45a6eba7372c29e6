package com.knowledgeengine.main.config;

import com.knowledgeengine.clustering.ClusteringSettings;
import com.knowledgeengine.index.IndexSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Переводит свойства приложения в настройки индекса и движка кластеризации
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(KnowledgeEngineProperties.class)
public class KnowledgeEngineConfig {

    @Bean
    public IndexSettings indexSettings(KnowledgeEngineProperties properties) {
        IndexSettings settings = IndexSettings.builder()
                .rebuildThreshold(properties.getIndex().getRebuildThreshold())
                .build();
        log.info("Index settings: {}", settings);
        return settings;
    }

    @Bean
    public ClusteringSettings clusteringSettings(KnowledgeEngineProperties properties) {
        KnowledgeEngineProperties.Clustering clustering = properties.getClustering();
        ClusteringSettings settings = ClusteringSettings.builder()
                .assignmentThreshold(clustering.getAssignmentThreshold())
                .nameBoost(clustering.getNameBoost())
                .maxConcepts(clustering.getMaxConcepts())
                .build();
        log.info("Clustering settings: {}", settings);
        return settings;
    }
}
