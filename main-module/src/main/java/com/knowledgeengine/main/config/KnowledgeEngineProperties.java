package com.knowledgeengine.main.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the knowledge organization engine.
 * The numeric defaults are empirical; they are exposed so they can be tuned per deployment.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "knowledge")
public class KnowledgeEngineProperties {

    /**
     * Knowledge bases created empty at startup.
     */
    @NotNull
    private List<String> knowledgeBases = new ArrayList<>(List.of("default"));

    @Valid
    @NotNull
    private Index index = new Index();

    @Valid
    @NotNull
    private Clustering clustering = new Clustering();

    @Valid
    @NotNull
    private Search search = new Search();

    @Valid
    @NotNull
    private Duplicates duplicates = new Duplicates();

    @Data
    public static class Index {
        /**
         * Mutations since the last vocabulary rebuild that trigger the next one.
         */
        @Min(1)
        private int rebuildThreshold = 100;
    }

    @Data
    public static class Clustering {
        /**
         * Minimum boosted Jaccard score for joining an existing cluster.
         */
        @DecimalMin("0.0")
        private double assignmentThreshold = 0.5;

        /**
         * Added when the suggested topic name equals the cluster name.
         */
        @DecimalMin("0.0")
        private double nameBoost = 0.2;

        /**
         * Representative concepts kept per cluster.
         */
        @Min(1)
        private int maxConcepts = 5;
    }

    @Data
    public static class Search {
        @Min(1)
        private int snippetLength = 100;
    }

    @Data
    public static class Duplicates {
        /**
         * Minimum cosine similarity for two documents to count as duplicates.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.85;

        /**
         * Maximum number of duplicate groups returned.
         */
        @Min(1)
        private int limit = 100;
    }
}
