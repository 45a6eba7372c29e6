package com.knowledgeengine.clustering;

import com.knowledgeengine.common.exception.ClusterNotFoundException;
import com.knowledgeengine.common.model.ClusterInfo;
import com.knowledgeengine.common.similarity.SetSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups documents by the overlap of their extracted concepts.
 *
 * <p>A new document joins the existing cluster whose representative concepts have the
 * highest Jaccard similarity with its own, plus {@link ClusteringSettings#nameBoost()}
 * when the suggested topic name equals the cluster name. The best score must reach
 * {@link ClusteringSettings#assignmentThreshold()}; otherwise a new cluster is created.
 * Equal scores go to the oldest cluster.
 *
 * <p>Not thread-safe.
 */
@Slf4j
public class ClusteringEngine {

    private static final int MAX_NAME_LENGTH = 255;

    private final ClusteringSettings settings;

    /** Кластеры по возрастанию ID: порядок обхода задаёт разрешение ничьих */
    private final TreeMap<Integer, Cluster> clusters = new TreeMap<>();

    /** documentId → clusterId */
    private final Map<Long, Integer> assignments = new HashMap<>();

    private int nextClusterId = 0;

    public ClusteringEngine(ClusteringSettings settings) {
        this.settings = settings;
        log.debug("Initialized clustering engine with threshold={}, nameBoost={}, maxConcepts={}",
                settings.assignmentThreshold(), settings.nameBoost(), settings.maxConcepts());
    }

    /**
     * Finds the cluster a document with these concepts belongs to. Does not modify state.
     *
     * @param concepts extracted concept names; all of them take part in matching
     * @param suggestedName topic name proposed for the document, may be null
     * @return id of the best cluster, or empty when none reaches the threshold
     */
    public Optional<Integer> matchCluster(List<String> concepts, String suggestedName) {
        Set<String> documentConcepts = new LinkedHashSet<>(ConceptNormalizer.normalizeAll(concepts));
        if (documentConcepts.isEmpty() || clusters.isEmpty()) {
            return Optional.empty();
        }
        String normalizedName = ConceptNormalizer.normalize(suggestedName);

        Cluster best = null;
        double bestScore = 0.0;
        for (Cluster cluster : clusters.values()) {
            if (cluster.getConcepts().isEmpty()) {
                continue;
            }
            double score = SetSimilarity.jaccard(documentConcepts, cluster.getConcepts());
            if (!normalizedName.isEmpty() && normalizedName.equals(cluster.normalizedName())) {
                score += settings.nameBoost();
            }
            // strictly greater: the oldest cluster keeps a tie
            if (best == null || score > bestScore) {
                best = cluster;
                bestScore = score;
            }
        }

        if (best != null && bestScore >= settings.assignmentThreshold()) {
            log.debug("Matched cluster {} ({}) with score {}", best.getId(), best.getName(), bestScore);
            return Optional.of(best.getId());
        }
        log.debug("No cluster reached threshold {} (best score {})", settings.assignmentThreshold(), bestScore);
        return Optional.empty();
    }

    public Optional<Integer> matchCluster(List<String> concepts) {
        return matchCluster(concepts, null);
    }

    /**
     * Creates an empty cluster. Only the first {@code maxConcepts} distinct concepts are kept,
     * in the order given.
     *
     * @param name display name; falls back to the first concept, then to "Cluster &lt;id&gt;"
     * @return id of the new cluster
     */
    public int createCluster(List<String> concepts, String name, String skillLevel) {
        List<String> normalized = ConceptNormalizer.normalizeAll(concepts);
        List<String> representative = normalized.subList(0, Math.min(settings.maxConcepts(), normalized.size()));

        int clusterId = nextClusterId++;
        String clusterName = resolveName(name, concepts, clusterId);
        clusters.put(clusterId, new Cluster(clusterId, clusterName, representative, skillLevel));

        log.info("Created cluster {}: '{}' with concepts {}", clusterId, clusterName, representative);
        return clusterId;
    }

    public int createCluster(List<String> concepts, String name) {
        return createCluster(concepts, name, null);
    }

    /**
     * Puts a document into its best matching cluster, creating one when nothing matches.
     * A document that is already assigned is detached from its old cluster first.
     *
     * @return id of the cluster now holding the document
     */
    public int assign(long documentId, List<String> concepts, String suggestedName, String skillLevel) {
        if (documentId < 0) {
            throw new IllegalArgumentException("Document id cannot be negative: " + documentId);
        }
        if (detach(documentId)) {
            log.debug("Document {} was already assigned, re-assigning", documentId);
        }

        int clusterId = matchCluster(concepts, suggestedName)
                .orElseGet(() -> createCluster(concepts, suggestedName, skillLevel));

        clusters.get(clusterId).addDocument(documentId);
        assignments.put(documentId, clusterId);
        log.debug("Assigned document {} to cluster {}", documentId, clusterId);
        return clusterId;
    }

    /**
     * @return true if the document was assigned to some cluster
     */
    public boolean removeDocument(long documentId) {
        boolean removed = detach(documentId);
        if (removed) {
            log.debug("Removed document {} from its cluster", documentId);
        }
        return removed;
    }

    /** Ручной перенос документа в указанный кластер */
    public void moveDocument(long documentId, int clusterId) {
        Cluster target = requireCluster(clusterId);
        detach(documentId);
        target.addDocument(documentId);
        assignments.put(documentId, clusterId);
        log.info("Moved document {} to cluster {}", documentId, clusterId);
    }

    /**
     * Deletes a cluster; its documents become unclustered. The id is never reused.
     *
     * @return snapshot of the cluster as it was before deletion
     */
    public ClusterInfo deleteCluster(int clusterId) {
        Cluster cluster = requireCluster(clusterId);
        ClusterInfo snapshot = cluster.toInfo();
        for (Long documentId : cluster.getDocumentIds()) {
            assignments.remove(documentId);
        }
        clusters.remove(clusterId);
        log.info("Deleted cluster {} ('{}'), {} documents left unclustered",
                clusterId, snapshot.name(), snapshot.documentCount());
        return snapshot;
    }

    public void renameCluster(int clusterId, String name) {
        Cluster cluster = requireCluster(clusterId);
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Cluster name cannot be empty");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Cluster name cannot be longer than " + MAX_NAME_LENGTH + " characters");
        }
        log.info("Renamed cluster {} from '{}' to '{}'", clusterId, cluster.getName(), trimmed);
        cluster.setName(trimmed);
    }

    public void updateSkillLevel(int clusterId, String skillLevel) {
        requireCluster(clusterId).setSkillLevel(skillLevel);
    }

    public Optional<ClusterInfo> cluster(int clusterId) {
        return Optional.ofNullable(clusters.get(clusterId)).map(Cluster::toInfo);
    }

    /** Снимки всех кластеров по возрастанию ID */
    public List<ClusterInfo> clusters() {
        return clusters.values().stream().map(Cluster::toInfo).toList();
    }

    public Optional<Integer> clusterOf(long documentId) {
        return Optional.ofNullable(assignments.get(documentId));
    }

    public int size() {
        return clusters.size();
    }

    private boolean detach(long documentId) {
        Integer clusterId = assignments.remove(documentId);
        if (clusterId == null) {
            return false;
        }
        clusters.get(clusterId).removeDocument(documentId);
        return true;
    }

    private Cluster requireCluster(int clusterId) {
        Cluster cluster = clusters.get(clusterId);
        if (cluster == null) {
            throw new ClusterNotFoundException(clusterId);
        }
        return cluster;
    }

    private static String resolveName(String name, List<String> concepts, int clusterId) {
        String candidate = name == null ? "" : name.strip();
        if (candidate.isEmpty() && concepts != null) {
            candidate = concepts.stream()
                    .filter(c -> c != null && !c.isBlank())
                    .map(String::strip)
                    .findFirst()
                    .orElse("");
        }
        if (candidate.isEmpty()) {
            candidate = "Cluster " + clusterId;
        }
        return candidate.length() > MAX_NAME_LENGTH ? candidate.substring(0, MAX_NAME_LENGTH) : candidate;
    }
}
