package com.knowledgeengine.main.service;

import com.knowledgeengine.clustering.ClusteringEngine;
import com.knowledgeengine.common.exception.ClusterNotFoundException;
import com.knowledgeengine.common.exception.KnowledgeBaseNotFoundException;
import com.knowledgeengine.common.model.ClusterInfo;
import com.knowledgeengine.common.model.DuplicateGroup;
import com.knowledgeengine.common.model.ScoredDocument;
import com.knowledgeengine.common.model.SearchHit;
import com.knowledgeengine.index.VectorIndex;
import com.knowledgeengine.index.duplicate.DuplicateDetector;
import com.knowledgeengine.main.config.KnowledgeEngineProperties;
import com.knowledgeengine.main.dto.IngestRequest;
import com.knowledgeengine.main.knowledgebase.KnowledgeBase;
import com.knowledgeengine.main.knowledgebase.KnowledgeBaseFactory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the knowledge bases and cross-references their index and clusters.
 * The index and the clustering engine never talk to each other; this service feeds
 * both for every document and intersects their results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeBaseService {

    private final KnowledgeBaseFactory knowledgeBaseFactory;
    private final KnowledgeEngineProperties properties;

    private final Map<String, KnowledgeBase> knowledgeBases = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (String knowledgeBaseId : properties.getKnowledgeBases()) {
            knowledgeBases.computeIfAbsent(knowledgeBaseId, knowledgeBaseFactory::create);
        }
        log.info("Knowledge engine started with knowledge bases {}", knowledgeBaseIds());
    }

    public void createKnowledgeBase(String knowledgeBaseId) {
        if (knowledgeBaseId == null || knowledgeBaseId.isBlank()) {
            throw new IllegalArgumentException("Knowledge base id cannot be blank");
        }
        KnowledgeBase created = knowledgeBaseFactory.create(knowledgeBaseId);
        if (knowledgeBases.putIfAbsent(knowledgeBaseId, created) != null) {
            throw new IllegalArgumentException("Knowledge base already exists: " + knowledgeBaseId);
        }
        log.info("Created knowledge base {}", knowledgeBaseId);
    }

    /** @return true если база существовала */
    public boolean dropKnowledgeBase(String knowledgeBaseId) {
        boolean dropped = knowledgeBases.remove(knowledgeBaseId) != null;
        log.info("Drop knowledge base {}: {}", knowledgeBaseId, dropped);
        return dropped;
    }

    public Set<String> knowledgeBaseIds() {
        return new TreeSet<>(knowledgeBases.keySet());
    }

    /**
     * Indexes the document and assigns it to a cluster.
     * @return id of the cluster the document landed in
     */
    public int ingest(String knowledgeBaseId, IngestRequest request) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.write(() -> {
            kb.getVectorIndex().add(request.getDocumentId(), request.getText());
            int clusterId = assign(kb.getClusteringEngine(), request);
            log.debug("Ingested document {} into knowledge base {}, cluster {}",
                    request.getDocumentId(), knowledgeBaseId, clusterId);
            return clusterId;
        });
    }

    /**
     * Bulk path, also used to replay persisted documents at startup: one index rebuild
     * for the whole batch, then cluster assignment in the given order.
     * @return cluster ids, aligned with the requests
     */
    public List<Integer> ingestBatch(String knowledgeBaseId, List<IngestRequest> requests) {
        KnowledgeBase kb = require(knowledgeBaseId);
        List<Long> documentIds = new ArrayList<>(requests.size());
        List<String> texts = new ArrayList<>(requests.size());
        for (IngestRequest request : requests) {
            documentIds.add(request.getDocumentId());
            texts.add(request.getText());
        }

        return kb.write(() -> {
            kb.getVectorIndex().addBatch(documentIds, texts);
            List<Integer> clusterIds = new ArrayList<>(requests.size());
            for (IngestRequest request : requests) {
                clusterIds.add(assign(kb.getClusteringEngine(), request));
            }
            log.info("Ingested batch of {} documents into knowledge base {}", requests.size(), knowledgeBaseId);
            return clusterIds;
        });
    }

    /**
     * Replaces the document text. When concepts are given the document is re-clustered too.
     * @return id of the cluster holding the document afterwards, if any
     */
    public Optional<Integer> updateDocument(String knowledgeBaseId, IngestRequest request) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.write(() -> {
            kb.getVectorIndex().update(request.getDocumentId(), request.getText());
            if (request.getConcepts() != null) {
                return Optional.of(assign(kb.getClusteringEngine(), request));
            }
            return kb.getClusteringEngine().clusterOf(request.getDocumentId());
        });
    }

    public void removeDocument(String knowledgeBaseId, long documentId) {
        KnowledgeBase kb = require(knowledgeBaseId);
        kb.write(() -> {
            kb.getVectorIndex().remove(documentId);
            kb.getClusteringEngine().removeDocument(documentId);
            return null;
        });
        log.debug("Removed document {} from knowledge base {}", documentId, knowledgeBaseId);
    }

    /**
     * @param allowedIds restricts results to these documents; null means no restriction
     */
    public List<SearchHit> search(String knowledgeBaseId, String query, int topK, Set<Long> allowedIds) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.read(() -> toHits(kb.getVectorIndex(), kb.getVectorIndex().search(query, topK, allowedIds)));
    }

    public List<SearchHit> search(String knowledgeBaseId, String query, int topK) {
        return search(knowledgeBaseId, query, topK, null);
    }

    /** Поиск только среди документов кластера */
    public List<SearchHit> searchInCluster(String knowledgeBaseId, int clusterId, String query, int topK) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.read(() -> {
            ClusterInfo cluster = kb.getClusteringEngine().cluster(clusterId)
                    .orElseThrow(() -> new ClusterNotFoundException(clusterId));
            Set<Long> members = new HashSet<>(cluster.documentIds());
            return toHits(kb.getVectorIndex(), kb.getVectorIndex().search(query, topK, members));
        });
    }

    public List<SearchHit> findSimilar(String knowledgeBaseId, long documentId, int topK) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.read(() -> toHits(kb.getVectorIndex(), kb.getVectorIndex().findSimilar(documentId, topK)));
    }

    /**
     * Groups of near-identical documents, largest group first.
     * @param similarityThreshold minimum cosine similarity between a document and its duplicate
     * @param limit maximum number of groups
     */
    public List<DuplicateGroup> findDuplicates(String knowledgeBaseId, double similarityThreshold, int limit) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.read(() -> new DuplicateDetector(kb.getVectorIndex()).findDuplicates(similarityThreshold, limit));
    }

    public List<DuplicateGroup> findDuplicates(String knowledgeBaseId) {
        KnowledgeEngineProperties.Duplicates duplicates = properties.getDuplicates();
        return findDuplicates(knowledgeBaseId, duplicates.getSimilarityThreshold(), duplicates.getLimit());
    }

    public List<ClusterInfo> clusters(String knowledgeBaseId) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.read(() -> kb.getClusteringEngine().clusters());
    }

    public Optional<ClusterInfo> cluster(String knowledgeBaseId, int clusterId) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.read(() -> kb.getClusteringEngine().cluster(clusterId));
    }

    public void renameCluster(String knowledgeBaseId, int clusterId, String name) {
        KnowledgeBase kb = require(knowledgeBaseId);
        kb.write(() -> {
            kb.getClusteringEngine().renameCluster(clusterId, name);
            return null;
        });
    }

    /**
     * Deletes a cluster. Its documents become unclustered, or are removed from the
     * knowledge base entirely when {@code deleteDocuments} is set.
     * @return the cluster as it was before deletion
     */
    public ClusterInfo deleteCluster(String knowledgeBaseId, int clusterId, boolean deleteDocuments) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.write(() -> {
            ClusterInfo cluster = kb.getClusteringEngine().cluster(clusterId)
                    .orElseThrow(() -> new ClusterNotFoundException(clusterId));
            if (deleteDocuments) {
                for (Long documentId : cluster.documentIds()) {
                    if (kb.getVectorIndex().contains(documentId)) {
                        kb.getVectorIndex().remove(documentId);
                    }
                }
            }
            kb.getClusteringEngine().deleteCluster(clusterId);
            log.info("Deleted cluster {} from knowledge base {} (documents {})",
                    clusterId, knowledgeBaseId, deleteDocuments ? "deleted" : "unclustered");
            return cluster;
        });
    }

    public void moveDocument(String knowledgeBaseId, long documentId, int clusterId) {
        KnowledgeBase kb = require(knowledgeBaseId);
        kb.write(() -> {
            if (!kb.getVectorIndex().contains(documentId)) {
                throw new IllegalArgumentException("Document " + documentId + " is not indexed");
            }
            kb.getClusteringEngine().moveDocument(documentId, clusterId);
            return null;
        });
    }

    public int documentCount(String knowledgeBaseId) {
        KnowledgeBase kb = require(knowledgeBaseId);
        return kb.read(() -> kb.getVectorIndex().size());
    }

    private int assign(ClusteringEngine engine, IngestRequest request) {
        return engine.assign(
                request.getDocumentId(),
                request.getConcepts() == null ? List.of() : request.getConcepts(),
                request.getSuggestedName(),
                request.getSkillLevel());
    }

    private List<SearchHit> toHits(VectorIndex index, List<ScoredDocument> results) {
        int snippetLength = properties.getSearch().getSnippetLength();
        return results.stream()
                .map(r -> SearchHit.of(r, index.text(r.documentId()).orElse(""), snippetLength))
                .toList();
    }

    private KnowledgeBase require(String knowledgeBaseId) {
        KnowledgeBase kb = knowledgeBases.get(knowledgeBaseId);
        if (kb == null) {
            throw new KnowledgeBaseNotFoundException(knowledgeBaseId);
        }
        return kb;
    }
}
