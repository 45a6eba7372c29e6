package com.knowledgeengine.main.service;

import com.knowledgeengine.clustering.ClusteringEngine;
import com.knowledgeengine.common.exception.DocumentNotFoundException;
import com.knowledgeengine.common.exception.EmptyDocumentException;
import com.knowledgeengine.common.model.ClusterInfo;
import com.knowledgeengine.index.VectorIndex;
import com.knowledgeengine.main.config.KnowledgeEngineProperties;
import com.knowledgeengine.main.dto.IngestRequest;
import com.knowledgeengine.main.knowledgebase.KnowledgeBase;
import com.knowledgeengine.main.knowledgebase.KnowledgeBaseFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты порядка вызовов индекса и движка кластеризации
 */
@ExtendWith(MockitoExtension.class)
class KnowledgeBaseServiceOrderingTest {

    @Mock
    private KnowledgeBaseFactory knowledgeBaseFactory;

    @Mock
    private VectorIndex vectorIndex;

    @Mock
    private ClusteringEngine clusteringEngine;

    private KnowledgeBaseService service;

    @BeforeEach
    void setUp() {
        when(knowledgeBaseFactory.create(anyString()))
                .thenAnswer(inv -> new KnowledgeBase(inv.getArgument(0), vectorIndex, clusteringEngine));
        service = new KnowledgeBaseService(knowledgeBaseFactory, new KnowledgeEngineProperties());
        service.init();
    }

    @Test
    @DisplayName("Документ индексируется до кластеризации")
    void indexesBeforeClustering() {
        when(clusteringEngine.assign(eq(7L), anyList(), any(), any())).thenReturn(3);

        int clusterId = service.ingest("default", IngestRequest.builder()
                .documentId(7).text("gradle build cache").concepts(List.of("gradle")).suggestedName("Build").build());

        assertThat(clusterId).isEqualTo(3);
        InOrder inOrder = inOrder(vectorIndex, clusteringEngine);
        inOrder.verify(vectorIndex).add(7L, "gradle build cache");
        inOrder.verify(clusteringEngine).assign(7L, List.of("gradle"), "Build", null);
    }

    @Test
    @DisplayName("Ошибка индекса не доходит до кластеризации")
    void indexFailureSkipsClustering() {
        doThrow(new EmptyDocumentException(7L)).when(vectorIndex).add(eq(7L), anyString());

        assertThatThrownBy(() -> service.ingest("default", IngestRequest.builder()
                .documentId(7).text("?").concepts(List.of("gradle")).build()))
                .isInstanceOf(EmptyDocumentException.class);

        verifyNoInteractions(clusteringEngine);
    }

    @Test
    void missingConceptsAreTreatedAsEmpty() {
        service.ingest("default", IngestRequest.builder().documentId(1).text("plain text").build());

        verify(clusteringEngine).assign(1L, List.of(), null, null);
    }

    @Test
    void removeFailsBeforeTouchingClusters() {
        doThrow(new DocumentNotFoundException(5L)).when(vectorIndex).remove(5L);

        assertThatThrownBy(() -> service.removeDocument("default", 5L))
                .isInstanceOf(DocumentNotFoundException.class);

        verify(clusteringEngine, never()).removeDocument(anyLong());
    }

    @Test
    void batchUsesSingleIndexCall() {
        service.ingestBatch("default", List.of(
                IngestRequest.builder().documentId(1).text("first text").build(),
                IngestRequest.builder().documentId(2).text("second text").build()));

        verify(vectorIndex, times(1)).addBatch(List.of(1L, 2L), List.of("first text", "second text"));
        verify(vectorIndex, never()).add(anyLong(), anyString());
        verify(clusteringEngine, times(2)).assign(anyLong(), anyList(), any(), any());
    }

    @Test
    @DisplayName("Документы удаляемого кластера уходят из индекса до удаления кластера")
    void deleteClusterRemovesDocumentsBeforeCluster() {
        ClusterInfo cluster = ClusterInfo.builder()
                .id(4).name("Build").concepts(List.of("gradle")).documentIds(List.of(7L, 8L)).build();
        when(clusteringEngine.cluster(4)).thenReturn(Optional.of(cluster));
        when(vectorIndex.contains(anyLong())).thenReturn(true);

        service.deleteCluster("default", 4, true);

        InOrder inOrder = inOrder(vectorIndex, clusteringEngine);
        inOrder.verify(vectorIndex).remove(7L);
        inOrder.verify(vectorIndex).remove(8L);
        inOrder.verify(clusteringEngine).deleteCluster(4);
    }
}
