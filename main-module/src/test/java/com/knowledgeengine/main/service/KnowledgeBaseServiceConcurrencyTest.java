package com.knowledgeengine.main.service;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.knowledgeengine.clustering.ClusteringSettings;
import com.knowledgeengine.common.model.ClusterInfo;
import com.knowledgeengine.common.model.SearchHit;
import com.knowledgeengine.index.IndexSettings;
import com.knowledgeengine.main.config.KnowledgeEngineProperties;
import com.knowledgeengine.main.dto.IngestRequest;
import com.knowledgeengine.main.knowledgebase.KnowledgeBaseFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Readers search while a single writer ingests and triggers rebuilds.
 */
class KnowledgeBaseServiceConcurrencyTest {

    private static final String KB = "default";
    private static final int DOCUMENTS = 300;

    private KnowledgeBaseService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        KnowledgeBaseFactory factory = new KnowledgeBaseFactory(
                IndexSettings.builder().rebuildThreshold(25).build(), ClusteringSettings.defaults());
        service = new KnowledgeBaseService(factory, new KnowledgeEngineProperties());
        service.init();
        executor = Executors.newFixedThreadPool(5,
                new ThreadFactoryBuilder().setNameFormat("kb-test-%d").build());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentReadersNeverFailDuringWrites() throws Exception {
        service.ingest(KB, request(0));
        AtomicBoolean writing = new AtomicBoolean(true);
        CountDownLatch start = new CountDownLatch(1);

        Future<?> writer = executor.submit(() -> {
            await(start);
            for (int id = 1; id < DOCUMENTS; id++) {
                service.ingest(KB, request(id));
            }
            writing.set(false);
            return null;
        });

        List<Future<Integer>> readers = new ArrayList<>();
        for (int r = 0; r < 4; r++) {
            readers.add(executor.submit(() -> {
                await(start);
                int searches = 0;
                while (writing.get()) {
                    List<SearchHit> hits = service.search(KB, "topic shared", 5);
                    assertThat(hits).isNotEmpty().hasSizeLessThanOrEqualTo(5);
                    List<ClusterInfo> clusters = service.clusters(KB);
                    assertThat(clusters).isNotEmpty();
                    searches++;
                }
                return searches;
            }));
        }

        start.countDown();
        writer.get(30, TimeUnit.SECONDS);
        for (Future<Integer> reader : readers) {
            assertThat(reader.get(30, TimeUnit.SECONDS)).isGreaterThanOrEqualTo(0);
        }

        assertThat(service.documentCount(KB)).isEqualTo(DOCUMENTS);
        int assigned = service.clusters(KB).stream().mapToInt(ClusterInfo::documentCount).sum();
        assertThat(assigned).isEqualTo(DOCUMENTS);
    }

    private static IngestRequest request(int id) {
        String topic = "topic" + (id % 7);
        return IngestRequest.builder()
                .documentId(id)
                .text("shared words about " + topic + " number " + id)
                .concepts(List.of(topic, "shared"))
                .suggestedName(topic)
                .build();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
