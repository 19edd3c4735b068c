package com.archflow.core.history;

import com.archflow.config.PipelineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HistoricalLearningService}.
 */
class HistoricalLearningServiceTest {

    private ExecutorService executor;
    private PipelineProperties.History properties;
    private InMemoryFeedbackStore store;
    private HistoricalLearningService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        properties = new PipelineProperties.History();
        store = new InMemoryFeedbackStore();
        service = new HistoricalLearningService(store, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("keywords")
    class Keywords {

        @Test
        @DisplayName("drops stop words, short words and numbers")
        void filters() {
            List<String> keywords = HistoricalLearningService.extractKeywords("Build a web app with 100 users and the API");

            assertTrue(keywords.contains("web"));
            assertTrue(keywords.contains("users"));
            assertTrue(keywords.contains("api"));
            assertFalse(keywords.contains("app"));
            assertFalse(keywords.contains("a"));
            assertFalse(keywords.contains("100"));
            assertFalse(keywords.contains("the"));
        }

        @Test
        @DisplayName("recognises technology terms")
        void techTerms() {
            List<String> keywords = HistoricalLearningService.extractKeywords("Serverless API on Kubernetes with Postgres");
            assertTrue(keywords.contains("kubernetes"));
            assertTrue(keywords.contains("postgres"));
        }

        @Test
        @DisplayName("caps the keyword list at twenty")
        void capped() {
            String many = String.join(" ", java.util.stream.IntStream.range(0, 40)
                    .mapToObj(i -> "keyword" + (char) ('a' + i % 26) + (char) ('a' + i / 26))
                    .toList());
            assertEquals(20, HistoricalLearningService.extractKeywords(many).size());
        }

        @Test
        @DisplayName("similarity is zero for unrelated summaries")
        void unrelated() {
            List<String> keywords = HistoricalLearningService.extractKeywords("kubernetes cluster postgres");
            assertEquals(0.0, HistoricalLearningService.similarity(keywords, new FeedbackRecord("static marketing site", 5)));
        }
    }

    @Nested
    @DisplayName("contextFor")
    class ContextFor {

        @Test
        @DisplayName("returns nothing without history")
        void empty() {
            assertEquals("", service.contextFor("Kubernetes cluster with Postgres database"));
        }

        @Test
        @DisplayName("summarises successes and warnings from similar deployments")
        void summarises() {
            store.add(new FeedbackRecord("Kubernetes cluster with Postgres database", 5, true,
                    "Switched to managed Postgres", List.of(), "Worked great, deployment was smooth overall"));
            store.add(new FeedbackRecord("Kubernetes cluster with Postgres database and cache", 1, false,
                    null, List.of("Node pool ran out of memory"), null));
            store.add(new FeedbackRecord("Kubernetes Postgres database backups", 4, true,
                    "Added backups", List.of(), null));

            String context = service.contextFor("Kubernetes cluster with Postgres database");

            assertTrue(context.startsWith("## Historical Learning from Past Deployments"));
            assertTrue(context.contains("Switched to managed Postgres (rating: 5/5)"));
            assertTrue(context.contains("**Warning**: Node pool ran out of memory"));
            assertTrue(context.contains("node pool ran out of memory"));
        }

        @Test
        @DisplayName("a slow store times out to an empty context")
        void timeout() {
            properties.setTimeout(Duration.ofMillis(50));
            HistoricalFeedbackStore slow = (keywords, limit) -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(new FeedbackRecord("Kubernetes cluster", 5));
            };
            var slowService = new HistoricalLearningService(slow, properties, executor);

            assertEquals("", slowService.contextFor("Kubernetes cluster with Postgres database"));
        }

        @Test
        @DisplayName("a failing store yields an empty context")
        void failure() {
            HistoricalFeedbackStore broken = (keywords, limit) -> {
                throw new IllegalStateException("database offline");
            };
            var brokenService = new HistoricalLearningService(broken, properties, executor);

            assertEquals("", brokenService.contextFor("Kubernetes cluster with Postgres database"));
        }
    }
}
