package com.profile.matching.api;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.MatchRequest;
import com.profile.matching.core.model.MatchResult;
import com.profile.matching.graph.KnowledgeGraphBuilder;
import com.profile.matching.llm.BackendMode;
import com.profile.matching.llm.CompletionRequest;
import com.profile.matching.llm.CompletionResult;
import com.profile.matching.llm.GeneratedReason;
import com.profile.matching.llm.ReasonBackend;
import com.profile.matching.llm.ReasonContext;
import com.profile.matching.llm.ReasonSource;
import com.profile.matching.llm.ResilientReasonGenerator;
import com.profile.matching.metrics.MicrometerMetricsService;
import com.profile.matching.retrieval.RetrievalException;
import com.profile.matching.retrieval.RetrievalScore;
import com.profile.matching.retrieval.SimilarityRetriever;
import com.profile.matching.support.TestProfiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MatchOrchestratorTest {

    private static final String PYTHON_FALLBACK =
            "Strong match based on shared skill: python with a combined alignment score of 48/100.";

    private MatchOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private MatchOrchestrator fallbackOrchestrator(MatchingOptions options) {
        orchestrator = MatchOrchestrator.builder()
                .options(options)
                .reasonGenerator(ResilientReasonGenerator.fallbackOnly())
                .build();
        return orchestrator;
    }

    @Nested
    @DisplayName("Blending")
    class Blending {

        @Test
        @DisplayName("Blends structural 15 and similarity 80 into 50.75")
        void blendsScores() {
            List<MatchResult> results = fallbackOrchestrator(MatchingOptions.defaults()).run(
                    TestProfiles.user("python"), TestProfiles.objective("Chief Technology Officer"),
                    List.of(TestProfiles.candidate("c1", "Data Analyst", "Python", "SQL")),
                    Map.of("c1", RetrievalScore.of(80.0, 1)));

            assertEquals(1, results.size());
            MatchResult result = results.get(0);
            assertEquals("c1", result.profileId());
            assertEquals("Name c1", result.name());
            assertEquals(50.75, result.score());
            assertEquals(List.of("Shared skill: python"), result.kgSignals());
            assertEquals(1, result.retrievalRank());
            assertEquals(PYTHON_FALLBACK, result.reason());
        }

        @Test
        @DisplayName("Candidate missing from similarity scores gets 0 and no rank")
        void missingSimilarity() {
            List<MatchResult> results = fallbackOrchestrator(MatchingOptions.defaults()).run(
                    TestProfiles.user("python"), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("c2", "Analyst", "Python")), Map.of());

            MatchResult result = results.get(0);
            assertEquals(6.75, result.score());
            assertNull(result.retrievalRank());
            assertFalse(result.hasRetrievalRank());
        }

        @Test
        @DisplayName("No signals and no similarity still yields a result with the semantic reason")
        void noSignals() {
            List<MatchResult> results = fallbackOrchestrator(MatchingOptions.defaults()).run(
                    TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("c3", "Designer")), null);

            assertEquals(0.0, results.get(0).score());
            assertTrue(results.get(0).kgSignals().isEmpty());
            assertEquals("Candidate aligns semantically with the target profile.", results.get(0).reason());
        }
    }

    @Nested
    @DisplayName("Ordering and filtering")
    class OrderingAndFiltering {

        @Test
        @DisplayName("Results are sorted by score descending")
        void sortedDescending() {
            List<MatchResult> results = fallbackOrchestrator(MatchingOptions.defaults()).run(
                    TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("low", "A1"), TestProfiles.candidate("high", "A2"),
                            TestProfiles.candidate("mid", "A3")),
                    Map.of("low", RetrievalScore.of(10.0, 3), "high", RetrievalScore.of(90.0, 1),
                            "mid", RetrievalScore.of(50.0, 2)));

            assertEquals(List.of("high", "mid", "low"), results.stream().map(MatchResult::profileId).toList());
        }

        @Test
        @DisplayName("Ties keep input order even when tasks finish out of order")
        void stableTies() {
            ResilientReasonGenerator generator = mock(ResilientReasonGenerator.class);
            when(generator.generate(any())).thenAnswer(invocation -> {
                ReasonContext context = invocation.getArgument(0);
                if (context.candidate().profileId().equals("first")) {
                    Thread.sleep(300);
                }
                return new GeneratedReason("ok", ReasonSource.FALLBACK, "Fallback");
            });
            orchestrator = MatchOrchestrator.builder()
                    .options(MatchingOptions.builder().maxConcurrency(4).build())
                    .reasonGenerator(generator)
                    .build();

            List<MatchResult> results = orchestrator.run(TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("first", "Same"), TestProfiles.candidate("second", "Same"),
                            TestProfiles.candidate("third", "Same")),
                    Map.of());

            assertEquals(List.of("first", "second", "third"), results.stream().map(MatchResult::profileId).toList());
        }

        @Test
        @DisplayName("Threshold is inclusive")
        void inclusiveThreshold() {
            MatchingOptions options = MatchingOptions.builder()
                    .blendWeights(new BlendWeights(0.0, 1.0))
                    .minScoreThreshold(50.0)
                    .build();

            List<MatchResult> results = fallbackOrchestrator(options).run(
                    TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("below", "A"), TestProfiles.candidate("at", "B")),
                    Map.of("below", RetrievalScore.of(49.99, 2), "at", RetrievalScore.of(50.0, 1)));

            assertEquals(List.of("at"), results.stream().map(MatchResult::profileId).toList());
        }

        @Test
        @DisplayName("Everything below threshold yields an empty list")
        void allFiltered() {
            MatchingOptions options = MatchingOptions.builder().minScoreThreshold(99.0).build();

            assertTrue(fallbackOrchestrator(options).run(TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("c1", "A")), Map.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Empty candidate list short-circuits without building a graph or calling backends")
        void emptyCandidates() {
            KnowledgeGraphBuilder graphBuilder = mock(KnowledgeGraphBuilder.class);
            SimilarityRetriever retriever = mock(SimilarityRetriever.class);
            ReasonBackend backend = mock(ReasonBackend.class);
            orchestrator = MatchOrchestrator.builder()
                    .graphBuilder(graphBuilder)
                    .retriever(retriever)
                    .reasonGenerator(ResilientReasonGenerator.builder().primary(backend).build())
                    .build();

            assertEquals(List.of(), orchestrator.run(TestProfiles.user(), TestProfiles.objective(), List.of(), Map.of()));
            assertEquals(List.of(), orchestrator.match(
                    new MatchRequest(TestProfiles.user(), TestProfiles.objective(), List.of())));
            verifyNoInteractions(graphBuilder, retriever, backend);
        }

        @Test
        @DisplayName("Closing one orchestrator leaves a shared reason generator usable")
        void sharedGeneratorStaysOpen() {
            ReasonBackend backend = mock(ReasonBackend.class);
            when(backend.getBackendName()).thenReturn("Stub");
            when(backend.complete(any())).thenReturn(CompletionResult.success("Remote reason."));
            try (ResilientReasonGenerator shared = ResilientReasonGenerator.builder()
                    .primary(backend)
                    .mode(BackendMode.PRIMARY)
                    .build()) {
                MatchOrchestrator first = MatchOrchestrator.builder().reasonGenerator(shared).build();
                first.close();
                orchestrator = MatchOrchestrator.builder().reasonGenerator(shared).build();

                List<MatchResult> results = orchestrator.run(TestProfiles.user("python"), TestProfiles.objective(),
                        List.of(TestProfiles.candidate("c1", "Data Analyst", "Python")),
                        Map.of("c1", RetrievalScore.of(80.0, 1)));

                assertEquals("Remote reason.", results.get(0).reason());
            }
        }

        @Test
        @DisplayName("A slow backend for one candidate does not affect the others")
        void slowBackendIsolated() {
            ReasonBackend backend = mock(ReasonBackend.class);
            when(backend.getBackendName()).thenReturn("Stub");
            when(backend.complete(any())).thenAnswer(invocation -> {
                CompletionRequest request = invocation.getArgument(0);
                if (request.prompt().contains("Title: Slow Hand")) {
                    Thread.sleep(5_000);
                }
                return CompletionResult.success("Remote reason.");
            });
            ResilientReasonGenerator generator = ResilientReasonGenerator.builder()
                    .primary(backend)
                    .mode(BackendMode.PRIMARY)
                    .timeout(Duration.ofMillis(300))
                    .build();
            orchestrator = MatchOrchestrator.builder().reasonGenerator(generator).build();

            long start = System.nanoTime();
            List<MatchResult> results = orchestrator.run(TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("slow", "Slow Hand"), TestProfiles.candidate("fast", "Fast Hand")),
                    Map.of("slow", RetrievalScore.of(60.0, 1), "fast", RetrievalScore.of(40.0, 2)));
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertEquals(2, results.size());
            assertEquals("Candidate aligns semantically with the target profile.", results.get(0).reason());
            assertEquals("Remote reason.", results.get(1).reason());
            assertTrue(elapsedMillis < 3_000, "took " + elapsedMillis + "ms");
        }

        @Test
        @DisplayName("Unexpected failure in the fan-out surfaces as one MatchingException")
        void fanOutFailure() {
            ResilientReasonGenerator generator = mock(ResilientReasonGenerator.class);
            when(generator.generate(any())).thenThrow(new IllegalStateException("bug"));
            orchestrator = MatchOrchestrator.builder().reasonGenerator(generator).build();

            MatchingException e = assertThrows(MatchingException.class, () -> orchestrator.run(
                    TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("c1", "A")), Map.of()));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("Graph construction failure surfaces as MatchingException")
        void graphFailure() {
            KnowledgeGraphBuilder graphBuilder = mock(KnowledgeGraphBuilder.class);
            when(graphBuilder.build(any(), any(), any())).thenThrow(new IllegalStateException("broken graph"));
            orchestrator = MatchOrchestrator.builder()
                    .graphBuilder(graphBuilder)
                    .reasonGenerator(ResilientReasonGenerator.fallbackOnly())
                    .build();

            assertThrows(MatchingException.class, () -> orchestrator.run(TestProfiles.user(), TestProfiles.objective(),
                    List.of(TestProfiles.candidate("c1", "A")), Map.of()));
        }
    }

    @Nested
    @DisplayName("Full request with a retriever")
    class WithRetriever {

        private final List<CandidateProfile> candidates = List.of(
                TestProfiles.candidate("c1", "Data Analyst", "Python"),
                TestProfiles.candidate("c2", "Designer"));

        private MatchRequest request() {
            return new MatchRequest(TestProfiles.user("Python"), TestProfiles.objective(), candidates);
        }

        @Test
        @DisplayName("Uses retriever scores and ranks")
        void usesRetriever() {
            SimilarityRetriever retriever = mock(SimilarityRetriever.class);
            when(retriever.retrieve(any(), any(), any()))
                    .thenReturn(Map.of("c2", RetrievalScore.of(90.0, 1), "c1", RetrievalScore.of(20.0, 2)));
            orchestrator = MatchOrchestrator.builder()
                    .reasonGenerator(ResilientReasonGenerator.fallbackOnly())
                    .retriever(retriever)
                    .build();

            List<MatchResult> results = orchestrator.match(request());

            assertEquals("c2", results.get(0).profileId());
            assertEquals(1, results.get(0).retrievalRank());
            assertEquals(49.5, results.get(0).score());
        }

        @Test
        @DisplayName("Retrieval failure under ZERO_FILL continues with zero similarity")
        void zeroFill() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            SimilarityRetriever retriever = mock(SimilarityRetriever.class);
            when(retriever.getName()).thenReturn("Broken");
            when(retriever.retrieve(any(), any(), any())).thenThrow(new RetrievalException("model offline"));
            orchestrator = MatchOrchestrator.builder()
                    .reasonGenerator(ResilientReasonGenerator.fallbackOnly())
                    .retriever(retriever)
                    .metrics(new MicrometerMetricsService(registry))
                    .build();

            List<MatchResult> results = orchestrator.match(request());

            assertEquals(2, results.size());
            assertEquals(6.75, results.get(0).score());
            assertTrue(results.stream().noneMatch(MatchResult::hasRetrievalRank));
            assertEquals(1.0, registry.get("match.retrieval.failure").counter().count());
        }

        @Test
        @DisplayName("Retrieval failure under ABORT fails the request")
        void abort() {
            SimilarityRetriever retriever = mock(SimilarityRetriever.class);
            when(retriever.getName()).thenReturn("Broken");
            when(retriever.retrieve(any(), any(), any())).thenThrow(new RetrievalException("model offline"));
            orchestrator = MatchOrchestrator.builder()
                    .options(MatchingOptions.builder().retrievalFailurePolicy(RetrievalFailurePolicy.ABORT).build())
                    .reasonGenerator(ResilientReasonGenerator.fallbackOnly())
                    .retriever(retriever)
                    .build();

            MatchingException e = assertThrows(MatchingException.class, () -> orchestrator.match(request()));
            assertInstanceOf(RetrievalException.class, e.getCause());
        }

        @Test
        @DisplayName("Full request without a retriever is rejected")
        void noRetriever() {
            fallbackOrchestrator(MatchingOptions.defaults());

            assertThrows(MatchingException.class, () -> orchestrator.match(request()));
        }
    }

    @Test
    @DisplayName("Metrics count candidates, reason sources and filtered results")
    void recordsMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        orchestrator = MatchOrchestrator.builder()
                .options(MatchingOptions.builder().minScoreThreshold(10.0).build())
                .reasonGenerator(ResilientReasonGenerator.fallbackOnly())
                .metrics(new MicrometerMetricsService(registry))
                .build();

        orchestrator.run(TestProfiles.user("Python"), TestProfiles.objective(),
                List.of(TestProfiles.candidate("c1", "A", "Python"), TestProfiles.candidate("c2", "B")),
                Map.of("c1", RetrievalScore.of(50.0, 1)));

        assertEquals(2.0, registry.get("match.candidates").summary().totalAmount());
        assertEquals(2.0, registry.get("match.reason.source").tag("source", "FALLBACK").counter().count());
        assertEquals(0.0, registry.get("match.reason.source").tag("source", "PRIMARY").counter().count());
        assertEquals(1.0, registry.get("match.results.filtered").counter().count());
        assertEquals(1, registry.get("match.duration").timer().count());
    }

    @Test
    @DisplayName("Wiring from environment applies options and backend settings")
    void fromEnvironment() {
        orchestrator = MatchOrchestrator.fromEnvironment(
                Map.of("LLM_BACKEND", "none", "MIN_SCORE_THRESHOLD", "5", "LLM_TIMEOUT", "2"),
                mock(SimilarityRetriever.class));

        assertEquals(BackendMode.NONE, orchestrator.getOptions().getBackendMode());
        assertEquals(5.0, orchestrator.getOptions().getMinScoreThreshold());
        assertEquals(Duration.ofSeconds(2), orchestrator.getOptions().getReasonTimeout());
    }
}
