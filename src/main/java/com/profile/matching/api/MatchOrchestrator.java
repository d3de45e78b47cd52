package com.profile.matching.api;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.MatchRequest;
import com.profile.matching.core.model.MatchResult;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.core.model.UserProfile;
import com.profile.matching.graph.KnowledgeGraph;
import com.profile.matching.graph.KnowledgeGraphBuilder;
import com.profile.matching.llm.GeneratedReason;
import com.profile.matching.llm.ReasonContext;
import com.profile.matching.llm.ResilientReasonGenerator;
import com.profile.matching.logging.LogContext;
import com.profile.matching.metrics.MetricsService;
import com.profile.matching.metrics.NoOpMetricsService;
import com.profile.matching.retrieval.RetrievalScore;
import com.profile.matching.retrieval.SimilarityRetriever;
import com.profile.matching.scoring.StructuralScore;
import com.profile.matching.scoring.StructuralScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ranks candidates for one user by blending the knowledge-graph structural score with
 * an externally supplied similarity score, and attaches a reason to each.
 *
 * <p>Pipeline per request:</p>
 * <ol>
 *   <li>Build one graph for the request and score every candidate structurally.</li>
 *   <li>Blend: {@code final = round(wKG * structural + wSIM * similarity, 2)}. Candidates the
 *       retriever did not return count as similarity 0 with no rank.</li>
 *   <li>Generate reasons concurrently, one task per candidate, on a bounded pool. One candidate's
 *       slow or failing backend never affects another's.</li>
 *   <li>Drop results below the minimum score, then sort by score descending. The sort is
 *       stable, so ties keep input order whatever order the tasks finished in.</li>
 * </ol>
 *
 * <p>Usage:</p>
 * <pre>
 * try (MatchOrchestrator orchestrator = MatchOrchestrator.builder()
 *         .options(MatchingOptions.defaults())
 *         .reasonGenerator(generator)
 *         .retriever(new LexicalSimilarityRetriever())
 *         .build()) {
 *     List&lt;MatchResult&gt; ranked = orchestrator.match(request);
 * }
 * </pre>
 *
 * <p>A reason generator passed to the builder belongs to the caller and stays open after
 * {@link #close()}. Only the generator created by {@link #fromEnvironment(Map, SimilarityRetriever)}
 * is closed with the orchestrator.</p>
 */
public class MatchOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MatchOrchestrator.class);

    private final MatchingOptions options;
    private final KnowledgeGraphBuilder graphBuilder;
    private final StructuralScorer scorer;
    private final ResilientReasonGenerator reasonGenerator;
    private final boolean ownsReasonGenerator;
    private final SimilarityRetriever retriever;
    private final MetricsService metrics;
    private final ExecutorService executor;

    private MatchOrchestrator(Builder builder) {
        this.options = builder.options != null ? builder.options : MatchingOptions.defaults();
        this.graphBuilder = builder.graphBuilder != null ? builder.graphBuilder : new KnowledgeGraphBuilder();
        this.scorer = builder.scorer != null ? builder.scorer : new StructuralScorer();
        this.reasonGenerator = Objects.requireNonNull(builder.reasonGenerator, "reasonGenerator is required");
        this.ownsReasonGenerator = builder.ownsReasonGenerator;
        this.retriever = builder.retriever;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.executor = Executors.newFixedThreadPool(options.getMaxConcurrency(), workerThreads());
    }

    /**
     * Full request: retrieves similarity scores with the configured retriever, then ranks.
     *
     * @throws MatchingException when no retriever is configured, when retrieval fails under
     *                           {@link RetrievalFailurePolicy#ABORT}, or when ranking fails
     */
    public List<MatchResult> match(MatchRequest request) {
        Objects.requireNonNull(request, "request is required");
        if (request.networkProfiles().isEmpty()) {
            return List.of();
        }
        if (retriever == null) {
            throw new MatchingException("No similarity retriever configured");
        }
        Map<String, RetrievalScore> similarity = retrieve(request);
        return run(request.userProfile(), request.userObjective(), request.networkProfiles(), similarity);
    }

    /**
     * Ranks candidates against externally supplied similarity scores.
     *
     * @param externalSimilarity profile id to similarity and rank; missing ids count as (0, no rank)
     * @return results at or above the minimum score, best first
     * @throws MatchingException when structural scoring or the reason fan-out fails
     */
    public List<MatchResult> run(UserProfile userProfile, UserObjective objective,
                                 List<CandidateProfile> candidates,
                                 Map<String, RetrievalScore> externalSimilarity) {
        Objects.requireNonNull(candidates, "candidates is required");
        if (candidates.isEmpty()) {
            return List.of();
        }
        Objects.requireNonNull(userProfile, "userProfile is required");
        Objects.requireNonNull(objective, "objective is required");
        Map<String, RetrievalScore> similarity = externalSimilarity != null ? externalSimilarity : Map.of();

        long startNanos = System.nanoTime();
        try (LogContext ctx = LogContext.forMatch(LogContext.generateCorrelationId(), objective.personId())) {
            metrics.recordCandidateCount(candidates.size());

            log.info("Stage 1: scoring {} candidates on the knowledge graph", candidates.size());
            Map<String, StructuralScore> structural = scoreStructurally(userProfile, objective, candidates);

            log.info("Stage 2: blending and generating reasons (mode={}, concurrency={})",
                    reasonGenerator.getMode(), options.getMaxConcurrency());
            List<MatchResult> results = blendAndExplain(userProfile, objective, candidates, structural, similarity);

            List<MatchResult> ranked = filterAndSort(results);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordMatchDuration(elapsed);
            log.info("Matching complete. {} of {} candidates kept in {} ms",
                    ranked.size(), candidates.size(), elapsed.toMillis());
            return ranked;
        }
    }

    private Map<String, RetrievalScore> retrieve(MatchRequest request) {
        try {
            return retriever.retrieve(request.userProfile(), request.userObjective(), request.networkProfiles());
        } catch (RuntimeException e) {
            metrics.incrementRetrievalFailure();
            if (options.getRetrievalFailurePolicy() == RetrievalFailurePolicy.ABORT) {
                throw new MatchingException("Similarity retrieval failed via " + retriever.getName(), e);
            }
            log.warn("Similarity retrieval failed via {}: {}; continuing with zero similarity",
                    retriever.getName(), e.getMessage());
            return Map.of();
        }
    }

    private Map<String, StructuralScore> scoreStructurally(UserProfile userProfile, UserObjective objective,
                                                          List<CandidateProfile> candidates) {
        try {
            KnowledgeGraph graph = graphBuilder.build(userProfile, objective, candidates);
            log.debug("Knowledge graph: {}", graph);
            return scorer.scoreAll(graph, objective, candidates);
        } catch (RuntimeException e) {
            throw new MatchingException("Structural scoring failed: " + e.getMessage(), e);
        }
    }

    private List<MatchResult> blendAndExplain(UserProfile userProfile, UserObjective objective,
                                              List<CandidateProfile> candidates,
                                              Map<String, StructuralScore> structural,
                                              Map<String, RetrievalScore> similarity) {
        BlendWeights weights = options.getBlendWeights();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        List<CompletableFuture<MatchResult>> futures = new ArrayList<>(candidates.size());
        for (CandidateProfile candidate : candidates) {
            StructuralScore kg = structural.getOrDefault(candidate.profileId(), StructuralScore.empty());
            RetrievalScore sim = similarity.getOrDefault(candidate.profileId(), RetrievalScore.absent());
            double finalScore = weights.blend(kg.score(), sim.similarity());
            metrics.recordStructuralScore(kg.score());
            metrics.recordFinalScore(finalScore);

            ReasonContext context = new ReasonContext(userProfile, objective, candidate,
                    kg.signals(), kg.score(), sim.similarity());
            futures.add(CompletableFuture.supplyAsync(() -> {
                try (LogContext restored = LogContext.restore(mdc);
                     LogContext candidateCtx = LogContext.forCandidate(candidate.profileId())) {
                    GeneratedReason reason = reasonGenerator.generate(context);
                    metrics.incrementReasonSource(reason.source());
                    return new MatchResult(candidate.profileId(), candidate.name(), finalScore,
                            reason.text(), kg.signals(), sim.rank());
                }
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw new MatchingException("Reason generation failed: " + e.getCause(), e.getCause());
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private List<MatchResult> filterAndSort(List<MatchResult> results) {
        double threshold = options.getMinScoreThreshold();
        List<MatchResult> kept = new ArrayList<>(results.size());
        for (MatchResult result : results) {
            if (result.score() >= threshold) {
                kept.add(result);
            }
        }
        if (kept.size() < results.size()) {
            metrics.incrementFilteredResults(results.size() - kept.size());
            log.debug("Dropped {} results below threshold {}", results.size() - kept.size(), threshold);
        }
        // List.sort is a stable merge sort: equal scores keep input order
        kept.sort(Comparator.comparingDouble(MatchResult::score).reversed());
        return List.copyOf(kept);
    }

    public MatchingOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownsReasonGenerator) {
            reasonGenerator.close();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "match-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Wires an orchestrator from environment-style variables: {@link MatchingOptions#fromEnvironment(Map)}
     * for behavior and {@link BackendSettings#fromEnvironment(Map)} for the Ollama (primary) and
     * Hugging Face (secondary) backends.
     */
    public static MatchOrchestrator fromEnvironment(Map<String, String> env, SimilarityRetriever retriever) {
        MatchingOptions options = MatchingOptions.fromEnvironment(env);
        BackendSettings settings = BackendSettings.fromEnvironment(env);
        log.info("Configuring matching from environment: mode={}, timeout={}, {}",
                options.getBackendMode(), options.getReasonTimeout(), settings);
        ResilientReasonGenerator generator = ResilientReasonGenerator.builder()
                .primary(settings.createPrimary(options.getReasonTimeout()))
                .secondary(settings.createSecondary(options.getReasonTimeout()))
                .mode(options.getBackendMode())
                .timeout(options.getReasonTimeout())
                .build();
        Builder builder = builder()
                .options(options)
                .reasonGenerator(generator)
                .retriever(retriever);
        builder.ownsReasonGenerator = true;
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingOptions options;
        private KnowledgeGraphBuilder graphBuilder;
        private StructuralScorer scorer;
        private ResilientReasonGenerator reasonGenerator;
        private boolean ownsReasonGenerator;
        private SimilarityRetriever retriever;
        private MetricsService metrics;

        public Builder options(MatchingOptions options) {
            this.options = options;
            return this;
        }

        public Builder graphBuilder(KnowledgeGraphBuilder graphBuilder) {
            this.graphBuilder = graphBuilder;
            return this;
        }

        public Builder scorer(StructuralScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder reasonGenerator(ResilientReasonGenerator reasonGenerator) {
            this.reasonGenerator = reasonGenerator;
            this.ownsReasonGenerator = false;
            return this;
        }

        public Builder retriever(SimilarityRetriever retriever) {
            this.retriever = retriever;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public MatchOrchestrator build() {
            return new MatchOrchestrator(this);
        }
    }
}
