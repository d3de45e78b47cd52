package com.profile.matching.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes a reason for one candidate by walking an ordered chain of remote backends,
 * then falling back to a deterministic sentence.
 *
 * <p>Chain per {@link BackendMode}: AUTO tries primary then secondary, PRIMARY and SECONDARY
 * try only that backend, NONE tries nothing. Each attempt is bounded by the call timeout.
 * A timeout, a failed result or any exception from a backend is logged and the chain moves on.
 * {@link #generate(ReasonContext)} always returns a non-blank reason and never throws.</p>
 *
 * <p>Holds no per-candidate state, so one instance serves concurrent candidates and may be
 * shared between orchestrators. After {@link #close()} every remote attempt is skipped and the
 * fallback is returned.</p>
 */
public class ResilientReasonGenerator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientReasonGenerator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final ReasonBackend primary;
    private final ReasonBackend secondary;
    private final BackendMode mode;
    private final Duration timeout;
    private final ReasonPromptBuilder promptBuilder;
    private final FallbackReasonComposer fallbackComposer;
    private final ExecutorService callExecutor;

    private ResilientReasonGenerator(Builder builder) {
        this.primary = builder.primary;
        this.secondary = builder.secondary;
        this.mode = builder.mode != null ? builder.mode : BackendMode.AUTO;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.promptBuilder = builder.promptBuilder != null ? builder.promptBuilder : new ReasonPromptBuilder();
        this.fallbackComposer = builder.fallbackComposer != null ? builder.fallbackComposer : new FallbackReasonComposer();
        this.callExecutor = Executors.newCachedThreadPool(daemonThreads());
    }

    /**
     * Produces the reason for one candidate.
     */
    public GeneratedReason generate(ReasonContext context) {
        Objects.requireNonNull(context, "context is required");
        List<Attempt> chain = chain();

        if (!chain.isEmpty()) {
            CompletionRequest request = CompletionRequest.of(promptBuilder.build(context));
            for (Attempt attempt : chain) {
                Optional<String> text = attempt(attempt.backend(), request);
                if (text.isPresent()) {
                    log.debug("Reason for {} produced by {}", context.candidate().profileId(),
                            attempt.backend().getBackendName());
                    return new GeneratedReason(text.get(), attempt.source(), attempt.backend().getBackendName());
                }
            }
            log.warn("All reason backends failed for candidate {}; using fallback", context.candidate().profileId());
        }

        return new GeneratedReason(fallbackComposer.compose(context), ReasonSource.FALLBACK,
                FallbackReasonComposer.PRODUCER_NAME);
    }

    /**
     * Remote attempts for the configured mode, skipping backends that were not supplied.
     */
    List<Attempt> chain() {
        List<Attempt> chain = new ArrayList<>(2);
        if ((mode == BackendMode.AUTO || mode == BackendMode.PRIMARY) && primary != null) {
            chain.add(new Attempt(ReasonSource.PRIMARY, primary));
        }
        if ((mode == BackendMode.AUTO || mode == BackendMode.SECONDARY) && secondary != null) {
            chain.add(new Attempt(ReasonSource.SECONDARY, secondary));
        }
        return chain;
    }

    private Optional<String> attempt(ReasonBackend backend, CompletionRequest request) {
        CompletableFuture<CompletionResult> call = null;
        try {
            call = CompletableFuture.supplyAsync(() -> backend.complete(request), callExecutor);
            CompletionResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result != null && result.isSuccess()) {
                return result.value();
            }
            log.warn("Reason backend {} failed: {}", backend.getBackendName(),
                    result != null && result.failureReason() != null ? result.failureReason() : "empty response");
        } catch (RejectedExecutionException e) {
            log.warn("Reason backend {} skipped: generator is closed", backend.getBackendName());
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Reason backend {} timed out after {}", backend.getBackendName(), timeout);
        } catch (ExecutionException e) {
            log.warn("Reason backend {} raised {}", backend.getBackendName(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            if (call != null) {
                call.cancel(true);
            }
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for reason backend {}", backend.getBackendName());
        }
        return Optional.empty();
    }

    public BackendMode getMode() {
        return mode;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "reason-backend-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Generator with no remote backends: always uses the fallback.
     */
    public static ResilientReasonGenerator fallbackOnly() {
        return builder().mode(BackendMode.NONE).build();
    }

    public static class Builder {
        private ReasonBackend primary;
        private ReasonBackend secondary;
        private BackendMode mode;
        private Duration timeout;
        private ReasonPromptBuilder promptBuilder;
        private FallbackReasonComposer fallbackComposer;

        public Builder primary(ReasonBackend primary) {
            this.primary = primary;
            return this;
        }

        public Builder secondary(ReasonBackend secondary) {
            this.secondary = secondary;
            return this;
        }

        public Builder mode(BackendMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder promptBuilder(ReasonPromptBuilder promptBuilder) {
            this.promptBuilder = promptBuilder;
            return this;
        }

        public Builder fallbackComposer(FallbackReasonComposer fallbackComposer) {
            this.fallbackComposer = fallbackComposer;
            return this;
        }

        public ResilientReasonGenerator build() {
            return new ResilientReasonGenerator(this);
        }
    }

    record Attempt(ReasonSource source, ReasonBackend backend) {}
}
