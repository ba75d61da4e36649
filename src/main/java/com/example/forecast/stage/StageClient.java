package com.example.forecast.stage;

import com.example.forecast.model.FailureKind;
import com.example.forecast.model.StageKind;
import com.example.forecast.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Uniform caller for one stage: timeout, bounded retry, error translation and contract validation.
 * <p>
 * Every call returns exactly one {@link StageResult}; nothing thrown by the stage escapes.
 * Only transient kinds ({@code TIMEOUT}, {@code UNAVAILABLE}) are retried, with exponential
 * backoff from the {@link RetryPolicy}. A success is trusted only after its {@link ContractCheck}
 * passes; a violation becomes {@code INVALID_RESPONSE} and is never retried.
 * <p>
 * Stateless apart from its collaborators, so one instance serves all concurrent segment tasks.
 */
public class StageClient<I, C, O> {

    private static final Logger log = LoggerFactory.getLogger(StageClient.class);

    private final Stage<I, C, O> stage;
    private final ContractCheck<I, C, O> contract;
    private final RetryPolicy retryPolicy;
    private final ExecutorService callExecutor;
    private final StageResultCache<O> cache;
    private final StageFingerprints fingerprints;

    public StageClient(Stage<I, C, O> stage,
                       ContractCheck<I, C, O> contract,
                       RetryPolicy retryPolicy,
                       ExecutorService callExecutor,
                       StageResultCache<O> cache,
                       StageFingerprints fingerprints) {
        this.stage = stage;
        this.contract = contract;
        this.retryPolicy = retryPolicy;
        this.callExecutor = callExecutor;
        this.cache = cache != null ? cache : StageResultCache.<O>disabled();
        this.fingerprints = fingerprints;
        if (this.cache.isEnabled() && fingerprints == null) {
            throw new IllegalArgumentException("An enabled cache needs a fingerprint source");
        }
    }

    public StageKind kind() {
        return stage.kind();
    }

    public boolean isAvailable() {
        try {
            return stage.isAvailable();
        } catch (RuntimeException e) {
            log.warn("{}: availability check failed: {}", stage.kind().stageName(), e.getMessage());
            return false;
        }
    }

    /** Single call without a request deadline. */
    public StageResult<O> call(I payload, C config, long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0, got " + timeoutMs);
        }
        return call(payload, config, Duration.ofMillis(timeoutMs), Instant.MAX);
    }

    /**
     * Invokes the stage. Each attempt is bounded by {@code timeout} and by the time left
     * until {@code deadline}; when the deadline is the tighter bound, running out of time
     * is reported as {@code DEADLINE_EXCEEDED} rather than {@code TIMEOUT}.
     */
    public StageResult<O> call(I payload, C config, Duration timeout, Instant deadline) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        String stageName = stage.kind().stageName();
        long started = System.nanoTime();

        String fingerprint = null;
        if (cache.isEnabled()) {
            fingerprint = fingerprints.of(stage.kind(), payload, config);
            Optional<StageResult.Success<O>> hit = cache.get(fingerprint);
            if (hit.isPresent()) {
                log.debug("{}: served from cache", stageName);
                return new StageResult.Success<>(hit.get().payload(), stageName, 0, elapsedMillis(started), true);
            }
        }

        FailureKind lastKind = null;
        String lastMessage = null;
        int attempt = 0;
        while (attempt < retryPolicy.maxAttempts()) {
            attempt++;
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isZero() || remaining.isNegative()) {
                return StageResult.failure(FailureKind.DEADLINE_EXCEEDED,
                        appendLast("request deadline exhausted before attempt " + attempt, lastMessage),
                        stageName, attempt - 1, elapsedMillis(started));
            }
            boolean deadlineBound = remaining.compareTo(timeout) < 0;
            Duration budget = deadlineBound ? remaining : timeout;

            try {
                O output = invokeWithTimeout(payload, config, Instant.now().plus(budget), budget);
                Optional<String> violation = contract.violation(payload, config, output);
                if (violation.isPresent()) {
                    log.warn("{}: contract violation on attempt {}: {}", stageName, attempt, violation.get());
                    return StageResult.failure(FailureKind.INVALID_RESPONSE,
                            "contract violation: " + violation.get(), stageName, attempt, elapsedMillis(started));
                }
                StageResult.Success<O> success = StageResult.success(output, stageName, attempt, elapsedMillis(started));
                if (fingerprint != null) {
                    cache.put(fingerprint, success);
                }
                return success;
            } catch (StageException e) {
                lastKind = e.kind();
                lastMessage = e.getMessage();
            } catch (TimeoutException e) {
                lastKind = deadlineBound ? FailureKind.DEADLINE_EXCEEDED : FailureKind.TIMEOUT;
                lastMessage = "no response within " + budget.toMillis() + "ms";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StageResult.failure(FailureKind.DEADLINE_EXCEEDED, "call cancelled",
                        stageName, attempt, elapsedMillis(started));
            }

            if (!lastKind.isTransient()) {
                return StageResult.failure(lastKind, lastMessage, stageName, attempt, elapsedMillis(started));
            }
            Duration delay = retryPolicy.nextDelay(attempt);
            if (delay == null) {
                break;
            }
            log.warn("{}: attempt {}/{} failed ({}: {}), retrying in {}ms...",
                    stageName, attempt, retryPolicy.maxAttempts(), lastKind, lastMessage, delay.toMillis());
            try {
                sleepWithin(delay, deadline);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return StageResult.failure(FailureKind.DEADLINE_EXCEEDED, "call cancelled during backoff",
                        stageName, attempt, elapsedMillis(started));
            }
        }

        FailureKind exhausted = lastKind == FailureKind.TIMEOUT ? FailureKind.TIMEOUT : FailureKind.UNREACHABLE;
        return StageResult.failure(exhausted,
                "%s after %d attempts: %s".formatted(stageName, attempt, lastMessage),
                stageName, attempt, elapsedMillis(started));
    }

    private O invokeWithTimeout(I payload, C config, Instant callDeadline, Duration budget)
            throws StageException, TimeoutException, InterruptedException {
        Future<O> future = callExecutor.submit(MdcTasks.callable(() -> stage.invoke(payload, config, callDeadline)));
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageException stageException) {
                throw stageException;
            }
            throw new StageException(FailureKind.INTERNAL,
                    "unexpected stage error: " + rootCauseMessage(cause), cause);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static void sleepWithin(Duration delay, Instant deadline) throws InterruptedException {
        Duration untilDeadline = Duration.between(Instant.now(), deadline);
        Duration sleep = delay.compareTo(untilDeadline) < 0 ? delay : untilDeadline;
        if (!sleep.isNegative() && !sleep.isZero()) {
            Thread.sleep(sleep.toMillis());
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String appendLast(String message, String lastMessage) {
        return lastMessage == null ? message : message + " (last error: " + lastMessage + ")";
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
