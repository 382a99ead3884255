package io.fetchbox.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides what happens to a task after a failed attempt.
 *
 * <p>{@code phaseFailures} is the number of failures recorded in the failing
 * phase, including the one being decided. Download and upload failures are
 * counted apart, so each phase spends its own budget: a retryable failure is
 * retried while {@code phaseFailures < limit} for its phase; anything else is
 * dead-lettered.
 *
 * <p>Delay for failure {@code n} is {@code min(base * 2^(n-1), max)} scaled by a
 * uniform factor in {@code [1 - jitter, 1 + jitter]}. Jitter is applied after
 * clamping, so a clamped delay can still land up to {@code jitter} above max.
 */
public final class BackoffEngine {
    public static final double DEFAULT_JITTER_RATIO = 0.2d;

    private final double jitterRatio;
    private final DoubleSupplier unitJitter;

    public BackoffEngine() {
        this(DEFAULT_JITTER_RATIO, () -> ThreadLocalRandom.current().nextDouble(-1.0d, 1.0d));
    }

    BackoffEngine(double jitterRatio, DoubleSupplier unitJitter) {
        this.jitterRatio = Math.max(0.0d, Math.min(1.0d, jitterRatio));
        this.unitJitter = unitJitter;
    }

    public RetryDecision decide(TaskFailure failure, int phaseFailures, RetryLimits limits) {
        return decide(failure.phase(), failure.retryable(), phaseFailures, limits);
    }

    public RetryDecision decide(FailurePhase phase, boolean retryable, int phaseFailures, RetryLimits limits) {
        if (!retryable || phase == FailurePhase.SYSTEM) {
            return RetryDecision.deadLetter();
        }
        if (phaseFailures >= limits.limitFor(phase)) {
            return RetryDecision.deadLetter();
        }
        return RetryDecision.retry(delayMs(phaseFailures, limits.baseBackoffMs(), limits.maxBackoffMs()));
    }

    public long delayMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long clamped = clampedDelayMs(attempt, baseBackoffMs, maxBackoffMs);
        double factor = 1.0d + (jitterRatio * unitJitter.getAsDouble());
        return Math.max(0L, Math.round(clamped * factor));
    }

    static long clampedDelayMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long max = Math.max(0L, maxBackoffMs);
        long backoff = Math.max(0L, baseBackoffMs);
        for (int i = 1; i < attempt; i++) {
            if (backoff >= max / 2L) {
                backoff = max;
                break;
            }
            backoff *= 2L;
        }
        return Math.min(backoff, max);
    }
}
