package fr.lapetina.ocr.pipeline.domain.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with bounded jitter.
 *
 * <p>The delay before retry {@code n} (0-based) is
 * {@code min(cap, base(n) + jitter(n))} with {@code base(n) = initial * multiplier^n}
 * and {@code jitter(n) < base(n) * (multiplier - 1) * jitterFactor}. Since
 * {@code base(n) + jitter(n) < base(n + 1)}, successive delays never decrease,
 * and once the cap is reached they stay at the cap.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public RetryPolicy(
            int maxAttempts,
            Duration initialDelay,
            Duration maxDelay,
            double multiplier,
            double jitterFactor,
            DoubleSupplier random
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        this(maxAttempts, initialDelay, maxDelay, multiplier, 0.5, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0, () -> 0.0);
    }

    /**
     * Delay to wait before retry number {@code retry} (0 for the first retry).
     */
    public Duration delayBefore(int retry) {
        if (retry < 0) {
            throw new IllegalArgumentException("retry must be >= 0");
        }
        double capMs = maxDelay.toMillis();
        double baseMs = initialDelay.toMillis() * Math.pow(multiplier, retry);
        if (baseMs >= capMs) {
            return maxDelay;
        }
        double jitterMs = baseMs * (multiplier - 1.0) * jitterFactor * random.getAsDouble();
        return Duration.ofMillis((long) Math.min(capMs, baseMs + jitterMs));
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} attempts.
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", initialDelay=" + initialDelay +
                ", maxDelay=" + maxDelay +
                ", multiplier=" + multiplier +
                '}';
    }
}
