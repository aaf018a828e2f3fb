package dev.jbang.pdfscraper.http;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Retry schedule for a fetch. Delays grow exponentially from {@code baseDelay}, are capped at
 * {@code maxDelay}, and are jittered into the upper half of the computed delay.
 *
 * @param maxAttempts Total number of attempts, including the first one
 * @param baseDelay Delay before the second attempt (before jitter)
 * @param maxDelay Upper bound for any single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

	public static final int DEFAULT_MAX_ATTEMPTS = 5;
	public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
	public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

	public RetryPolicy {
		Objects.requireNonNull(baseDelay, "baseDelay");
		Objects.requireNonNull(maxDelay, "maxDelay");
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
		}
		if (baseDelay.isNegative() || maxDelay.isNegative()) {
			throw new IllegalArgumentException("Backoff delays must not be negative");
		}
	}

	public static RetryPolicy defaults() {
		return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
	}

	/** A policy that makes a single attempt */
	public static RetryPolicy noRetries() {
		return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
	}

	/** Whether another attempt is allowed after {@code attempt} attempts have been made */
	public boolean canRetry(int attempt) {
		return attempt < maxAttempts;
	}

	/**
	 * Un-jittered delay after the given (1-based) failed attempt: base, 2*base, 4*base, ... capped
	 * at maxDelay.
	 */
	public long backoffMillis(int attempt) {
		long base = baseDelay.toMillis();
		if (base <= 0) {
			return 0;
		}
		int shift = Math.min(Math.max(0, attempt - 1), 30);
		return Math.min(base * (1L << shift), maxDelay.toMillis());
	}

	/** Jittered delay in {@code [delay/2, delay)} after the given failed attempt */
	public long jitteredBackoffMillis(int attempt, Random random) {
		long delay = backoffMillis(attempt);
		if (delay <= 1) {
			return delay;
		}
		long half = delay / 2;
		return half + (long) (random.nextDouble() * (delay - half));
	}
}
