package dev.jbang.pdfscraper.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for an {@link HttpFetcher}.
 *
 * @param timeout Applied both as the connect timeout and as the per-request timeout
 * @param retryPolicy How often and how patiently transient failures are retried
 * @param userAgent The User-Agent header sent with every request
 */
public record FetcherConfig(Duration timeout, RetryPolicy retryPolicy, String userAgent) {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
	public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
			+ "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36";

	public FetcherConfig {
		Objects.requireNonNull(timeout, "timeout");
		Objects.requireNonNull(retryPolicy, "retryPolicy");
		if (timeout.isZero() || timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must be positive, got " + timeout);
		}
		if (userAgent == null || userAgent.isBlank()) {
			userAgent = DEFAULT_USER_AGENT;
		}
	}

	public static FetcherConfig defaults() {
		return new FetcherConfig(DEFAULT_TIMEOUT, RetryPolicy.defaults(), DEFAULT_USER_AGENT);
	}
}
