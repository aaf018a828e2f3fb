package dev.jbang.pdfscraper.http;

import java.net.URI;

/** Notified by a {@link Fetcher} right before each attempt it makes */
@FunctionalInterface
public interface AttemptListener {
	AttemptListener NONE = (url, attempt) -> {};

	/**
	 * @param url The URL about to be requested
	 * @param attempt The 1-based attempt number
	 */
	void beforeAttempt(URI url, int attempt);
}
