package dev.jbang.pdfscraper.http;

import java.net.URI;

/**
 * Retrieves the body of a URL. Implementations apply their own timeout and retry policy, and never
 * touch storage.
 */
public interface Fetcher {

	/**
	 * Fetch the body of a URL.
	 *
	 * @param url The absolute URL to fetch
	 * @param listener Called before every attempt
	 * @return The response body
	 * @throws TransientFetchException If every allowed attempt failed with a retryable error
	 * @throws PermanentFetchException If the request failed in a way that retrying won't fix
	 * @throws InterruptedException If interrupted while waiting for a response or a backoff
	 */
	byte[] fetch(URI url, AttemptListener listener) throws FetchException, InterruptedException;

	default byte[] fetch(URI url) throws FetchException, InterruptedException {
		return fetch(url, AttemptListener.NONE);
	}
}
