package dev.jbang.pdfscraper.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Fetcher} backed by the JDK HTTP client, retrying transient failures with backoff */
public class HttpFetcher implements Fetcher {
	private static final Logger logger = LoggerFactory.getLogger(HttpFetcher.class);

	private final HttpClient httpClient;
	private final FetcherConfig config;

	public HttpFetcher(FetcherConfig config) {
		this.config = config;
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.version(HttpClient.Version.HTTP_1_1)
				.connectTimeout(config.timeout())
				.build();
	}

	public FetcherConfig config() {
		return config;
	}

	@Override
	public byte[] fetch(URI url, AttemptListener listener) throws FetchException, InterruptedException {
		RetryPolicy policy = config.retryPolicy();
		TransientFetchException lastException = null;
		for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
			listener.beforeAttempt(url, attempt);
			try {
				return fetchOnce(url, attempt);
			} catch (TransientFetchException e) {
				lastException = e;
				if (policy.canRetry(attempt)) {
					long backoffMillis = policy.jitteredBackoffMillis(attempt, random());
					logger.debug(
							"Attempt {} of {} for {} failed ({}), retrying in {} ms",
							attempt,
							policy.maxAttempts(),
							url,
							e.kind(),
							backoffMillis);
					Thread.sleep(backoffMillis);
				}
			}
		}
		throw lastException.withAttempts(policy.maxAttempts());
	}

	/** Perform a single GET, classifying any failure as transient or permanent */
	private byte[] fetchOnce(URI url, int attempt) throws FetchException, InterruptedException {
		HttpRequest request;
		try {
			request = request(url).build();
		} catch (IllegalArgumentException e) {
			throw new PermanentFetchException("Malformed URL: " + url, String.valueOf(url), e);
		}

		HttpResponse<byte[]> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
		} catch (HttpTimeoutException e) {
			throw new TransientFetchException(TransientFetchException.Kind.TIMEOUT, url.toString(), -1, attempt, e);
		} catch (IOException e) {
			throw new TransientFetchException(TransientFetchException.Kind.CONNECTION, url.toString(), -1, attempt, e);
		}

		int statusCode = response.statusCode();
		if (statusCode >= 200 && statusCode < 300) {
			byte[] body = response.body();
			return body != null ? body : new byte[0];
		}
		if (statusCode == 429) {
			throw new TransientFetchException(
					TransientFetchException.Kind.RATE_LIMITED, url.toString(), statusCode, attempt, null);
		}
		if (statusCode == 408) {
			throw new TransientFetchException(
					TransientFetchException.Kind.TIMEOUT, url.toString(), statusCode, attempt, null);
		}
		if (statusCode >= 500) {
			throw new TransientFetchException(
					TransientFetchException.Kind.SERVER_ERROR, url.toString(), statusCode, attempt, null);
		}
		throw new PermanentFetchException(
				"Failed to fetch " + url + " - HTTP status: " + statusCode, url.toString(), statusCode, attempt);
	}

	private HttpRequest.Builder request(URI url) {
		return HttpRequest.newBuilder()
				.uri(url)
				.timeout(config.timeout())
				.header("User-Agent", config.userAgent())
				.header("Accept-Language", "en-US,en;q=0.9")
				.GET();
	}

	private static Random random() {
		return ThreadLocalRandom.current();
	}
}
