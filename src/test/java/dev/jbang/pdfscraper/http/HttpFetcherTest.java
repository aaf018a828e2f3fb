package dev.jbang.pdfscraper.http;

import static org.assertj.core.api.Assertions.*;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpFetcherTest {
	private MockWebServer server;

	@BeforeEach
	void setUp() throws Exception {
		server = new MockWebServer();
		server.start();
	}

	@AfterEach
	void tearDown() throws Exception {
		server.shutdown();
	}

	@Test
	void testFetchReturnsBody() throws Exception {
		// Given
		server.enqueue(new MockResponse().setBody("%PDF-1.4 hello"));
		HttpFetcher fetcher = fetcher(3, Duration.ofSeconds(5));

		// When
		byte[] body = fetcher.fetch(uri("/d1.pdf"));

		// Then
		assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("%PDF-1.4 hello");
		assertThat(server.getRequestCount()).isEqualTo(1);
	}

	@Test
	void testSendsBrowserHeaders() throws Exception {
		// Given
		server.enqueue(new MockResponse().setBody("ok"));
		HttpFetcher fetcher = fetcher(1, Duration.ofSeconds(5));

		// When
		fetcher.fetch(uri("/page"));

		// Then
		RecordedRequest request = server.takeRequest();
		assertThat(request.getMethod()).isEqualTo("GET");
		assertThat(request.getHeader("User-Agent")).isEqualTo(FetcherConfig.DEFAULT_USER_AGENT);
		assertThat(request.getHeader("Accept-Language")).isEqualTo("en-US,en;q=0.9");
	}

	@Test
	void testServerErrorIsRetriedExactlyMaxAttempts() {
		// Given
		for (int i = 0; i < 5; i++) {
			server.enqueue(new MockResponse().setResponseCode(503));
		}
		HttpFetcher fetcher = fetcher(3, Duration.ofSeconds(5));

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(uri("/d1.pdf")))
				.isInstanceOfSatisfying(TransientFetchException.class, e -> {
					assertThat(e.kind()).isEqualTo(TransientFetchException.Kind.SERVER_ERROR);
					assertThat(e.statusCode()).isEqualTo(503);
					assertThat(e.attempts()).isEqualTo(3);
					assertThat(e.isTransient()).isTrue();
				});
		assertThat(server.getRequestCount()).isEqualTo(3);
	}

	@Test
	void testRecoversAfterTransientFailure() throws Exception {
		// Given
		server.enqueue(new MockResponse().setResponseCode(500));
		server.enqueue(new MockResponse().setResponseCode(429));
		server.enqueue(new MockResponse().setBody("finally"));
		HttpFetcher fetcher = fetcher(5, Duration.ofSeconds(5));
		List<Integer> attempts = new ArrayList<>();

		// When
		byte[] body = fetcher.fetch(uri("/flaky"), (url, attempt) -> attempts.add(attempt));

		// Then
		assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("finally");
		assertThat(attempts).containsExactly(1, 2, 3);
		assertThat(server.getRequestCount()).isEqualTo(3);
	}

	@Test
	void testClientErrorIsNotRetried() {
		// Given
		server.enqueue(new MockResponse().setResponseCode(404));
		server.enqueue(new MockResponse().setBody("should never be served"));
		HttpFetcher fetcher = fetcher(5, Duration.ofSeconds(5));

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(uri("/missing.pdf")))
				.isInstanceOfSatisfying(PermanentFetchException.class, e -> {
					assertThat(e.statusCode()).isEqualTo(404);
					assertThat(e.attempts()).isEqualTo(1);
					assertThat(e.isTransient()).isFalse();
					assertThat(e.getMessage()).contains("HTTP status: 404");
				});
		assertThat(server.getRequestCount()).isEqualTo(1);
	}

	@Test
	void testRateLimitIsTransient() {
		// Given
		server.enqueue(new MockResponse().setResponseCode(429));
		server.enqueue(new MockResponse().setResponseCode(429));
		HttpFetcher fetcher = fetcher(2, Duration.ofSeconds(5));

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(uri("/busy")))
				.isInstanceOfSatisfying(TransientFetchException.class, e -> assertThat(e.kind())
						.isEqualTo(TransientFetchException.Kind.RATE_LIMITED));
		assertThat(server.getRequestCount()).isEqualTo(2);
	}

	@Test
	void testSlowResponseTimesOut() {
		// Given
		server.enqueue(new MockResponse().setBody("late").setHeadersDelay(3, TimeUnit.SECONDS));
		HttpFetcher fetcher = fetcher(1, Duration.ofMillis(300));

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(uri("/slow")))
				.isInstanceOfSatisfying(TransientFetchException.class, e -> {
					assertThat(e.kind()).isEqualTo(TransientFetchException.Kind.TIMEOUT);
					assertThat(e.attempts()).isEqualTo(1);
				});
	}

	@Test
	void testMalformedUrlIsPermanent() {
		// Given
		HttpFetcher fetcher = fetcher(3, Duration.ofSeconds(5));

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(URI.create("ftp://example.com/file.pdf")))
				.isInstanceOf(PermanentFetchException.class);
		assertThat(server.getRequestCount()).isZero();
	}

	private HttpFetcher fetcher(int maxAttempts, Duration timeout) {
		RetryPolicy policy = new RetryPolicy(maxAttempts, Duration.ofMillis(1), Duration.ofMillis(5));
		return new HttpFetcher(new FetcherConfig(timeout, policy, null));
	}

	private URI uri(String path) {
		return server.url(path).uri();
	}
}
