package dev.jbang.pdfscraper.scraper;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.pdfscraper.crawl.CrawlResult;
import dev.jbang.pdfscraper.download.DownloadResult;
import dev.jbang.pdfscraper.model.DocumentLink;
import java.net.URI;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RunSummaryTest {

	@Test
	void testCombinesCrawlAndDownloads() {
		// Given
		CrawlResult crawl = new CrawlResult(
				Set.of(
						new DocumentLink(URI.create("https://x.org/a.pdf"), null),
						new DocumentLink(URI.create("https://x.org/b.pdf"), null)),
				Set.of(URI.create("https://x.org/")),
				Map.of(URI.create("https://x.org/broken"), "HTTP status: 500"));
		DownloadResult downloads = new DownloadResult(1, 1, 0, 0, Map.of("https://x.org/b.pdf", "HTTP status: 404"));

		// When
		RunSummary summary = RunSummary.of(crawl, downloads, false);

		// Then
		assertThat(summary.discovered()).isEqualTo(2);
		assertThat(summary.failedDocuments()).containsOnlyKeys("https://x.org/b.pdf");
		assertThat(summary.hasFailures()).isTrue();
		assertThat(summary.toString())
				.isEqualTo("PARTIAL (2 documents discovered, 1 downloaded, 1 failed, 0 already done, "
						+ "0 not dispatched, 1 pages failed)");
	}

	@Test
	void testCleanRunIsSuccess() {
		// Given
		RunSummary summary = new RunSummary(3, 2, 0, 1, 0, Map.of(), Map.of(), false);

		// When/Then
		assertThat(summary.hasFailures()).isFalse();
		assertThat(summary.toString()).startsWith("SUCCESS");
	}

	@Test
	void testCancelledWins() {
		RunSummary summary = new RunSummary(3, 0, 1, 0, 2, Map.of("u", "e"), Map.of(), true);
		assertThat(summary.toString()).startsWith("CANCELLED");
	}
}
