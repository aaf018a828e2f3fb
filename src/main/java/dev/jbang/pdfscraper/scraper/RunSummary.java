package dev.jbang.pdfscraper.scraper;

import dev.jbang.pdfscraper.crawl.CrawlResult;
import dev.jbang.pdfscraper.download.DownloadResult;
import java.net.URI;
import java.util.Map;

/** Result of a complete scraper run */
public record RunSummary(
		int discovered,
		int succeeded,
		int failed,
		int skipped,
		int notDispatched,
		Map<String, String> failedDocuments,
		Map<URI, String> failedPages,
		boolean cancelled) {

	public static RunSummary of(CrawlResult crawl, DownloadResult downloads, boolean cancelled) {
		return new RunSummary(
				crawl.documents().size(),
				downloads.succeeded(),
				downloads.failed(),
				downloads.skipped(),
				downloads.notDispatched(),
				downloads.failures(),
				crawl.failedPages(),
				cancelled);
	}

	/** Whether any document or page could not be retrieved */
	public boolean hasFailures() {
		return failed > 0 || !failedPages.isEmpty();
	}

	@Override
	public String toString() {
		return "%s (%d documents discovered, %d downloaded, %d failed, %d already done, %d not dispatched, %d pages failed)"
				.formatted(
						cancelled ? "CANCELLED" : hasFailures() ? "PARTIAL" : "SUCCESS",
						discovered,
						succeeded,
						failed,
						skipped,
						notDispatched,
						failedPages.size());
	}
}
