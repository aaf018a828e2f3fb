package dev.jbang.pdfscraper.crawl;

import dev.jbang.pdfscraper.model.DocumentLink;
import java.net.URI;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of walking the archive.
 *
 * @param documents Every distinct document found, in discovery order
 * @param visitedPages Pages that were fetched successfully
 * @param failedPages Pages that could not be fetched, with the reason
 */
public record CrawlResult(Set<DocumentLink> documents, Set<URI> visitedPages, Map<URI, String> failedPages) {

	public boolean isPartial() {
		return !failedPages.isEmpty();
	}

	@Override
	public String toString() {
		return "%d documents found on %d pages, %d pages failed"
				.formatted(documents.size(), visitedPages.size(), failedPages.size());
	}
}
