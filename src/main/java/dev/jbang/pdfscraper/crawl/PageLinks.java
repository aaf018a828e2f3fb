package dev.jbang.pdfscraper.crawl;

import dev.jbang.pdfscraper.model.DocumentLink;
import java.net.URI;
import java.util.Set;

/**
 * Links found on a single page, split into pages worth visiting and documents worth downloading.
 * Both sets keep the order in which the links appeared on the page.
 */
public record PageLinks(Set<URI> subpages, Set<DocumentLink> documents) {

	public static PageLinks empty() {
		return new PageLinks(Set.of(), Set.of());
	}

	public boolean isEmpty() {
		return subpages.isEmpty() && documents.isEmpty();
	}
}
