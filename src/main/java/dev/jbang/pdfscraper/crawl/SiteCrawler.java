package dev.jbang.pdfscraper.crawl;

import dev.jbang.pdfscraper.http.FetchException;
import dev.jbang.pdfscraper.http.Fetcher;
import dev.jbang.pdfscraper.model.DocumentLink;
import dev.jbang.pdfscraper.util.UrlUtils;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the archive breadth-first, starting at the root and following same-site subpages up to a
 * fixed depth, and collects every document link it sees. Each page is fetched at most once.
 */
public class SiteCrawler {
	private static final Logger logger = LoggerFactory.getLogger(SiteCrawler.class);

	public static final int DEFAULT_MAX_DEPTH = 1;

	private final Fetcher fetcher;
	private final LinkDiscoverer discoverer;
	private final int maxDepth;
	private volatile boolean cancelled;

	/**
	 * @param fetcher Used to retrieve pages
	 * @param discoverer Used to classify the links on each page
	 * @param maxDepth How many levels of subpages to follow below the root (0 means root only)
	 */
	public SiteCrawler(Fetcher fetcher, LinkDiscoverer discoverer, int maxDepth) {
		if (maxDepth < 0) {
			throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
		}
		this.fetcher = fetcher;
		this.discoverer = discoverer;
		this.maxDepth = maxDepth;
	}

	/**
	 * Discover all documents reachable from the root.
	 *
	 * @param rootUrl The archive root
	 * @return The documents found, plus which pages were visited or failed
	 * @throws CrawlException If the root page itself cannot be fetched
	 * @throws InterruptedException If interrupted while fetching
	 */
	public CrawlResult crawl(URI rootUrl) throws CrawlException, InterruptedException {
		URI root = UrlUtils.normalize(rootUrl);
		if (root == null) {
			throw new CrawlException("Not an absolute http(s) URL: " + rootUrl, null);
		}

		Deque<PendingPage> pending = new ArrayDeque<>();
		Set<URI> seen = new HashSet<>();
		Set<URI> visited = new LinkedHashSet<>();
		Map<URI, String> failed = new LinkedHashMap<>();
		Map<URI, DocumentLink> documents = new LinkedHashMap<>();

		pending.add(new PendingPage(root, 0));
		seen.add(root);

		while (!pending.isEmpty()) {
			if (cancelled) {
				logger.warn("Crawl cancelled with {} pages still pending", pending.size());
				break;
			}
			PendingPage page = pending.poll();
			byte[] body;
			try {
				logger.info("Fetching page {}", page.url());
				body = fetcher.fetch(page.url());
			} catch (FetchException e) {
				if (page.depth() == 0) {
					throw new CrawlException("Failed to fetch archive root " + page.url() + ": " + e.getMessage(), e);
				}
				logger.warn("Skipping page {}: {}", page.url(), e.getMessage());
				failed.put(page.url(), e.getMessage());
				continue;
			}
			visited.add(page.url());

			PageLinks links = discoverer.discover(body, page.url());
			int newDocuments = 0;
			for (DocumentLink document : links.documents()) {
				if (documents.putIfAbsent(document.url(), document) == null) {
					newDocuments++;
				}
			}
			int newPages = 0;
			if (page.depth() < maxDepth) {
				for (URI subpage : links.subpages()) {
					if (seen.add(subpage)) {
						pending.add(new PendingPage(subpage, page.depth() + 1));
						newPages++;
					}
				}
			}
			logger.debug(
					"{}: {} new documents, {} new pages, {} pages pending",
					page.url(),
					newDocuments,
					newPages,
					pending.size());
		}

		CrawlResult result = new CrawlResult(
				Collections.unmodifiableSet(new LinkedHashSet<>(documents.values())),
				Collections.unmodifiableSet(visited),
				Collections.unmodifiableMap(failed));
		logger.info("Crawl of {} finished: {}", root, result);
		return result;
	}

	/** Stop the crawl before the next page; the documents found so far are still returned */
	public void cancel() {
		cancelled = true;
	}

	private record PendingPage(URI url, int depth) {}
}
