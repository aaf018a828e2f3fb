package dev.jbang.pdfscraper.scraper;

import dev.jbang.pdfscraper.crawl.LinkDiscoverer;
import dev.jbang.pdfscraper.crawl.SameSitePolicy;
import dev.jbang.pdfscraper.crawl.SiteCrawler;
import dev.jbang.pdfscraper.download.DefaultDownloadManager;
import dev.jbang.pdfscraper.http.FetcherConfig;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Configuration record for a scraper run. Encapsulates where to start, where to put documents and
 * the download log, and how to crawl and fetch.
 */
public record ScraperConfig(
		URI rootUrl,
		Path outputDir,
		Path ledgerFile,
		int threads,
		FetcherConfig fetcherConfig,
		int maxDepth,
		SameSitePolicy sameSitePolicy,
		List<String> documentSuffixes,
		String contentSelector,
		boolean fromStart,
		boolean dryRun) {

	public static final URI DEFAULT_ROOT_URL = URI.create("https://www.hmmt.org/www/archive/problems");
	public static final Path DEFAULT_OUTPUT_DIR = Path.of("downloaded_pdfs");
	public static final Path DEFAULT_LEDGER_FILE = Path.of("download_log.json");

	public ScraperConfig {
		Objects.requireNonNull(rootUrl, "rootUrl");
		Objects.requireNonNull(outputDir, "outputDir");
		Objects.requireNonNull(ledgerFile, "ledgerFile");
		Objects.requireNonNull(fetcherConfig, "fetcherConfig");
		Objects.requireNonNull(sameSitePolicy, "sameSitePolicy");
		if (threads < 1) {
			throw new IllegalArgumentException("threads must be at least 1, got " + threads);
		}
		if (maxDepth < 0) {
			throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
		}
		if (documentSuffixes == null || documentSuffixes.isEmpty()) {
			documentSuffixes = LinkDiscoverer.DEFAULT_DOCUMENT_SUFFIXES;
		}
		documentSuffixes = List.copyOf(documentSuffixes);
	}

	/** A configuration with every setting at its default, rooted at the given URL */
	public static ScraperConfig defaults(URI rootUrl, Path outputDir, Path ledgerFile) {
		return new ScraperConfig(
				rootUrl,
				outputDir,
				ledgerFile,
				DefaultDownloadManager.DEFAULT_THREAD_COUNT,
				FetcherConfig.defaults(),
				SiteCrawler.DEFAULT_MAX_DEPTH,
				SameSitePolicy.exact_host,
				LinkDiscoverer.DEFAULT_DOCUMENT_SUFFIXES,
				LinkDiscoverer.DEFAULT_CONTENT_SELECTOR,
				false,
				false);
	}

	/** The extension given to documents whose URL has none: the first document suffix */
	public String defaultExtension() {
		String suffix = documentSuffixes.get(0);
		return suffix.startsWith(".") ? suffix : "." + suffix;
	}
}
