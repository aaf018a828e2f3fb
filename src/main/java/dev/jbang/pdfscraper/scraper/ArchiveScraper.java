package dev.jbang.pdfscraper.scraper;

import dev.jbang.pdfscraper.crawl.CrawlException;
import dev.jbang.pdfscraper.crawl.CrawlResult;
import dev.jbang.pdfscraper.crawl.LinkDiscoverer;
import dev.jbang.pdfscraper.crawl.SiteCrawler;
import dev.jbang.pdfscraper.download.DefaultDownloadManager;
import dev.jbang.pdfscraper.download.DocumentStore;
import dev.jbang.pdfscraper.download.DownloadManager;
import dev.jbang.pdfscraper.download.DownloadResult;
import dev.jbang.pdfscraper.download.NoOpDownloadManager;
import dev.jbang.pdfscraper.http.Fetcher;
import dev.jbang.pdfscraper.http.HttpFetcher;
import dev.jbang.pdfscraper.ledger.DownloadLedger;
import dev.jbang.pdfscraper.ledger.LedgerException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline for one archive: crawl the site for documents, skip the ones the ledger
 * already has, and download the rest.
 */
public class ArchiveScraper {
	private static final Logger logger = LoggerFactory.getLogger(ArchiveScraper.class);

	private final ScraperConfig config;
	private final Fetcher fetcher;
	private final SiteCrawler crawler;
	private final DownloadLedger ledger;
	private volatile DownloadManager downloadManager;
	private volatile boolean cancelled;

	public ArchiveScraper(ScraperConfig config) {
		this(config, new HttpFetcher(config.fetcherConfig()));
	}

	public ArchiveScraper(ScraperConfig config, Fetcher fetcher) {
		this.config = config;
		this.fetcher = fetcher;
		LinkDiscoverer discoverer = new LinkDiscoverer(
				config.rootUrl(), config.sameSitePolicy(), config.documentSuffixes(), config.contentSelector());
		this.crawler = new SiteCrawler(fetcher, discoverer, config.maxDepth());
		this.ledger = new DownloadLedger(config.ledgerFile());
	}

	/**
	 * Crawl the archive without downloading anything.
	 *
	 * @throws CrawlException If the archive root cannot be fetched
	 */
	public CrawlResult discover() throws CrawlException, InterruptedException {
		return crawler.crawl(config.rootUrl());
	}

	/**
	 * Crawl the archive and download every document not downloaded before.
	 *
	 * @return What was discovered, downloaded, skipped and failed
	 * @throws CrawlException If the archive root cannot be fetched
	 * @throws LedgerException If the download log cannot be read or written
	 * @throws IOException If the output directory cannot be prepared
	 * @throws InterruptedException If interrupted while crawling or waiting for downloads
	 */
	public RunSummary run() throws CrawlException, IOException, InterruptedException {
		// Read the log first so a broken one fails the run before any network traffic
		ledger.load();

		CrawlResult crawl = discover();
		logger.info("Found {} documents", crawl.documents().size());
		if (crawl.isPartial()) {
			logger.warn("{} pages could not be fetched, results are partial", crawl.failedPages().size());
		}

		DocumentStore store = new DocumentStore(config.outputDir());
		DownloadManager manager = config.dryRun()
				? new NoOpDownloadManager(ledger, store)
				: new DefaultDownloadManager(
						config.threads(),
						fetcher,
						ledger,
						store,
						config.defaultExtension(),
						config.fromStart());
		downloadManager = manager;
		if (cancelled) {
			manager.cancel();
		}

		DownloadResult downloads = manager.run(crawl.documents());
		RunSummary summary = RunSummary.of(crawl, downloads, cancelled);
		logger.info("Run finished: {}", summary);
		return summary;
	}

	/**
	 * Stop the run as soon as it is safe: no new pages are crawled and no new downloads start, but
	 * downloads in progress finish their current attempt and are recorded.
	 */
	public void cancel() {
		cancelled = true;
		crawler.cancel();
		DownloadManager manager = downloadManager;
		if (manager != null) {
			manager.cancel();
		}
	}

	public DownloadLedger ledger() {
		return ledger;
	}

	public ScraperConfig config() {
		return config;
	}
}
