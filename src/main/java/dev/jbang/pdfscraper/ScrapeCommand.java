package dev.jbang.pdfscraper;

import dev.jbang.pdfscraper.crawl.CrawlException;
import dev.jbang.pdfscraper.ledger.LedgerException;
import dev.jbang.pdfscraper.scraper.ArchiveScraper;
import dev.jbang.pdfscraper.scraper.RunSummary;
import dev.jbang.pdfscraper.scraper.ScraperConfig;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Scrape command: crawl the archive and download every document not downloaded yet */
@Command(
		name = "scrape",
		description = "Crawl the archive and download all documents that haven't been downloaded yet",
		mixinStandardHelpOptions = true)
public class ScrapeCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	CrawlOptions options;

	@Option(
			names = {"--from-start"},
			description = "Ignore completed entries in the download log and download everything again")
	private boolean fromStart;

	@Option(
			names = {"--dry-run"},
			description = "Crawl and report what would be downloaded, without downloading anything")
	private boolean dryRun;

	@Override
	public Integer call() {
		ScraperConfig config;
		try {
			config = options.toConfig(fromStart, dryRun);
		} catch (IllegalArgumentException e) {
			logger.error("Invalid configuration: {}", e.getMessage());
			return Main.EXIT_FATAL;
		}

		logger.info("Archive PDF Scraper - Scrape");
		logger.info("============================");
		logger.info("Archive root: {}", config.rootUrl());
		logger.info("Output directory: {}", config.outputDir().toAbsolutePath());
		logger.info("Download log: {}", config.ledgerFile().toAbsolutePath());
		logger.info("Max parallel downloads: {}", config.threads());
		if (dryRun) {
			logger.info("Dry-run mode enabled - files will not be downloaded");
		}
		logger.info("");

		ArchiveScraper scraper = new ArchiveScraper(config);
		CountDownLatch finished = new CountDownLatch(1);
		long graceMillis = config.fetcherConfig().timeout().toMillis() * 2
				+ config.fetcherConfig().retryPolicy().maxDelay().toMillis();
		Thread shutdownHook = new Thread(
				() -> {
					if (finished.getCount() > 0) {
						logger.warn("Interrupted, letting downloads in progress finish...");
						scraper.cancel();
						try {
							finished.await(graceMillis, TimeUnit.MILLISECONDS);
						} catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						}
					}
				},
				"scraper-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		RunSummary summary;
		try {
			summary = scraper.run();
		} catch (CrawlException e) {
			logger.error("Error: {}", e.getMessage());
			return Main.EXIT_FATAL;
		} catch (LedgerException e) {
			logger.error("Error: {}", e.getMessage());
			return Main.EXIT_FATAL;
		} catch (IOException e) {
			logger.error("Error preparing output directory: {}", e.getMessage());
			return Main.EXIT_FATAL;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Scraper interrupted");
			return Main.EXIT_FATAL;
		} finally {
			finished.countDown();
			removeShutdownHook(shutdownHook);
		}

		printSummary(summary);
		return summary.hasFailures() || summary.cancelled() ? Main.EXIT_FAILURES : Main.EXIT_OK;
	}

	private void printSummary(RunSummary summary) {
		logger.info("");
		logger.info("Summary");
		logger.info("=======");
		logger.info("Documents discovered: {}", summary.discovered());
		logger.info("Downloaded: {}", summary.succeeded());
		logger.info("Failed: {}", summary.failed());
		logger.info("Skipped (already downloaded): {}", summary.skipped());
		if (summary.notDispatched() > 0) {
			logger.info("Not downloaded: {}", summary.notDispatched());
		}
		if (!summary.failedPages().isEmpty()) {
			logger.info("");
			logger.info("Pages that could not be crawled:");
			summary.failedPages().forEach((page, reason) -> logger.info("  {} - {}", page, reason));
		}
		if (!summary.failedDocuments().isEmpty()) {
			logger.info("");
			logger.info("Documents that could not be downloaded:");
			for (Map.Entry<String, String> failure : summary.failedDocuments().entrySet()) {
				logger.info("  {} - {}", failure.getKey(), failure.getValue());
			}
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			logger.debug("JVM is already shutting down");
		}
	}
}
