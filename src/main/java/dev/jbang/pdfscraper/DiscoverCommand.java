package dev.jbang.pdfscraper;

import dev.jbang.pdfscraper.crawl.CrawlException;
import dev.jbang.pdfscraper.crawl.CrawlResult;
import dev.jbang.pdfscraper.model.DocumentLink;
import dev.jbang.pdfscraper.scraper.ArchiveScraper;
import dev.jbang.pdfscraper.scraper.ScraperConfig;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Discover command: crawl the archive and print the documents found */
@Command(
		name = "discover",
		description = "Crawl the archive and print the URL of every document found, without downloading",
		mixinStandardHelpOptions = true)
public class DiscoverCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	CrawlOptions options;

	@Override
	public Integer call() {
		ScraperConfig config;
		try {
			config = options.toConfig(false, true);
		} catch (IllegalArgumentException e) {
			logger.error("Invalid configuration: {}", e.getMessage());
			return Main.EXIT_FATAL;
		}

		CrawlResult result;
		try {
			result = new ArchiveScraper(config).discover();
		} catch (CrawlException e) {
			logger.error("Error: {}", e.getMessage());
			return Main.EXIT_FATAL;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Discovery interrupted");
			return Main.EXIT_FATAL;
		}

		for (DocumentLink document : result.documents()) {
			System.out.println(document.url());
		}
		logger.info("{}", result);
		result.failedPages().forEach((page, reason) -> logger.warn("Failed page: {} - {}", page, reason));
		return result.isPartial() ? Main.EXIT_FAILURES : Main.EXIT_OK;
	}
}
