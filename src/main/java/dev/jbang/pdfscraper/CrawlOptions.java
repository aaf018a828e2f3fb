package dev.jbang.pdfscraper;

import dev.jbang.pdfscraper.crawl.SameSitePolicy;
import dev.jbang.pdfscraper.http.FetcherConfig;
import dev.jbang.pdfscraper.http.RetryPolicy;
import dev.jbang.pdfscraper.scraper.ScraperConfig;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import picocli.CommandLine.Option;

/** Options shared by every command that crawls or downloads */
public class CrawlOptions {

	@Option(
			names = {"-u", "--root-url"},
			description = "Archive page to start crawling from (default: ${DEFAULT-VALUE})",
			defaultValue = "https://www.hmmt.org/www/archive/problems")
	URI rootUrl;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory to store downloaded documents (default: ${DEFAULT-VALUE})",
			defaultValue = "downloaded_pdfs")
	Path outputDir;

	@Option(
			names = {"-l", "--log-file"},
			description = "JSON file recording every download (default: ${DEFAULT-VALUE})",
			defaultValue = "download_log.json")
	Path ledgerFile;

	@Option(
			names = {"-t", "--threads"},
			description = "Maximum number of parallel downloads (default: ${DEFAULT-VALUE})",
			defaultValue = "10")
	int threads;

	@Option(
			names = {"--timeout"},
			description = "Request timeout in seconds (default: ${DEFAULT-VALUE})",
			defaultValue = "10")
	int timeoutSeconds;

	@Option(
			names = {"--max-attempts"},
			description = "Maximum number of attempts per request, including the first (default: ${DEFAULT-VALUE})",
			defaultValue = "5")
	int maxAttempts;

	@Option(
			names = {"--backoff-base"},
			description = "Delay in milliseconds before the first retry, doubled on each further retry (default: ${DEFAULT-VALUE})",
			defaultValue = "1000")
	long backoffBaseMillis;

	@Option(
			names = {"--backoff-cap"},
			description = "Maximum delay in milliseconds between retries (default: ${DEFAULT-VALUE})",
			defaultValue = "10000")
	long backoffCapMillis;

	@Option(
			names = {"--max-depth"},
			description = "How many levels of subpages below the root to follow (default: ${DEFAULT-VALUE})",
			defaultValue = "1")
	int maxDepth;

	@Option(
			names = {"--same-site"},
			description = "Which hosts count as the archive's own site: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
			defaultValue = "exact_host")
	SameSitePolicy sameSitePolicy;

	@Option(
			names = {"--suffix"},
			description = "URL suffixes that identify documents, comma-separated (default: ${DEFAULT-VALUE})",
			defaultValue = ".pdf",
			split = ",")
	List<String> documentSuffixes;

	@Option(
			names = {"--content-selector"},
			description = "CSS selector of the page element whose links are followed, empty for the whole page (default: ${DEFAULT-VALUE})",
			defaultValue = "div#content")
	String contentSelector;

	@Option(
			names = {"--user-agent"},
			description = "User-Agent header sent with every request")
	String userAgent;

	ScraperConfig toConfig(boolean fromStart, boolean dryRun) {
		RetryPolicy retryPolicy =
				new RetryPolicy(maxAttempts, Duration.ofMillis(backoffBaseMillis), Duration.ofMillis(backoffCapMillis));
		FetcherConfig fetcherConfig = new FetcherConfig(Duration.ofSeconds(timeoutSeconds), retryPolicy, userAgent);
		return new ScraperConfig(
				rootUrl,
				outputDir,
				ledgerFile,
				threads,
				fetcherConfig,
				maxDepth,
				sameSitePolicy,
				documentSuffixes,
				contentSelector,
				fromStart,
				dryRun);
	}
}
