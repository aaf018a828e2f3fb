package dev.jbang.pdfscraper;

import dev.jbang.pdfscraper.ledger.DownloadLedger;
import dev.jbang.pdfscraper.ledger.LedgerException;
import dev.jbang.pdfscraper.model.LedgerEntry;
import dev.jbang.pdfscraper.util.FileUtils;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Status command to summarize the download log */
@Command(
		name = "status",
		description = "Show what the download log records: completed and failed downloads, and missing files",
		mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory containing downloaded documents (default: ${DEFAULT-VALUE})",
			defaultValue = "downloaded_pdfs")
	private Path outputDir;

	@Option(
			names = {"-l", "--log-file"},
			description = "JSON file recording every download (default: ${DEFAULT-VALUE})",
			defaultValue = "download_log.json")
	private Path ledgerFile;

	@Override
	public Integer call() {
		DownloadLedger ledger = new DownloadLedger(ledgerFile);
		try {
			ledger.load();
		} catch (LedgerException e) {
			logger.error("Error: {}", e.getMessage());
			return Main.EXIT_FATAL;
		}

		List<LedgerEntry> entries = ledger.entries();
		List<LedgerEntry> failed =
				entries.stream().filter(e -> !e.isCompleted()).toList();
		List<LedgerEntry> missing = entries.stream()
				.filter(LedgerEntry::isCompleted)
				.filter(e -> !FileUtils.isNonEmptyFile(outputDir.resolve(e.filename())))
				.toList();

		logger.info("Download log: {}", ledgerFile.toAbsolutePath());
		logger.info("Entries: {}", entries.size());
		logger.info("Completed: {}", entries.size() - failed.size());
		logger.info("Failed: {}", failed.size());
		if (!failed.isEmpty()) {
			logger.info("");
			logger.info("Failed downloads:");
			failed.forEach(e -> logger.info("  {} - {}", e.url(), e.error() != null ? e.error() : "unknown error"));
		}
		if (!missing.isEmpty()) {
			logger.info("");
			logger.info("Completed downloads whose file is missing (will be downloaded again):");
			missing.forEach(e -> logger.info("  {} -> {}", e.url(), e.filename()));
		}
		return failed.isEmpty() && missing.isEmpty() ? Main.EXIT_OK : Main.EXIT_FAILURES;
	}
}
