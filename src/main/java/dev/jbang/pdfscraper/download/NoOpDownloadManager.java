package dev.jbang.pdfscraper.download;

import dev.jbang.pdfscraper.ledger.DownloadLedger;
import dev.jbang.pdfscraper.model.DocumentLink;
import dev.jbang.pdfscraper.model.LedgerEntry;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-operation implementation of DownloadManager that skips all downloads. Reports which documents
 * would be downloaded without touching the network, the output directory or the ledger.
 */
public class NoOpDownloadManager implements DownloadManager {
	private static final Logger logger = LoggerFactory.getLogger(NoOpDownloadManager.class);

	private final DownloadLedger ledger;
	private final DocumentStore store;
	private final AtomicInteger skippedDownloads = new AtomicInteger(0);
	private final AtomicInteger wouldDownload = new AtomicInteger(0);

	/**
	 * Create a new NoOpDownloadManager.
	 *
	 * @param ledger Used to tell which documents are already downloaded, may be null
	 * @param store Where downloaded documents are kept, consulted to see that a completed document's
	 *     file is still there; may be null when there is no ledger
	 */
	public NoOpDownloadManager(DownloadLedger ledger, DocumentStore store) {
		this.ledger = ledger;
		this.store = store;
	}

	public NoOpDownloadManager() {
		this(null, null);
	}

	@Override
	public void start() {
		logger.info("NoOpDownloadManager started - all downloads will be skipped");
	}

	@Override
	public boolean submit(DocumentLink link) {
		String url = link.url().toString();
		if (isAlreadyDownloaded(url)) {
			skippedDownloads.incrementAndGet();
			logger.debug("Already downloaded: {}", url);
			return false;
		}
		wouldDownload.incrementAndGet();
		logger.info("Would download {} (found on {})", url, link.sourcePage());
		return false;
	}

	/** Same rule the real download uses: completed in the ledger and the file still present */
	private boolean isAlreadyDownloaded(String url) {
		if (ledger == null) {
			return false;
		}
		Optional<LedgerEntry> entry = ledger.get(url);
		if (entry.isEmpty() || !entry.get().isCompleted()) {
			return false;
		}
		return store == null || store.contains(entry.get().filename());
	}

	@Override
	public void shutdown() {
		logger.info("NoOpDownloadManager shutdown");
	}

	@Override
	public void cancel() {
		// nothing is ever in progress
	}

	/**
	 * Returns immediately as there are no downloads. Documents that would have been downloaded are
	 * reported as not dispatched.
	 */
	@Override
	public DownloadResult awaitCompletion() {
		return new DownloadResult(0, 0, skippedDownloads.get(), wouldDownload.get(), Map.of());
	}

	@Override
	public int getCompletedCount() {
		return 0;
	}

	@Override
	public int getFailedCount() {
		return 0;
	}

	@Override
	public int getSkippedCount() {
		return skippedDownloads.get();
	}

	@Override
	public int getRemainingCount() {
		return 0;
	}
}
