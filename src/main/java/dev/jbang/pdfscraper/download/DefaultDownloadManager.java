package dev.jbang.pdfscraper.download;

import dev.jbang.pdfscraper.http.FetchException;
import dev.jbang.pdfscraper.http.Fetcher;
import dev.jbang.pdfscraper.ledger.DownloadLedger;
import dev.jbang.pdfscraper.ledger.LedgerException;
import dev.jbang.pdfscraper.model.DocumentLink;
import dev.jbang.pdfscraper.model.LedgerEntry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation that downloads documents in parallel worker threads. Submitted documents
 * are checked against the ledger, given a unique filename, queued, and picked up by a fixed number
 * of workers. Each worker records the outcome of its download in the ledger before taking the next
 * one.
 */
public class DefaultDownloadManager implements DownloadManager {
	private static final Logger logger = LoggerFactory.getLogger(DefaultDownloadManager.class);

	public static final int DEFAULT_THREAD_COUNT = 10;
	private static final long POLL_MILLIS = 100;

	private final int threadCount;
	private final Fetcher fetcher;
	private final DownloadLedger ledger;
	private final DocumentStore store;
	private final FilenameRegistry registry;
	private final boolean fromStart;

	private final BlockingQueue<DownloadTask> downloadQueue;
	private final ExecutorService executorService;
	private final AtomicInteger activeDownloads = new AtomicInteger(0);
	private final AtomicInteger completedDownloads = new AtomicInteger(0);
	private final AtomicInteger failedDownloads = new AtomicInteger(0);
	private final AtomicInteger skippedDownloads = new AtomicInteger(0);
	private final AtomicInteger notDispatched = new AtomicInteger(0);
	private final Map<String, String> failures = new ConcurrentHashMap<>();
	private final Set<String> submittedUrls = ConcurrentHashMap.newKeySet();
	private final AtomicReference<LedgerException> fatalError = new AtomicReference<>();
	private volatile boolean started;
	private volatile boolean shutdownRequested;
	private volatile boolean cancelled;

	/**
	 * Create a new DefaultDownloadManager.
	 *
	 * @param threadCount Number of parallel download threads
	 * @param fetcher Fetcher used to download documents
	 * @param ledger The loaded ledger, consulted for skips and updated with every outcome
	 * @param store Where downloaded documents are written
	 * @param defaultExtension Extension for documents whose URL doesn't carry one
	 * @param fromStart Download everything again, ignoring completed ledger entries
	 */
	public DefaultDownloadManager(
			int threadCount,
			Fetcher fetcher,
			DownloadLedger ledger,
			DocumentStore store,
			String defaultExtension,
			boolean fromStart) {
		if (threadCount < 1) {
			throw new IllegalArgumentException("threadCount must be at least 1, got " + threadCount);
		}
		this.threadCount = threadCount;
		this.fetcher = fetcher;
		this.ledger = ledger;
		this.store = store;
		this.registry = new FilenameRegistry(defaultExtension);
		this.fromStart = fromStart;
		this.downloadQueue = new LinkedBlockingQueue<>();
		this.executorService = Executors.newFixedThreadPool(threadCount, workerThreadFactory());
	}

	public DefaultDownloadManager(int threadCount, Fetcher fetcher, DownloadLedger ledger, DocumentStore store) {
		this(threadCount, fetcher, ledger, store, ".pdf", false);
	}

	/**
	 * Prepare the output directory, rebuild the filename registry from the ledger and the files
	 * already on disk, and start the worker threads.
	 */
	@Override
	public void start() throws IOException {
		if (started) {
			throw new IllegalStateException("DownloadManager already started");
		}
		store.init();
		for (LedgerEntry entry : ledger.entries()) {
			registry.assign(entry.url(), entry.filename());
		}
		registry.reserveAll(store.filenames());
		logger.info(
				"Starting DownloadManager with {} threads, {} filenames already in use", threadCount, registry.size());
		started = true;
		for (int i = 0; i < threadCount; i++) {
			executorService.submit(this::downloadWorker);
		}
	}

	@Override
	public boolean submit(DocumentLink link) {
		if (!started) {
			throw new IllegalStateException("Cannot submit downloads before start");
		}
		if (shutdownRequested) {
			throw new IllegalStateException("Cannot submit downloads after shutdown requested");
		}
		if (cancelled) {
			notDispatched.incrementAndGet();
			return false;
		}

		String url = link.url().toString();
		if (!submittedUrls.add(url)) {
			logger.debug("Ignoring {}, already submitted", url);
			return false;
		}
		if (!fromStart && isAlreadyDownloaded(url)) {
			skippedDownloads.incrementAndGet();
			logger.debug("Skipping {} (already downloaded)", url);
			return false;
		}

		String filename = registry.claim(link.url());
		try {
			downloadQueue.put(new DownloadTask(link, filename));
			logger.debug("Queued download of {} as {}", url, filename);
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted while submitting download", e);
		}
	}

	@Override
	public void shutdown() {
		if (!shutdownRequested) {
			logger.debug("No more downloads will be submitted");
			shutdownRequested = true;
		}
	}

	@Override
	public void cancel() {
		if (!cancelled) {
			logger.warn(
					"Cancelling downloads: {} in progress will finish, {} queued will not start",
					activeDownloads.get(),
					downloadQueue.size());
			cancelled = true;
		}
	}

	/**
	 * Wait for the workers to drain the queue, or to stop after a cancellation, and summarize.
	 *
	 * @throws LedgerException If the ledger could not be written during the run
	 */
	@Override
	public DownloadResult awaitCompletion() throws InterruptedException {
		shutdown();
		executorService.shutdown();
		while (!executorService.awaitTermination(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
			// keep waiting, workers exit once the queue is empty or the run is cancelled
		}

		List<DownloadTask> undispatched = new ArrayList<>();
		downloadQueue.drainTo(undispatched);
		notDispatched.addAndGet(undispatched.size());

		LedgerException fatal = fatalError.get();
		if (fatal != null) {
			throw fatal;
		}

		DownloadResult result = new DownloadResult(
				completedDownloads.get(),
				failedDownloads.get(),
				skippedDownloads.get(),
				notDispatched.get(),
				new TreeMap<>(failures));
		logger.info("Downloads finished: {}", result);
		return result;
	}

	@Override
	public int getCompletedCount() {
		return completedDownloads.get();
	}

	@Override
	public int getFailedCount() {
		return failedDownloads.get();
	}

	@Override
	public int getSkippedCount() {
		return skippedDownloads.get();
	}

	@Override
	public int getRemainingCount() {
		return downloadQueue.size() + activeDownloads.get();
	}

	/** Whether the ledger says the URL is done and its file is still there */
	private boolean isAlreadyDownloaded(String url) {
		Optional<LedgerEntry> entry = ledger.get(url);
		if (entry.isEmpty() || !entry.get().isCompleted()) {
			return false;
		}
		if (!store.contains(entry.get().filename())) {
			logger.warn("{} is recorded as downloaded but {} is missing, downloading again", url, entry.get().filename());
			return false;
		}
		return true;
	}

	/** Worker thread that processes downloads from the queue */
	private void downloadWorker() {
		while (!cancelled) {
			DownloadTask task;
			try {
				task = downloadQueue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
			if (task == null) {
				if (shutdownRequested && downloadQueue.isEmpty()) {
					break;
				}
				continue;
			}

			activeDownloads.incrementAndGet();
			try {
				processDownload(task);
			} catch (CancellationException e) {
				notDispatched.incrementAndGet();
				logger.info("Abandoned {} after cancellation", task.url());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				notDispatched.incrementAndGet();
				break;
			} catch (LedgerException e) {
				logger.error("Cannot update download log, stopping: {}", e.getMessage());
				fatalError.compareAndSet(null, e);
				cancel();
			} catch (RuntimeException e) {
				failedDownloads.incrementAndGet();
				failures.put(task.url().toString(), String.valueOf(e.getMessage()));
				logger.error("Unexpected error downloading {}", task.url(), e);
			} finally {
				activeDownloads.decrementAndGet();
			}
			logger.info(
					"Downloads: {} queued, {} active, {} completed, {} failed",
					downloadQueue.size(),
					activeDownloads.get(),
					completedDownloads.get(),
					failedDownloads.get());
		}
	}

	/** Process a single download task */
	private void processDownload(DownloadTask task) throws InterruptedException {
		String url = task.url().toString();
		String filename = task.targetFilename();

		byte[] body;
		try {
			body = fetcher.fetch(task.url(), (u, attempt) -> {
				if (cancelled && attempt > 1) {
					throw new CancellationException("Download of " + u + " cancelled");
				}
				task.incrementAttempts();
			});
		} catch (FetchException e) {
			fail(task, e.getMessage());
			return;
		}
		if (body.length == 0) {
			fail(task, "Empty response body for " + url);
			return;
		}

		try {
			store.write(filename, body);
		} catch (IOException | RuntimeException e) {
			fail(task, "Failed to write " + filename + ": " + e.getMessage());
			return;
		}

		try {
			ledger.record(LedgerEntry.completed(url, filename, body.length, task.attemptCount()));
		} catch (LedgerException e) {
			// the ledger doesn't know about this file
			store.delete(filename);
			throw e;
		}
		completedDownloads.incrementAndGet();
		logger.info("Downloaded {} ({} bytes)", filename, body.length);
	}

	private void fail(DownloadTask task, String reason) {
		ledger.record(LedgerEntry.failed(task.url().toString(), task.targetFilename(), task.attemptCount(), reason));
		failures.put(task.url().toString(), reason);
		failedDownloads.incrementAndGet();
		logger.error("Failed to download {}: {}", task.url(), reason);
	}

	private static ThreadFactory workerThreadFactory() {
		AtomicInteger counter = new AtomicInteger();
		return r -> {
			Thread thread = new Thread(r, "download-worker-" + counter.incrementAndGet());
			thread.setDaemon(false);
			return thread;
		};
	}
}
