package dev.jbang.pdfscraper.download;

import dev.jbang.pdfscraper.model.DocumentLink;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Interface for managing parallel downloads of documents. Documents are submitted one at a time,
 * queued, and downloaded by a bounded set of workers.
 */
public interface DownloadManager {
	/**
	 * Start the download manager. Should be called once after construction.
	 *
	 * @throws IOException If the output location cannot be prepared
	 */
	void start() throws IOException;

	/**
	 * Submit a document for download. Documents that were downloaded by an earlier run are skipped.
	 *
	 * @param link The document to download
	 * @return true if the document was queued, false if it was skipped
	 */
	boolean submit(DocumentLink link);

	/**
	 * Signal that no more downloads will be submitted.
	 */
	void shutdown();

	/**
	 * Stop handing out queued downloads. Downloads already in progress are allowed to finish their
	 * current attempt; the rest are reported as not dispatched.
	 */
	void cancel();

	/**
	 * Wait for all queued downloads to complete. Implies {@link #shutdown()}.
	 *
	 * @return The outcome of every submitted document
	 * @throws InterruptedException if interrupted while waiting
	 */
	DownloadResult awaitCompletion() throws InterruptedException;

	/**
	 * Download a batch of documents: start, submit all of them in URL order, and wait.
	 *
	 * @param links The documents to download
	 * @return The outcome of every document
	 */
	default DownloadResult run(Collection<DocumentLink> links) throws IOException, InterruptedException {
		start();
		try {
			List<DocumentLink> sorted = links.stream().sorted().toList();
			for (DocumentLink link : sorted) {
				submit(link);
			}
		} finally {
			shutdown();
		}
		return awaitCompletion();
	}

	/**
	 * Get the number of completed downloads.
	 *
	 * @return Number of successfully completed downloads
	 */
	int getCompletedCount();

	/**
	 * Get the number of failed downloads.
	 *
	 * @return Number of failed downloads
	 */
	int getFailedCount();

	/**
	 * Get the number of documents skipped because they were already downloaded.
	 *
	 * @return Number of skipped documents
	 */
	int getSkippedCount();

	/**
	 * Get the number of downloads that are queued or in progress.
	 *
	 * @return Number of remaining downloads
	 */
	int getRemainingCount();
}
