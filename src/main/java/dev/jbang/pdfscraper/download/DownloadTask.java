package dev.jbang.pdfscraper.download;

import dev.jbang.pdfscraper.model.DocumentLink;
import java.net.URI;
import java.util.concurrent.atomic.AtomicInteger;

/** A document that has been given a filename and is waiting for, or going through, download */
public class DownloadTask {
	private final DocumentLink link;
	private final String targetFilename;
	private final AtomicInteger attemptCount = new AtomicInteger();

	public DownloadTask(DocumentLink link, String targetFilename) {
		this.link = link;
		this.targetFilename = targetFilename;
	}

	public URI url() {
		return link.url();
	}

	public String targetFilename() {
		return targetFilename;
	}

	public int attemptCount() {
		return attemptCount.get();
	}

	/** Count a new fetch attempt, returning the updated total */
	int incrementAttempts() {
		return attemptCount.incrementAndGet();
	}

	@Override
	public String toString() {
		return "%s -> %s (%d attempts)".formatted(link.url(), targetFilename, attemptCount.get());
	}
}
