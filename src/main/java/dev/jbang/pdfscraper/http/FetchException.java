package dev.jbang.pdfscraper.http;

import java.io.IOException;

/** Base class for failures to fetch a URL */
public abstract class FetchException extends IOException {
	private final String url;
	private final int attempts;

	protected FetchException(String message, String url, int attempts, Throwable cause) {
		super(message, cause);
		this.url = url;
		this.attempts = attempts;
	}

	public String url() {
		return url;
	}

	/** Number of attempts made before giving up */
	public int attempts() {
		return attempts;
	}

	/** Whether the failure could go away by trying again later */
	public abstract boolean isTransient();
}
