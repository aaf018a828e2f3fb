package dev.jbang.pdfscraper.http;

/** A fetch failure that will not be retried, like a 404 or a malformed URL */
public class PermanentFetchException extends FetchException {
	private final int statusCode;

	public PermanentFetchException(String message, String url, int statusCode, int attempts) {
		super(message, url, attempts, null);
		this.statusCode = statusCode;
	}

	public PermanentFetchException(String message, String url, Throwable cause) {
		super(message, url, 1, cause);
		this.statusCode = -1;
	}

	/** The HTTP status, or -1 if the request never produced one */
	public int statusCode() {
		return statusCode;
	}

	@Override
	public boolean isTransient() {
		return false;
	}
}
