package dev.jbang.pdfscraper.http;

/**
 * A fetch failure that is worth retrying: timeouts, connection problems, server errors and rate
 * limiting. Thrown by the fetcher once the retry policy is exhausted.
 */
public class TransientFetchException extends FetchException {

	public enum Kind {
		TIMEOUT,
		CONNECTION,
		SERVER_ERROR,
		RATE_LIMITED
	}

	private final Kind kind;
	private final int statusCode;

	public TransientFetchException(Kind kind, String url, int statusCode, int attempts, Throwable cause) {
		super(describe(kind, url, statusCode, attempts, cause), url, attempts, cause);
		this.kind = kind;
		this.statusCode = statusCode;
	}

	public Kind kind() {
		return kind;
	}

	/** The HTTP status of the last attempt, or -1 if no response was received */
	public int statusCode() {
		return statusCode;
	}

	/** Copy of this failure with the number of attempts actually made */
	TransientFetchException withAttempts(int attempts) {
		return new TransientFetchException(kind, url(), statusCode, attempts, getCause());
	}

	@Override
	public boolean isTransient() {
		return true;
	}

	private static String describe(Kind kind, String url, int statusCode, int attempts, Throwable cause) {
		StringBuilder sb = new StringBuilder("Failed to fetch ").append(url).append(" - ");
		switch (kind) {
			case TIMEOUT -> sb.append("timed out");
			case CONNECTION -> sb.append("connection error");
			case SERVER_ERROR, RATE_LIMITED -> sb.append("HTTP status: ").append(statusCode);
		}
		if (cause != null && cause.getMessage() != null) {
			sb.append(" (").append(cause.getMessage()).append(")");
		}
		if (attempts > 0) {
			sb.append(" after ").append(attempts).append(attempts == 1 ? " attempt" : " attempts");
		}
		return sb.toString();
	}
}
