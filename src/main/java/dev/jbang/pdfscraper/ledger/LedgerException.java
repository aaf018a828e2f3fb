package dev.jbang.pdfscraper.ledger;

/**
 * The download ledger could not be read or written. A run that hits this cannot keep its record of
 * downloads accurate and has to stop.
 */
public class LedgerException extends RuntimeException {
	public LedgerException(String message, Throwable cause) {
		super(message, cause);
	}
}
