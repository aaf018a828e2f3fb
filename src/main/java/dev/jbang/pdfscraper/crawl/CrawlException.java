package dev.jbang.pdfscraper.crawl;

/** The crawl could not even start, typically because the archive root is unreachable */
public class CrawlException extends Exception {
	public CrawlException(String message, Throwable cause) {
		super(message, cause);
	}
}
