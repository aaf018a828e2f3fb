package dev.jbang.pdfscraper.model;

/** Terminal outcome of a download, as recorded in the ledger */
public enum DownloadStatus {
	completed,
	failed
}
