package dev.jbang.pdfscraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Objects;

/** Outcome of downloading a single document URL */
@JsonPropertyOrder({"url", "filename", "status", "timestamp", "size", "attempts", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEntry(
		@JsonProperty("url") String url,
		@JsonProperty("filename") String filename,
		@JsonProperty("status") DownloadStatus status,
		@JsonProperty("timestamp") Instant timestamp,
		@JsonProperty("size") Long size,
		@JsonProperty("attempts") Integer attempts,
		@JsonProperty("error") String error) {

	public LedgerEntry {
		Objects.requireNonNull(url, "url");
		Objects.requireNonNull(filename, "filename");
		Objects.requireNonNull(status, "status");
		if (timestamp == null) {
			timestamp = Instant.now();
		}
	}

	public static LedgerEntry completed(String url, String filename, long size, int attempts) {
		return new LedgerEntry(url, filename, DownloadStatus.completed, Instant.now(), size, attempts, null);
	}

	public static LedgerEntry failed(String url, String filename, int attempts, String error) {
		return new LedgerEntry(url, filename, DownloadStatus.failed, Instant.now(), null, attempts, error);
	}

	public boolean isCompleted() {
		return status == DownloadStatus.completed;
	}
}
