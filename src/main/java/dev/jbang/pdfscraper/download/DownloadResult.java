package dev.jbang.pdfscraper.download;

import java.util.Map;

/**
 * Summary of a batch of downloads.
 *
 * @param succeeded Documents downloaded and recorded as completed
 * @param failed Documents recorded as failed
 * @param skipped Documents that were already downloaded by an earlier run
 * @param notDispatched Documents never attempted because the run was cancelled
 * @param failures Failed URLs mapped to the reason they failed
 */
public record DownloadResult(int succeeded, int failed, int skipped, int notDispatched, Map<String, String> failures) {

	public static DownloadResult empty() {
		return new DownloadResult(0, 0, 0, 0, Map.of());
	}

	public int total() {
		return succeeded + failed + skipped + notDispatched;
	}

	@Override
	public String toString() {
		return "%d succeeded, %d failed, %d skipped, %d not dispatched"
				.formatted(succeeded, failed, skipped, notDispatched);
	}
}
