package dev.jbang.pdfscraper.download;

import dev.jbang.pdfscraper.util.HashUtils;
import dev.jbang.pdfscraper.util.UrlUtils;
import java.net.URI;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Hands out local filenames so that no two documents ever share one. Names are derived from the
 * last path segment of the URL; a short hash of the URL is added when that name is already taken.
 * Names are compared case-insensitively so the guarantee also holds on case-insensitive file
 * systems.
 */
public class FilenameRegistry {
	static final int MAX_STEM_LENGTH = 120;
	private static final String FALLBACK_STEM = "document";

	private final String defaultExtension;
	private final Map<String, String> filenamesByUrl = new HashMap<>();
	private final Set<String> taken = new HashSet<>();

	/** @param defaultExtension Extension given to names derived from URLs that don't have one */
	public FilenameRegistry(String defaultExtension) {
		this.defaultExtension = defaultExtension;
	}

	/** Mark a filename as unavailable, e.g. because a file with that name already exists */
	public synchronized void reserve(String filename) {
		taken.add(key(filename));
	}

	public synchronized void reserveAll(Collection<String> filenames) {
		filenames.forEach(this::reserve);
	}

	/** Remember a filename assigned to a URL in an earlier run, so the URL keeps it */
	public synchronized void assign(String url, String filename) {
		filenamesByUrl.put(url, filename);
		taken.add(key(filename));
	}

	/**
	 * Get the filename for a URL, claiming a new unique one if the URL doesn't have one yet.
	 *
	 * @param url The document URL
	 * @return A filename that no other URL has been or will be given
	 */
	public synchronized String claim(URI url) {
		String key = url.toString();
		String existing = filenamesByUrl.get(key);
		if (existing != null) {
			return existing;
		}

		String baseName = baseName(url);
		String filename = baseName;
		if (taken.contains(key(filename))) {
			int dot = baseName.lastIndexOf('.');
			String stem = dot > 0 ? baseName.substring(0, dot) : baseName;
			String ext = dot > 0 ? baseName.substring(dot) : "";
			String hashed = stem + "-" + HashUtils.sha256(key).substring(0, 8);
			filename = hashed + ext;
			for (int counter = 2; taken.contains(key(filename)); counter++) {
				filename = hashed + "-" + counter + ext;
			}
		}

		taken.add(key(filename));
		filenamesByUrl.put(key, filename);
		return filename;
	}

	/** Number of names currently in use */
	public synchronized int size() {
		return taken.size();
	}

	/** The filename a URL would get if nothing else claimed its name first */
	String baseName(URI url) {
		String segment = UrlUtils.lastPathSegment(url);
		String sanitized = segment.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("^[._]+", "");

		int dot = sanitized.lastIndexOf('.');
		String stem = dot > 0 ? sanitized.substring(0, dot) : sanitized;
		String ext = dot > 0 ? sanitized.substring(dot).toLowerCase(Locale.ROOT) : defaultExtension;
		if (stem.isEmpty()) {
			stem = FALLBACK_STEM;
		}
		if (stem.length() > MAX_STEM_LENGTH) {
			stem = stem.substring(0, MAX_STEM_LENGTH);
		}
		return stem + ext;
	}

	private static String key(String filename) {
		return filename.toLowerCase(Locale.ROOT);
	}
}
