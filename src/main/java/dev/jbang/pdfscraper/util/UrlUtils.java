package dev.jbang.pdfscraper.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** Utility class for URL handling */
public class UrlUtils {
	// unreserved, sub-delims and the path/query separators of RFC 3986
	private static final String ALLOWED = "-._~!$&'()*+,;=:@/?";
	private static final char[] HEX = "0123456789ABCDEF".toCharArray();

	/**
	 * Parse an absolute URL as written in a page, percent-encoding the characters {@link URI} rejects
	 * (spaces, brackets, pipes, non-ASCII letters, stray '%' and the like), and normalize it.
	 *
	 * @return The normalized URL, or null if it is empty, malformed or not http(s)
	 */
	public static URI parse(String url) {
		if (url == null || url.isBlank()) {
			return null;
		}
		try {
			return normalize(new URI(encodeIllegalChars(url.trim())));
		} catch (URISyntaxException | IllegalArgumentException e) {
			return null;
		}
	}

	/**
	 * Normalize a URL so equivalent spellings compare equal: lower-case scheme and host, no default
	 * port, no fragment, no dot-segments, and "/" for an empty path.
	 *
	 * @return The normalized URL, or null if it is not an absolute http(s) URL
	 */
	public static URI normalize(URI url) {
		if (url == null || !url.isAbsolute() || url.getHost() == null) {
			return null;
		}
		String scheme = url.getScheme().toLowerCase(Locale.ROOT);
		if (!scheme.equals("http") && !scheme.equals("https")) {
			return null;
		}
		String host = url.getHost().toLowerCase(Locale.ROOT);
		int port = url.getPort();
		if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
			port = -1;
		}
		String path = url.getRawPath();
		if (path == null || path.isEmpty()) {
			path = "/";
		}
		StringBuilder sb = new StringBuilder(scheme).append("://");
		if (url.getRawUserInfo() != null) {
			sb.append(url.getRawUserInfo()).append('@');
		}
		sb.append(host);
		if (port != -1) {
			sb.append(':').append(port);
		}
		sb.append(path);
		if (url.getRawQuery() != null) {
			sb.append('?').append(url.getRawQuery());
		}
		try {
			return new URI(sb.toString()).normalize();
		} catch (URISyntaxException e) {
			return null;
		}
	}

	/** The decoded last path segment of a URL, or an empty string if there is none */
	public static String lastPathSegment(URI url) {
		String path = url.getPath();
		if (path == null || path.isEmpty()) {
			return "";
		}
		int lastSlash = path.lastIndexOf('/');
		return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
	}

	/** The lower-cased extension of the last path segment including the dot, or "" */
	public static String extension(URI url) {
		String segment = lastPathSegment(url);
		int dot = segment.lastIndexOf('.');
		return dot > 0 ? segment.substring(dot).toLowerCase(Locale.ROOT) : "";
	}

	/** Percent-encode everything after the authority that isn't allowed to appear literally in a URI */
	static String encodeIllegalChars(String url) {
		int schemeEnd = url.indexOf("://");
		int pathStart = url.length();
		if (schemeEnd >= 0) {
			for (int i = schemeEnd + 3; i < url.length(); i++) {
				char c = url.charAt(i);
				if (c == '/' || c == '?' || c == '#') {
					pathStart = i;
					break;
				}
			}
		} else {
			pathStart = 0;
		}

		StringBuilder sb = new StringBuilder(url.length() + 16).append(url, 0, pathStart);
		boolean inFragment = false;
		for (int i = pathStart; i < url.length(); i++) {
			char c = url.charAt(i);
			if (c == '%' && i + 2 < url.length() && isHex(url.charAt(i + 1)) && isHex(url.charAt(i + 2))) {
				sb.append(c);
			} else if (c == '#' && !inFragment) {
				inFragment = true;
				sb.append(c);
			} else if (c > 0x20 && c < 0x7f && (Character.isLetterOrDigit(c) || ALLOWED.indexOf(c) >= 0)) {
				sb.append(c);
			} else {
				int end = Character.isHighSurrogate(c) && i + 1 < url.length() ? i + 2 : i + 1;
				for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
					sb.append('%').append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
				}
				i = end - 1;
			}
		}
		return sb.toString();
	}

	private static boolean isHex(char c) {
		return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}
}
