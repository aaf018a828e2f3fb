package dev.jbang.pdfscraper.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Utility class for computing hashes */
public class HashUtils {

	/**
	 * Compute the SHA-256 hash of a string
	 *
	 * @param value The string to hash, encoded as UTF-8
	 * @return The hex-encoded hash
	 */
	public static String sha256(String value) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return bytesToHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			// Every JDK is required to ship SHA-256
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	/** Convert byte array to hex string */
	private static String bytesToHex(byte[] bytes) {
		StringBuilder result = new StringBuilder();
		for (byte b : bytes) {
			result.append(String.format("%02x", b));
		}
		return result.toString();
	}
}
