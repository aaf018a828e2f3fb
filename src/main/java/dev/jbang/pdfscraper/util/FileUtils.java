package dev.jbang.pdfscraper.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for file operations */
public class FileUtils {
	private static final Logger logger = LoggerFactory.getLogger(FileUtils.class);

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Whether the path is a regular file with at least one byte in it */
	public static boolean isNonEmptyFile(Path file) {
		try {
			return Files.isRegularFile(file) && Files.size(file) > 0;
		} catch (IOException e) {
			return false;
		}
	}

	/** Delete a file if it exists, logging instead of failing if that isn't possible */
	public static void deleteQuietly(Path file) {
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			logger.debug("Could not delete {}", file, e);
		}
	}
}
