package dev.jbang.pdfscraper.download;

import dev.jbang.pdfscraper.util.FileUtils;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Writes downloaded documents into the output directory. A document only appears under its final
 * name once all of its bytes are on disk; until then it lives in a ".part" file.
 */
public class DocumentStore {
	static final String PARTIAL_SUFFIX = ".part";

	private final Path outputDir;

	public DocumentStore(Path outputDir) {
		this.outputDir = outputDir.toAbsolutePath().normalize();
	}

	public Path outputDir() {
		return outputDir;
	}

	/** Create the output directory and remove partial files left behind by an earlier run */
	public void init() throws IOException {
		FileUtils.ensureDirectory(outputDir);
		try (Stream<Path> paths = Files.list(outputDir)) {
			paths.filter(p -> p.getFileName().toString().endsWith(PARTIAL_SUFFIX)).forEach(FileUtils::deleteQuietly);
		}
	}

	/**
	 * Store a document under the given name, replacing any existing file.
	 *
	 * @return The path of the written file
	 * @throws IOException If the document could not be written completely
	 */
	public Path write(String filename, byte[] content) throws IOException {
		Path target = resolve(filename);
		Path tempFile = Files.createTempFile(outputDir, "." + filename + "-", PARTIAL_SUFFIX);
		try {
			try (OutputStream out = Files.newOutputStream(tempFile)) {
				writeContent(out, content);
			}
			try {
				Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
			}
			tempFile = null;
			return target;
		} finally {
			if (tempFile != null) {
				FileUtils.deleteQuietly(tempFile);
			}
		}
	}

	/** Write the document bytes to the partial file */
	protected void writeContent(OutputStream out, byte[] content) throws IOException {
		out.write(content);
	}

	/** Whether a complete, non-empty document exists under this name */
	public boolean contains(String filename) {
		return FileUtils.isNonEmptyFile(resolve(filename));
	}

	public void delete(String filename) {
		FileUtils.deleteQuietly(resolve(filename));
	}

	/** Names of the documents currently in the output directory */
	public List<String> filenames() throws IOException {
		if (!Files.isDirectory(outputDir)) {
			return List.of();
		}
		try (Stream<Path> paths = Files.list(outputDir)) {
			return paths.filter(Files::isRegularFile)
					.map(p -> p.getFileName().toString())
					.filter(name -> !name.endsWith(PARTIAL_SUFFIX))
					.sorted()
					.toList();
		}
	}

	/** Resolve a filename inside the output directory, rejecting anything that would escape it */
	public Path resolve(String filename) {
		Path target = outputDir.resolve(filename).normalize();
		if (!outputDir.equals(target.getParent())) {
			throw new IllegalArgumentException("Invalid document filename: " + filename);
		}
		return target;
	}
}
