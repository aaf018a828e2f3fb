package dev.jbang.pdfscraper.ledger;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.jbang.pdfscraper.model.LedgerEntry;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent record of download outcomes, keyed by document URL. Every {@link #record} is written
 * through to disk before it returns, so a crash loses at most the entry that was being recorded.
 * All mutation happens under a single lock.
 */
public class DownloadLedger {
	private static final Logger logger = LoggerFactory.getLogger(DownloadLedger.class);

	private static final TypeReference<List<LedgerEntry>> ENTRY_LIST = new TypeReference<>() {};

	private static final ObjectMapper mapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private final Path ledgerFile;
	private final Object lock = new Object();
	private final Map<String, LedgerEntry> entries = new TreeMap<>();
	// lower-cased filename -> owning URL
	private final Map<String, String> filenameOwners = new HashMap<>();

	public DownloadLedger(Path ledgerFile) {
		this.ledgerFile = ledgerFile;
	}

	public Path ledgerFile() {
		return ledgerFile;
	}

	/**
	 * Read the ledger file, replacing anything held in memory. A missing file yields an empty
	 * ledger.
	 *
	 * @return An unmodifiable snapshot of the entries by URL
	 * @throws LedgerException If the file exists but cannot be read or parsed
	 */
	public Map<String, LedgerEntry> load() {
		synchronized (lock) {
			entries.clear();
			filenameOwners.clear();
			if (!Files.exists(ledgerFile)) {
				logger.debug("No ledger at {}, starting empty", ledgerFile);
				return snapshot();
			}
			List<LedgerEntry> loaded;
			try {
				loaded = Files.size(ledgerFile) == 0 ? List.of() : mapper.readValue(ledgerFile.toFile(), ENTRY_LIST);
			} catch (IOException e) {
				throw new LedgerException("Failed to read download log " + ledgerFile + ": " + e.getMessage(), e);
			}
			for (LedgerEntry entry : loaded) {
				if (entry == null) {
					continue;
				}
				LedgerEntry previous = entries.put(entry.url(), entry);
				if (previous != null) {
					filenameOwners.remove(key(previous.filename()), previous.url());
				}
				filenameOwners.put(key(entry.filename()), entry.url());
			}
			logger.info("Loaded {} entries from {}", entries.size(), ledgerFile);
			return snapshot();
		}
	}

	/**
	 * Insert or replace the entry for a URL and persist the ledger.
	 *
	 * @throws IllegalStateException If the entry's filename already belongs to another URL
	 * @throws LedgerException If the ledger cannot be written
	 */
	public void record(LedgerEntry entry) {
		synchronized (lock) {
			String owner = filenameOwners.get(key(entry.filename()));
			if (owner != null && !owner.equals(entry.url())) {
				throw new IllegalStateException(
						"Filename " + entry.filename() + " is already recorded for " + owner + ", not " + entry.url());
			}
			LedgerEntry previous = entries.put(entry.url(), entry);
			if (previous != null && !key(previous.filename()).equals(key(entry.filename()))) {
				filenameOwners.remove(key(previous.filename()), previous.url());
			}
			filenameOwners.put(key(entry.filename()), entry.url());
			persist();
		}
	}

	/**
	 * Write all entries to the ledger file. The file is replaced atomically where the file system
	 * supports it, so readers never see a half-written ledger.
	 *
	 * @throws LedgerException If the ledger cannot be written
	 */
	public void persist() {
		synchronized (lock) {
			Path tempFile = null;
			try {
				Path dir = ledgerFile.toAbsolutePath().getParent();
				Files.createDirectories(dir);
				tempFile = Files.createTempFile(dir, ledgerFile.getFileName().toString(), ".tmp");
				mapper.writeValue(tempFile.toFile(), new ArrayList<>(entries.values()));
				try {
					Files.move(tempFile, ledgerFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
				} catch (AtomicMoveNotSupportedException e) {
					Files.move(tempFile, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
				}
				tempFile = null;
			} catch (IOException e) {
				throw new LedgerException("Failed to write download log " + ledgerFile + ": " + e.getMessage(), e);
			} finally {
				if (tempFile != null) {
					try {
						Files.deleteIfExists(tempFile);
					} catch (IOException e) {
						logger.debug("Could not remove temporary ledger file {}", tempFile, e);
					}
				}
			}
		}
	}

	public Optional<LedgerEntry> get(String url) {
		synchronized (lock) {
			return Optional.ofNullable(entries.get(url));
		}
	}

	public boolean isCompleted(String url) {
		return get(url).map(LedgerEntry::isCompleted).orElse(false);
	}

	/** All entries, sorted by URL */
	public List<LedgerEntry> entries() {
		synchronized (lock) {
			return List.copyOf(entries.values());
		}
	}

	/** Every filename the ledger has assigned, completed or not */
	public Set<String> filenames() {
		synchronized (lock) {
			Set<String> result = new TreeSet<>();
			entries.values().forEach(e -> result.add(e.filename()));
			return result;
		}
	}

	public int size() {
		synchronized (lock) {
			return entries.size();
		}
	}

	private Map<String, LedgerEntry> snapshot() {
		return Collections.unmodifiableMap(new TreeMap<>(entries));
	}

	private static String key(String filename) {
		return filename.toLowerCase(Locale.ROOT);
	}
}
