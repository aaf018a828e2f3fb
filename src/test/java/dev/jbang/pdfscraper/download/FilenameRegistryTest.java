package dev.jbang.pdfscraper.download;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.pdfscraper.util.HashUtils;
import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FilenameRegistryTest {

	@Test
	void testSameBaseNameGetsHashSuffix() {
		// Given
		FilenameRegistry registry = new FilenameRegistry(".pdf");
		URI first = URI.create("https://example.org/feb/d1.pdf");
		URI second = URI.create("https://example.org/nov/d1.pdf");

		// When
		String firstName = registry.claim(first);
		String secondName = registry.claim(second);

		// Then
		assertThat(firstName).isEqualTo("d1.pdf");
		assertThat(secondName).isEqualTo("d1-" + HashUtils.sha256(second.toString()).substring(0, 8) + ".pdf");
	}

	@Test
	void testUrlKeepsItsName() {
		// Given
		FilenameRegistry registry = new FilenameRegistry(".pdf");
		URI url = URI.create("https://example.org/a/d1.pdf");

		// When
		String name = registry.claim(url);
		registry.claim(URI.create("https://example.org/b/d1.pdf"));

		// Then
		assertThat(registry.claim(url)).isEqualTo(name);
	}

	@Test
	void testManyCollidingUrlsGetDistinctNames() {
		// Given
		FilenameRegistry registry = new FilenameRegistry(".pdf");
		Set<String> names = new HashSet<>();

		// When
		for (int i = 0; i < 200; i++) {
			String base = i % 2 == 0 ? "d1.pdf" : "D1.PDF";
			names.add(registry.claim(URI.create("https://example.org/" + i + "/" + base)).toLowerCase(Locale.ROOT));
		}

		// Then
		assertThat(names).hasSize(200);
	}

	@Test
	void testHashCollisionFallsBackToCounter() {
		// Given
		FilenameRegistry registry = new FilenameRegistry(".pdf");
		URI url = URI.create("https://example.org/b/d1.pdf");
		String hashed = "d1-" + HashUtils.sha256(url.toString()).substring(0, 8);
		registry.reserveAll(List.of("d1.pdf", hashed + ".pdf"));

		// When
		String name = registry.claim(url);

		// Then
		assertThat(name).isEqualTo(hashed + "-2.pdf");
	}

	@Test
	void testNamesAreComparedCaseInsensitively() {
		// Given
		FilenameRegistry registry = new FilenameRegistry(".pdf");
		registry.reserve("REPORT.pdf");

		// When
		String name = registry.claim(URI.create("https://example.org/report.PDF"));

		// Then
		assertThat(name).startsWith("report-").endsWith(".pdf");
	}

	@Test
	void testAssignedNamesAreReusedAndBlocked() {
		// Given
		FilenameRegistry registry = new FilenameRegistry(".pdf");
		registry.assign("https://example.org/old/d1.pdf", "d1.pdf");

		// When/Then
		assertThat(registry.claim(URI.create("https://example.org/old/d1.pdf"))).isEqualTo("d1.pdf");
		assertThat(registry.claim(URI.create("https://example.org/new/d1.pdf"))).isNotEqualTo("d1.pdf");
		assertThat(registry.size()).isEqualTo(2);
	}

	@Test
	void testBaseNameIsSanitized() {
		FilenameRegistry registry = new FilenameRegistry(".pdf");
		assertThat(registry.baseName(URI.create("https://example.org/Guts%20Round%20(2020).pdf")))
				.isEqualTo("Guts_Round_2020_.pdf");
		assertThat(registry.baseName(URI.create("https://example.org/download?id=3")))
				.isEqualTo("download.pdf");
		assertThat(registry.baseName(URI.create("https://example.org/"))).isEqualTo("document.pdf");
		assertThat(registry.baseName(URI.create("https://example.org/..pdf"))).isEqualTo("pdf.pdf");
		assertThat(registry.baseName(URI.create("https://example.org/" + "x".repeat(300) + ".pdf")))
				.hasSize(FilenameRegistry.MAX_STEM_LENGTH + 4);
	}
}
