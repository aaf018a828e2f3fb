package dev.jbang.pdfscraper.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashUtilsTest {

	@Test
	void testSha256() {
		assertThat(HashUtils.sha256("abc"))
				.isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
		assertThat(HashUtils.sha256("https://example.com/a/d1.pdf"))
				.hasSize(64)
				.isEqualTo(HashUtils.sha256("https://example.com/a/d1.pdf"))
				.isNotEqualTo(HashUtils.sha256("https://example.com/b/d1.pdf"));
	}
}
