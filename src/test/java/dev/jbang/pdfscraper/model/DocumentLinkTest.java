package dev.jbang.pdfscraper.model;

import static org.assertj.core.api.Assertions.*;

import java.net.URI;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class DocumentLinkTest {

	@Test
	void testIdentityIsTheUrl() {
		// Given
		DocumentLink fromFeb = new DocumentLink(URI.create("https://x.org/a.pdf"), URI.create("https://x.org/feb"));
		DocumentLink fromNov = new DocumentLink(URI.create("https://x.org/a.pdf"), URI.create("https://x.org/nov"));

		// When/Then
		assertThat(fromFeb).isEqualTo(fromNov).hasSameHashCodeAs(fromNov);
		assertThat(Set.of(fromFeb)).contains(fromNov);
	}

	@Test
	void testOrderedByUrl() {
		// Given
		TreeSet<DocumentLink> links = new TreeSet<>();
		links.add(new DocumentLink(URI.create("https://x.org/b.pdf"), null));
		links.add(new DocumentLink(URI.create("https://x.org/a.pdf"), null));

		// When/Then
		assertThat(links.first().url()).isEqualTo(URI.create("https://x.org/a.pdf"));
	}

	@Test
	void testRequiresAbsoluteUrl() {
		assertThatThrownBy(() -> new DocumentLink(URI.create("a.pdf"), null))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
