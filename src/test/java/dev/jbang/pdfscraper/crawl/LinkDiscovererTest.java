package dev.jbang.pdfscraper.crawl;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.pdfscraper.model.DocumentLink;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class LinkDiscovererTest {
	private static final URI ROOT = URI.create("https://www.hmmt.org/www/archive/problems");

	@Test
	void testClassifiesLinksInsideContent() {
		// Given
		String html = """
				<html><body>
				<div id="nav"><a href="/www/nav-page">Nav</a><a href="/nav.pdf">Nav PDF</a></div>
				<div id="content">
				  <a href="february">February</a>
				  <a href="/www/archive/november.html">November</a>
				  <a href="files/2020-guts.pdf">Guts</a>
				  <a href="https://cdn.example.org/other/Team.PDF">External PDF</a>
				  <a href="https://elsewhere.org/page">Elsewhere</a>
				  <a href="images/logo.png">Logo</a>
				  <a href="#top">Top</a>
				  <a href="mailto:someone@hmmt.org">Mail</a>
				</div>
				</body></html>
				""";
		LinkDiscoverer discoverer = new LinkDiscoverer(ROOT);

		// When
		PageLinks links = discoverer.discover(bytes(html), ROOT);

		// Then
		assertThat(links.subpages())
				.containsExactly(
						URI.create("https://www.hmmt.org/www/archive/february"),
						URI.create("https://www.hmmt.org/www/archive/november.html"));
		assertThat(links.documents())
				.extracting(DocumentLink::url)
				.containsExactly(
						URI.create("https://www.hmmt.org/www/archive/files/2020-guts.pdf"),
						URI.create("https://cdn.example.org/other/Team.PDF"));
		assertThat(links.documents()).allSatisfy(d -> assertThat(d.sourcePage()).isEqualTo(ROOT));
	}

	@Test
	void testMissingContentElementYieldsNothing() {
		// Given
		String html = "<html><body><a href='a.pdf'>A</a><a href='page'>P</a></body></html>";
		LinkDiscoverer discoverer = new LinkDiscoverer(ROOT);

		// When
		PageLinks links = discoverer.discover(bytes(html), ROOT);

		// Then
		assertThat(links.isEmpty()).isTrue();
	}

	@Test
	void testWholePageWhenNoSelector() {
		// Given
		String html = "<html><body><a href='a.pdf'>A</a><a href='page'>P</a></body></html>";
		LinkDiscoverer discoverer = new LinkDiscoverer(ROOT, SameSitePolicy.exact_host, List.of(".pdf"), null);

		// When
		PageLinks links = discoverer.discover(bytes(html), ROOT);

		// Then
		assertThat(links.documents()).hasSize(1);
		assertThat(links.subpages()).containsExactly(URI.create("https://www.hmmt.org/www/archive/page"));
	}

	@Test
	void testDuplicateLinksAreReportedOnce() {
		// Given
		String html = """
				<div id="content">
				  <a href="a.pdf">A</a><a href="./a.pdf">A again</a><a href="a.pdf#page=2">A page 2</a>
				  <a href="sub">Sub</a><a href="sub#x">Sub again</a>
				</div>
				""";
		LinkDiscoverer discoverer = new LinkDiscoverer(ROOT);

		// When
		PageLinks links = discoverer.discover(bytes(html), ROOT);

		// Then
		assertThat(links.documents()).hasSize(1);
		assertThat(links.subpages()).hasSize(1);
	}

	@Test
	void testSameSitePolicies() {
		// Given
		String html = """
				<div id="content">
				  <a href="https://hmmt.org/one">Bare host</a>
				  <a href="https://docs.hmmt.org/two">Subdomain</a>
				  <a href="https://www.hmmt.org/three">Same host</a>
				  <a href="https://nothmmt.org/four">Lookalike</a>
				</div>
				""";
		LinkDiscoverer exact =
				new LinkDiscoverer(ROOT, SameSitePolicy.exact_host, List.of(".pdf"), "div#content");
		LinkDiscoverer subdomains =
				new LinkDiscoverer(ROOT, SameSitePolicy.subdomains, List.of(".pdf"), "div#content");

		// When
		PageLinks exactLinks = exact.discover(bytes(html), ROOT);
		PageLinks subdomainLinks = subdomains.discover(bytes(html), ROOT);

		// Then
		assertThat(exactLinks.subpages()).containsExactly(URI.create("https://www.hmmt.org/three"));
		assertThat(subdomainLinks.subpages())
				.containsExactly(
						URI.create("https://hmmt.org/one"),
						URI.create("https://docs.hmmt.org/two"),
						URI.create("https://www.hmmt.org/three"));
	}

	@Test
	void testCustomDocumentSuffixes() {
		// Given
		LinkDiscoverer discoverer =
				new LinkDiscoverer(ROOT, SameSitePolicy.exact_host, List.of("pdf", ".PS"), "div#content");

		// When/Then
		assertThat(discoverer.isDocument(URI.create("https://x.org/a.pdf"))).isTrue();
		assertThat(discoverer.isDocument(URI.create("https://x.org/a.ps"))).isTrue();
		assertThat(discoverer.isDocument(URI.create("https://x.org/a.pdf?download=1"))).isTrue();
		assertThat(discoverer.isDocument(URI.create("https://x.org/a.docx"))).isFalse();
		assertThat(discoverer.isDocument(URI.create("https://x.org/pdf"))).isFalse();
	}

	@Test
	void testKeepsLinksWithCharactersThatNeedEncoding() {
		// Given
		String html = """
				<div id="content">
				  <a href="/files/HMMT_2008_[Guts].pdf">Guts</a>
				  <a href="/files/a|b.pdf">Pipe</a>
				  <a href="/files/100%.pdf">Percent</a>
				  <a href="/files/ok.pdf">Plain</a>
				</div>
				""";
		LinkDiscoverer discoverer = new LinkDiscoverer(ROOT);

		// When
		PageLinks links = discoverer.discover(bytes(html), ROOT);

		// Then
		assertThat(links.documents())
				.extracting(d -> d.url().getPath())
				.containsExactly("/files/HMMT_2008_[Guts].pdf", "/files/a|b.pdf", "/files/100%.pdf", "/files/ok.pdf");
	}

	@Test
	void testHonoursDeclaredCharset() {
		// Given
		String html = """
				<html><head><meta charset="ISO-8859-1"></head><body>
				<div id="content"><a href="/files/F\u00e9vrier.pdf">F\u00e9vrier</a></div>
				</body></html>
				""";
		LinkDiscoverer discoverer = new LinkDiscoverer(ROOT);

		// When
		PageLinks links = discoverer.discover(html.getBytes(StandardCharsets.ISO_8859_1), ROOT);

		// Then
		assertThat(links.documents())
				.extracting(DocumentLink::url)
				.containsExactly(URI.create("https://www.hmmt.org/files/F%C3%A9vrier.pdf"));
	}

	@Test
	void testToleratesGarbage() {
		// Given
		byte[] garbage = new byte[] {0, 1, 2, (byte) 0xff, '<', 'a'};
		LinkDiscoverer discoverer = new LinkDiscoverer(ROOT);

		// When/Then
		assertThat(discoverer.discover(garbage, ROOT).isEmpty()).isTrue();
	}

	private static byte[] bytes(String html) {
		return html.getBytes(StandardCharsets.UTF_8);
	}
}
