package dev.jbang.pdfscraper.crawl;

import dev.jbang.pdfscraper.model.DocumentLink;
import dev.jbang.pdfscraper.util.UrlUtils;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts and classifies the links of an HTML page. Works purely on the bytes it is given and
 * never touches the network or the disk.
 */
public class LinkDiscoverer {
	private static final Logger logger = LoggerFactory.getLogger(LinkDiscoverer.class);

	public static final String DEFAULT_CONTENT_SELECTOR = "div#content";
	public static final List<String> DEFAULT_DOCUMENT_SUFFIXES = List.of(".pdf");

	private static final Set<String> PAGE_EXTENSIONS = Set.of(".html", ".htm", ".php", ".asp", ".aspx", ".shtml");

	private final URI siteRoot;
	private final SameSitePolicy sameSitePolicy;
	private final List<String> documentSuffixes;
	private final String contentSelector;

	/**
	 * @param siteRoot The archive root, used to decide which pages are on the same site
	 * @param sameSitePolicy How strictly "same site" is interpreted
	 * @param documentSuffixes URL path suffixes that mark a document, e.g. ".pdf"
	 * @param contentSelector CSS selector for the element whose links are considered, or null/blank
	 *     for the whole page
	 */
	public LinkDiscoverer(
			URI siteRoot, SameSitePolicy sameSitePolicy, List<String> documentSuffixes, String contentSelector) {
		this.siteRoot = siteRoot;
		this.sameSitePolicy = sameSitePolicy;
		this.documentSuffixes = documentSuffixes.stream()
				.map(s -> s.toLowerCase(Locale.ROOT))
				.map(s -> s.startsWith(".") ? s : "." + s)
				.toList();
		this.contentSelector = contentSelector == null || contentSelector.isBlank() ? null : contentSelector;
	}

	public LinkDiscoverer(URI siteRoot) {
		this(siteRoot, SameSitePolicy.exact_host, DEFAULT_DOCUMENT_SUFFIXES, DEFAULT_CONTENT_SELECTOR);
	}

	/**
	 * Find the subpages and documents linked from a page.
	 *
	 * @param page The raw page body
	 * @param pageUrl The URL the page was fetched from, used to resolve relative links
	 * @return The classified links; empty if the page doesn't have the expected structure
	 */
	public PageLinks discover(byte[] page, URI pageUrl) {
		Document doc;
		try {
			// null charset: jsoup honours a BOM or a declared charset and falls back to UTF-8
			doc = Jsoup.parse(new ByteArrayInputStream(page), null, pageUrl.toString());
		} catch (IOException | RuntimeException e) {
			logger.warn("Could not parse {}: {}", pageUrl, e.getMessage());
			return PageLinks.empty();
		}

		Elements anchors;
		if (contentSelector != null) {
			Element content = doc.selectFirst(contentSelector);
			if (content == null) {
				logger.warn("No element matching '{}' on {}, ignoring its links", contentSelector, pageUrl);
				return PageLinks.empty();
			}
			anchors = content.select("a[href]");
		} else {
			anchors = doc.select("a[href]");
		}

		Set<URI> subpages = new LinkedHashSet<>();
		Set<DocumentLink> documents = new LinkedHashSet<>();
		for (Element anchor : anchors) {
			String href = anchor.attr("href").trim();
			if (href.isEmpty() || href.startsWith("#")) {
				continue;
			}
			URI url = UrlUtils.parse(anchor.absUrl("href"));
			if (url == null) {
				logger.debug("Dropping unusable link '{}' on {}", href, pageUrl);
				continue;
			}
			if (isDocument(url)) {
				documents.add(new DocumentLink(url, pageUrl));
			} else if (isPage(url) && sameSitePolicy.isSameSite(siteRoot, url)) {
				subpages.add(url);
			} else {
				logger.trace("Ignoring link {} on {}", url, pageUrl);
			}
		}
		return new PageLinks(Collections.unmodifiableSet(subpages), Collections.unmodifiableSet(documents));
	}

	/** Whether the URL points at a document, judged by its path suffix */
	public boolean isDocument(URI url) {
		String path = url.getPath();
		if (path == null) {
			return false;
		}
		String lower = path.toLowerCase(Locale.ROOT);
		for (String suffix : documentSuffixes) {
			if (lower.endsWith(suffix)) {
				return true;
			}
		}
		return false;
	}

	private boolean isPage(URI url) {
		String extension = UrlUtils.extension(url);
		return extension.isEmpty() || PAGE_EXTENSIONS.contains(extension);
	}
}
