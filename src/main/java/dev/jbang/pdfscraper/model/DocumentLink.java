package dev.jbang.pdfscraper.model;

import java.net.URI;
import java.util.Objects;

/**
 * A link to a downloadable document, together with the page it was found on. Two links are equal
 * when their URLs are equal, regardless of where they were discovered.
 */
public final class DocumentLink implements Comparable<DocumentLink> {
	private final URI url;
	private final URI sourcePage;

	public DocumentLink(URI url, URI sourcePage) {
		this.url = Objects.requireNonNull(url, "url");
		if (!url.isAbsolute()) {
			throw new IllegalArgumentException("Document URL must be absolute: " + url);
		}
		this.sourcePage = sourcePage;
	}

	public URI url() {
		return url;
	}

	/** The page this link was discovered on, may be null for links that were supplied directly */
	public URI sourcePage() {
		return sourcePage;
	}

	@Override
	public int compareTo(DocumentLink other) {
		return url.toString().compareTo(other.url.toString());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DocumentLink)) return false;
		return url.equals(((DocumentLink) o).url);
	}

	@Override
	public int hashCode() {
		return url.hashCode();
	}

	@Override
	public String toString() {
		return url.toString();
	}
}
