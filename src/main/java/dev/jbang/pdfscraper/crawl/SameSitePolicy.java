package dev.jbang.pdfscraper.crawl;

import java.net.URI;
import java.util.Locale;

/** Decides whether a discovered page belongs to the same site as the archive root */
public enum SameSitePolicy {
	/** Only the root's exact host */
	exact_host {
		@Override
		public boolean isSameSite(URI root, URI candidate) {
			return host(root).equals(host(candidate));
		}
	},
	/** The root's host and any of its subdomains, ignoring a leading "www." on the root */
	subdomains {
		@Override
		public boolean isSameSite(URI root, URI candidate) {
			String rootHost = host(root);
			if (rootHost.startsWith("www.")) {
				rootHost = rootHost.substring(4);
			}
			String candidateHost = host(candidate);
			return candidateHost.equals(rootHost) || candidateHost.endsWith("." + rootHost);
		}
	};

	public abstract boolean isSameSite(URI root, URI candidate);

	private static String host(URI url) {
		return url.getHost() == null ? "" : url.getHost().toLowerCase(Locale.ROOT);
	}
}
