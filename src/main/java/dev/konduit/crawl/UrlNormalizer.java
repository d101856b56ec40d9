package dev.konduit.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static URL helpers used by the crawler: canonical form for deduplication, origin extraction,
 * domain membership and the brand token behind the reference fallback page.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL for deduplication:
     * - Remove fragments (#section)
     * - Lowercase scheme and host (path and query are case-sensitive)
     * - Drop default ports and replace an empty path with "/"
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the input unchanged if malformed
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        URI uri;
        try {
            uri = new URI(url.strip());
        } catch (URISyntaxException e) {
            log.debug("Malformed URL, returning unchanged: {}", url);
            return url;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return url;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }

        StringBuilder sb = new StringBuilder(toBase(scheme, uri.getHost(), uri.getPort()));
        sb.append(path);
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    /**
     * Extract the origin (scheme://host[:port]) of a URL. Default ports are omitted.
     *
     * @param url the URL to extract the origin from
     * @return the origin
     * @throws IllegalArgumentException if the URL is malformed or has no scheme/host
     */
    public static String normalizeToBase(String url) {
        URI uri = parse(url);
        return toBase(uri.getScheme().toLowerCase(Locale.ROOT), uri.getHost(), uri.getPort());
    }

    /**
     * Lower-cased host of a URL, or null when the URL is malformed or has no host.
     */
    public static @Nullable String hostOf(String url) {
        try {
            String host = new URI(url.strip()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Check whether a URL is an http(s) URL whose host equals the domain or is one of its
     * subdomains ({@code docs.example.com} is within {@code example.com}).
     *
     * @param url    the candidate URL
     * @param domain the crawl's target host
     * @return true if the URL belongs to the domain
     */
    public static boolean isWithinDomain(String url, String domain) {
        URI uri;
        try {
            uri = new URI(url.strip());
        } catch (URISyntaxException e) {
            return false;
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            return false;
        }
        if (uri.getHost() == null) {
            return false;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String target = domain.toLowerCase(Locale.ROOT);
        return host.equals(target) || host.endsWith("." + target);
    }

    /**
     * Prefix {@code https://} when the user typed a bare host such as {@code python.org}.
     */
    public static String ensureScheme(String url) {
        String trimmed = url.strip();
        if (trimmed.regionMatches(true, 0, "http://", 0, 7)
                || trimmed.regionMatches(true, 0, "https://", 0, 8)) {
            return trimmed;
        }
        return "https://" + trimmed;
    }

    /**
     * First label of a host with any leading {@code www.} removed, lower-cased then capitalised:
     * {@code www.python.org} gives {@code Python}.
     *
     * @param host the crawl's target host
     * @return the brand token, never empty for a non-empty host
     */
    public static String brandToken(String host) {
        String bare = host.toLowerCase(Locale.ROOT);
        if (bare.startsWith("www.")) {
            bare = bare.substring(4);
        }
        int dot = bare.indexOf('.');
        String label = dot > 0 ? bare.substring(0, dot) : bare;
        if (label.isEmpty()) {
            return label;
        }
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    private static URI parse(String url) {
        try {
            URI uri = new URI(url.strip());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL missing scheme or host: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }
    }

    private static String toBase(String scheme, String host, int port) {
        String base = scheme + "://" + host.toLowerCase(Locale.ROOT);
        if (port == -1 || isDefaultPort(scheme, port)) {
            return base;
        }
        return base + ":" + port;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
