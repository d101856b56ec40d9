package dev.konduit.crawl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Turns raw HTML into readable text and in-domain outbound links using jsoup.
 */
@Component
public class ContentExtractor {

    /** Elements that never carry page content. */
    static final String NON_CONTENT = "script, style, nav, footer, header, noscript, aside, form";

    /** Elements whose text is collected. */
    static final String CONTENT_BEARING = "h1, h2, h3, p, li, div, span";

    /** A block needs more words than this to be kept. */
    static final int MIN_WORDS = 5;

    /**
     * Extract readable text: strip non-content elements, prefer {@code <main>} then
     * {@code <article>} then {@code <body>}, and join the text of every content-bearing element
     * with more than {@link #MIN_WORDS} words that is not a copyright line.
     *
     * @param html raw page HTML
     * @return space-joined text, empty when nothing qualifies
     */
    public String extractText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        doc.select(NON_CONTENT).remove();

        Element region = doc.selectFirst("main");
        if (region == null) {
            region = doc.selectFirst("article");
        }
        if (region == null) {
            region = doc.body();
        }

        List<String> parts = new ArrayList<>();
        for (Element element : region.select(CONTENT_BEARING)) {
            String text = element.text().strip();
            if (wordCount(text) > MIN_WORDS && !text.startsWith("©")) {
                parts.add(text);
            }
        }
        return String.join(" ", parts);
    }

    /**
     * Extract absolute, normalized links whose host equals or is a subdomain of {@code domain}.
     *
     * @param html    raw page HTML
     * @param baseUrl URL the page was fetched from, for resolving relative hrefs
     * @param domain  the crawl's target host
     * @return links in document order, without duplicates
     */
    public Set<String> extractLinks(String html, String baseUrl, String domain) {
        Set<String> links = new LinkedHashSet<>();
        if (html == null || html.isBlank()) {
            return links;
        }
        Document doc = Jsoup.parse(html, baseUrl);
        for (Element anchor : doc.select("a[href]")) {
            String absolute = anchor.absUrl("href");
            if (absolute.isEmpty()) {
                continue;
            }
            String normalized = UrlNormalizer.normalize(absolute);
            if (UrlNormalizer.isWithinDomain(normalized, domain)) {
                links.add(normalized);
            }
        }
        return links;
    }

    private static int wordCount(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        return text.split("\\s+").length;
    }
}
