package dev.konduit.crawl;

import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import crawlercommons.robots.SimpleRobotRules;

/**
 * Breadth-first crawler bounded by page count and link depth.
 *
 * <p>Each call to {@link #crawl} owns its queue, visited set and robots rules, so several crawls
 * may run at once on different threads. Within one crawl, fetches happen strictly one after
 * another with a polite pause after each attempt.
 *
 * <p>Per dequeued URL: skip if already visited or too deep; ask {@link RobotsPolicyGate} (anything
 * but ALLOWED lands in the blocked list); fetch; extract and rank the text; stop early once the
 * page holds enough query terms; otherwise enqueue unseen in-domain links one level deeper. When
 * nothing was collected, one reference page named after the site's brand is tried. The pages are
 * archived on completion.
 */
@Service
public class SiteCrawler {

    private static final Logger log = LoggerFactory.getLogger(SiteCrawler.class);

    private final RobotsPolicyGate policyGate;
    private final PageFetcher fetcher;
    private final ContentExtractor extractor;
    private final CrawlArchive archive;
    private final CrawlerProperties properties;

    public SiteCrawler(RobotsPolicyGate policyGate,
                       PageFetcher fetcher,
                       ContentExtractor extractor,
                       CrawlArchive archive,
                       CrawlerProperties properties) {
        this.policyGate = policyGate;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.archive = archive;
        this.properties = properties;
    }

    /**
     * Crawl a site from a seed URL.
     *
     * @param startUrl seed URL; a missing scheme defaults to https
     * @param query    user query driving ranking and early exit, may be blank
     * @param maxPages maximum pages to collect, also the bound on pending queue entries
     * @param maxDepth maximum link distance from the seed
     * @return collected pages and blocked URLs; both empty is a normal outcome
     * @throws IllegalArgumentException if the seed has no host
     */
    public CrawlOutcome crawl(String startUrl, String query, int maxPages, int maxDepth) {
        String seed = UrlNormalizer.normalize(UrlNormalizer.ensureScheme(startUrl));
        String domain = UrlNormalizer.hostOf(seed);
        if (domain == null) {
            throw new IllegalArgumentException("Seed URL has no host: " + startUrl);
        }
        String effectiveQuery = query == null ? "" : query;

        Deque<CrawlTask> queue = new ArrayDeque<>();
        Set<String> enqueued = new HashSet<>();
        Set<String> visited = new HashSet<>();
        Map<String, SimpleRobotRules> robotsRules = new HashMap<>();
        List<Page> pages = new ArrayList<>();
        List<String> blocked = new ArrayList<>();

        queue.add(new CrawlTask(seed, 0));
        enqueued.add(seed);

        log.info("Starting crawl of {} (domain: {}, maxPages={}, maxDepth={})",
                seed, domain, maxPages, maxDepth);

        while (!queue.isEmpty() && pages.size() < maxPages) {
            CrawlTask task = queue.poll();
            String url = task.url();
            enqueued.remove(url);
            if (visited.contains(url) || task.depth() > maxDepth) {
                continue;
            }

            if (!policyGate.evaluate(url, robotsRules).permitsFetch()) {
                visited.add(url);
                blocked.add(url);
                continue;
            }

            Optional<String> html = fetcher.fetch(url);
            visited.add(url);
            if (html.isPresent() && processPage(url, task.depth(), html.get(), domain,
                    effectiveQuery, maxPages, maxDepth, pages, queue, enqueued, visited)) {
                log.info("Early stop at {}: sufficient relevant hits found", url);
                break;
            }
            if (!pause()) {
                break;
            }
        }

        if (pages.isEmpty()) {
            fetchReferencePage(domain, effectiveQuery).ifPresent(pages::add);
        }

        log.info("Crawl complete for {}: {} pages collected, {} URLs blocked",
                domain, pages.size(), blocked.size());
        archivePages(domain, pages);
        return new CrawlOutcome(pages, blocked);
    }

    /**
     * Extract, rank and record one fetched page, then expand its links.
     *
     * @return true when the page triggers early termination
     */
    private boolean processPage(String url, int depth, String html, String domain, String query,
                                int maxPages, int maxDepth, List<Page> pages,
                                Deque<CrawlTask> queue, Set<String> enqueued, Set<String> visited) {
        String text = extractor.extractText(html);
        if (text.isBlank()) {
            log.debug("No readable text at {}", url);
            return false;
        }
        String ranked = QueryAwareRanker.rank(text, query);
        pages.add(new Page(url, ranked));
        log.info("Crawled [{}/{}]: {} ({} chars)", pages.size(), maxPages, url, ranked.length());

        if (QueryAwareRanker.relevantHits(ranked, query) >= properties.earlyExitHits()) {
            return true;
        }

        if (depth < maxDepth) {
            for (String link : extractor.extractLinks(html, url, domain)) {
                if (queue.size() >= maxPages) {
                    break;
                }
                if (!visited.contains(link) && enqueued.add(link)) {
                    queue.add(new CrawlTask(link, depth + 1));
                }
            }
        }
        return false;
    }

    /**
     * Single fallback fetch of the reference page named after the site's brand, e.g.
     * {@code https://en.wikipedia.org/wiki/Python} for {@code www.python.org}.
     */
    private Optional<Page> fetchReferencePage(String domain, String query) {
        String fallbackUrl = properties.fallbackBaseUrl() + UrlNormalizer.brandToken(domain);
        log.warn("No crawlable data found for {}, trying reference page {}", domain, fallbackUrl);
        return fetcher.fetch(fallbackUrl)
                .map(extractor::extractText)
                .filter(text -> !text.isBlank())
                .map(text -> new Page(fallbackUrl, QueryAwareRanker.rank(text, query)));
    }

    private void archivePages(String domain, List<Page> pages) {
        try {
            log.info("Crawl data saved to {}", archive.save(domain, pages));
        } catch (UncheckedIOException e) {
            log.warn("Could not archive crawl of {}: {}", domain, e.getMessage());
        }
    }

    /**
     * Polite delay between fetches.
     *
     * @return false if the crawling thread was interrupted
     */
    private boolean pause() {
        if (properties.politeDelayMs() <= 0) {
            return true;
        }
        try {
            Thread.sleep(properties.politeDelayMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Crawl interrupted, stopping");
            return false;
        }
    }
}
