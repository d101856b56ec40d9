package dev.konduit.crawl;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Crawler settings bound from {@code konduit.crawler.*}.
 *
 * @param maxPages default page budget per crawl
 * @param maxDepth default link depth per crawl (seed is depth 0)
 * @param concurrency capacity of the fetch gate shared by all crawls
 * @param timeoutMs connect and read timeout per request
 * @param politeDelayMs pause after every fetch attempt
 * @param earlyExitHits distinct query terms that end a crawl once found in one page
 * @param fallbackBaseUrl reference site prefix used when a crawl yields nothing
 * @param referenceSeedUrl seed crawled when every requested site came back empty
 * @param referenceMaxPages page budget for the reference seed crawl
 * @param dataDir directory receiving crawl archives
 * @param auditLog append-only robots decision log
 * @param acceptLanguage Accept-Language header sent with every page request
 * @param userAgents identity strings, one picked at random per request
 */
@ConfigurationProperties(prefix = "konduit.crawler")
public record CrawlerProperties(
        int maxPages,
        int maxDepth,
        int concurrency,
        int timeoutMs,
        long politeDelayMs,
        int earlyExitHits,
        String fallbackBaseUrl,
        String referenceSeedUrl,
        int referenceMaxPages,
        String dataDir,
        String auditLog,
        String acceptLanguage,
        List<String> userAgents
) {
    public CrawlerProperties {
        userAgents = userAgents == null ? List.of() : List.copyOf(userAgents);
        if (userAgents.isEmpty()) {
            throw new IllegalArgumentException("konduit.crawler.user-agents must not be empty");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("konduit.crawler.concurrency must be at least 1");
        }
    }
}
