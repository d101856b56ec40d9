package dev.konduit.crawl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs independent site crawls side by side and merges their outcomes.
 *
 * <p>Every seed gets its own {@link SiteCrawler#crawl} call on the crawl executor; crawls share
 * no mutable state. Results are merged in seed order. A crawl that throws is logged and
 * contributes nothing.
 */
@Service
public class CrawlCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CrawlCoordinator.class);

    private final SiteCrawler siteCrawler;
    private final ExecutorService crawlExecutor;

    public CrawlCoordinator(SiteCrawler siteCrawler,
                            @Qualifier("crawlExecutor") ExecutorService crawlExecutor) {
        this.siteCrawler = siteCrawler;
        this.crawlExecutor = crawlExecutor;
    }

    /**
     * Crawl every non-blank seed concurrently.
     *
     * @param seeds    seed URLs; null or blank entries are ignored
     * @param query    user query, may be blank
     * @param maxPages page budget per site
     * @param maxDepth depth limit per site
     * @return pages and blocked URLs of all sites, in seed order
     */
    public CrawlOutcome crawlAll(List<String> seeds, String query, int maxPages, int maxDepth) {
        List<String> validSeeds = seeds.stream()
                .filter(seed -> seed != null && !seed.isBlank())
                .toList();
        if (validSeeds.isEmpty()) {
            return CrawlOutcome.empty();
        }

        List<CompletableFuture<CrawlOutcome>> crawls = validSeeds.stream()
                .map(seed -> CompletableFuture.supplyAsync(
                        () -> siteCrawler.crawl(seed, query, maxPages, maxDepth), crawlExecutor))
                .toList();

        List<Page> pages = new ArrayList<>();
        List<String> blocked = new ArrayList<>();
        for (int i = 0; i < crawls.size(); i++) {
            try {
                CrawlOutcome outcome = crawls.get(i).join();
                pages.addAll(outcome.pages());
                blocked.addAll(outcome.blocked());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Crawl of {} failed: {}", validSeeds.get(i), cause.getMessage(), cause);
            }
        }
        return new CrawlOutcome(pages, blocked);
    }
}
