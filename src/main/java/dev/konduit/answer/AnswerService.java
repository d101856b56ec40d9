package dev.konduit.answer;

import dev.konduit.crawl.CrawlCoordinator;
import dev.konduit.crawl.CrawlOutcome;
import dev.konduit.crawl.CrawlerProperties;
import dev.konduit.crawl.Page;
import dev.konduit.index.IndexBuildJob;
import dev.konduit.index.IndexSnapshot;
import dev.konduit.search.SearchProperties;
import dev.konduit.search.SearchRequest;
import dev.konduit.search.SearchResult;
import dev.konduit.search.SearchService;
import dev.konduit.summarize.Summarizer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates crawl, index build, hybrid search and optional summarisation for one request.
 *
 * <p>Sites are crawled one after the other, primary first. When neither yields a page the
 * configured reference seed is crawled instead. The index is rebuilt from whatever was collected
 * and the query runs against the snapshot that build produced, even if another request has
 * rebuilt or cleared the live index in the meantime. Results are cut to {@code top-k}; the wider
 * {@code answer-top-k} only sizes the candidate pool handed to the reranker.
 */
@Service
public class AnswerService {

  private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

  static final String NO_READABLE_CONTENT = "No readable content found.";
  static final String SUMMARY_UNAVAILABLE = "Unable to summarize content.";

  private final CrawlCoordinator crawlCoordinator;
  private final IndexBuildJob indexBuildJob;
  private final SearchService searchService;
  private final Summarizer summarizer;
  private final CrawlerProperties crawlerProperties;
  private final SearchProperties searchProperties;

  public AnswerService(
      CrawlCoordinator crawlCoordinator,
      IndexBuildJob indexBuildJob,
      SearchService searchService,
      Summarizer summarizer,
      CrawlerProperties crawlerProperties,
      SearchProperties searchProperties) {
    this.crawlCoordinator = crawlCoordinator;
    this.indexBuildJob = indexBuildJob;
    this.searchService = searchService;
    this.summarizer = summarizer;
    this.crawlerProperties = crawlerProperties;
    this.searchProperties = searchProperties;
  }

  /**
   * Crawls one or two sites without a query and starts an index rebuild in the background.
   *
   * @param primary first site, may be blank
   * @param secondary second site, may be blank
   * @return page count, blocked URLs and the pending build
   * @throws IllegalArgumentException if both URLs are blank
   */
  public CrawlSummary crawlOnly(@Nullable String primary, @Nullable String secondary) {
    List<String> seeds = seeds(primary, secondary);
    if (seeds.isEmpty()) {
      throw new IllegalArgumentException("Please provide at least one URL.");
    }
    log.info("Crawl initiated for {}", seeds);

    CrawlOutcome outcome =
        crawlCoordinator.crawlAll(
            seeds, "", crawlerProperties.maxPages(), crawlerProperties.maxDepth());
    if (outcome.isEmpty()) {
      return new CrawlSummary(
          false,
          0,
          outcome.blocked(),
          "No pages found, possibly blocked by robots.txt.",
          null);
    }

    CompletableFuture<IndexSnapshot> build = indexBuildJob.submit(outcome.pages());
    String message = "Crawled %d pages successfully.".formatted(outcome.pages().size());
    if (!outcome.blocked().isEmpty()) {
      message += " %d URLs blocked by robots.txt.".formatted(outcome.blocked().size());
    }
    log.info(
        "Crawl completed: {} pages, {} blocked", outcome.pages().size(), outcome.blocked().size());
    return new CrawlSummary(true, outcome.pages().size(), outcome.blocked(), message, build);
  }

  /**
   * Answers a query from freshly crawled content.
   *
   * @param query the question, not blank
   * @param primary first site, may be blank
   * @param secondary second site, may be blank
   * @param smart whether to add a summary of the results
   * @return the answer; never throws for crawl, build or summarizer failures
   * @throws IllegalArgumentException if the query is blank
   */
  public Answer answer(
      String query, @Nullable String primary, @Nullable String secondary, boolean smart) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query is required.");
    }
    String trimmed = query.strip();

    List<Page> pages = new ArrayList<>();
    List<String> blocked = new ArrayList<>();
    for (String seed : seeds(primary, secondary)) {
      log.info("Crawling {} for '{}'", seed, trimmed);
      collect(
          crawlCoordinator.crawlAll(
              List.of(seed), trimmed, crawlerProperties.maxPages(), crawlerProperties.maxDepth()),
          pages,
          blocked);
    }

    if (pages.isEmpty()) {
      log.warn("No data from requested sites, crawling {}", crawlerProperties.referenceSeedUrl());
      collect(
          crawlCoordinator.crawlAll(
              List.of(crawlerProperties.referenceSeedUrl()),
              "",
              crawlerProperties.referenceMaxPages(),
              crawlerProperties.maxDepth()),
          pages,
          blocked);
    }
    if (pages.isEmpty()) {
      return Answer.failed(NO_READABLE_CONTENT, blocked);
    }

    IndexSnapshot built;
    try {
      built = indexBuildJob.submit(pages).join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return Answer.failed("Index build failed: " + cause.getMessage(), blocked);
    }
    if (built.isEmpty()) {
      return Answer.failed(NO_READABLE_CONTENT, blocked);
    }

    SearchRequest request =
        new SearchRequest(
            trimmed,
            searchProperties.getTopK(),
            searchProperties.getAnswerTopK(),
            searchProperties.getWeight(),
            searchProperties.getMinScore());
    List<SearchResult> results = searchService.search(built, request);
    if (results.isEmpty()) {
      return Answer.nothingRelevant(blocked);
    }

    String summary = smart ? summarize(results, trimmed) : null;
    log.info("Answered '{}' with {} results", trimmed, results.size());
    return Answer.found(summary, results, blocked);
  }

  private String summarize(List<SearchResult> results, String query) {
    String combined = results.stream().map(SearchResult::content).collect(Collectors.joining(" "));
    try {
      return summarizer.summarize(combined, query);
    } catch (RuntimeException e) {
      log.warn("Summarizer failed: {}", e.getMessage());
      return SUMMARY_UNAVAILABLE;
    }
  }

  private static void collect(CrawlOutcome outcome, List<Page> pages, List<String> blocked) {
    pages.addAll(outcome.pages());
    blocked.addAll(outcome.blocked());
  }

  private static List<String> seeds(@Nullable String primary, @Nullable String secondary) {
    return Stream.of(primary, secondary)
        .filter(seed -> seed != null && !seed.isBlank())
        .map(String::strip)
        .toList();
  }
}
