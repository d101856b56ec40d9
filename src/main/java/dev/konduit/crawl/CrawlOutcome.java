package dev.konduit.crawl;

import java.util.List;

/**
 * Result of crawling one seed site: collected pages in visit order and the URLs refused by
 * robots.txt (explicitly disallowed or unreadable).
 *
 * <p>Both lists empty is a normal outcome; the caller decides how to surface it.
 */
public record CrawlOutcome(List<Page> pages, List<String> blocked) {

  public CrawlOutcome {
    pages = pages == null ? List.of() : List.copyOf(pages);
    blocked = blocked == null ? List.of() : List.copyOf(blocked);
  }

  public static CrawlOutcome empty() {
    return new CrawlOutcome(List.of(), List.of());
  }

  public boolean isEmpty() {
    return pages.isEmpty();
  }
}
