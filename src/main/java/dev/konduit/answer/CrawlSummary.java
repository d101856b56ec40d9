package dev.konduit.answer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.konduit.index.IndexSnapshot;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;

/**
 * Result of a crawl-only request.
 *
 * @param success whether any page was collected
 * @param pageCount number of pages collected
 * @param blocked URLs refused by robots.txt
 * @param message human-readable outcome
 * @param indexBuild the index rebuild started from the collected pages; null when nothing was
 *     collected
 */
public record CrawlSummary(
    boolean success,
    @JsonProperty("pages") int pageCount,
    List<String> blocked,
    String message,
    @JsonIgnore @Nullable CompletableFuture<IndexSnapshot> indexBuild) {

  public CrawlSummary {
    blocked = List.copyOf(blocked);
  }
}
