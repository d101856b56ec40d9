package dev.konduit.answer;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.konduit.search.SearchResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of answering a query.
 *
 * <p>{@code success == false} means no content could be gathered or indexed. A successful answer
 * with no results carries the {@link #NO_RELEVANT_INFORMATION} marker as its summary. Blocked
 * URLs are reported in every case.
 *
 * @param success whether retrieval ran over some content
 * @param summary condensed answer, null unless requested or nothing matched
 * @param results ranked chunks
 * @param blocked URLs refused by robots.txt during the crawls
 * @param message explanation for an unsuccessful answer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Answer(
    boolean success,
    @Nullable String summary,
    List<SearchResult> results,
    List<String> blocked,
    @Nullable String message) {

  public static final String NO_RELEVANT_INFORMATION = "No relevant information found.";

  public Answer {
    results = List.copyOf(results);
    blocked = List.copyOf(blocked);
  }

  static Answer found(@Nullable String summary, List<SearchResult> results, List<String> blocked) {
    return new Answer(true, summary, results, blocked, null);
  }

  static Answer nothingRelevant(List<String> blocked) {
    return new Answer(true, NO_RELEVANT_INFORMATION, List.of(), blocked, null);
  }

  static Answer failed(String message, List<String> blocked) {
    return new Answer(false, null, List.of(), blocked, message);
  }
}
