package dev.konduit.crawl;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cheap relevance-weighted truncation applied to page text during a crawl.
 *
 * <p>Pure static functions; no state.
 */
public final class QueryAwareRanker {

  /** Segments need more tokens than this to be kept. */
  static final int MIN_SEGMENT_TOKENS = 6;

  /** Number of segments retained. */
  static final int TOP_SEGMENTS = 6;

  private QueryAwareRanker() {}

  /**
   * Keep the {@value #TOP_SEGMENTS} period-delimited segments sharing the most tokens with the
   * query. Segments of {@value #MIN_SEGMENT_TOKENS} tokens or fewer are dropped; ties keep their
   * original order. A blank query returns the text untouched.
   *
   * @param text extracted page text
   * @param query user query, may be blank
   * @return the top segments joined with {@code ". "}
   */
  public static String rank(String text, String query) {
    if (query == null || query.isBlank()) {
      return text;
    }
    Set<String> queryTokens = tokens(query);
    List<String> segments =
        Arrays.stream(text.split("\\."))
            .map(String::strip)
            .filter(segment -> tokenCount(segment) > MIN_SEGMENT_TOKENS)
            .toList();

    return segments.stream()
        .sorted(Comparator.comparingInt((String s) -> overlap(s, queryTokens)).reversed())
        .limit(TOP_SEGMENTS)
        .collect(Collectors.joining(". "));
  }

  /**
   * Number of distinct query terms that occur as substrings of the (lower-cased) text. The
   * crawler stops once this reaches its early-exit threshold.
   */
  public static int relevantHits(String text, String query) {
    if (query == null || query.isBlank() || text == null || text.isEmpty()) {
      return 0;
    }
    String haystack = text.toLowerCase(Locale.ROOT);
    return (int) tokens(query).stream().filter(haystack::contains).count();
  }

  private static int overlap(String segment, Set<String> queryTokens) {
    Set<String> segmentTokens = tokens(segment);
    segmentTokens.retainAll(queryTokens);
    return segmentTokens.size();
  }

  private static Set<String> tokens(String text) {
    Set<String> tokens = new HashSet<>();
    for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private static int tokenCount(String text) {
    return text.isEmpty() ? 0 : text.split("\\s+").length;
  }
}
