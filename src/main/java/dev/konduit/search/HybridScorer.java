package dev.konduit.search;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure static utility combining semantic similarity with lexical overlap.
 *
 * <p>Tokens are runs of three or more word characters, lower-cased. The keyword score of a chunk
 * is {@code |q ∩ c| / sqrt(|q| * |c|)} over the distinct query and chunk tokens, rounded to three
 * decimals, and 0 when either side has no tokens. The fused score is {@code semantic * weight +
 * keyword * (1 - weight)}.
 */
public final class HybridScorer {

  private static final Pattern TOKEN =
      Pattern.compile("\\b\\w{3,}\\b", Pattern.UNICODE_CHARACTER_CLASS);

  private HybridScorer() {}

  /**
   * Normalised token overlap between a query and a chunk.
   *
   * @return a score in [0, 1], rounded to three decimals
   */
  public static double keywordScore(String query, String text) {
    Set<String> queryTokens = tokens(query);
    Set<String> textTokens = tokens(text);
    if (queryTokens.isEmpty() || textTokens.isEmpty()) {
      return 0.0;
    }
    long common = queryTokens.stream().filter(textTokens::contains).count();
    double overlap = common / Math.sqrt((double) queryTokens.size() * textTokens.size());
    return Math.round(overlap * 1000.0) / 1000.0;
  }

  /**
   * Weighted sum of the two scores.
   *
   * @param weight share of the semantic score, in [0, 1]
   */
  public static double fuse(double semanticScore, double keywordScore, double weight) {
    return semanticScore * weight + keywordScore * (1.0 - weight);
  }

  static Set<String> tokens(String text) {
    Set<String> tokens = new HashSet<>();
    if (text == null) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }
}
