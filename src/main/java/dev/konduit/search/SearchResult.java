package dev.konduit.search;

import org.jspecify.annotations.Nullable;

/**
 * One ranked chunk returned by a query.
 *
 * @param url source page of the chunk
 * @param content the chunk text
 * @param semanticScore cosine similarity between query and chunk vectors
 * @param keywordScore normalised token overlap between query and chunk text
 * @param finalScore fused hybrid score
 * @param rerankScore cross-encoder score; null when reranking was skipped or failed
 */
public record SearchResult(
    String url,
    String content,
    double semanticScore,
    double keywordScore,
    double finalScore,
    @Nullable Double rerankScore) {

  /** Result before the reranking stage. */
  public SearchResult(
      String url, String content, double semanticScore, double keywordScore, double finalScore) {
    this(url, content, semanticScore, keywordScore, finalScore, null);
  }

  SearchResult withRerankScore(double score) {
    return new SearchResult(url, content, semanticScore, keywordScore, finalScore, score);
  }
}
