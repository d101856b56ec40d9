package dev.konduit.search;

/**
 * Parameters of one hybrid search.
 *
 * <p>{@code topK} caps the reranked output. {@code poolK} sizes the candidate pool: the best
 * {@code overFetchFactor * poolK} chunks by fused score go on to the reranker. For a plain search
 * both are the same; the answer flow widens the pool without returning more results.
 *
 * @param query the search query text (must not be null or blank)
 * @param topK maximum number of results (must be >= 1)
 * @param poolK result count the candidate pool is sized from (must be >= topK)
 * @param weight share of the semantic score in the fused score, in [0, 1]
 * @param minScore fused score a candidate needs to reach the reranker
 */
public record SearchRequest(String query, int topK, int poolK, double weight, double minScore) {

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be positive, got: " + topK);
    }
    if (poolK < topK) {
      throw new IllegalArgumentException(
          "poolK must be at least topK (%d), got: %d".formatted(topK, poolK));
    }
    if (weight < 0.0 || weight > 1.0) {
      throw new IllegalArgumentException("weight must be in [0.0, 1.0], got: " + weight);
    }
  }

  /** Request whose candidate pool is sized from {@code topK} itself. */
  public SearchRequest(String query, int topK, double weight, double minScore) {
    this(query, topK, topK, weight, minScore);
  }
}
