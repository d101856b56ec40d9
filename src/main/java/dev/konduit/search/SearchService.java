package dev.konduit.search;

import dev.konduit.index.IndexSnapshot;
import dev.konduit.index.SearchIndex;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Two-stage hybrid retrieval over an {@link IndexSnapshot}, by default the live one held by
 * {@link SearchIndex}.
 *
 * <p>Pipeline: embed query (cached) -> score every chunk semantically and lexically -> fuse ->
 * keep the best {@code overFetchFactor * poolK} by fused score -> drop those under {@code
 * minScore} -> cross-encoder rerank down to {@code topK}.
 *
 * <p>Searching an unbuilt index throws {@link dev.konduit.index.IndexNotBuiltException}. A query
 * that matches nothing returns an empty list. If the query cannot be embedded, semantic scores are
 * 0 and ranking falls back to keyword overlap.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final SearchIndex searchIndex;
  private final RerankerService rerankerService;
  private final SearchProperties properties;

  public SearchService(
      SearchIndex searchIndex, RerankerService rerankerService, SearchProperties properties) {
    this.searchIndex = searchIndex;
    this.rerankerService = rerankerService;
    this.properties = properties;
  }

  /**
   * Searches the live index with the configured top-k, weight and minimum score.
   *
   * @param query the query text, not blank
   * @return results ordered by rerank score descending, possibly empty
   * @throws dev.konduit.index.IndexNotBuiltException if no index is active
   */
  public List<SearchResult> search(String query) {
    SearchRequest request =
        new SearchRequest(
            query, properties.getTopK(), properties.getWeight(), properties.getMinScore());
    return search(searchIndex.requireSnapshot(), request);
  }

  /**
   * Hybrid search with reranking over a given snapshot.
   *
   * @param snapshot the index to read; a caller that just built it passes the build's result so
   *     a concurrent rebuild cannot change what it searches
   * @param request query and ranking parameters
   * @return at most {@code request.topK()} results ordered by rerank score descending
   */
  public List<SearchResult> search(IndexSnapshot snapshot, SearchRequest request) {
    String query = request.query();
    Embedding queryVector = embedQuery(query);

    List<SearchResult> candidates =
        IntStream.range(0, snapshot.size())
            .mapToObj(i -> score(snapshot, i, query, queryVector, request.weight()))
            .sorted(Comparator.comparingDouble(SearchResult::finalScore).reversed())
            .limit((long) properties.getOverFetchFactor() * request.poolK())
            .filter(r -> r.finalScore() >= request.minScore())
            .toList();
    log.debug("Retrieved {} candidate chunks for '{}' before reranking", candidates.size(), query);

    List<SearchResult> results = rerankerService.rerank(query, candidates, request.topK());
    log.info("Search for '{}' returned {} results", query, results.size());
    return results;
  }

  private SearchResult score(
      IndexSnapshot snapshot, int i, String query, @Nullable Embedding queryVector, double weight) {
    String chunk = snapshot.chunks().get(i);
    double semantic =
        queryVector == null
            ? 0.0
            : CosineSimilarity.between(queryVector, snapshot.embeddings().get(i));
    double keyword = HybridScorer.keywordScore(query, chunk);
    double fused = HybridScorer.fuse(semantic, keyword, weight);
    return new SearchResult(snapshot.urls().get(i), chunk, semantic, keyword, fused);
  }

  private @Nullable Embedding embedQuery(String query) {
    try {
      return searchIndex.queryEmbedding(query);
    } catch (RuntimeException e) {
      log.warn("Query embedding failed, ranking by keyword overlap only: {}", e.getMessage());
      return null;
    }
  }
}
