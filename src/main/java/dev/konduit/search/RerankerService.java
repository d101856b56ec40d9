package dev.konduit.search;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking of hybrid search candidates using an ONNX scoring model
 * (ms-marco-MiniLM-L-6-v2).
 *
 * <p>Each (query, chunk) pair is scored jointly; results come back sorted by that score and cut
 * to {@code topK}. If the model fails, the candidates keep their fused order, are cut to {@code
 * topK} and carry no rerank score.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
@Service
public class RerankerService {

  private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

  private final ScoringModel scoringModel;

  public RerankerService(ScoringModel scoringModel) {
    this.scoringModel = scoringModel;
  }

  /**
   * Reranks candidates with the cross-encoder.
   *
   * @param query the original query text
   * @param candidates hybrid candidates, best fused score first
   * @param topK maximum number of results to return
   * @return at most {@code topK} results sorted by rerank score descending; the input itself when
   *     it is empty
   */
  public List<SearchResult> rerank(String query, List<SearchResult> candidates, int topK) {
    if (candidates.isEmpty()) {
      return candidates;
    }

    List<TextSegment> segments =
        candidates.stream().map(r -> TextSegment.from(r.content())).toList();

    List<Double> scores;
    try {
      scores = scoringModel.scoreAll(segments, query).content();
    } catch (RuntimeException e) {
      log.warn("Reranking failed, keeping fused order: {}", e.getMessage());
      return candidates.stream().limit(topK).toList();
    }
    if (scores == null || scores.size() != candidates.size()) {
      log.warn(
          "Reranker returned {} scores for {} candidates, keeping fused order",
          scores == null ? 0 : scores.size(),
          candidates.size());
      return candidates.stream().limit(topK).toList();
    }

    List<SearchResult> reranked =
        IntStream.range(0, candidates.size())
            .mapToObj(i -> candidates.get(i).withRerankScore(scores.get(i)))
            .sorted(
                Comparator.comparingDouble((SearchResult r) -> r.rerankScore()).reversed())
            .limit(topK)
            .toList();
    log.debug("Reranked {} candidates down to {}", candidates.size(), reranked.size());
    return reranked;
  }
}
