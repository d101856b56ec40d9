package dev.konduit.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for hybrid retrieval, bound from {@code konduit.search.*}.
 *
 * <ul>
 *   <li>{@code top-k} - results returned by a plain search (default 5)
 *   <li>{@code answer-top-k} - sizes the candidate pool when answering a query; the answer itself
 *       still carries at most {@code top-k} results (default 7, never below {@code top-k})
 *   <li>{@code weight} - share of the semantic score in the fused score (default 0.7)
 *   <li>{@code min-score} - fused score a candidate needs to reach the reranker (default 0.15)
 *   <li>{@code over-fetch-factor} - candidates handed to the reranker per requested result
 *       (default 3)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "konduit.search")
public class SearchProperties {

  private int topK = 5;
  private int answerTopK = 7;
  private double weight = 0.7;
  private double minScore = 0.15;
  private int overFetchFactor = 3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (weight < 0.0 || weight > 1.0) {
      throw new IllegalStateException(
          "konduit.search.weight must be in [0.0, 1.0], got: " + weight);
    }
    if (topK < 1 || answerTopK < 1) {
      throw new IllegalStateException(
          "konduit.search.top-k and answer-top-k must be positive, got: "
              + topK
              + ", "
              + answerTopK);
    }
    if (answerTopK < topK) {
      throw new IllegalStateException(
          "konduit.search.answer-top-k must not be below top-k, got: "
              + answerTopK
              + " < "
              + topK);
    }
    if (overFetchFactor < 1) {
      throw new IllegalStateException(
          "konduit.search.over-fetch-factor must be at least 1, got: " + overFetchFactor);
    }
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public int getAnswerTopK() {
    return answerTopK;
  }

  public void setAnswerTopK(int answerTopK) {
    this.answerTopK = answerTopK;
  }

  public double getWeight() {
    return weight;
  }

  public void setWeight(double weight) {
    this.weight = weight;
  }

  public double getMinScore() {
    return minScore;
  }

  public void setMinScore(double minScore) {
    this.minScore = minScore;
  }

  public int getOverFetchFactor() {
    return overFetchFactor;
  }

  public void setOverFetchFactor(int overFetchFactor) {
    this.overFetchFactor = overFetchFactor;
  }
}
