package dev.konduit.api;

import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/search}.
 *
 * @param query the question
 * @param url primary site to crawl
 * @param url2 secondary site to crawl
 * @param smart add an extractive summary of the results
 */
public record QueryRequest(
    @NotBlank(message = "Query is required.") String query,
    @Nullable String url,
    @Nullable String url2,
    @Nullable Boolean smart) {

  boolean smartMode() {
    return Boolean.TRUE.equals(smart);
  }
}
