package dev.konduit.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/query}: a question against the index built by the last crawl. */
public record IndexQueryRequest(@NotBlank(message = "Query is required.") String query) {}
