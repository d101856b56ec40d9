package dev.konduit.api;

import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/crawl}. At least one of the two URLs is required.
 *
 * @param url primary site
 * @param url2 secondary site
 */
public record CrawlRequest(@Nullable String url, @Nullable String url2) {}
