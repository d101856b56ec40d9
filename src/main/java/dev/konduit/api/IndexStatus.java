package dev.konduit.api;

/** Body of {@code GET /api/index}. */
public record IndexStatus(boolean built, int chunks) {}
