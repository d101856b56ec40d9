package dev.konduit.index;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;

/**
 * Immutable, aligned view of an index: position {@code i} of {@code chunks}, {@code urls} and
 * {@code embeddings} describes the same chunk. An empty snapshot is what a build with no usable
 * text produces; it is never published as the live index.
 *
 * @param chunks chunk texts in page order
 * @param urls source URL of each chunk
 * @param embeddings bi-encoder vector of each chunk
 */
public record IndexSnapshot(List<String> chunks, List<String> urls, List<Embedding> embeddings) {

  public IndexSnapshot {
    chunks = List.copyOf(chunks);
    urls = List.copyOf(urls);
    embeddings = List.copyOf(embeddings);
    if (chunks.size() != urls.size() || chunks.size() != embeddings.size()) {
      throw new IllegalArgumentException(
          "Misaligned index: %d chunks, %d urls, %d embeddings"
              .formatted(chunks.size(), urls.size(), embeddings.size()));
    }
  }

  private static final IndexSnapshot EMPTY = new IndexSnapshot(List.of(), List.of(), List.of());

  public static IndexSnapshot empty() {
    return EMPTY;
  }

  public int size() {
    return chunks.size();
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
