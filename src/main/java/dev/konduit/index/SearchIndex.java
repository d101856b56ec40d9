package dev.konduit.index;

import dev.konduit.crawl.Page;
import dev.konduit.ingestion.chunking.SentenceChunker;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The single in-memory retrieval index: chunk texts, their source URLs and their embeddings.
 *
 * <p>A build chunks every page, embeds all chunks in one batch and publishes the result as a new
 * {@link IndexSnapshot} through a volatile reference. Readers always see either the previous or
 * the new snapshot in full, never a half-built one. Builds are serialised. A build that yields no
 * chunks leaves the index unbuilt, and {@link #requireSnapshot()} then fails fast.
 *
 * <p>Query vectors are memoised by exact query string for the lifetime of the process. The cache
 * is unbounded and never evicted, which is only acceptable while query volume stays small.
 */
@Component
public class SearchIndex {

  private static final Logger log = LoggerFactory.getLogger(SearchIndex.class);

  private final SentenceChunker chunker;
  private final EmbeddingModel embeddingModel;
  private final IndexArchive archive;

  private final Object buildLock = new Object();
  private final Map<String, Embedding> queryCache = new ConcurrentHashMap<>();
  private volatile @Nullable IndexSnapshot snapshot;

  public SearchIndex(SentenceChunker chunker, EmbeddingModel embeddingModel, IndexArchive archive) {
    this.chunker = chunker;
    this.embeddingModel = embeddingModel;
    this.archive = archive;
  }

  /**
   * Rebuilds the index from scratch.
   *
   * @param pages crawled pages; blank pages contribute nothing
   * @return the snapshot this build published, or {@link IndexSnapshot#empty()} when the index is
   *     now unbuilt. Callers that must search exactly what they built search this snapshot rather
   *     than the live one, which a later build may already have replaced.
   * @throws IndexBuildException if the embedding model fails; the previous snapshot stays active
   */
  public IndexSnapshot build(List<Page> pages) {
    synchronized (buildLock) {
      List<String> chunks = new ArrayList<>();
      List<String> urls = new ArrayList<>();
      for (Page page : pages) {
        String content = page.content().strip();
        if (content.isEmpty()) {
          continue;
        }
        List<String> pageChunks = chunker.chunk(content);
        chunks.addAll(pageChunks);
        urls.addAll(Collections.nCopies(pageChunks.size(), page.url()));
      }

      if (chunks.isEmpty()) {
        log.warn("No valid text found in {} pages, index left unbuilt", pages.size());
        snapshot = null;
        return IndexSnapshot.empty();
      }

      IndexSnapshot built = new IndexSnapshot(chunks, urls, embed(chunks));
      snapshot = built;
      log.info("Indexed {} chunks from {} pages", built.size(), pages.size());

      try {
        log.debug("Index arrays saved to {}", archive.save(built));
      } catch (UncheckedIOException e) {
        log.warn("Could not persist index arrays: {}", e.getMessage());
      }
      return built;
    }
  }

  /**
   * Returns the active snapshot.
   *
   * @throws IndexNotBuiltException if no usable index exists
   */
  public IndexSnapshot requireSnapshot() {
    IndexSnapshot current = snapshot;
    if (current == null) {
      throw new IndexNotBuiltException();
    }
    return current;
  }

  public boolean isBuilt() {
    return snapshot != null;
  }

  /** Number of indexed chunks, 0 when unbuilt. */
  public int size() {
    IndexSnapshot current = snapshot;
    return current == null ? 0 : current.size();
  }

  /**
   * Embeds a query, reusing the vector of an identical earlier query.
   *
   * @param query the exact query string (no normalisation)
   * @return the query vector
   */
  public Embedding queryEmbedding(String query) {
    return queryCache.computeIfAbsent(query, q -> embeddingModel.embed(q).content());
  }

  int cachedQueryCount() {
    return queryCache.size();
  }

  private List<Embedding> embed(List<String> chunks) {
    List<TextSegment> segments = chunks.stream().map(TextSegment::from).toList();
    List<Embedding> embeddings;
    try {
      embeddings = embeddingModel.embedAll(segments).content();
    } catch (RuntimeException e) {
      throw new IndexBuildException("Embedding " + chunks.size() + " chunks failed", e);
    }
    if (embeddings == null || embeddings.size() != chunks.size()) {
      throw new IndexBuildException(
          "Embedding model returned %d vectors for %d chunks"
              .formatted(embeddings == null ? 0 : embeddings.size(), chunks.size()),
          null);
    }
    return embeddings;
  }
}
