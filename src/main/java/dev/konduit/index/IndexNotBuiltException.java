package dev.konduit.index;

/**
 * Thrown when a search is attempted while no index exists, either because nothing was built yet
 * or because the last build produced no chunks. Distinct from a search that finds nothing.
 */
public class IndexNotBuiltException extends IllegalStateException {

  public IndexNotBuiltException() {
    super("Index not built yet: build it from crawled pages before searching");
  }
}
