package dev.konduit.index;

/** Embedding the chunks of a build failed; the previously active index stays in place. */
public class IndexBuildException extends RuntimeException {

  public IndexBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
