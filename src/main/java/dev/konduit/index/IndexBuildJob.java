package dev.konduit.index;

import dev.konduit.crawl.Page;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs {@link SearchIndex#build} off the request thread and hands back a future the caller can
 * await, poll or cancel. Builds run on a single-threaded executor, so they complete in submission
 * order.
 */
@Service
public class IndexBuildJob {

  private static final Logger log = LoggerFactory.getLogger(IndexBuildJob.class);

  private final SearchIndex searchIndex;
  private final Executor indexBuildExecutor;

  public IndexBuildJob(
      SearchIndex searchIndex, @Qualifier("indexBuildExecutor") Executor indexBuildExecutor) {
    this.searchIndex = searchIndex;
    this.indexBuildExecutor = indexBuildExecutor;
  }

  /**
   * Submits a rebuild.
   *
   * @param pages pages to index
   * @return future completing with the snapshot the build published (empty when nothing was
   *     indexable), or exceptionally with {@link IndexBuildException}
   */
  public CompletableFuture<IndexSnapshot> submit(List<Page> pages) {
    List<Page> snapshot = List.copyOf(pages);
    return CompletableFuture.supplyAsync(() -> searchIndex.build(snapshot), indexBuildExecutor)
        .whenComplete(
            (built, error) -> {
              if (error != null) {
                log.error("Background index build failed: {}", error.getMessage(), error);
              }
            });
  }
}
