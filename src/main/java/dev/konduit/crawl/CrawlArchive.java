package dev.konduit.crawl;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes the pages of one finished crawl to {@code <data-dir>/crawled_<domain>_<epochSeconds>.json}
 * as {@code [{"url": ..., "content": ...}, ...]}. Write-once; nothing in the application reads
 * these files back.
 */
@Component
public class CrawlArchive {

  private final Path dataDir;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Autowired
  public CrawlArchive(CrawlerProperties properties, ObjectMapper objectMapper, Clock clock) {
    this(Path.of(properties.dataDir()), objectMapper, clock);
  }

  CrawlArchive(Path dataDir, ObjectMapper objectMapper, Clock clock) {
    this.dataDir = dataDir;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Persist crawled pages.
   *
   * @param domain the crawl's target host
   * @param pages pages collected by the crawl, possibly empty
   * @return path of the written file
   * @throws UncheckedIOException if the file cannot be written
   */
  public Path save(String domain, List<Page> pages) {
    Path target =
        dataDir.resolve("crawled_%s_%d.json".formatted(domain, clock.instant().getEpochSecond()));
    try {
      Files.createDirectories(dataDir);
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), pages);
      return target;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write crawl archive " + target, e);
    }
  }
}
