package dev.konduit.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Persists the chunk and URL arrays of the latest successful build to {@code
 * <data-dir>/embeddings.json} as {@code {"chunks": [...], "urls": [...]}}, overwriting the previous
 * file. Vectors are not written; they are recomputed on the next build.
 */
@Component
public class IndexArchive {

  static final String FILE_NAME = "embeddings.json";

  private final Path file;
  private final ObjectMapper objectMapper;

  @Autowired
  public IndexArchive(
      @Value("${konduit.index.data-dir:data}") String dataDir, ObjectMapper objectMapper) {
    this(Path.of(dataDir), objectMapper);
  }

  IndexArchive(Path dataDir, ObjectMapper objectMapper) {
    this.file = dataDir.resolve(FILE_NAME);
    this.objectMapper = objectMapper;
  }

  /**
   * Write the aligned arrays of a snapshot.
   *
   * @param snapshot the freshly built index
   * @return path of the written file
   * @throws UncheckedIOException if the file cannot be written
   */
  public Path save(IndexSnapshot snapshot) {
    try {
      Files.createDirectories(file.toAbsolutePath().getParent());
      objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValue(file.toFile(), new PersistedChunks(snapshot.chunks(), snapshot.urls()));
      return file;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write index archive " + file, e);
    }
  }

  /**
   * Read the arrays written by the last {@link #save}.
   *
   * @return persisted chunks and urls, index-aligned
   * @throws UncheckedIOException if the file is missing or unreadable
   */
  PersistedChunks load() {
    try {
      return objectMapper.readValue(file.toFile(), PersistedChunks.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read index archive " + file, e);
    }
  }

  /** On-disk shape of the archive. */
  record PersistedChunks(List<String> chunks, List<String> urls) {
    public PersistedChunks {
      chunks = chunks == null ? List.of() : List.copyOf(chunks);
      urls = urls == null ? List.of() : List.copyOf(urls);
    }
  }
}
