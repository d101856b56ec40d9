package dev.konduit.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Splits page text into sentence-aligned chunks of bounded length.
 *
 * <p>Whitespace is collapsed first; text shorter than {@value #MIN_TEXT_LENGTH} characters yields
 * no chunks. Sentences (ending in {@code .}, {@code !} or {@code ?}) are packed greedily: a chunk
 * is flushed as soon as the next sentence would push it past the limit. A single sentence longer
 * than the limit is broken at word boundaries; only a lone word longer than the limit can produce
 * an oversized chunk. Chunks are never empty and joining them with single spaces gives back the
 * normalised text.
 */
@Component
public class SentenceChunker {

  static final int DEFAULT_MAX_LENGTH = 300;
  static final int MIN_TEXT_LENGTH = 50;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?]) +");

  /** Chunks text with the default limit of {@value #DEFAULT_MAX_LENGTH} characters. */
  public List<String> chunk(@Nullable String text) {
    return chunk(text, DEFAULT_MAX_LENGTH);
  }

  /**
   * Chunks text into sentence-aligned segments.
   *
   * @param text the page text
   * @param maxLength maximum chunk length in characters
   * @return ordered non-empty chunks, empty when the text is too short
   */
  public List<String> chunk(@Nullable String text, int maxLength) {
    if (maxLength < 1) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    if (text == null) {
      return List.of();
    }
    String normalized = WHITESPACE.matcher(text).replaceAll(" ").strip();
    if (normalized.length() < MIN_TEXT_LENGTH) {
      return List.of();
    }

    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String sentence : SENTENCE_END.split(normalized)) {
      for (String piece : fitToLength(sentence, maxLength)) {
        if (current.length() > 0 && current.length() + 1 + piece.length() > maxLength) {
          chunks.add(current.toString());
          current.setLength(0);
        }
        if (current.length() > 0) {
          current.append(' ');
        }
        current.append(piece);
      }
    }
    if (current.length() > 0) {
      chunks.add(current.toString());
    }
    return chunks;
  }

  /** Breaks an oversized sentence into word-aligned pieces no longer than maxLength. */
  private static List<String> fitToLength(String sentence, int maxLength) {
    if (sentence.length() <= maxLength) {
      return List.of(sentence);
    }
    List<String> pieces = new ArrayList<>();
    StringBuilder piece = new StringBuilder();
    for (String word : sentence.split(" ")) {
      if (piece.length() > 0 && piece.length() + 1 + word.length() > maxLength) {
        pieces.add(piece.toString());
        piece.setLength(0);
      }
      if (piece.length() > 0) {
        piece.append(' ');
      }
      piece.append(word);
    }
    if (piece.length() > 0) {
      pieces.add(piece.toString());
    }
    return pieces;
  }
}
