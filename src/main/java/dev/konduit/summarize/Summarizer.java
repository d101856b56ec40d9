package dev.konduit.summarize;

import org.jspecify.annotations.Nullable;

/** Condenses retrieved text into a short answer, optionally focused on a query. */
public interface Summarizer {

  /**
   * @param text text to condense, may be blank
   * @param query the user's question, or null for a generic summary
   * @return a non-null summary or a fixed marker sentence
   */
  String summarize(String text, @Nullable String query);
}
