package dev.konduit.summarize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Query-aware extractive summarizer: picks sentences out of the retrieved text rather than
 * generating new ones.
 *
 * <p>The text is cleaned (whitespace collapsed, numeric citation markers such as {@code [12]}
 * removed), split into sentences and de-duplicated case-insensitively. Sentences of {@value
 * #MIN_SENTENCE_LENGTH} characters or fewer are dropped. With a query, only sentences containing
 * at least one query term are kept, unless none do. The first {@code maxSentences} survivors form
 * the summary.
 */
@Component
public class ExtractiveSummarizer implements Summarizer {

  private static final Logger log = LoggerFactory.getLogger(ExtractiveSummarizer.class);

  static final String NO_CONTENT = "No relevant content found.";
  static final String NO_ANSWER = "No clear answer could be derived.";
  static final int MIN_SENTENCE_LENGTH = 25;
  static final int DEFAULT_MAX_SENTENCES = 5;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern CITATION = Pattern.compile("\\[[0-9]+\\]");
  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

  private final int maxSentences;

  public ExtractiveSummarizer() {
    this(DEFAULT_MAX_SENTENCES);
  }

  ExtractiveSummarizer(int maxSentences) {
    if (maxSentences < 1) {
      throw new IllegalArgumentException("maxSentences must be positive");
    }
    this.maxSentences = maxSentences;
  }

  @Override
  public String summarize(String text, @Nullable String query) {
    if (text == null || text.isBlank()) {
      return NO_CONTENT;
    }

    List<String> sentences = distinctSentences(clean(text));
    List<String> selected = focus(sentences, query);
    if (selected.isEmpty()) {
      return NO_ANSWER;
    }
    log.debug("Summary built from {} of {} sentences", selected.size(), sentences.size());
    return String.join(" ", selected);
  }

  static String clean(String text) {
    String collapsed = WHITESPACE.matcher(text).replaceAll(" ").strip();
    return CITATION.matcher(collapsed).replaceAll("");
  }

  private static List<String> distinctSentences(String text) {
    Set<String> seen = new HashSet<>();
    List<String> kept = new ArrayList<>();
    for (String sentence : SENTENCE_END.split(text)) {
      String key = sentence.strip().toLowerCase(Locale.ROOT);
      if (key.length() > MIN_SENTENCE_LENGTH && seen.add(key)) {
        kept.add(sentence.strip());
      }
    }
    return kept;
  }

  private List<String> focus(List<String> sentences, @Nullable String query) {
    Set<String> terms = queryTerms(query);
    List<String> relevant =
        terms.isEmpty()
            ? sentences
            : sentences.stream().filter(s -> containsAny(s, terms)).toList();
    if (relevant.isEmpty()) {
      relevant = sentences;
    }
    return relevant.stream().limit(maxSentences).toList();
  }

  private static Set<String> queryTerms(@Nullable String query) {
    if (query == null || query.isBlank()) {
      return Set.of();
    }
    Set<String> terms = new HashSet<>();
    Arrays.stream(NON_WORD.split(query.toLowerCase(Locale.ROOT)))
        .filter(term -> term.length() >= 3)
        .forEach(terms::add);
    return terms;
  }

  private static boolean containsAny(String sentence, Set<String> terms) {
    String lower = sentence.toLowerCase(Locale.ROOT);
    return terms.stream().anyMatch(lower::contains);
  }
}
