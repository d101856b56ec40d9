package dev.konduit.summarize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ExtractiveSummarizerTest {

  private static final String PYTHON = "Python is a popular programming language.";
  private static final String GUIDO = "Python was created by Guido van Rossum in the Netherlands.";
  private static final String WEATHER = "The weather in Amsterdam is mild and rainy.";

  private final ExtractiveSummarizer summarizer = new ExtractiveSummarizer();

  @Test
  void blankInputHasNoContent() {
    assertThat(summarizer.summarize("  ", "python")).isEqualTo(ExtractiveSummarizer.NO_CONTENT);
    assertThat(summarizer.summarize(null, null)).isEqualTo(ExtractiveSummarizer.NO_CONTENT);
  }

  @Test
  void removesCitationMarkersAndCollapsesWhitespace() {
    String text =
        "Python was created by Guido van Rossum.[1]\n\n  It was first released in 1991.[23]";

    assertThat(summarizer.summarize(text, null))
        .isEqualTo("Python was created by Guido van Rossum. It was first released in 1991.");
  }

  @Test
  void dropsDuplicateAndShortSentences() {
    String text = PYTHON + " Yes. " + PYTHON.toUpperCase() + " " + GUIDO;

    assertThat(summarizer.summarize(text, null)).isEqualTo(PYTHON + " " + GUIDO);
  }

  @Test
  void keepsSentencesMentioningQueryTerms() {
    String text = WEATHER + " " + PYTHON + " " + GUIDO;

    assertThat(summarizer.summarize(text, "Who created Python?")).isEqualTo(PYTHON + " " + GUIDO);
  }

  @Test
  void fallsBackToAllSentencesWhenNoneMatchTheQuery() {
    String text = WEATHER + " " + PYTHON;

    assertThat(summarizer.summarize(text, "rust borrow checker")).isEqualTo(text);
  }

  @Test
  void limitsNumberOfSentences() {
    ExtractiveSummarizer brief = new ExtractiveSummarizer(2);
    String text = PYTHON + " " + GUIDO + " " + WEATHER;

    assertThat(brief.summarize(text, null)).isEqualTo(PYTHON + " " + GUIDO);
  }

  @Test
  void onlyShortSentencesYieldNoAnswer() {
    assertThat(summarizer.summarize("Yes. No. Maybe later.", "python"))
        .isEqualTo(ExtractiveSummarizer.NO_ANSWER);
  }

  @Test
  void rejectsNonPositiveSentenceLimit() {
    assertThatThrownBy(() -> new ExtractiveSummarizer(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
