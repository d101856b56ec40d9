package dev.konduit.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class SentenceChunkerTest {

  private final SentenceChunker chunker = new SentenceChunker();

  @Test
  void textShorterThanMinimumYieldsNoChunks() {
    assertThat(chunker.chunk("Too short to index.")).isEmpty();
    assertThat(chunker.chunk("   \n\t  ")).isEmpty();
    assertThat(chunker.chunk(null)).isEmpty();
  }

  @Test
  void packsAdjacentSentencesUntilTheNextWouldOverflow() {
    String text =
        "Alpha beta gamma delta epsilon. Zeta eta theta iota kappa. Lambda mu nu xi omicron pi.";

    List<String> chunks = chunker.chunk(text, 60);

    assertThat(chunks)
        .containsExactly(
            "Alpha beta gamma delta epsilon. Zeta eta theta iota kappa.",
            "Lambda mu nu xi omicron pi.");
  }

  @Test
  void collapsesWhitespaceBeforeSplitting() {
    String text =
        "First sentence is right here!\n\n   Second\tsentence follows it closely?  Yes it does.";

    List<String> chunks = chunker.chunk(text);

    assertThat(chunks)
        .containsExactly(
            "First sentence is right here! Second sentence follows it closely? Yes it does.");
  }

  @Test
  void oversizedSentenceIsBrokenAtWordBoundaries() {
    String sentence = "word ".repeat(40).strip() + ".";

    List<String> chunks = chunker.chunk(sentence, 50);

    assertThat(chunks).hasSizeGreaterThan(1);
    assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(50));
    assertThat(String.join(" ", chunks)).isEqualTo(sentence);
  }

  @Test
  void defaultLimitIsThreeHundredCharacters() {
    String text = "This sentence has exactly enough words to matter here. ".repeat(30);

    List<String> chunks = chunker.chunk(text);

    assertThat(chunks).hasSizeGreaterThan(1);
    assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(300));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThatThrownBy(() -> chunker.chunk("anything", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
