package dev.konduit.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchRequestTest {

  @Test
  void plainRequestSizesPoolFromTopK() {
    SearchRequest request = new SearchRequest("python", 5, 0.7, 0.15);

    assertThat(request.poolK()).isEqualTo(5);
  }

  @Test
  void rejectsBlankQuery() {
    assertThatThrownBy(() -> new SearchRequest("  ", 5, 0.7, 0.15))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Query");
  }

  @Test
  void rejectsNonPositiveTopK() {
    assertThatThrownBy(() -> new SearchRequest("python", 0, 0.7, 0.15))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("topK");
  }

  @Test
  void rejectsPoolSmallerThanTopK() {
    assertThatThrownBy(() -> new SearchRequest("python", 5, 3, 0.7, 0.15))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("poolK");
  }

  @Test
  void rejectsWeightOutsideUnitInterval() {
    assertThatThrownBy(() -> new SearchRequest("python", 5, 1.5, 0.15))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("weight");
  }
}
