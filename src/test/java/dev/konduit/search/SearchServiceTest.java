package dev.konduit.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.konduit.index.IndexNotBuiltException;
import dev.konduit.index.IndexSnapshot;
import dev.konduit.index.SearchIndex;
import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {

  @Mock private SearchIndex searchIndex;
  @Mock private RerankerService rerankerService;

  @Captor private ArgumentCaptor<List<SearchResult>> candidatesCaptor;

  private SearchService searchService;

  @BeforeEach
  void setUp() {
    searchService = new SearchService(searchIndex, rerankerService, new SearchProperties());
  }

  private static Embedding vector(float x, float y) {
    return Embedding.from(new float[] {x, y});
  }

  private void passThroughReranker() {
    given(rerankerService.rerank(anyString(), anyList(), anyInt()))
        .willAnswer(invocation -> invocation.getArgument(1));
  }

  @Test
  void fusesSemanticAndKeywordScoresAndDropsWeakCandidates() {
    given(searchIndex.requireSnapshot())
        .willReturn(
            new IndexSnapshot(
                List.of("python release notes", "gardening tips", "python tutorial"),
                List.of("https://a.test/1", "https://a.test/2", "https://a.test/3"),
                List.of(vector(1f, 0f), vector(0f, 1f), vector(0.6f, 0.8f))));
    given(searchIndex.queryEmbedding("python release")).willReturn(vector(1f, 0f));
    passThroughReranker();

    List<SearchResult> results = searchService.search("python release");

    assertThat(results)
        .extracting(SearchResult::url)
        .containsExactly("https://a.test/1", "https://a.test/3");
    SearchResult best = results.get(0);
    assertThat(best.semanticScore()).isCloseTo(1.0, within(1e-6));
    assertThat(best.keywordScore()).isEqualTo(0.816);
    assertThat(best.finalScore()).isCloseTo(1.0 * 0.7 + 0.816 * 0.3, within(1e-6));
    assertThat(results.get(1).semanticScore()).isCloseTo(0.6, within(1e-6));
  }

  private static IndexSnapshot uniformSnapshot(int size) {
    List<String> chunks = IntStream.range(0, size).mapToObj(i -> "c" + i).toList();
    return new IndexSnapshot(
        chunks,
        chunks.stream().map(c -> "https://a.test/" + c).toList(),
        chunks.stream().map(c -> vector(1f, 0f)).toList());
  }

  @Test
  void overFetchesThreeCandidatesPerRequestedResult() {
    given(searchIndex.queryEmbedding("query")).willReturn(vector(1f, 0f));
    given(rerankerService.rerank(eq("query"), candidatesCaptor.capture(), eq(2)))
        .willReturn(List.of());

    searchService.search(uniformSnapshot(8), new SearchRequest("query", 2, 0.7, 0.15));

    assertThat(candidatesCaptor.getValue()).hasSize(6);
  }

  @Test
  void widerPoolFeedsRerankerWithoutRaisingResultCut() {
    given(searchIndex.queryEmbedding("query")).willReturn(vector(1f, 0f));
    given(rerankerService.rerank(eq("query"), candidatesCaptor.capture(), eq(5)))
        .willReturn(List.of());

    searchService.search(uniformSnapshot(30), new SearchRequest("query", 5, 7, 0.7, 0.15));

    assertThat(candidatesCaptor.getValue()).hasSize(21);
  }

  @Test
  void givenSnapshotIsSearchedInsteadOfLiveIndex() {
    IndexSnapshot built =
        new IndexSnapshot(
            List.of("python release notes"), List.of("https://a.test/"), List.of(vector(1f, 0f)));
    given(searchIndex.queryEmbedding("python release")).willReturn(vector(1f, 0f));
    passThroughReranker();

    List<SearchResult> results =
        searchService.search(built, new SearchRequest("python release", 5, 0.7, 0.15));

    assertThat(results).extracting(SearchResult::url).containsExactly("https://a.test/");
    verify(searchIndex, never()).requireSnapshot();
  }

  @Test
  void queryMatchingNothingReturnsEmptyList() {
    given(searchIndex.requireSnapshot())
        .willReturn(
            new IndexSnapshot(
                List.of("gardening tips"), List.of("https://a.test/"), List.of(vector(0f, 1f))));
    given(searchIndex.queryEmbedding("python")).willReturn(vector(1f, 0f));
    passThroughReranker();

    assertThat(searchService.search("python")).isEmpty();
  }

  @Test
  void unbuiltIndexFailsFast() {
    given(searchIndex.requireSnapshot()).willThrow(new IndexNotBuiltException());

    assertThatThrownBy(() -> searchService.search("python"))
        .isInstanceOf(IndexNotBuiltException.class);
    verifyNoInteractions(rerankerService);
  }

  @Test
  void queryEmbeddingFailureFallsBackToKeywordScores() {
    IndexSnapshot snapshot =
        new IndexSnapshot(
            List.of("python release notes"), List.of("https://a.test/"), List.of(vector(1f, 0f)));
    given(searchIndex.queryEmbedding("python release"))
        .willThrow(new IllegalStateException("model unavailable"));
    passThroughReranker();

    List<SearchResult> results =
        searchService.search(snapshot, new SearchRequest("python release", 5, 0.0, 0.15));

    assertThat(results).hasSize(1);
    assertThat(results.get(0).semanticScore()).isZero();
    assertThat(results.get(0).finalScore()).isCloseTo(0.816, within(1e-6));
  }

  @Test
  void blankQueryIsRejectedBeforeTouchingIndex() {
    assertThatThrownBy(() -> searchService.search(" "))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(searchIndex, rerankerService);
  }
}
