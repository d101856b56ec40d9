package dev.konduit.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

import dev.konduit.crawl.CrawlCoordinator;
import dev.konduit.crawl.CrawlOutcome;
import dev.konduit.crawl.CrawlerProperties;
import dev.konduit.crawl.Page;
import dev.konduit.fixture.CrawlerPropertiesFixture;
import dev.konduit.index.IndexArchive;
import dev.konduit.index.IndexBuildJob;
import dev.konduit.index.SearchIndex;
import dev.konduit.ingestion.chunking.SentenceChunker;
import dev.konduit.search.RerankerService;
import dev.konduit.search.SearchProperties;
import dev.konduit.search.SearchResult;
import dev.konduit.search.SearchService;
import dev.konduit.summarize.Summarizer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Runs the answer flow against a real index, build job and search pipeline, with only the models
 * and the crawl replaced.
 */
@ExtendWith(MockitoExtension.class)
class AnswerServiceIndexIsolationTest {

  private static final String PRIMARY = "https://python.org";
  private static final String QUERY = "python release";
  private static final List<Page> PAGES =
      IntStream.range(0, 8)
          .mapToObj(
              i ->
                  new Page(
                      "https://python.org/releases/" + i,
                      "Python release " + i + " notes describe the interpreter changes shipped."))
          .toList();

  @Mock private CrawlCoordinator crawlCoordinator;
  @Mock private EmbeddingModel embeddingModel;
  @Mock private ScoringModel scoringModel;
  @Mock private IndexArchive archive;
  @Mock private Summarizer summarizer;

  private final CrawlerProperties crawlerProperties = CrawlerPropertiesFixture.defaults();

  private SearchIndex searchIndex;
  private Runnable afterBuild;
  private AnswerService answerService;

  @BeforeEach
  void setUp() {
    searchIndex = new SearchIndex(new SentenceChunker(), embeddingModel, archive);
    afterBuild = () -> {};
    Executor buildExecutor =
        task -> {
          task.run();
          afterBuild.run();
        };
    SearchProperties searchProperties = new SearchProperties();
    answerService =
        new AnswerService(
            crawlCoordinator,
            new IndexBuildJob(searchIndex, buildExecutor),
            new SearchService(searchIndex, new RerankerService(scoringModel), searchProperties),
            summarizer,
            crawlerProperties,
            searchProperties);

    int maxPages = crawlerProperties.maxPages();
    int maxDepth = crawlerProperties.maxDepth();
    given(crawlCoordinator.crawlAll(List.of(PRIMARY), QUERY, maxPages, maxDepth))
        .willReturn(new CrawlOutcome(PAGES, List.of()));
    given(embeddingModel.embedAll(anyList()))
        .willAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(segments.stream().map(s -> unit()).toList());
            });
    given(embeddingModel.embed(QUERY)).willReturn(Response.from(unit()));
    given(scoringModel.scoreAll(anyList(), eq(QUERY)))
        .willAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(
                  IntStream.range(0, segments.size()).mapToObj(i -> (double) i).toList());
            });
  }

  private static Embedding unit() {
    return Embedding.from(new float[] {1f, 0f});
  }

  @Test
  void answersFromItsOwnBuildWhenAnotherBuildClearsTheLiveIndex() {
    afterBuild = () -> searchIndex.build(List.of(new Page("https://other.test/", "short")));

    Answer answer = answerService.answer(QUERY, PRIMARY, null, false);

    assertThat(searchIndex.isBuilt()).isFalse();
    assertThat(answer.success()).isTrue();
    assertThat(answer.results())
        .isNotEmpty()
        .allSatisfy(r -> assertThat(r.url()).startsWith("https://python.org/releases/"));
  }

  @Test
  void answerCarriesAtMostTopKResultsFromTheWiderCandidatePool() {
    Answer answer = answerService.answer(QUERY, PRIMARY, null, false);

    assertThat(answer.results()).hasSize(5);
    assertThat(answer.results())
        .extracting(SearchResult::rerankScore)
        .isSortedAccordingTo(Comparator.reverseOrder())
        .containsExactly(7.0, 6.0, 5.0, 4.0, 3.0);
  }
}
