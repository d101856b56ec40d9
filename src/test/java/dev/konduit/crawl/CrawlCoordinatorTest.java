package dev.konduit.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CrawlCoordinatorTest {

  @Mock private SiteCrawler siteCrawler;

  private ExecutorService executor;
  private CrawlCoordinator coordinator;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    coordinator = new CrawlCoordinator(siteCrawler, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void mergesOutcomesInSeedOrder() {
    given(siteCrawler.crawl("https://a.test/", "q", 50, 2))
        .willReturn(
            new CrawlOutcome(
                List.of(new Page("https://a.test/", "A")), List.of("https://a.test/x")));
    given(siteCrawler.crawl("https://b.test/", "q", 50, 2))
        .willReturn(
            new CrawlOutcome(
                List.of(new Page("https://b.test/", "B")), List.of("https://b.test/y")));

    CrawlOutcome merged =
        coordinator.crawlAll(List.of("https://a.test/", "https://b.test/"), "q", 50, 2);

    assertThat(merged.pages())
        .extracting(Page::url)
        .containsExactly("https://a.test/", "https://b.test/");
    assertThat(merged.blocked()).containsExactly("https://a.test/x", "https://b.test/y");
  }

  @Test
  void ignoresBlankAndMissingSeeds() {
    given(siteCrawler.crawl("https://a.test/", "", 5, 1))
        .willReturn(new CrawlOutcome(List.of(), List.of()));

    coordinator.crawlAll(Arrays.asList("https://a.test/", "  ", null), "", 5, 1);

    verify(siteCrawler).crawl("https://a.test/", "", 5, 1);
    verifyNoMoreInteractions(siteCrawler);
  }

  @Test
  void failingSiteContributesNothingButOthersSurvive() {
    given(siteCrawler.crawl("https://bad.test/", "", 50, 2))
        .willThrow(new IllegalArgumentException("boom"));
    given(siteCrawler.crawl("https://good.test/", "", 50, 2))
        .willReturn(new CrawlOutcome(List.of(new Page("https://good.test/", "ok")), List.of()));

    CrawlOutcome merged =
        coordinator.crawlAll(List.of("https://bad.test/", "https://good.test/"), "", 50, 2);

    assertThat(merged.pages()).extracting(Page::url).containsExactly("https://good.test/");
    assertThat(merged.blocked()).isEmpty();
  }

  @Test
  void noSeedsYieldsEmptyOutcome() {
    assertThat(coordinator.crawlAll(List.of(), "", 50, 2).pages()).isEmpty();
  }
}
