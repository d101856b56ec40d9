package dev.konduit.api;

import dev.konduit.answer.Answer;
import dev.konduit.answer.AnswerService;
import dev.konduit.answer.CrawlSummary;
import dev.konduit.index.SearchIndex;
import dev.konduit.search.SearchResult;
import dev.konduit.search.SearchService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Crawl, query and index-status endpoints. */
@RestController
@RequestMapping("/api")
public class SearchController {

  private final AnswerService answerService;
  private final SearchService searchService;
  private final SearchIndex searchIndex;

  public SearchController(
      AnswerService answerService, SearchService searchService, SearchIndex searchIndex) {
    this.answerService = answerService;
    this.searchService = searchService;
    this.searchIndex = searchIndex;
  }

  /** POST /api/crawl - crawl one or two sites and rebuild the index in the background. */
  @PostMapping("/crawl")
  public ResponseEntity<CrawlSummary> crawl(@RequestBody CrawlRequest request) {
    CrawlSummary summary = answerService.crawlOnly(request.url(), request.url2());
    return summary.success()
        ? ResponseEntity.ok(summary)
        : ResponseEntity.badRequest().body(summary);
  }

  /** POST /api/search - crawl, index and answer a query. */
  @PostMapping("/search")
  public ResponseEntity<Answer> search(@Valid @RequestBody QueryRequest request) {
    Answer answer =
        answerService.answer(request.query(), request.url(), request.url2(), request.smartMode());
    return answer.success()
        ? ResponseEntity.ok(answer)
        : ResponseEntity.status(HttpStatus.NOT_FOUND).body(answer);
  }

  /**
   * POST /api/query - search the index built by an earlier crawl, without crawling again. Fails
   * with 409 while no index is active.
   */
  @PostMapping("/query")
  public List<SearchResult> query(@Valid @RequestBody IndexQueryRequest request) {
    return searchService.search(request.query().strip());
  }

  /** GET /api/index - whether an index is active and how many chunks it holds. */
  @GetMapping("/index")
  public IndexStatus index() {
    return new IndexStatus(searchIndex.isBuilt(), searchIndex.size());
  }
}
