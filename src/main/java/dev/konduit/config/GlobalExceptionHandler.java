package dev.konduit.config;

import dev.konduit.index.IndexNotBuiltException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns exceptions escaping the crawl and search endpoints into RFC 9457 Problem Details.
 *
 * <p>Invalid input becomes 400. Searching before any index exists is a precondition failure and
 * becomes 409, which keeps it distinguishable from a successful search with no hits.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** Missing seeds or invalid search parameters. */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /** Search attempted while the index is unbuilt. */
  @ExceptionHandler(IndexNotBuiltException.class)
  ProblemDetail handleIndexNotBuilt(IndexNotBuiltException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
  }
}
