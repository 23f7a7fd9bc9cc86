package com.trending.tracker.crawl.api;

import com.trending.tracker.crawl.model.CrawlFailure;
import com.trending.tracker.crawl.model.ErrorResponse;
import com.trending.tracker.crawl.service.TrendingCrawlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@RestControllerAdvice
public class TrendingExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(TrendingExceptionHandler.class);

  @ExceptionHandler(TrendingCrawlException.class)
  public ResponseEntity<ErrorResponse> handleCrawlFailure(TrendingCrawlException ex) {
    CrawlFailure failure = ex.getResult().failure();
    String detail = failure == null ? null : failure.reasonCode() + ": " + failure.message();
    log.warn("{} ({})", ex.getMessage(), detail);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ErrorResponse(false, "CRAWL_ERROR", "Failed to fetch trending data", detail, Instant.now()));
  }

  @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ErrorResponse(false, "VALIDATION_ERROR", "Request validation failed", ex.getMessage(), Instant.now()));
  }
}
