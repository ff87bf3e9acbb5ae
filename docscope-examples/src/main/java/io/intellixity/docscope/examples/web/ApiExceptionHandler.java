package io.intellixity.docscope.examples.web;

import io.intellixity.docscope.mongo.QueryExecutionException;
import io.intellixity.docscope.query.QueryValidationException;
import io.intellixity.docscope.spi.discovery.SchemaDiscoveryException;
import org.bson.BSONException;
import org.bson.json.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  public record ErrorBody(boolean valid, String message, List<String> errors) {}

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<ErrorBody> invalidQuery(QueryValidationException e) {
    return ResponseEntity.badRequest().body(new ErrorBody(false, e.getMessage(), e.errors()));
  }

  @ExceptionHandler({IllegalArgumentException.class, JsonParseException.class, BSONException.class})
  public ResponseEntity<ErrorBody> badRequest(RuntimeException e) {
    return ResponseEntity.badRequest().body(new ErrorBody(false, e.getMessage(), List.of(String.valueOf(e.getMessage()))));
  }

  @ExceptionHandler(SchemaDiscoveryException.class)
  public ResponseEntity<ErrorBody> discoveryFailed(SchemaDiscoveryException e) {
    HttpStatus status = (e.getCause() == null) ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
    if (e.getCause() != null) log.error("docscope.api discoveryFailed message={}", e.getMessage(), e);
    return ResponseEntity.status(status).body(new ErrorBody(false, e.getMessage(), List.of()));
  }

  @ExceptionHandler(QueryExecutionException.class)
  public ResponseEntity<ErrorBody> executionFailed(QueryExecutionException e) {
    log.error("docscope.api executionFailed message={}", e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorBody(false, e.getMessage(), List.of()));
  }
}
