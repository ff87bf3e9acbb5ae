package io.intellixity.docscope.mongo;

/** Raised when a find cannot be executed. */
public final class QueryExecutionException extends RuntimeException {
  public QueryExecutionException(String message) {
    super(message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
