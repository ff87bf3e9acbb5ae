package io.intellixity.docscope.query;

import java.util.List;

/**
 * Raised by {@link QueryValidation#requireValidSyntax} and {@link QueryValidation#requireValidAgainstSchema}
 * when a filter fails validation. Carries every error found, warnings excluded.
 */
public final class QueryValidationException extends RuntimeException {
  private final List<String> errors;

  public QueryValidationException(String message) {
    this(message, List.of());
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
    this.errors = List.of();
  }

  public QueryValidationException(String message, List<String> errors) {
    super(message);
    this.errors = (errors == null) ? List.of() : List.copyOf(errors);
  }

  public List<String> errors() { return errors; }
}
