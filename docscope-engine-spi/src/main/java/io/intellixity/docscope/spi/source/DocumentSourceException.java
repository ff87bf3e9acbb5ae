package io.intellixity.docscope.spi.source;

/** Raised when a {@link DocumentSource} cannot list or read collections. */
public final class DocumentSourceException extends RuntimeException {
  public DocumentSourceException(String message) {
    super(message);
  }

  public DocumentSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
