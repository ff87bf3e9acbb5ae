package io.intellixity.docscope.spi.discovery;

/** Raised when schema discovery cannot produce a snapshot, e.g. for a collection that does not exist. */
public final class SchemaDiscoveryException extends RuntimeException {
  public SchemaDiscoveryException(String message) {
    super(message);
  }

  public SchemaDiscoveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
