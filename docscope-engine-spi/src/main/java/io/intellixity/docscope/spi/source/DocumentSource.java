package io.intellixity.docscope.spi.source;

import java.util.List;
import java.util.Map;

/**
 * Read access to a document store: enough to enumerate collections and pull a bounded sample.
 * <p>
 * Implementations throw {@link DocumentSourceException} when the store cannot be reached or read.
 */
public interface DocumentSource {
  /** Identifies the store, e.g. the database name; used to key cached snapshots. */
  String name();

  List<String> collectionNames();

  /**
   * Returns at most {@code limit} documents of {@code collection}. Which documents are returned
   * is up to the implementation.
   */
  List<Map<String, Object>> sample(String collection, int limit);
}
