package io.intellixity.docscope.query;

import java.util.List;

/**
 * Checks a query filter document and reports every problem found.
 * <p>
 * Implementations never throw for malformed queries: an empty list means valid, otherwise each entry is a
 * human-readable message in traversal order. Entries starting with {@code "Warning:"} are advisory.
 */
public interface QueryValidator {
  List<String> validate(Object query);
}
