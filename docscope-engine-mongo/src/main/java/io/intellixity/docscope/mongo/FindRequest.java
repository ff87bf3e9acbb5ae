package io.intellixity.docscope.mongo;

import org.bson.Document;

import java.util.List;
import java.util.Objects;

/**
 * A find against one collection.
 *
 * @param projection null for whole documents
 * @param limit      0 means no limit
 */
public record FindRequest(String collection,
                          Document filter,
                          Document projection,
                          List<SortField> sort,
                          int skip,
                          int limit) {
  public FindRequest {
    Objects.requireNonNull(collection, "collection");
    if (collection.isBlank()) throw new IllegalArgumentException("collection must not be blank");
    Objects.requireNonNull(filter, "filter");
    if (skip < 0) throw new IllegalArgumentException("skip cannot be negative");
    if (limit < 0) throw new IllegalArgumentException("limit cannot be negative");
    sort = (sort == null) ? List.of() : List.copyOf(sort);
    if (projection != null && projection.isEmpty()) projection = null;
  }

  public static FindRequest of(String collection, Document filter) {
    return new FindRequest(collection, filter, null, List.of(), 0, 0);
  }

  public FindRequest withProjection(Document projection) {
    return new FindRequest(collection, filter, projection, sort, skip, limit);
  }

  public FindRequest withSort(List<SortField> sort) {
    return new FindRequest(collection, filter, projection, sort, skip, limit);
  }

  public FindRequest withPage(int skip, int limit) {
    return new FindRequest(collection, filter, projection, sort, skip, limit);
  }

  /** Sort specification in driver form, or null when unsorted. */
  public Document sortDocument() {
    if (sort.isEmpty()) return null;
    Document d = new Document();
    for (SortField sf : sort) d.put(sf.field(), sf.direction().value());
    return d;
  }
}
