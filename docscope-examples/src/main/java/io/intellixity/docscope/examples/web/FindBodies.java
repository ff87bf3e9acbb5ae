package io.intellixity.docscope.examples.web;

import io.intellixity.docscope.mongo.FindRequest;
import io.intellixity.docscope.mongo.SortField;
import org.bson.BsonInvalidOperationException;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads request bodies in extended JSON. A find body looks like:
 * <pre>
 * {"filter": {...}, "projection": {...}, "sort": [{"field": "age", "direction": -1}], "skip": 0, "limit": 10}
 * </pre>
 * Parsing with {@link Document#parse} keeps {@code $oid}, {@code $date} and {@code $numberLong} values typed.
 */
final class FindBodies {
  private FindBodies() {}

  /** A bare query filter; the body must be a JSON document. */
  static Document filter(String json) {
    return document(json, "Query filter");
  }

  static FindRequest parse(String collection, String json) {
    Document body = document(json, "Find body");
    Document filter = document(body, "filter");
    if (filter == null) throw new IllegalArgumentException("'filter' must be a document");
    return new FindRequest(collection, filter, document(body, "projection"), sort(body.get("sort")),
        integer(body, "skip"), integer(body, "limit"));
  }

  private static Document document(String json, String what) {
    try {
      return Document.parse(json);
    } catch (BsonInvalidOperationException | JsonParseException e) {
      throw new IllegalArgumentException(what + " must be a JSON document: " + e.getMessage(), e);
    }
  }

  private static Document document(Document body, String key) {
    Object v = body.get(key);
    if (v == null) return null;
    if (v instanceof Document d) return d;
    throw new IllegalArgumentException("'" + key + "' must be a document");
  }

  private static int integer(Document body, String key) {
    Object v = body.get(key);
    if (v == null) return 0;
    if (v instanceof Integer i) return i;
    throw new IllegalArgumentException("'" + key + "' must be an integer");
  }

  private static List<SortField> sort(Object v) {
    if (v == null) return List.of();
    if (!(v instanceof List<?> items)) throw new IllegalArgumentException("'sort' must be an array");

    List<SortField> out = new ArrayList<>();
    for (Object item : items) {
      if (!(item instanceof Map<?, ?> m) || !(m.get("field") instanceof String field)
          || !(m.get("direction") instanceof Integer direction)) {
        throw new IllegalArgumentException("Invalid sort item " + item + ": expected {\"field\": name, \"direction\": 1 or -1}");
      }
      out.add(new SortField(field, SortField.Direction.of(direction)));
    }
    return out;
  }
}
