package io.intellixity.docscope.spi.discovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.intellixity.docscope.schema.CollectionSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Collection name to schema snapshot, in discovery order.
 * Serializes as a plain JSON object: {@code {"orders": {"_id": {"types": ["objectId"]}, ...}}}.
 */
public final class DatabaseSchema {
  private static final DatabaseSchema EMPTY = new DatabaseSchema(Map.of());

  private final Map<String, CollectionSchema> collections;

  private DatabaseSchema(Map<String, CollectionSchema> collections) {
    this.collections = Collections.unmodifiableMap(new LinkedHashMap<>(collections));
  }

  public static DatabaseSchema empty() { return EMPTY; }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static DatabaseSchema of(Map<String, CollectionSchema> collections) {
    if (collections == null || collections.isEmpty()) return EMPTY;
    return new DatabaseSchema(collections);
  }

  @JsonValue
  public Map<String, CollectionSchema> collections() { return collections; }

  public CollectionSchema collection(String name) { return collections.get(name); }

  public Set<String> collectionNames() { return collections.keySet(); }

  public boolean isEmpty() { return collections.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return (o instanceof DatabaseSchema other) && collections.equals(other.collections);
  }

  @Override
  public int hashCode() { return collections.hashCode(); }

  @Override
  public String toString() { return "DatabaseSchema" + collections.keySet(); }
}
