package io.intellixity.docscope.schema;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.docscope.schema.json.CollectionSchemaJsonDeserializer;
import io.intellixity.docscope.schema.json.CollectionSchemaJsonSerializer;

import java.util.*;

/**
 * Immutable snapshot of a collection's structure: top-level field name to {@link SchemaNode}.
 * The document root is implicit; there is no wrapping object node.
 * <p>
 * An empty snapshot means no sample was available, not that documents have no fields.
 */
@JsonSerialize(using = CollectionSchemaJsonSerializer.class)
@JsonDeserialize(using = CollectionSchemaJsonDeserializer.class)
public final class CollectionSchema {
  private static final CollectionSchema EMPTY = new CollectionSchema(Map.of());

  private final Map<String, SchemaNode> fields;

  private CollectionSchema(Map<String, SchemaNode> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static CollectionSchema empty() { return EMPTY; }

  public static CollectionSchema of(Map<String, SchemaNode> fields) {
    if (fields == null || fields.isEmpty()) return EMPTY;
    return new CollectionSchema(fields);
  }

  public Map<String, SchemaNode> fields() { return fields; }

  public SchemaNode field(String name) { return fields.get(name); }

  public boolean contains(String name) { return fields.containsKey(name); }

  public boolean isEmpty() { return fields.isEmpty(); }

  public int size() { return fields.size(); }

  /** Field-wise merge; shared fields are merged with {@link SchemaMerger}. */
  public CollectionSchema merge(CollectionSchema other) {
    return merge(other, null);
  }

  public CollectionSchema merge(CollectionSchema other, Diagnostics diagnostics) {
    if (other == null || other.isEmpty()) return this;
    if (isEmpty()) return other;
    return of(SchemaMerger.mergeFields(fields, other.fields, diagnostics));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return (o instanceof CollectionSchema other) && fields.equals(other.fields);
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return "CollectionSchema" + fields; }
}
