package io.intellixity.docscope.schema;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.docscope.schema.json.SchemaNodeJsonDeserializer;
import io.intellixity.docscope.schema.json.SchemaNodeJsonSerializer;
import io.intellixity.docscope.types.TypeTag;

import java.util.*;

/**
 * Inferred description of the values observed at one position of a document tree.
 * <p>
 * Immutable. {@code objectSchema} is expected when {@code object} is among the types and
 * {@code elementSchema} when {@code array} is, but nodes read back from storage may be partial;
 * consumers must tolerate either being absent.
 */
@JsonSerialize(using = SchemaNodeJsonSerializer.class)
@JsonDeserialize(using = SchemaNodeJsonDeserializer.class)
public final class SchemaNode {
  private static final SchemaNode UNKNOWN = new SchemaNode(EnumSet.of(TypeTag.UNKNOWN), null, null);
  private static final SchemaNode EMPTY_ARRAY_ELEMENT = new SchemaNode(EnumSet.of(TypeTag.EMPTY_ARRAY), null, null);

  private final Set<TypeTag> types;
  private final Map<String, SchemaNode> objectSchema;
  private final SchemaNode elementSchema;

  public SchemaNode(Set<TypeTag> types, Map<String, SchemaNode> objectSchema, SchemaNode elementSchema) {
    EnumSet<TypeTag> copy = EnumSet.noneOf(TypeTag.class);
    if (types != null) {
      for (TypeTag t : types) if (t != null) copy.add(t);
    }
    this.types = Collections.unmodifiableSet(copy);
    this.objectSchema = (objectSchema == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(objectSchema));
    this.elementSchema = elementSchema;
  }

  public static SchemaNode of(TypeTag type) {
    Objects.requireNonNull(type, "type");
    if (type == TypeTag.UNKNOWN) return UNKNOWN;
    return new SchemaNode(EnumSet.of(type), null, null);
  }

  public static SchemaNode object(Map<String, SchemaNode> fields) {
    return new SchemaNode(EnumSet.of(TypeTag.OBJECT), (fields == null) ? Map.of() : fields, null);
  }

  public static SchemaNode array(SchemaNode element) {
    return new SchemaNode(EnumSet.of(TypeTag.ARRAY), null, (element == null) ? EMPTY_ARRAY_ELEMENT : element);
  }

  /** Array whose elements were never observed. */
  public static SchemaNode emptyArray() {
    return array(EMPTY_ARRAY_ELEMENT);
  }

  /** Diagnostic placeholder for values that could not be described. */
  public static SchemaNode unknown() { return UNKNOWN; }

  public Set<TypeTag> types() { return types; }
  public Map<String, SchemaNode> objectSchema() { return objectSchema; }
  public SchemaNode elementSchema() { return elementSchema; }

  public boolean has(TypeTag type) { return types.contains(type); }

  /** A node is usable for merging/validation once it carries at least one type. */
  public boolean isValid() { return !types.isEmpty(); }

  /** Element schema that was only ever seen empty carries no element type information. */
  public boolean isEmptyArrayMarker() {
    return types.size() == 1 && types.contains(TypeTag.EMPTY_ARRAY);
  }

  public SchemaNode field(String name) {
    return (objectSchema == null) ? null : objectSchema.get(name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SchemaNode other)) return false;
    return types.equals(other.types)
        && Objects.equals(objectSchema, other.objectSchema)
        && Objects.equals(elementSchema, other.elementSchema);
  }

  @Override
  public int hashCode() {
    return Objects.hash(types, objectSchema, elementSchema);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{types=").append(types);
    if (objectSchema != null) sb.append(", objectSchema=").append(objectSchema);
    if (elementSchema != null) sb.append(", elementSchema=").append(elementSchema);
    return sb.append('}').toString();
  }
}
