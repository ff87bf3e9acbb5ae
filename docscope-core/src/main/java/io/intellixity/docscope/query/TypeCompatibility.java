package io.intellixity.docscope.query;

import io.intellixity.docscope.schema.SchemaNode;
import io.intellixity.docscope.types.BsonTypeClassifier;
import io.intellixity.docscope.types.TypeTag;

import java.util.Set;

/**
 * Decides whether a query value may be compared with a field of a given schema.
 * <p>
 * Numeric tags are interchangeable. A regex matches string fields, and a scalar matches
 * an array field whose elements accept it, the way the server compares array elements.
 * A field whose types include {@code unknown} accepts anything.
 */
final class TypeCompatibility {
  private TypeCompatibility() {}

  static boolean isCompatible(Object value, SchemaNode field) {
    if (field == null || !field.isValid() || field.has(TypeTag.UNKNOWN)) return true;
    TypeTag actual = BsonTypeClassifier.classify(value);
    if (accepts(field.types(), actual)) return true;

    if (field.has(TypeTag.ARRAY)) {
      SchemaNode element = field.elementSchema();
      // nothing is known about elements of arrays only ever seen empty
      if (element == null || element.isEmptyArrayMarker()) return true;
      return element.has(TypeTag.UNKNOWN) || accepts(element.types(), actual);
    }
    return false;
  }

  static boolean accepts(Set<TypeTag> allowed, TypeTag actual) {
    if (allowed.contains(actual)) return true;
    if (actual.isNumeric()) {
      for (TypeTag t : allowed) {
        if (t.isNumeric()) return true;
      }
    }
    return actual == TypeTag.REGEX && allowed.contains(TypeTag.STRING);
  }

  static boolean allowsArray(SchemaNode field) {
    return field.has(TypeTag.ARRAY) || field.has(TypeTag.UNKNOWN);
  }

  static boolean allowsString(SchemaNode field) {
    return field.has(TypeTag.STRING) || field.has(TypeTag.UNKNOWN) || elementHas(field, TypeTag.STRING);
  }

  static boolean allowsNumber(SchemaNode field) {
    if (field.has(TypeTag.UNKNOWN)) return true;
    for (TypeTag t : field.types()) {
      if (t.isNumeric()) return true;
    }
    SchemaNode element = field.has(TypeTag.ARRAY) ? field.elementSchema() : null;
    if (element == null) return false;
    for (TypeTag t : element.types()) {
      if (t.isNumeric()) return true;
    }
    return false;
  }

  /** True when any requested tag could match the field, directly or through its array elements. */
  static boolean overlaps(SchemaNode field, Set<TypeTag> requested) {
    if (field.has(TypeTag.UNKNOWN)) return true;
    for (TypeTag t : requested) {
      if (field.has(t) || elementHas(field, t)) return true;
    }
    return false;
  }

  private static boolean elementHas(SchemaNode field, TypeTag tag) {
    if (!field.has(TypeTag.ARRAY)) return false;
    SchemaNode element = field.elementSchema();
    return element != null && (element.has(tag) || element.has(TypeTag.UNKNOWN));
  }
}
