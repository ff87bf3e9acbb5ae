package io.intellixity.docscope.query;

import io.intellixity.docscope.types.BsonTypeClassifier;
import io.intellixity.docscope.types.TypeTag;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves {@code $type} arguments (string alias or numeric BSON code) to type tags.
 * {@code "number"} resolves to the whole numeric family.
 */
final class BsonTypeAliases {
  private BsonTypeAliases() {}

  private static final Map<String, TypeTag> EXTRA_NAMES = Map.of(
      "dbPointer", TypeTag.DB_REF,
      "javascriptWithScope", TypeTag.JAVASCRIPT,
      "symbol", TypeTag.STRING,
      "undefined", TypeTag.NULL
  );

  private static final Map<Integer, TypeTag> EXTRA_CODES = Map.of(
      6, TypeTag.NULL,
      14, TypeTag.STRING,
      15, TypeTag.JAVASCRIPT
  );

  /** Returns null when {@code spec} is not a recognized alias or code. */
  static Set<TypeTag> resolve(Object spec) {
    String s = BsonTypeClassifier.stringValue(spec);
    if (s != null) {
      if ("number".equals(s)) return TypeTag.numeric();
      TypeTag t = TypeTag.fromWireName(s);
      if (t == null) t = EXTRA_NAMES.get(s);
      return (t == null || isMarker(t)) ? null : EnumSet.of(t);
    }
    Long boxed = BsonTypeClassifier.longValue(spec);
    if (boxed != null) {
      long code = boxed;
      if (code < Integer.MIN_VALUE || code > Integer.MAX_VALUE) return null;
      TypeTag t = TypeTag.fromBsonCode((int) code);
      if (t == null) t = EXTRA_CODES.get((int) code);
      return (t == null) ? null : EnumSet.of(t);
    }
    return null;
  }

  private static boolean isMarker(TypeTag t) {
    return t == TypeTag.EMPTY_ARRAY || t == TypeTag.UNKNOWN;
  }
}
