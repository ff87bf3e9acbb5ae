package io.intellixity.docscope.query;

import java.util.HashMap;
import java.util.Map;

/**
 * Known MongoDB query-filter operators.
 * <p>
 * {@link Scope} records where an operator may legally appear: as a key of a filter document,
 * inside a field's operator block, or only nested in another operator's argument.
 */
public enum QueryOperator {
  // Comparison
  EQ("$eq", Category.COMPARISON, Scope.FIELD),
  NE("$ne", Category.COMPARISON, Scope.FIELD),
  GT("$gt", Category.COMPARISON, Scope.FIELD),
  GTE("$gte", Category.COMPARISON, Scope.FIELD),
  LT("$lt", Category.COMPARISON, Scope.FIELD),
  LTE("$lte", Category.COMPARISON, Scope.FIELD),
  IN("$in", Category.COMPARISON, Scope.FIELD),
  NIN("$nin", Category.COMPARISON, Scope.FIELD),

  // Logical
  AND("$and", Category.LOGICAL, Scope.DOCUMENT),
  OR("$or", Category.LOGICAL, Scope.DOCUMENT),
  NOR("$nor", Category.LOGICAL, Scope.DOCUMENT),
  NOT("$not", Category.LOGICAL, Scope.FIELD),

  // Element
  EXISTS("$exists", Category.ELEMENT, Scope.FIELD),
  TYPE("$type", Category.ELEMENT, Scope.FIELD),

  // Evaluation
  EXPR("$expr", Category.EVALUATION, Scope.DOCUMENT),
  JSON_SCHEMA("$jsonSchema", Category.EVALUATION, Scope.DOCUMENT),
  MOD("$mod", Category.EVALUATION, Scope.FIELD),
  REGEX("$regex", Category.EVALUATION, Scope.FIELD),
  OPTIONS("$options", Category.EVALUATION, Scope.FIELD),
  TEXT("$text", Category.EVALUATION, Scope.DOCUMENT),
  WHERE("$where", Category.EVALUATION, Scope.DOCUMENT),
  SEARCH("$search", Category.EVALUATION, Scope.NESTED),

  // Geospatial
  GEO_INTERSECTS("$geoIntersects", Category.GEOSPATIAL, Scope.FIELD),
  GEO_WITHIN("$geoWithin", Category.GEOSPATIAL, Scope.FIELD),
  NEAR("$near", Category.GEOSPATIAL, Scope.FIELD),
  NEAR_SPHERE("$nearSphere", Category.GEOSPATIAL, Scope.FIELD),
  MAX_DISTANCE("$maxDistance", Category.GEOSPATIAL, Scope.FIELD),
  MIN_DISTANCE("$minDistance", Category.GEOSPATIAL, Scope.FIELD),
  BOX("$box", Category.GEOSPATIAL, Scope.NESTED),
  CENTER("$center", Category.GEOSPATIAL, Scope.NESTED),
  CENTER_SPHERE("$centerSphere", Category.GEOSPATIAL, Scope.NESTED),
  GEOMETRY("$geometry", Category.GEOSPATIAL, Scope.NESTED),
  POLYGON("$polygon", Category.GEOSPATIAL, Scope.NESTED),

  // Array
  ALL("$all", Category.ARRAY, Scope.FIELD),
  ELEM_MATCH("$elemMatch", Category.ARRAY, Scope.FIELD),
  SIZE("$size", Category.ARRAY, Scope.FIELD),

  // Bitwise
  BITS_ALL_CLEAR("$bitsAllClear", Category.BITWISE, Scope.FIELD),
  BITS_ALL_SET("$bitsAllSet", Category.BITWISE, Scope.FIELD),
  BITS_ANY_CLEAR("$bitsAnyClear", Category.BITWISE, Scope.FIELD),
  BITS_ANY_SET("$bitsAnySet", Category.BITWISE, Scope.FIELD),

  // Comments
  COMMENT("$comment", Category.COMMENT, Scope.DOCUMENT);

  public enum Category { COMPARISON, LOGICAL, ELEMENT, EVALUATION, GEOSPATIAL, ARRAY, BITWISE, COMMENT }

  public enum Scope {
    /** Key of a filter document, e.g. {@code $or}. */
    DOCUMENT,
    /** Inside a field's operator block, e.g. {@code {"age": {"$gt": 1}}}. */
    FIELD,
    /** Only inside another operator's argument, e.g. {@code $geometry}. */
    NESTED
  }

  public static final String SIGIL = "$";

  private static final Map<String, QueryOperator> BY_KEY;

  static {
    Map<String, QueryOperator> m = new HashMap<>();
    for (QueryOperator op : values()) m.put(op.key, op);
    BY_KEY = Map.copyOf(m);
  }

  private final String key;
  private final Category category;
  private final Scope scope;

  QueryOperator(String key, Category category, Scope scope) {
    this.key = key;
    this.category = category;
    this.scope = scope;
  }

  public String key() { return key; }
  public Category category() { return category; }
  public Scope scope() { return scope; }

  public boolean isLogicalList() {
    return this == AND || this == OR || this == NOR;
  }

  /** Returns null for keys that are not known operators. */
  public static QueryOperator forKey(String key) {
    if (key == null) return null;
    return BY_KEY.get(key);
  }

  public static boolean isKnown(String key) {
    return forKey(key) != null;
  }

  public static boolean isOperatorKey(String key) {
    return key != null && key.startsWith(SIGIL);
  }

  @Override
  public String toString() { return key; }
}
