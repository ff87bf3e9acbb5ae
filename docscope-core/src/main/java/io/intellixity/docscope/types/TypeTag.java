package io.intellixity.docscope.types;

import java.util.*;

/**
 * Closed set of value categories observed in BSON/JSON-like documents.
 * <p>
 * {@link #wireName()} is the name used in schema snapshots and error messages; {@link #bsonCode()} is the
 * numeric BSON type accepted by {@code $type} (or {@code null} for tags without a BSON counterpart).
 */
public enum TypeTag {
  STRING("string", 2),
  BOOL("bool", 8),
  INT("int", 16),
  LONG("long", 18),
  DOUBLE("double", 1),
  DECIMAL("decimal", 19),
  ARRAY("array", 4),
  OBJECT("object", 3),
  OBJECT_ID("objectId", 7),
  DB_REF("dbRef", 12),
  TIMESTAMP("timestamp", 17),
  DATE("date", 9),
  NULL("null", 10),
  MIN_KEY("minKey", -1),
  MAX_KEY("maxKey", 127),
  BIN_DATA("binData", 5),
  JAVASCRIPT("javascript", 13),
  REGEX("regex", 11),

  // Schema-only markers: never produced by the classifier.
  EMPTY_ARRAY("empty_array", null),
  UNKNOWN("unknown", null);

  private static final Set<TypeTag> NUMERIC = Collections.unmodifiableSet(EnumSet.of(INT, LONG, DOUBLE, DECIMAL));

  private static final Map<String, TypeTag> BY_NAME;
  private static final Map<Integer, TypeTag> BY_CODE;

  static {
    Map<String, TypeTag> byName = new HashMap<>();
    Map<Integer, TypeTag> byCode = new HashMap<>();
    for (TypeTag t : values()) {
      byName.put(t.wireName, t);
      if (t.bsonCode != null) byCode.put(t.bsonCode, t);
    }
    BY_NAME = Map.copyOf(byName);
    BY_CODE = Map.copyOf(byCode);
  }

  private final String wireName;
  private final Integer bsonCode;

  TypeTag(String wireName, Integer bsonCode) {
    this.wireName = wireName;
    this.bsonCode = bsonCode;
  }

  public String wireName() { return wireName; }
  public Integer bsonCode() { return bsonCode; }

  public boolean isNumeric() { return NUMERIC.contains(this); }

  /** int, long, double, decimal. */
  public static Set<TypeTag> numeric() { return NUMERIC; }

  /** Lookup by wire name ("objectId", "binData", ...); returns null when unknown. */
  public static TypeTag fromWireName(String name) {
    if (name == null) return null;
    return BY_NAME.get(name);
  }

  /** Lookup by numeric BSON type code; returns null when unknown. */
  public static TypeTag fromBsonCode(int code) {
    return BY_CODE.get(code);
  }

  @Override
  public String toString() { return wireName; }
}
