package io.intellixity.docscope.types;

import com.mongodb.DBRef;
import org.bson.*;
import org.bson.types.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Maps runtime values (driver-decoded Java types and {@link BsonValue} wrappers) to a {@link TypeTag}.
 * <p>
 * The check order is significant: booleans before numbers, 64-bit before other integers,
 * binary before generic sequences. Anything unrecognized classifies as {@link TypeTag#UNKNOWN}.
 */
public final class BsonTypeClassifier {
  private BsonTypeClassifier() {}

  public static TypeTag classify(Object value) {
    if (value instanceof String || value instanceof BsonString) return TypeTag.STRING;
    if (value instanceof Boolean || value instanceof BsonBoolean) return TypeTag.BOOL;

    if (value instanceof Long || value instanceof BsonInt64) return TypeTag.LONG;
    if (value instanceof Integer || value instanceof Short || value instanceof Byte
        || value instanceof BigInteger || value instanceof BsonInt32) {
      return TypeTag.INT;
    }

    if (value instanceof Double || value instanceof Float || value instanceof BsonDouble) return TypeTag.DOUBLE;
    if (value instanceof Decimal128 || value instanceof BigDecimal || value instanceof BsonDecimal128) {
      return TypeTag.DECIMAL;
    }

    if (value instanceof byte[] || value instanceof Binary || value instanceof BsonBinary || value instanceof UUID) {
      return TypeTag.BIN_DATA;
    }

    if (value instanceof List<?> || value instanceof Object[]) return TypeTag.ARRAY;
    if (value instanceof Map<?, ?>) return TypeTag.OBJECT;

    if (value instanceof ObjectId || value instanceof BsonObjectId) return TypeTag.OBJECT_ID;
    if (value instanceof DBRef || value instanceof BsonDbPointer) return TypeTag.DB_REF;
    if (value instanceof BSONTimestamp || value instanceof BsonTimestamp) return TypeTag.TIMESTAMP;
    if (value instanceof MinKey || value instanceof BsonMinKey) return TypeTag.MIN_KEY;
    if (value instanceof MaxKey || value instanceof BsonMaxKey) return TypeTag.MAX_KEY;
    if (value instanceof Code || value instanceof BsonJavaScript || value instanceof BsonJavaScriptWithScope) {
      return TypeTag.JAVASCRIPT;
    }
    if (isRegex(value)) return TypeTag.REGEX;
    if (value instanceof Date || value instanceof Instant || value instanceof BsonDateTime) return TypeTag.DATE;

    if (value == null || value instanceof BsonNull) return TypeTag.NULL;

    return TypeTag.UNKNOWN;
  }

  public static boolean isRegex(Object value) {
    return value instanceof Pattern || value instanceof BsonRegularExpression;
  }

  /** Integer-valued (int or long), excluding booleans. */
  public static boolean isInteger(Object value) {
    TypeTag t = classify(value);
    return t == TypeTag.INT || t == TypeTag.LONG;
  }

  /** String content of a string-classified value; null for anything else. */
  public static String stringValue(Object value) {
    if (value instanceof String s) return s;
    if (value instanceof BsonString bs) return bs.getValue();
    return null;
  }

  /** Value of an integer-classified value as a long (BigInteger truncates); null for anything else. */
  public static Long longValue(Object value) {
    if (!isInteger(value)) return null;
    if (value instanceof BsonInt32 i) return (long) i.getValue();
    if (value instanceof BsonInt64 l) return l.getValue();
    return ((Number) value).longValue();
  }

  public static boolean isNumber(Object value) {
    return classify(value).isNumeric();
  }

  /** Views an array-classified value as a list; returns null for anything else. */
  public static List<?> asList(Object value) {
    if (value instanceof List<?> l) return l;
    if (value instanceof Object[] arr) return Arrays.asList(arr);
    return null;
  }
}
