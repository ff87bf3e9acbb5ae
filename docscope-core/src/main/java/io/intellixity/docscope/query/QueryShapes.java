package io.intellixity.docscope.query;

import io.intellixity.docscope.types.BsonTypeClassifier;
import io.intellixity.docscope.types.TypeTag;

import java.util.List;
import java.util.Map;

/** Structural predicates over query values, shared by both validators. */
final class QueryShapes {
  private QueryShapes() {}

  static boolean isDocument(Object v) {
    return v instanceof Map<?, ?>;
  }

  static boolean isSequence(Object v) {
    return BsonTypeClassifier.classify(v) == TypeTag.ARRAY;
  }

  static boolean isBoolean(Object v) {
    return BsonTypeClassifier.classify(v) == TypeTag.BOOL;
  }

  static boolean isString(Object v) {
    return BsonTypeClassifier.classify(v) == TypeTag.STRING;
  }

  static boolean isStringOrRegex(Object v) {
    return isString(v) || BsonTypeClassifier.isRegex(v);
  }

  static boolean isTypeSpec(Object v) {
    return isString(v) || BsonTypeClassifier.isInteger(v);
  }

  static String describe(Object v) {
    return BsonTypeClassifier.classify(v).wireName();
  }

  /** True if any key starts with '$'. */
  static boolean hasOperatorKeys(Map<?, ?> doc) {
    for (Object k : doc.keySet()) {
      if (QueryOperator.isOperatorKey(String.valueOf(k))) return true;
    }
    return false;
  }

  static boolean hasFieldKeys(Map<?, ?> doc) {
    for (Object k : doc.keySet()) {
      if (!QueryOperator.isOperatorKey(String.valueOf(k))) return true;
    }
    return false;
  }

  static List<?> list(Object v) {
    return BsonTypeClassifier.asList(v);
  }

  static boolean isTwoNumbers(Object v) {
    List<?> l = list(v);
    if (l == null || l.size() != 2) return false;
    for (Object x : l) {
      if (!BsonTypeClassifier.isNumber(x)) return false;
    }
    return true;
  }
}
