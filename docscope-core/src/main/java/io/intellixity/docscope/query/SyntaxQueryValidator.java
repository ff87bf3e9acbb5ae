package io.intellixity.docscope.query;

import io.intellixity.docscope.types.BsonTypeClassifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Schema-free structural validation of a query filter document.
 * <p>
 * Checks operator names, the structural shape of operator arguments and the operator/field layout of
 * nested documents. Field names and value types are not checked against any schema.
 */
public final class SyntaxQueryValidator implements QueryValidator {
  public static final int DEFAULT_MAX_DEPTH = 100;

  private final int maxDepth;

  public SyntaxQueryValidator() {
    this(DEFAULT_MAX_DEPTH);
  }

  public SyntaxQueryValidator(int maxDepth) {
    if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
    this.maxDepth = maxDepth;
  }

  @Override
  public List<String> validate(Object query) {
    if (!QueryShapes.isDocument(query)) {
      return List.of("Query root must be a document, but found '" + QueryShapes.describe(query) + "'.");
    }
    List<String> errors = new ArrayList<>();
    validateDocument(query, "", 0, errors);
    return List.copyOf(errors);
  }

  void validateDocument(Object part, String prefix, int depth, List<String> errors) {
    if (!(part instanceof Map<?, ?> doc)) {
      errors.add("Invalid structure at '" + prefix + "': expected a document, but found '"
          + QueryShapes.describe(part) + "'.");
      return;
    }
    if (depth > maxDepth) {
      errors.add("Query nesting exceeds the maximum depth of " + maxDepth + " at '" + prefix + "'.");
      return;
    }

    for (Map.Entry<?, ?> e : doc.entrySet()) {
      String key = String.valueOf(e.getKey());
      Object value = e.getValue();
      String path = QueryPaths.child(prefix, key);

      if (QueryOperator.isOperatorKey(key)) {
        validateOperator(key, value, path, depth, errors);
      } else {
        validateField(key, value, prefix, path, depth, errors);
      }
    }
  }

  private void validateOperator(String key, Object value, String path, int depth, List<String> errors) {
    QueryOperator op = QueryOperator.forKey(key);
    if (op == null) {
      errors.add("Unknown operator '" + key + "' used at '" + path + "'.");
      return;
    }

    switch (op) {
      case AND, OR, NOR -> {
        List<?> items = QueryShapes.isSequence(value) ? QueryShapes.list(value) : null;
        if (items == null) {
          errors.add(invalid(key, path, "expected an array of query documents"));
        } else if (items.isEmpty()) {
          errors.add("Warning: operator '" + key + "' at '" + path + "' has an empty array.");
        } else {
          for (int i = 0; i < items.size(); i++) {
            validateDocument(items.get(i), QueryPaths.index(path, i), depth + 1, errors);
          }
        }
      }
      case NOT -> {
        if (QueryShapes.isDocument(value)) {
          validateDocument(value, path, depth + 1, errors);
        } else if (!BsonTypeClassifier.isRegex(value)) {
          errors.add(invalid(key, path, "expected an operator expression (document) or a regex pattern"));
        }
      }
      case IN, NIN, ALL -> {
        if (!QueryShapes.isSequence(value)) errors.add(invalid(key, path, "expected an array"));
      }
      case ELEM_MATCH -> {
        if (QueryShapes.isDocument(value)) {
          validateDocument(value, path, depth + 1, errors);
        } else {
          errors.add(invalid(key, path, "expected a query document"));
        }
      }
      case EXISTS -> {
        if (!QueryShapes.isBoolean(value)) errors.add(invalid(key, path, "expected a boolean (true/false)"));
      }
      case TYPE -> {
        if (!isTypeArgument(value)) {
          errors.add(invalid(key, path, "expected a BSON type alias, a type number, or a non-empty array of them"));
        }
      }
      case SIZE -> {
        if (!BsonTypeClassifier.isInteger(value)) errors.add(invalid(key, path, "expected an integer"));
      }
      case REGEX -> {
        if (!QueryShapes.isStringOrRegex(value)) errors.add(invalid(key, path, "expected a string or regex pattern"));
      }
      case MOD -> {
        if (!QueryShapes.isTwoNumbers(value)) {
          errors.add(invalid(key, path, "expected an array of two numbers [divisor, remainder]"));
        }
      }
      default -> {
        // comparison, geospatial, text, bitwise and comment operators carry no structural rule here
      }
    }
  }

  private void validateField(String key, Object value, String prefix, String path, int depth, List<String> errors) {
    if (key.isEmpty()) {
      errors.add("Empty field name found at '" + prefix + "'.");
      return;
    }
    if (!checkSegments(key, path, errors)) return;

    if (value instanceof Map<?, ?> sub) {
      boolean hasOperators = QueryShapes.hasOperatorKeys(sub);
      boolean hasFields = QueryShapes.hasFieldKeys(sub);
      if (hasOperators && hasFields) {
        errors.add("Invalid query structure at '" + path
            + "': cannot mix operators and field names at the same level within a field's value.");
      } else if (hasOperators || hasFields) {
        validateDocument(sub, path, depth + 1, errors);
      }
    }
  }

  /** Dotted field names: no empty segment, no segment beginning with '$'. */
  static boolean checkSegments(String key, String path, List<String> errors) {
    String[] segments = key.split("\\.", -1);
    for (String segment : segments) {
      if (segment.isEmpty()) {
        errors.add("Invalid field name '" + key + "' at '" + path + "': empty path segment.");
        return false;
      }
      if (QueryOperator.isOperatorKey(segment)) {
        errors.add("Invalid field name '" + key + "' at '" + path + "': segment '" + segment + "' starts with '$'.");
        return false;
      }
    }
    return true;
  }

  static boolean isTypeArgument(Object value) {
    if (QueryShapes.isTypeSpec(value)) return true;
    List<?> items = QueryShapes.isSequence(value) ? QueryShapes.list(value) : null;
    // an empty list matches nothing
    if (items == null || items.isEmpty()) return false;
    for (Object item : items) {
      if (!QueryShapes.isTypeSpec(item)) return false;
    }
    return true;
  }

  static String invalid(String op, String path, String expectation) {
    return "Invalid value for operator '" + op + "' at '" + path + "': " + expectation + ".";
  }
}
