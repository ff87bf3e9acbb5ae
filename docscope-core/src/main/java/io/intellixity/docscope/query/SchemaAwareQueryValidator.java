package io.intellixity.docscope.query;

import io.intellixity.docscope.schema.CollectionSchema;
import io.intellixity.docscope.schema.SchemaNode;
import io.intellixity.docscope.types.BsonTypeClassifier;
import io.intellixity.docscope.types.TypeTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a query filter against a sampled {@link CollectionSchema}.
 * <p>
 * Field paths must resolve through the schema, operators must suit the field they are applied to and
 * comparison values must have a compatible type. Entries starting with {@code "Warning:"} are advisory.
 * <p>
 * A document-level {@code $not} is only checked for shape; its body is not resolved against the schema.
 */
public final class SchemaAwareQueryValidator implements QueryValidator {
  private final CollectionSchema schema;
  private final int maxDepth;
  private final SyntaxQueryValidator syntax;

  public SchemaAwareQueryValidator(CollectionSchema schema) {
    this(schema, SyntaxQueryValidator.DEFAULT_MAX_DEPTH);
  }

  public SchemaAwareQueryValidator(CollectionSchema schema, int maxDepth) {
    if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
    this.schema = schema;
    this.maxDepth = maxDepth;
    this.syntax = new SyntaxQueryValidator(maxDepth);
  }

  public CollectionSchema schema() { return schema; }

  @Override
  public List<String> validate(Object query) {
    if (schema == null) {
      return List.of("No schema is available to validate the query against.");
    }
    if (!(query instanceof Map<?, ?> doc)) {
      return List.of("Query root must be a document, but found '" + QueryShapes.describe(query) + "'.");
    }
    List<String> errors = new ArrayList<>();
    validateDocument(doc, schema.fields(), "", 0, errors);
    return List.copyOf(errors);
  }

  // ---- document scope ----

  private void validateDocument(Map<?, ?> doc, Map<String, SchemaNode> scope, String prefix, int depth,
                                List<String> errors) {
    if (depth > maxDepth) {
      errors.add("Query nesting exceeds the maximum depth of " + maxDepth + " at '" + prefix + "'.");
      return;
    }
    for (Map.Entry<?, ?> e : doc.entrySet()) {
      String key = String.valueOf(e.getKey());
      String path = QueryPaths.child(prefix, key);
      if (QueryOperator.isOperatorKey(key)) {
        validateDocumentOperator(key, e.getValue(), scope, path, depth, errors);
      } else {
        validateField(key, e.getValue(), scope, prefix, path, depth, errors);
      }
    }
  }

  private void validateDocumentOperator(String key, Object value, Map<String, SchemaNode> scope, String path,
                                        int depth, List<String> errors) {
    QueryOperator op = QueryOperator.forKey(key);
    if (op == null) {
      errors.add("Unknown operator '" + key + "' used at '" + path + "'.");
      return;
    }

    switch (op) {
      case AND, OR, NOR -> {
        List<?> items = QueryShapes.isSequence(value) ? QueryShapes.list(value) : null;
        if (items == null) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected an array of query documents"));
          return;
        }
        if (items.isEmpty()) {
          errors.add("Warning: operator '" + key + "' at '" + path + "' has an empty array.");
          return;
        }
        for (int i = 0; i < items.size(); i++) {
          Object item = items.get(i);
          String itemPath = QueryPaths.index(path, i);
          if (item instanceof Map<?, ?> sub) {
            validateDocument(sub, scope, itemPath, depth + 1, errors);
          } else {
            errors.add("Invalid element in '" + key + "' at '" + itemPath + "': expected a document, but found '"
                + QueryShapes.describe(item) + "'.");
          }
        }
      }
      case NOT -> {
        if (value instanceof Map<?, ?> body) {
          if (QueryShapes.hasFieldKeys(body)) {
            errors.add("Warning: top-level '$not' at '" + path
                + "' contains field names; only operator expressions are checked there.");
          }
        } else if (!BsonTypeClassifier.isRegex(value)) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected an operator expression (document) or a regex pattern"));
        }
      }
      case EXPR, JSON_SCHEMA -> {
        if (!QueryShapes.isDocument(value)) errors.add(SyntaxQueryValidator.invalid(key, path, "expected a document"));
      }
      case WHERE -> {
        TypeTag t = BsonTypeClassifier.classify(value);
        if (t != TypeTag.STRING && t != TypeTag.JAVASCRIPT) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a JavaScript string or code value"));
        }
      }
      case TEXT -> {
        if (!(value instanceof Map<?, ?> body)) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a document"));
        } else if (!QueryShapes.isString(body.get(QueryOperator.SEARCH.key()))) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a document with a string '$search'"));
        }
      }
      case COMMENT -> {
        // any value
      }
      default -> errors.add("Operator '" + key + "' is not valid at the document level ('" + path + "').");
    }
  }

  // ---- field resolution ----

  private void validateField(String key, Object value, Map<String, SchemaNode> scope, String prefix, String path,
                             int depth, List<String> errors) {
    if (key.isEmpty()) {
      errors.add("Empty field name found at '" + prefix + "'.");
      return;
    }
    if (!SyntaxQueryValidator.checkSegments(key, path, errors)) return;

    SchemaNode node = resolve(key, scope, path, errors);
    if (node == null) return;

    if (value instanceof Map<?, ?> sub && QueryShapes.hasOperatorKeys(sub)) {
      validateOperatorBlock(node, sub, path, depth + 1, errors);
    } else if (!TypeCompatibility.isCompatible(value, node)) {
      errors.add(mismatch("field '" + path + "'", node, value));
    }
  }

  /**
   * Walks a dotted field name through {@code scope}. Object children are preferred; arrays are entered through
   * their element schema, either by a numeric index or implicitly when elements are embedded documents.
   */
  private SchemaNode resolve(String key, Map<String, SchemaNode> scope, String path, List<String> errors) {
    String[] segments = key.split("\\.");
    SchemaNode node = scope.get(segments[0]);
    if (node == null) {
      errors.add("Field '" + segments[0] + "' (in '" + path + "') does not exist in the schema.");
      return null;
    }

    String walked = segments[0];
    for (int i = 1; i < segments.length; i++) {
      String segment = segments[i];
      SchemaNode element = node.has(TypeTag.ARRAY) ? node.elementSchema() : null;

      if (node.has(TypeTag.OBJECT) && node.field(segment) != null) {
        node = node.field(segment);
      } else if (isIndex(segment) && element != null && element.isValid() && !element.isEmptyArrayMarker()) {
        node = element;
      } else if (element != null && element.field(segment) != null) {
        node = element.field(segment);
      } else if (node.has(TypeTag.UNKNOWN)) {
        return node;
      } else if (node.has(TypeTag.OBJECT) && node.objectSchema() == null) {
        errors.add("Field '" + walked + "' (in '" + path + "') is an object but has no nested schema.");
        return null;
      } else if (node.has(TypeTag.OBJECT) || (element != null && element.objectSchema() != null)) {
        errors.add("Field '" + segment + "' (in '" + path + "') does not exist in the schema under '" + walked + "'.");
        return null;
      } else {
        errors.add("Field '" + walked + "' (in '" + path + "') is not an object; it has types " + node.types()
            + " and cannot contain '" + segment + "'.");
        return null;
      }
      walked = walked + "." + segment;
    }
    return node;
  }

  private static boolean isIndex(String segment) {
    for (int i = 0; i < segment.length(); i++) {
      if (!Character.isDigit(segment.charAt(i))) return false;
    }
    return !segment.isEmpty();
  }

  // ---- operator blocks ----

  private void validateOperatorBlock(SchemaNode node, Map<?, ?> block, String path, int depth, List<String> errors) {
    if (depth > maxDepth) {
      errors.add("Query nesting exceeds the maximum depth of " + maxDepth + " at '" + path + "'.");
      return;
    }
    if (QueryShapes.hasFieldKeys(block)) {
      errors.add("Invalid query structure at '" + path
          + "': cannot mix operators and field names at the same level within a field's value.");
    }

    for (Map.Entry<?, ?> e : block.entrySet()) {
      String key = String.valueOf(e.getKey());
      if (!QueryOperator.isOperatorKey(key)) continue;
      validateFieldOperator(node, key, e.getValue(), path, depth, errors);
    }
  }

  private void validateFieldOperator(SchemaNode node, String key, Object value, String path, int depth,
                                     List<String> errors) {
    QueryOperator op = QueryOperator.forKey(key);
    if (op == null) {
      errors.add("Unknown operator '" + key + "' used at '" + path + "'.");
      return;
    }
    if (op.scope() == QueryOperator.Scope.DOCUMENT) {
      errors.add("Operator '" + key + "' cannot be applied to field '" + path + "'.");
      return;
    }
    if (op.scope() == QueryOperator.Scope.NESTED) {
      errors.add("Operator '" + key + "' at '" + path + "' is only valid inside another operator's argument.");
      return;
    }

    switch (op) {
      case EQ, NE, GT, GTE, LT, LTE -> {
        if (!TypeCompatibility.isCompatible(value, node)) {
          errors.add(mismatch("operator '" + key + "' on field '" + path + "'", node, value));
        }
      }
      case IN, NIN -> {
        List<?> items = QueryShapes.isSequence(value) ? QueryShapes.list(value) : null;
        if (items == null) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected an array"));
          return;
        }
        for (int i = 0; i < items.size(); i++) {
          Object item = items.get(i);
          if (!TypeCompatibility.isCompatible(item, node)) {
            errors.add(mismatch("element of '" + key + "' at '" + QueryPaths.index(path, i) + "'", node, item));
          }
        }
      }
      case EXISTS -> {
        if (!QueryShapes.isBoolean(value)) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a boolean (true/false)"));
        }
      }
      case TYPE -> validateType(node, value, path, errors);
      case REGEX -> {
        if (!TypeCompatibility.allowsString(node)) {
          errors.add("Warning: '$regex' used on field '" + path + "' with types " + node.types()
              + "; it only matches string values.");
        }
        if (!QueryShapes.isStringOrRegex(value)) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a string or regex pattern"));
        }
      }
      case OPTIONS -> {
        if (!QueryShapes.isString(value)) errors.add(SyntaxQueryValidator.invalid(key, path, "expected a string"));
      }
      case SIZE -> {
        if (!TypeCompatibility.allowsArray(node)) {
          errors.add(notAnArray(key, path, node));
        }
        Long size = BsonTypeClassifier.longValue(value);
        if (size == null || size < 0) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a non-negative integer"));
        }
      }
      case ALL -> validateAll(node, value, path, depth, errors);
      case ELEM_MATCH -> {
        if (!TypeCompatibility.allowsArray(node)) {
          errors.add(notAnArray(key, path, node));
          return;
        }
        if (value instanceof Map<?, ?> body) {
          validateElemMatch(node, body, path, depth, errors);
        } else {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a query document"));
        }
      }
      case NOT -> {
        if (value instanceof Map<?, ?> body) {
          if (body.isEmpty()) {
            errors.add(SyntaxQueryValidator.invalid(key, path, "expected a non-empty operator expression"));
          } else if (!QueryShapes.hasOperatorKeys(body)) {
            errors.add(SyntaxQueryValidator.invalid(key, path, "expected an operator expression, not a document of fields"));
          } else {
            validateOperatorBlock(node, body, path, depth + 1, errors);
          }
        } else if (BsonTypeClassifier.isRegex(value)) {
          if (!TypeCompatibility.allowsString(node)) {
            errors.add("Warning: '$not' with a regex used on field '" + path + "' with types " + node.types()
                + "; the pattern only matches string values.");
          }
        } else {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected an operator expression (document) or a regex pattern"));
        }
      }
      case MOD -> {
        if (!QueryShapes.isTwoNumbers(value)) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected an array of two numbers [divisor, remainder]"));
        }
        if (!TypeCompatibility.allowsNumber(node)) {
          errors.add("Warning: '$mod' used on field '" + path + "' with non-numeric types " + node.types() + ".");
        }
      }
      case BITS_ALL_CLEAR, BITS_ALL_SET, BITS_ANY_CLEAR, BITS_ANY_SET -> {
        if (!isBitmask(value)) {
          errors.add(SyntaxQueryValidator.invalid(key, path,
              "expected a non-negative integer mask, an array of bit positions, or binary data"));
        }
      }
      case GEO_INTERSECTS, GEO_WITHIN, NEAR, NEAR_SPHERE -> {
        if (!QueryShapes.isDocument(value) && !QueryShapes.isSequence(value)) {
          errors.add(SyntaxQueryValidator.invalid(key, path, "expected a geometry document or a coordinate array"));
        }
      }
      case MAX_DISTANCE, MIN_DISTANCE -> {
        if (!BsonTypeClassifier.isNumber(value)) errors.add(SyntaxQueryValidator.invalid(key, path, "expected a number"));
      }
      default -> errors.add("Operator '" + key + "' cannot be applied to field '" + path + "'.");
    }
  }

  private void validateType(SchemaNode node, Object value, String path, List<String> errors) {
    if (!SyntaxQueryValidator.isTypeArgument(value)) {
      errors.add(SyntaxQueryValidator.invalid("$type", path,
          "expected a BSON type alias, a type number, or a non-empty array of them"));
      return;
    }
    List<?> specs = QueryShapes.isSequence(value) ? QueryShapes.list(value) : List.of(value);
    for (Object spec : specs) {
      Set<TypeTag> requested = BsonTypeAliases.resolve(spec);
      if (requested == null) {
        errors.add("Unknown BSON type '" + spec + "' in '$type' at '" + path + "'.");
      } else if (!TypeCompatibility.overlaps(node, requested)) {
        errors.add("Warning: '$type' at '" + path + "' requests '" + spec + "', which is not among the field's types "
            + node.types() + ".");
      }
    }
  }

  private void validateAll(SchemaNode node, Object value, String path, int depth, List<String> errors) {
    if (!TypeCompatibility.allowsArray(node)) {
      errors.add(notAnArray("$all", path, node));
      return;
    }
    List<?> items = QueryShapes.isSequence(value) ? QueryShapes.list(value) : null;
    if (items == null) {
      errors.add(SyntaxQueryValidator.invalid("$all", path, "expected an array"));
      return;
    }
    SchemaNode element = node.elementSchema();
    boolean checkElements = element != null && element.isValid() && !element.isEmptyArrayMarker();
    String elemMatchKey = QueryOperator.ELEM_MATCH.key();

    for (int i = 0; i < items.size(); i++) {
      Object item = items.get(i);
      String itemPath = QueryPaths.index(path, i);
      if (item instanceof Map<?, ?> m && m.size() == 1 && m.containsKey(elemMatchKey)) {
        Object body = m.get(elemMatchKey);
        if (body instanceof Map<?, ?> b) {
          validateElemMatch(node, b, itemPath, depth, errors);
        } else {
          errors.add(SyntaxQueryValidator.invalid(elemMatchKey, itemPath, "expected a query document"));
        }
      } else if (checkElements && !TypeCompatibility.isCompatible(item, element)) {
        errors.add(mismatch("element of '$all' at '" + itemPath + "'", element, item));
      }
    }
  }

  /**
   * Object elements: the body is a sub-query against the element's structure (logical operators included).
   * Primitive elements: the body is an operator block applied to each element.
   */
  private void validateElemMatch(SchemaNode node, Map<?, ?> body, String path, int depth, List<String> errors) {
    SchemaNode element = node.elementSchema();
    if (element == null || !element.isValid() || element.isEmptyArrayMarker() || element.has(TypeTag.UNKNOWN)) {
      syntax.validateDocument(body, path, depth + 1, errors);
      return;
    }

    if (isDocumentBody(body)) {
      if (element.objectSchema() != null) {
        validateDocument(body, element.objectSchema(), path, depth + 1, errors);
      } else {
        errors.add("Invalid '$elemMatch' at '" + path + "': elements have types " + element.types()
            + " and no known document structure to match fields against.");
      }
    } else {
      validateOperatorBlock(element, body, path, depth + 1, errors);
    }
  }

  private static boolean isDocumentBody(Map<?, ?> body) {
    if (body.isEmpty()) return false;
    if (QueryShapes.hasFieldKeys(body)) return true;
    for (Object k : body.keySet()) {
      QueryOperator op = QueryOperator.forKey(String.valueOf(k));
      if (op == null || op.scope() != QueryOperator.Scope.DOCUMENT) return false;
    }
    return true;
  }

  private static boolean isBitmask(Object value) {
    Long mask = BsonTypeClassifier.longValue(value);
    if (mask != null) return mask >= 0;
    if (BsonTypeClassifier.classify(value) == TypeTag.BIN_DATA) return true;
    List<?> positions = QueryShapes.isSequence(value) ? QueryShapes.list(value) : null;
    if (positions == null) return false;
    for (Object p : positions) {
      Long pos = BsonTypeClassifier.longValue(p);
      if (pos == null || pos < 0) return false;
    }
    return true;
  }

  private static String notAnArray(String op, String path, SchemaNode node) {
    return "Operator '" + op + "' requires an array field, but '" + path + "' has types " + node.types() + ".";
  }

  private static String mismatch(String subject, SchemaNode node, Object value) {
    return "Type mismatch for " + subject + ": expected one of " + node.types() + ", but found '"
        + QueryShapes.describe(value) + "'.";
  }
}
