package io.intellixity.docscope.schema;

import io.intellixity.docscope.types.BsonTypeClassifier;
import io.intellixity.docscope.types.TypeTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link SchemaNode} from a single value, recursing into documents and arrays.
 * Array element schemas are folded with {@link SchemaMerger}.
 */
public final class SchemaInferencer {
  private static final Logger log = LoggerFactory.getLogger(SchemaInferencer.class);

  /** BSON documents cannot nest deeper than this. */
  public static final int DEFAULT_MAX_DEPTH = 100;

  private final int maxDepth;

  public SchemaInferencer() {
    this(DEFAULT_MAX_DEPTH);
  }

  public SchemaInferencer(int maxDepth) {
    if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
    this.maxDepth = maxDepth;
  }

  public int maxDepth() { return maxDepth; }

  public SchemaNode infer(Object value) {
    return infer(value, null);
  }

  public SchemaNode infer(Object value, Diagnostics diagnostics) {
    return infer(value, diagnostics, "", 0);
  }

  private SchemaNode infer(Object value, Diagnostics diagnostics, String path, int depth) {
    TypeTag tag = BsonTypeClassifier.classify(value);
    if ((tag == TypeTag.OBJECT || tag == TypeTag.ARRAY) && depth >= maxDepth) {
      String msg = "Nesting deeper than " + maxDepth + " levels at '" + path + "'; described as 'unknown'";
      log.warn("docscope.infer depthExceeded path={} maxDepth={}", path, maxDepth);
      if (diagnostics != null) diagnostics.add(msg);
      return SchemaNode.unknown();
    }

    if (tag == TypeTag.OBJECT) {
      Map<String, SchemaNode> fields = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        String key = String.valueOf(e.getKey());
        fields.put(key, infer(e.getValue(), diagnostics, child(path, key), depth + 1));
      }
      return SchemaNode.object(fields);
    }

    if (tag == TypeTag.ARRAY) {
      List<?> items = BsonTypeClassifier.asList(value);
      if (items == null || items.isEmpty()) return SchemaNode.emptyArray();

      SchemaNode element = null;
      int i = 0;
      for (Object item : items) {
        SchemaNode itemSchema = infer(item, diagnostics, path + "[" + i++ + "]", depth + 1);
        element = (element == null) ? itemSchema : SchemaMerger.merge(element, itemSchema, diagnostics);
      }
      return SchemaNode.array(element);
    }

    return SchemaNode.of(tag);
  }

  private static String child(String path, String key) {
    return path.isEmpty() ? key : path + "." + key;
  }
}
