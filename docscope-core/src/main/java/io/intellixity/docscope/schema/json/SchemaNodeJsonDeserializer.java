package io.intellixity.docscope.schema.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.docscope.schema.SchemaNode;
import io.intellixity.docscope.types.TypeTag;

import java.io.IOException;
import java.util.*;

/**
 * Tolerant reader for stored schema snapshots.
 * <p>
 * Unknown type names become {@code unknown}; members of the wrong JSON shape are ignored rather than rejected,
 * so a partially damaged snapshot still loads (validators report what is missing).
 * The legacy member names {@code schema} and {@code element_schema} are accepted as well.
 */
public final class SchemaNodeJsonDeserializer extends JsonDeserializer<SchemaNode> {
  @Override
  public SchemaNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    return readNode(root);
  }

  static SchemaNode readNode(JsonNode n) {
    if (n == null || !n.isObject()) return null;

    EnumSet<TypeTag> types = EnumSet.noneOf(TypeTag.class);
    JsonNode t = n.get("types");
    if (t != null && t.isArray()) {
      for (JsonNode x : t) {
        if (x.isTextual()) types.add(tagOf(x.asText()));
      }
    } else if (t != null && t.isTextual()) {
      types.add(tagOf(t.asText()));
    }

    JsonNode obj = member(n, "objectSchema", "schema");
    Map<String, SchemaNode> fields = (obj != null && obj.isObject()) ? readFields(obj) : null;

    JsonNode el = member(n, "elementSchema", "element_schema");
    SchemaNode element = readNode(el);

    return new SchemaNode(types, fields, element);
  }

  static Map<String, SchemaNode> readFields(JsonNode obj) {
    Map<String, SchemaNode> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.put(e.getKey(), readNode(e.getValue()));
    }
    return out;
  }

  private static JsonNode member(JsonNode n, String name, String legacyName) {
    JsonNode v = n.get(name);
    return (v != null) ? v : n.get(legacyName);
  }

  private static TypeTag tagOf(String name) {
    TypeTag tag = TypeTag.fromWireName(name);
    return (tag == null) ? TypeTag.UNKNOWN : tag;
  }
}
