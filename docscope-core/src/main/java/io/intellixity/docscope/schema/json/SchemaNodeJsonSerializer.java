package io.intellixity.docscope.schema.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.docscope.schema.SchemaNode;
import io.intellixity.docscope.types.TypeTag;

import java.io.IOException;
import java.util.Map;

/**
 * Canonical JSON form of a {@link SchemaNode}:
 * <pre>
 * {"types": ["array"], "elementSchema": {"types": ["object"], "objectSchema": {"sku": {"types": ["string"]}}}}
 * </pre>
 * Types are written in declaration order so equal nodes serialize identically.
 */
public final class SchemaNodeJsonSerializer extends JsonSerializer<SchemaNode> {
  @Override
  public void serialize(SchemaNode node, JsonGenerator g, SerializerProvider serializers) throws IOException {
    writeNode(node, g);
  }

  static void writeNode(SchemaNode node, JsonGenerator g) throws IOException {
    if (node == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeArrayFieldStart("types");
    for (TypeTag t : node.types()) g.writeString(t.wireName());
    g.writeEndArray();

    if (node.objectSchema() != null) {
      g.writeFieldName("objectSchema");
      writeFields(node.objectSchema(), g);
    }
    if (node.elementSchema() != null) {
      g.writeFieldName("elementSchema");
      writeNode(node.elementSchema(), g);
    }
    g.writeEndObject();
  }

  static void writeFields(Map<String, SchemaNode> fields, JsonGenerator g) throws IOException {
    g.writeStartObject();
    for (Map.Entry<String, SchemaNode> e : fields.entrySet()) {
      g.writeFieldName(e.getKey());
      writeNode(e.getValue(), g);
    }
    g.writeEndObject();
  }
}
