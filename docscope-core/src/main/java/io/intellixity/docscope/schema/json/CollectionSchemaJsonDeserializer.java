package io.intellixity.docscope.schema.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.docscope.schema.CollectionSchema;

import java.io.IOException;

public final class CollectionSchemaJsonDeserializer extends JsonDeserializer<CollectionSchema> {
  @Override
  public CollectionSchema deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Collection schema JSON must be an object");
    return CollectionSchema.of(SchemaNodeJsonDeserializer.readFields(root));
  }
}
