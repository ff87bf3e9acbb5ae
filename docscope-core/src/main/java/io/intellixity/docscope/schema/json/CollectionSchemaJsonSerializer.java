package io.intellixity.docscope.schema.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.docscope.schema.CollectionSchema;

import java.io.IOException;

/** Writes a {@link CollectionSchema} as a JSON object of field name to node. */
public final class CollectionSchemaJsonSerializer extends JsonSerializer<CollectionSchema> {
  @Override
  public void serialize(CollectionSchema schema, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (schema == null) {
      g.writeNull();
      return;
    }
    SchemaNodeJsonSerializer.writeFields(schema.fields(), g);
  }
}
