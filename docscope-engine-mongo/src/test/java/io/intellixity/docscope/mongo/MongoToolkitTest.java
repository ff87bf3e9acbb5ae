package io.intellixity.docscope.mongo;

import io.intellixity.docscope.query.QueryValidationException;
import io.intellixity.docscope.schema.CollectionSchemaAggregator;
import io.intellixity.docscope.spi.discovery.SchemaDiscovery;
import io.intellixity.docscope.spi.source.DocumentSource;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoToolkitTest {

  private static final class FixedSource implements DocumentSource {
    @Override public String name() { return "shop"; }
    @Override public List<String> collectionNames() { return List.of("orders"); }

    @Override
    public List<Map<String, Object>> sample(String collection, int limit) {
      return List.of(Document.parse("{\"_id\": 1, \"age\": 30, \"name\": \"Ann\"}"));
    }
  }

  private static final class CapturingExecutor implements FindExecutor {
    final List<FindRequest> requests = new ArrayList<>();

    @Override
    public List<Document> find(FindRequest request) {
      requests.add(request);
      return List.of(new Document("_id", 1));
    }
  }

  private final CapturingExecutor executor = new CapturingExecutor();
  private final MongoToolkit toolkit = new MongoToolkit("shop",
      new SchemaDiscovery(new FixedSource(), new CollectionSchemaAggregator(), SchemaDiscovery.CacheSettings.disabled()),
      executor, 10, null);

  @Test
  void syntaxResultIsText() {
    assertEquals("Syntax is valid.", toolkit.validateSyntax(Document.parse("{\"age\": {\"$gt\": 1}}")));
    assertEquals("""
        Syntax validation errors found:
        - Unknown operator '$bad' used at 'age.$bad'.""",
        toolkit.validateSyntax(Document.parse("{\"age\": {\"$bad\": 1}}")));
  }

  @Test
  void schemaResultIsText() {
    assertEquals(MongoToolkit.SCHEMA_VALID, toolkit.validateAgainstSchema("orders", Document.parse("{\"age\": 3}")));
    String text = toolkit.validateAgainstSchema("orders", Document.parse("{\"age\": \"x\"}"));
    assertTrue(text.startsWith("Schema validation errors found:\n- "), text);
  }

  @Test
  void findValidatedRunsValidFilters() {
    List<Document> docs = toolkit.findValidated(FindRequest.of("orders", Document.parse("{\"name\": \"Ann\"}")));
    assertEquals(1, docs.size());
    assertEquals(1, executor.requests.size());
  }

  @Test
  void findValidatedRejectsBeforeExecuting() {
    QueryValidationException e = assertThrows(QueryValidationException.class,
        () -> toolkit.findValidated(FindRequest.of("orders", Document.parse("{\"nickname\": \"A\"}"))));
    assertEquals(1, e.errors().size());
    assertTrue(executor.requests.isEmpty());
  }

  @Test
  void warningsDoNotBlockExecution() {
    toolkit.findValidated(FindRequest.of("orders", Document.parse("{\"age\": {\"$type\": \"string\"}}")));
    assertEquals(1, executor.requests.size());
  }

  @Test
  void databaseSchemaUsesConfiguredSampleSize() {
    assertEquals(List.of("orders"), List.copyOf(toolkit.databaseSchema().collectionNames()));
    assertTrue(toolkit.collectionSchema("orders").contains("age"));
  }

  @Test
  void connectRejectsBlankSettings() {
    assertThrows(IllegalArgumentException.class, () -> MongoToolkit.connect("", "db", null));
    assertThrows(IllegalArgumentException.class, () -> MongoToolkit.connect("mongodb://localhost", " ", null));
  }

  @Test
  void closeLeavesForeignClientsAlone() {
    assertDoesNotThrow(toolkit::close);
  }
}
