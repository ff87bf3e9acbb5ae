package io.intellixity.docscope.schema;

import io.intellixity.docscope.types.TypeTag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaMergerTest {
  private static final SchemaInferencer INFER = new SchemaInferencer();

  private static List<SchemaNode> samples() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("a", 1);
    nested.put("b", List.of("x", 2.5));
    return List.of(
        INFER.infer(1),
        INFER.infer("s"),
        INFER.infer(List.of()),
        INFER.infer(List.of(1, 2)),
        INFER.infer(nested),
        INFER.infer(Map.of("a", "text", "c", Map.of("d", true))),
        INFER.infer(null)
    );
  }

  @Test
  void mergeIsCommutative() {
    for (SchemaNode a : samples()) {
      for (SchemaNode b : samples()) {
        assertEquals(SchemaMerger.merge(a, b), SchemaMerger.merge(b, a), a + " / " + b);
      }
    }
  }

  @Test
  void mergeIsAssociative() {
    List<SchemaNode> s = samples();
    for (SchemaNode a : s) {
      for (SchemaNode b : s) {
        for (SchemaNode c : s) {
          assertEquals(
              SchemaMerger.merge(SchemaMerger.merge(a, b), c),
              SchemaMerger.merge(a, SchemaMerger.merge(b, c)));
        }
      }
    }
  }

  @Test
  void mergeIsIdempotent() {
    for (SchemaNode a : samples()) {
      assertEquals(a, SchemaMerger.merge(a, a));
    }
  }

  @Test
  void typesAreUnionedAndFieldsMergedKeyWise() {
    SchemaNode a = INFER.infer(Map.of("a", 1));
    SchemaNode b = INFER.infer(Map.of("a", "x", "b", true));
    SchemaNode merged = SchemaMerger.merge(a, b);

    assertEquals(EnumSet.of(TypeTag.INT, TypeTag.STRING), merged.field("a").types());
    assertEquals(EnumSet.of(TypeTag.BOOL), merged.field("b").types());
  }

  @Test
  void emptyArrayMarkerIsDroppedOnceElementsAreSeen() {
    SchemaNode merged = SchemaMerger.merge(INFER.infer(List.of()), INFER.infer(List.of(3)));
    assertEquals(EnumSet.of(TypeTag.INT), merged.elementSchema().types());
  }

  @Test
  void invalidSideIsReplacedAndReported() {
    SchemaNode invalid = new SchemaNode(EnumSet.noneOf(TypeTag.class), null, null);
    SchemaNode valid = SchemaNode.of(TypeTag.INT);
    Diagnostics d = new Diagnostics();

    assertSame(valid, SchemaMerger.merge(invalid, valid, d));
    assertSame(valid, SchemaMerger.merge(valid, null, d));
    assertEquals(SchemaNode.unknown(), SchemaMerger.merge(null, invalid, d));
    assertEquals(3, d.size());
  }

  @Test
  void invalidFieldsOnBothSidesBecomeUnknown() {
    SchemaNode invalid = new SchemaNode(EnumSet.noneOf(TypeTag.class), null, null);
    Map<String, SchemaNode> a = new LinkedHashMap<>();
    a.put("x", invalid);
    Map<String, SchemaNode> b = new LinkedHashMap<>();
    b.put("x", null);
    Diagnostics d = new Diagnostics();

    Map<String, SchemaNode> out = SchemaMerger.mergeFields(a, b, d);
    assertEquals(SchemaNode.unknown(), out.get("x"));
    assertFalse(d.isEmpty());
  }
}
