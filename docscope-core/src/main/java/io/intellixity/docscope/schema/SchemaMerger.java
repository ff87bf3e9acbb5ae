package io.intellixity.docscope.schema;

import io.intellixity.docscope.types.TypeTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Total merge of two schema fragments.
 * <p>
 * Commutative, associative and idempotent for valid nodes. Invalid input (null, or a node without types)
 * never fails the merge: the valid side wins, and two invalid sides produce {@link SchemaNode#unknown()}.
 */
public final class SchemaMerger {
  private static final Logger log = LoggerFactory.getLogger(SchemaMerger.class);

  private SchemaMerger() {}

  public static SchemaNode merge(SchemaNode a, SchemaNode b) {
    return merge(a, b, null);
  }

  public static SchemaNode merge(SchemaNode a, SchemaNode b, Diagnostics diagnostics) {
    boolean aValid = a != null && a.isValid();
    boolean bValid = b != null && b.isValid();
    if (!aValid && !bValid) {
      report(diagnostics, "Merge received two invalid schema nodes; substituting 'unknown'");
      return SchemaNode.unknown();
    }
    if (!aValid) {
      report(diagnostics, "Merge received an invalid schema node; keeping the other side");
      return b;
    }
    if (!bValid) {
      report(diagnostics, "Merge received an invalid schema node; keeping the other side");
      return a;
    }
    if (a.equals(b)) return a;

    EnumSet<TypeTag> types = EnumSet.noneOf(TypeTag.class);
    types.addAll(a.types());
    types.addAll(b.types());

    Map<String, SchemaNode> fields = mergeFields(a.objectSchema(), b.objectSchema(), diagnostics);
    SchemaNode element = mergeElements(a.elementSchema(), b.elementSchema(), diagnostics);
    return new SchemaNode(types, fields, element);
  }

  /** Key-wise merge of two field maps; either side may be null. */
  public static Map<String, SchemaNode> mergeFields(Map<String, SchemaNode> a,
                                                    Map<String, SchemaNode> b,
                                                    Diagnostics diagnostics) {
    if (a == null) return b;
    if (b == null) return a;

    Map<String, SchemaNode> out = new LinkedHashMap<>(a);
    for (Map.Entry<String, SchemaNode> e : b.entrySet()) {
      String key = e.getKey();
      SchemaNode incoming = e.getValue();
      if (!out.containsKey(key)) {
        out.put(key, incoming);
        continue;
      }
      SchemaNode existing = out.get(key);
      boolean existingValid = existing != null && existing.isValid();
      boolean incomingValid = incoming != null && incoming.isValid();
      if (existingValid && incomingValid) {
        out.put(key, merge(existing, incoming, diagnostics));
      } else if (incomingValid) {
        report(diagnostics, "Invalid schema for field '" + key + "'; keeping the other side");
        out.put(key, incoming);
      } else if (existingValid) {
        report(diagnostics, "Invalid schema for field '" + key + "'; keeping the other side");
      } else {
        report(diagnostics, "Invalid schema on both sides for field '" + key + "'; substituting 'unknown'");
        out.put(key, SchemaNode.unknown());
      }
    }
    return out;
  }

  private static SchemaNode mergeElements(SchemaNode a, SchemaNode b, Diagnostics diagnostics) {
    boolean aValid = a != null && a.isValid();
    boolean bValid = b != null && b.isValid();
    if (!aValid && !bValid) return (a == null && b == null) ? null : SchemaNode.unknown();
    if (!aValid) return b;
    if (!bValid) return a;

    SchemaNode merged = merge(a, b, diagnostics);
    if (merged.has(TypeTag.EMPTY_ARRAY) && merged.types().size() > 1) {
      EnumSet<TypeTag> types = EnumSet.copyOf(merged.types());
      types.remove(TypeTag.EMPTY_ARRAY);
      merged = new SchemaNode(types, merged.objectSchema(), merged.elementSchema());
    }
    return merged;
  }

  private static void report(Diagnostics diagnostics, String message) {
    log.warn("docscope.merge anomaly={}", message);
    if (diagnostics != null) diagnostics.add(message);
  }
}
