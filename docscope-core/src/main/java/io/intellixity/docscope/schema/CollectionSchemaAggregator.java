package io.intellixity.docscope.schema;

import io.intellixity.docscope.types.BsonTypeClassifier;
import io.intellixity.docscope.types.TypeTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Folds sampled documents into one {@link CollectionSchema}.
 * <p>
 * Performs no I/O: callers hand over documents already truncated to their sample size.
 * A document that cannot be processed is recorded in the diagnostics and skipped; the rest still count.
 */
public final class CollectionSchemaAggregator {
  private static final Logger log = LoggerFactory.getLogger(CollectionSchemaAggregator.class);

  private final SchemaInferencer inferencer;

  public CollectionSchemaAggregator() {
    this(new SchemaInferencer());
  }

  public CollectionSchemaAggregator(SchemaInferencer inferencer) {
    this.inferencer = Objects.requireNonNull(inferencer, "inferencer");
  }

  public AggregationResult aggregate(Iterable<?> documents) {
    return aggregate(CollectionSchema.empty(), documents);
  }

  /** Continues from {@code base}, e.g. to fold a further sample into an earlier snapshot. */
  public AggregationResult aggregate(CollectionSchema base, Iterable<?> documents) {
    CollectionSchema start = (base == null) ? CollectionSchema.empty() : base;
    if (documents == null) return new AggregationResult(start, 0, 0, null);

    Diagnostics diagnostics = new Diagnostics();
    Map<String, SchemaNode> merged = new LinkedHashMap<>(start.fields());
    int analyzed = 0;
    int skipped = 0;
    int index = 0;

    for (Object doc : documents) {
      int position = index++;
      TypeTag tag = BsonTypeClassifier.classify(doc);
      if (tag != TypeTag.OBJECT) {
        skipped++;
        diagnostics.add("Skipping document #" + position + ": expected an object but found '" + tag.wireName() + "'");
        continue;
      }

      try {
        SchemaNode docSchema = inferencer.infer(doc, diagnostics);
        Map<String, SchemaNode> docFields = docSchema.objectSchema();
        if (docFields == null) {
          skipped++;
          diagnostics.add("Skipping document #" + position + " (_id=" + idOf(doc) + "): inference produced no field map");
          continue;
        }
        merged = new LinkedHashMap<>(SchemaMerger.mergeFields(merged, docFields, diagnostics));
        analyzed++;
      } catch (RuntimeException e) {
        skipped++;
        String id = idOf(doc);
        log.warn("docscope.aggregate skippedDocument index={} id={} error={}", position, id, e.toString(), e);
        diagnostics.add("Error processing document #" + position + " (_id=" + id + "): " + e.getMessage()
            + "; document skipped");
      }
    }

    if (log.isDebugEnabled()) {
      log.debug("docscope.aggregate analyzed={} skipped={} fields={} diagnostics={}",
          analyzed, skipped, merged.size(), diagnostics.size());
    }
    return new AggregationResult(CollectionSchema.of(merged), analyzed, skipped, diagnostics.messages());
  }

  /** Only used for messages; a document that fails to read reports {@code N/A}. */
  private static String idOf(Object doc) {
    if (!(doc instanceof Map<?, ?> m)) return "N/A";
    try {
      Object id = m.get("_id");
      return (id == null) ? "N/A" : String.valueOf(id);
    } catch (RuntimeException e) {
      log.debug("docscope.aggregate unreadableId error={}", e.toString());
      return "N/A";
    }
  }
}
