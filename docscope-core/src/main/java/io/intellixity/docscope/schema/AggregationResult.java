package io.intellixity.docscope.schema;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one aggregation pass.
 *
 * @param schema            merged snapshot (empty when no document was analyzable)
 * @param documentsAnalyzed documents that contributed to {@code schema}
 * @param documentsSkipped  documents rejected or failed during processing
 * @param diagnostics       anomalies recorded along the way, in encounter order
 */
public record AggregationResult(CollectionSchema schema,
                                int documentsAnalyzed,
                                int documentsSkipped,
                                List<String> diagnostics) {
  public AggregationResult {
    Objects.requireNonNull(schema, "schema");
    diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
  }

  public boolean hasDiagnostics() { return !diagnostics.isEmpty(); }
}
