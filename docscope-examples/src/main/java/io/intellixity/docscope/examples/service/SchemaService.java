package io.intellixity.docscope.examples.service;

import io.intellixity.docscope.mongo.FindRequest;
import io.intellixity.docscope.mongo.MongoToolkit;
import io.intellixity.docscope.query.QueryValidation;
import io.intellixity.docscope.spi.discovery.DatabaseSchema;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public final class SchemaService {
  private final MongoToolkit toolkit;

  public SchemaService(MongoToolkit toolkit) {
    this.toolkit = toolkit;
  }

  public record ValidationReport(boolean valid, List<String> errors, List<String> warnings) {
    public static ValidationReport of(List<String> messages) {
      List<String> errors = new ArrayList<>();
      List<String> warnings = new ArrayList<>();
      for (String m : messages) {
        if (QueryValidation.isWarning(m)) warnings.add(m);
        else errors.add(m);
      }
      return new ValidationReport(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }
  }

  /** @param collection null for every collection; sampleSize null for the configured default */
  public DatabaseSchema schema(String collection, Integer sampleSize) {
    int n = (sampleSize == null) ? toolkit.sampleSize() : sampleSize;
    return toolkit.databaseSchema(collection, n);
  }

  public ValidationReport validateSyntax(Document filter) {
    return ValidationReport.of(QueryValidation.validateSyntax(filter));
  }

  public ValidationReport validate(String collection, Document filter) {
    return ValidationReport.of(toolkit.schemaErrors(collection, filter));
  }

  public List<Document> find(FindRequest request) {
    return toolkit.findValidated(request);
  }

  public void clearCache() {
    toolkit.invalidateSchemas();
  }
}
