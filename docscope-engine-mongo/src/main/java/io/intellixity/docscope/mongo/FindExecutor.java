package io.intellixity.docscope.mongo;

import org.bson.Document;

import java.util.List;

/** Runs a {@link FindRequest}; failures surface as {@link QueryExecutionException}. */
public interface FindExecutor {
  List<Document> find(FindRequest request);
}
