package io.intellixity.docscope.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Executes finds through the sync driver. */
public final class MongoQueryExecutor implements FindExecutor {
  private static final Logger log = LoggerFactory.getLogger(MongoQueryExecutor.class);

  private final MongoHandle handle;

  public MongoQueryExecutor(MongoHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public List<Document> find(FindRequest request) {
    Objects.requireNonNull(request, "request");
    log.info("docscope.mongo find db={} collection={} filter={} skip={} limit={}",
        handle.database(), request.collection(), request.filter().toJson(), request.skip(), request.limit());

    try {
      MongoCollection<Document> col = handle.db().getCollection(request.collection());
      FindIterable<Document> find = col.find(request.filter());
      if (request.projection() != null) find = find.projection(request.projection());
      Document sort = request.sortDocument();
      if (sort != null) find = find.sort(sort);
      if (request.skip() > 0) find = find.skip(request.skip());
      if (request.limit() > 0) find = find.limit(request.limit());

      List<Document> out = find.into(new ArrayList<>());
      if (log.isDebugEnabled()) log.debug("docscope.mongo find collection={} returned={}", request.collection(), out.size());
      return out;
    } catch (MongoException e) {
      throw new QueryExecutionException("MongoDB operation failed during query execution on '"
          + request.collection() + "': " + e.getMessage(), e);
    }
  }
}
