package io.intellixity.docscope.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Aggregates;
import io.intellixity.docscope.spi.source.DocumentSource;
import io.intellixity.docscope.spi.source.DocumentSourceException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** {@link DocumentSource} over one MongoDB database using the sync driver. */
public final class MongoDocumentSource implements DocumentSource {
  private static final Logger log = LoggerFactory.getLogger(MongoDocumentSource.class);

  private final MongoHandle handle;
  private final SamplingMode mode;

  public MongoDocumentSource(MongoHandle handle) {
    this(handle, SamplingMode.FIRST);
  }

  public MongoDocumentSource(MongoHandle handle, SamplingMode mode) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.mode = (mode == null) ? SamplingMode.FIRST : mode;
  }

  public SamplingMode mode() { return mode; }

  @Override
  public String name() { return handle.database(); }

  @Override
  public List<String> collectionNames() {
    try {
      return handle.db().listCollectionNames().into(new ArrayList<>());
    } catch (MongoException e) {
      throw new DocumentSourceException("Listing collections of '" + handle.database() + "' failed: " + e.getMessage(), e);
    }
  }

  @Override
  public List<Map<String, Object>> sample(String collection, int limit) {
    Objects.requireNonNull(collection, "collection");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");

    MongoCollection<Document> col = handle.db().getCollection(collection);
    Iterable<Document> docs = (mode == SamplingMode.RANDOM)
        ? col.aggregate(List.of(Aggregates.sample(limit)))
        : col.find().limit(limit);

    List<Map<String, Object>> out = new ArrayList<>();
    try {
      for (Document d : docs) out.add(d);
    } catch (MongoException e) {
      throw new DocumentSourceException("Sampling '" + handle.database() + "." + collection + "' failed: "
          + e.getMessage(), e);
    }
    if (log.isDebugEnabled()) {
      log.debug("docscope.mongo sample db={} collection={} mode={} limit={} returned={}",
          handle.database(), collection, mode, limit, out.size());
    }
    return out;
  }
}
