package io.intellixity.docscope.spi.discovery;

import io.intellixity.docscope.schema.AggregationResult;
import io.intellixity.docscope.schema.CollectionSchema;
import io.intellixity.docscope.schema.CollectionSchemaAggregator;
import io.intellixity.docscope.spi.internal.LruTtlCache;
import io.intellixity.docscope.spi.source.DocumentSource;
import io.intellixity.docscope.spi.source.DocumentSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Samples collections of a {@link DocumentSource} and folds each sample into a {@link CollectionSchema}.
 * <p>
 * Collections whose sample is empty have no snapshot and are left out of {@link #discover} results.
 * Snapshots are cached per (source, collection, sample size) when a cache is configured.
 */
public final class SchemaDiscovery {
  private static final Logger log = LoggerFactory.getLogger(SchemaDiscovery.class);

  public static final int DEFAULT_SAMPLE_SIZE = 100;

  /** Snapshot cache limits; {@code maxEntries == 0} disables caching. */
  public record CacheSettings(int maxEntries, long ttlMillis, long idleMillis) {
    public CacheSettings {
      if (maxEntries < 0) throw new IllegalArgumentException("maxEntries must be >= 0");
      if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
      if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    }

    public static CacheSettings disabled() { return new CacheSettings(0, 0, 0); }

    public static CacheSettings defaults() { return new CacheSettings(256, 10 * 60_000L, 0); }

    public boolean enabled() { return maxEntries > 0; }
  }

  record SnapshotKey(String source, String collection, int sampleSize) {}

  private final DocumentSource source;
  private final CollectionSchemaAggregator aggregator;
  private final LruTtlCache<SnapshotKey, CollectionSchema> cache;

  public SchemaDiscovery(DocumentSource source) {
    this(source, new CollectionSchemaAggregator(), CacheSettings.disabled());
  }

  public SchemaDiscovery(DocumentSource source, CollectionSchemaAggregator aggregator, CacheSettings cacheSettings) {
    this.source = Objects.requireNonNull(source, "source");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    CacheSettings settings = (cacheSettings == null) ? CacheSettings.disabled() : cacheSettings;
    this.cache = settings.enabled()
        ? new LruTtlCache<>(settings.maxEntries(), settings.ttlMillis(), settings.idleMillis())
        : null;
  }

  /** Package-private: lets tests drive the cache clock. */
  SchemaDiscovery(DocumentSource source, CollectionSchemaAggregator aggregator,
                  LruTtlCache<SnapshotKey, CollectionSchema> cache) {
    this.source = Objects.requireNonNull(source, "source");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.cache = cache;
  }

  public DocumentSource source() { return source; }

  public DatabaseSchema discover() {
    return discover(null, DEFAULT_SAMPLE_SIZE);
  }

  /**
   * @param targetCollection a single collection to describe, or null for all of them
   * @throws SchemaDiscoveryException when the target does not exist or the source fails
   */
  public DatabaseSchema discover(String targetCollection, int sampleSize) {
    requirePositive(sampleSize);
    List<String> names = listCollections();

    List<String> toInspect;
    if (targetCollection != null) {
      if (!names.contains(targetCollection)) {
        throw new SchemaDiscoveryException(
            "Collection '" + targetCollection + "' not found in database '" + source.name() + "'.");
      }
      toInspect = List.of(targetCollection);
    } else {
      toInspect = names;
    }
    if (toInspect.isEmpty()) {
      log.info("docscope.discover source={} collections=0", source.name());
      return DatabaseSchema.empty();
    }

    Map<String, CollectionSchema> out = new LinkedHashMap<>();
    for (String collection : toInspect) {
      CollectionSchema schema = snapshot(collection, sampleSize);
      if (!schema.isEmpty()) out.put(collection, schema);
    }
    log.info("docscope.discover source={} inspected={} described={} sampleSize={}",
        source.name(), toInspect.size(), out.size(), sampleSize);
    return DatabaseSchema.of(out);
  }

  /**
   * Snapshot of one collection. An empty snapshot means the sample was empty.
   *
   * @throws SchemaDiscoveryException when the source fails
   */
  public CollectionSchema collectionSchema(String collection, int sampleSize) {
    Objects.requireNonNull(collection, "collection");
    requirePositive(sampleSize);
    return snapshot(collection, sampleSize);
  }

  public void invalidate() {
    if (cache != null) cache.clear();
  }

  /** Drops cached snapshots of one collection, for every sample size. */
  public void invalidate(String collection) {
    if (cache == null) return;
    String sourceName = source.name();
    int dropped = cache.invalidateIf(k -> k.source().equals(sourceName) && k.collection().equals(collection));
    if (log.isDebugEnabled()) log.debug("docscope.discover invalidated collection={} entries={}", collection, dropped);
  }

  private CollectionSchema snapshot(String collection, int sampleSize) {
    if (cache == null) return sampleAndAggregate(collection, sampleSize);
    return cache.getOrLoad(new SnapshotKey(source.name(), collection, sampleSize),
        () -> sampleAndAggregate(collection, sampleSize));
  }

  private CollectionSchema sampleAndAggregate(String collection, int sampleSize) {
    List<Map<String, Object>> documents;
    try {
      documents = source.sample(collection, sampleSize);
    } catch (DocumentSourceException e) {
      throw new SchemaDiscoveryException("Sampling collection '" + collection + "' failed: " + e.getMessage(), e);
    }
    if (documents == null || documents.isEmpty()) {
      log.info("docscope.discover collection={} sampled=0 (no schema)", collection);
      return CollectionSchema.empty();
    }

    AggregationResult result = aggregator.aggregate(documents);
    log.info("docscope.discover collection={} analyzed={} skipped={} fields={}",
        collection, result.documentsAnalyzed(), result.documentsSkipped(), result.schema().size());
    if (result.hasDiagnostics() && log.isDebugEnabled()) {
      log.debug("docscope.discover collection={} diagnostics={}", collection, result.diagnostics());
    }
    return result.schema();
  }

  private List<String> listCollections() {
    try {
      return source.collectionNames();
    } catch (DocumentSourceException e) {
      throw new SchemaDiscoveryException(
          "Listing collections of '" + source.name() + "' failed: " + e.getMessage(), e);
    }
  }

  private static void requirePositive(int sampleSize) {
    if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");
  }
}
