package io.intellixity.docscope.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.docscope.query.QueryValidation;
import io.intellixity.docscope.query.QueryValidationException;
import io.intellixity.docscope.schema.CollectionSchema;
import io.intellixity.docscope.schema.CollectionSchemaAggregator;
import io.intellixity.docscope.spi.discovery.DatabaseSchema;
import io.intellixity.docscope.spi.discovery.SchemaDiscovery;
import io.intellixity.docscope.spi.source.DocumentSourceException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * One-stop access to a MongoDB database: schema discovery, filter validation and validated finds.
 * <p>
 * Validation results come back as text for callers that relay them verbatim ({@link #validateSyntax},
 * {@link #validateAgainstSchema}); the list forms are on {@link QueryValidation}.
 * Closing the toolkit closes the client only when the toolkit created it.
 */
public final class MongoToolkit implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MongoToolkit.class);

  public static final String SYNTAX_VALID = "Syntax is valid.";
  public static final String SCHEMA_VALID = "Query is valid against the collection schema.";

  public record Options(int sampleSize, SamplingMode samplingMode, SchemaDiscovery.CacheSettings cache) {
    public Options {
      if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");
      samplingMode = (samplingMode == null) ? SamplingMode.FIRST : samplingMode;
      cache = (cache == null) ? SchemaDiscovery.CacheSettings.disabled() : cache;
    }

    public static Options defaults() {
      return new Options(SchemaDiscovery.DEFAULT_SAMPLE_SIZE, SamplingMode.FIRST, SchemaDiscovery.CacheSettings.defaults());
    }
  }

  private final String database;
  private final SchemaDiscovery discovery;
  private final FindExecutor executor;
  private final int sampleSize;
  private final MongoClient ownedClient;

  /** Uses a client managed elsewhere; {@link #close()} leaves it open. */
  public MongoToolkit(MongoHandle handle, Options options) {
    this(handle, options, null);
  }

  private MongoToolkit(MongoHandle handle, Options options, MongoClient ownedClient) {
    this(handle.database(),
        new SchemaDiscovery(new MongoDocumentSource(handle, options.samplingMode()),
            new CollectionSchemaAggregator(), options.cache()),
        new MongoQueryExecutor(handle),
        options.sampleSize(),
        ownedClient);
  }

  MongoToolkit(String database, SchemaDiscovery discovery, FindExecutor executor, int sampleSize,
               MongoClient ownedClient) {
    this.database = Objects.requireNonNull(database, "database");
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.executor = Objects.requireNonNull(executor, "executor");
    if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");
    this.sampleSize = sampleSize;
    this.ownedClient = ownedClient;
  }

  /**
   * Creates a client for {@code uri}, checks the server answers a ping and binds the toolkit to {@code database}.
   *
   * @throws IllegalArgumentException when uri or database is blank or the uri is malformed
   * @throws DocumentSourceException when the server cannot be reached
   */
  public static MongoToolkit connect(String uri, String database, Options options) {
    if (uri == null || uri.isBlank()) throw new IllegalArgumentException("mongo uri cannot be empty");
    if (database == null || database.isBlank()) throw new IllegalArgumentException("database name cannot be empty");
    Options opts = (options == null) ? Options.defaults() : options;

    MongoClientSettings settings = MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(uri))
        .applyToClusterSettings(b -> b.serverSelectionTimeout(5, TimeUnit.SECONDS))
        .build();
    MongoClient client = MongoClients.create(settings);
    try {
      client.getDatabase("admin").runCommand(new Document("ping", 1));
    } catch (MongoException e) {
      client.close();
      throw new DocumentSourceException("Could not connect to MongoDB: " + e.getMessage(), e);
    }
    log.info("docscope.mongo connected database={} sampleSize={} sampling={}", database, opts.sampleSize(),
        opts.samplingMode());
    return new MongoToolkit(new MongoHandle(client, database), opts, client);
  }

  public String database() { return database; }

  public int sampleSize() { return sampleSize; }

  // ---- schema ----

  public DatabaseSchema databaseSchema() {
    return discovery.discover(null, sampleSize);
  }

  /** @param targetCollection null for all collections */
  public DatabaseSchema databaseSchema(String targetCollection, int sampleSize) {
    return discovery.discover(targetCollection, sampleSize);
  }

  public CollectionSchema collectionSchema(String collection) {
    return discovery.collectionSchema(collection, sampleSize);
  }

  public void invalidateSchemas() {
    discovery.invalidate();
  }

  public void invalidateSchema(String collection) {
    discovery.invalidate(collection);
  }

  // ---- validation ----

  /** {@value #SYNTAX_VALID} or a bullet list of the problems found. */
  public String validateSyntax(Object query) {
    return render(SYNTAX_VALID, "Syntax validation errors found:", QueryValidation.validateSyntax(query));
  }

  /** Validates against the sampled schema of {@code collection}. */
  public String validateAgainstSchema(String collection, Object query) {
    return render(SCHEMA_VALID, "Schema validation errors found:", schemaErrors(collection, query));
  }

  public List<String> schemaErrors(String collection, Object query) {
    return QueryValidation.validateAgainstSchema(query, collectionSchema(collection));
  }

  // ---- execution ----

  public List<Document> find(FindRequest request) {
    return executor.find(request);
  }

  /**
   * Validates the filter against the sampled schema before running it. Warnings do not block execution.
   *
   * @throws QueryValidationException when the filter has errors
   */
  public List<Document> findValidated(FindRequest request) {
    Objects.requireNonNull(request, "request");
    List<String> errors = QueryValidation.errorsOnly(schemaErrors(request.collection(), request.filter()));
    if (!errors.isEmpty()) {
      log.warn("docscope.mongo rejected collection={} errors={}", request.collection(), errors.size());
      throw new QueryValidationException("Query does not match the schema of '" + request.collection() + "'", errors);
    }
    return executor.find(request);
  }

  @Override
  public void close() {
    if (ownedClient != null) {
      log.info("docscope.mongo closing database={}", database);
      ownedClient.close();
    }
  }

  static String render(String validMessage, String heading, List<String> messages) {
    if (messages.isEmpty()) return validMessage;
    StringBuilder sb = new StringBuilder(heading);
    for (String m : messages) sb.append("\n- ").append(m);
    return sb.toString();
  }
}
