package io.intellixity.docscope.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import java.util.Objects;

/** A client bound to one database (resolved by application code). */
public final class MongoHandle {
  private final MongoClient client;
  private final String database;

  public MongoHandle(MongoClient client, String database) {
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
    if (database.isBlank()) throw new IllegalArgumentException("database must not be blank");
  }

  public String database() { return database; }

  public MongoDatabase db() { return client.getDatabase(database); }
}
