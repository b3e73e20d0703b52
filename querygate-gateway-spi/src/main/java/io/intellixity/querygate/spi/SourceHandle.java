package io.intellixity.querygate.spi;

/**
 * Resolved runtime handle for one data source.
 * <p>
 * JDBC: client() is a {@code javax.sql.DataSource}, namespace() is the schema.
 * Mongo: client() is a {@code MongoClient}, namespace() is the database.
 */
public interface SourceHandle<C> {
  /** Unique identifier for this handle (logging and caching). */
  String id();

  /** Native client used by an adapter. */
  C client();

  /** Schema or database; may be null when the client already points at one. */
  String namespace();
}
