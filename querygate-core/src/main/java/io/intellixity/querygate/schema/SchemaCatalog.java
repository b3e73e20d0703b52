package io.intellixity.querygate.schema;

/** Read-only access to versioned schema snapshots. */
public interface SchemaCatalog {
  /** Latest snapshot for a data source. */
  SchemaSnapshot getSnapshot(String dataSourceId);

  /** Exact snapshot version, used to pin a request to the version it was validated against. */
  SchemaSnapshot getSnapshot(String dataSourceId, long version);

  /** Monotonic counter bumped on every publish across all data sources. */
  long catalogVersion();
}
