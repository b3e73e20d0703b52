package io.intellixity.querygate.pipeline;

import io.intellixity.querygate.schema.SchemaCatalog;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.util.LruTtlCache;

import java.util.Objects;

/**
 * Read-through cache in front of a slower catalog.
 * <p>
 * "Latest" lookups expire after {@code latestTtlMillis} so newly published versions become visible;
 * exact-version lookups never expire because a published snapshot is immutable.
 */
public final class CachingSchemaCatalog implements SchemaCatalog {
  private record VersionKey(String dataSourceId, long version) {}

  private final SchemaCatalog delegate;
  private final LruTtlCache<String, SchemaSnapshot> latest;
  private final LruTtlCache<VersionKey, SchemaSnapshot> versions;

  public CachingSchemaCatalog(SchemaCatalog delegate, int maxEntries, long latestTtlMillis) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.latest = new LruTtlCache<>(maxEntries, latestTtlMillis, 0);
    this.versions = new LruTtlCache<>(maxEntries, 0, 0);
  }

  @Override
  public SchemaSnapshot getSnapshot(String dataSourceId) {
    Objects.requireNonNull(dataSourceId, "dataSourceId");
    SchemaSnapshot s = latest.getOrCompute(dataSourceId, () -> delegate.getSnapshot(dataSourceId));
    versions.put(new VersionKey(dataSourceId, s.version()), s);
    return s;
  }

  @Override
  public SchemaSnapshot getSnapshot(String dataSourceId, long version) {
    Objects.requireNonNull(dataSourceId, "dataSourceId");
    return versions.getOrCompute(new VersionKey(dataSourceId, version), () -> delegate.getSnapshot(dataSourceId, version));
  }

  @Override
  public long catalogVersion() {
    return delegate.catalogVersion();
  }

  /** Drops the cached "latest" entry, e.g. after a publish notification. */
  public void invalidate(String dataSourceId) {
    latest.invalidate(dataSourceId);
  }
}
