package io.intellixity.querygate.schema;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link SchemaCatalog} keeping every published version.
 * <p>
 * Readers never block; publishing a version older than or equal to the latest one for the same
 * data source is rejected.
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {
  private final Map<String, NavigableMap<Long, SchemaSnapshot>> bySource = new ConcurrentHashMap<>();
  private final AtomicLong catalogVersion = new AtomicLong();

  public InMemorySchemaCatalog() {}

  public InMemorySchemaCatalog(List<SchemaSnapshot> snapshots) {
    for (SchemaSnapshot s : snapshots) publish(s);
  }

  public void publish(SchemaSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    NavigableMap<Long, SchemaSnapshot> versions =
        bySource.computeIfAbsent(snapshot.dataSourceId(), k -> new ConcurrentSkipListMap<>());
    synchronized (versions) {
      if (!versions.isEmpty() && versions.lastKey() >= snapshot.version()) {
        throw new IllegalArgumentException("Schema version must increase for " + snapshot.dataSourceId()
            + ": latest=" + versions.lastKey() + " offered=" + snapshot.version());
      }
      versions.put(snapshot.version(), snapshot);
    }
    catalogVersion.incrementAndGet();
  }

  @Override
  public SchemaSnapshot getSnapshot(String dataSourceId) {
    NavigableMap<Long, SchemaSnapshot> versions = bySource.get(dataSourceId);
    if (versions == null || versions.isEmpty()) {
      throw new SchemaSnapshotNotFoundException("No schema snapshot for data source: " + dataSourceId);
    }
    return versions.lastEntry().getValue();
  }

  @Override
  public SchemaSnapshot getSnapshot(String dataSourceId, long version) {
    NavigableMap<Long, SchemaSnapshot> versions = bySource.get(dataSourceId);
    SchemaSnapshot s = versions == null ? null : versions.get(version);
    if (s == null) {
      throw new SchemaSnapshotNotFoundException("No schema snapshot " + dataSourceId + "@" + version);
    }
    return s;
  }

  @Override
  public long catalogVersion() { return catalogVersion.get(); }
}
