package io.intellixity.querygate.schema;

import java.util.*;

/**
 * Immutable, versioned structure of one data source. {@code sourceFamily} selects the adapter
 * (e.g. {@code jdbc}, {@code mongo}).
 */
public record SchemaSnapshot(String dataSourceId, String sourceFamily, long version, Map<String, ResourceDef> resources) {
  public SchemaSnapshot {
    Objects.requireNonNull(dataSourceId, "dataSourceId");
    Objects.requireNonNull(sourceFamily, "sourceFamily");
    if (version < 0) throw new IllegalArgumentException("version must be >= 0");
    resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources == null ? Map.of() : resources));
  }

  public ResourceDef resource(String name) {
    return name == null ? null : resources.get(name);
  }

  /** Every sensitivity tag used anywhere in the snapshot. */
  public Set<String> sensitivityTags() {
    Set<String> out = new TreeSet<>();
    for (ResourceDef r : resources.values()) {
      for (ColumnDef c : r.columns().values()) out.addAll(c.sensitivityTags());
    }
    return out;
  }

  public static SchemaSnapshot of(String dataSourceId, String sourceFamily, long version, ResourceDef... resources) {
    Map<String, ResourceDef> m = new LinkedHashMap<>();
    for (ResourceDef r : resources) m.put(r.name(), r);
    return new SchemaSnapshot(dataSourceId, sourceFamily, version, m);
  }
}
