package io.intellixity.querygate.schema;

import java.util.*;

/**
 * Table or collection. {@code resourceClass} is the unit the policy table grants
 * (e.g. {@code cost_center}); several resources may share a class.
 */
public record ResourceDef(String name, String resourceClass, String owner, Map<String, ColumnDef> columns) {
  public ResourceDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(resourceClass, "resourceClass");
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns == null ? Map.of() : columns));
  }

  public ColumnDef column(String columnName) {
    return columnName == null ? null : columns.get(columnName);
  }

  public static ResourceDef of(String name, String resourceClass, String owner, ColumnDef... columns) {
    Map<String, ColumnDef> m = new LinkedHashMap<>();
    for (ColumnDef c : columns) m.put(c.name(), c);
    return new ResourceDef(name, resourceClass, owner, m);
  }
}
