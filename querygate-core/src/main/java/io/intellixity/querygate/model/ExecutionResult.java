package io.intellixity.querygate.model;

import java.util.*;

/** Rows returned by the gateway, already masked. */
public record ExecutionResult(String sourceId,
                              long schemaVersion,
                              List<String> columns,
                              List<Map<String, Object>> rows,
                              boolean truncated,
                              Set<String> maskedColumns) {
  public ExecutionResult {
    Objects.requireNonNull(sourceId, "sourceId");
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<Map<String, Object>> copy = new ArrayList<>();
    if (rows != null) {
      for (Map<String, Object> r : rows) copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
    }
    rows = Collections.unmodifiableList(copy);
    maskedColumns = maskedColumns == null ? Set.of() : Set.copyOf(maskedColumns);
  }

  public int rowCount() { return rows.size(); }
}
