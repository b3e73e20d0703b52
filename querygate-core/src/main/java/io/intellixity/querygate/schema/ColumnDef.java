package io.intellixity.querygate.schema;

import java.util.Objects;
import java.util.Set;

/** Column (or document field) with its sensitivity tags, e.g. {@code PII}. */
public record ColumnDef(String name, String type, Set<String> sensitivityTags) {
  public ColumnDef {
    Objects.requireNonNull(name, "name");
    type = (type == null || type.isBlank()) ? "string" : type;
    sensitivityTags = sensitivityTags == null ? Set.of() : Set.copyOf(sensitivityTags);
  }

  public boolean isSensitive() { return !sensitivityTags.isEmpty(); }

  public static ColumnDef of(String name, String type, String... tags) {
    return new ColumnDef(name, type, Set.of(tags));
  }
}
