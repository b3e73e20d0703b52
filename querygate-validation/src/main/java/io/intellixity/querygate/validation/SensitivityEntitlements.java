package io.intellixity.querygate.validation;

import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.schema.ColumnDef;

import java.util.*;

/**
 * Maps a column sensitivity tag to the entitlement that unlocks it. Tags without an explicit mapping
 * require an entitlement of the same name (a {@code PII} column needs the {@code PII} entitlement).
 */
public final class SensitivityEntitlements {
  private final Map<String, String> tagToEntitlement;

  public SensitivityEntitlements(Map<String, String> tagToEntitlement) {
    Map<String, String> m = new HashMap<>();
    if (tagToEntitlement != null) {
      tagToEntitlement.forEach((k, v) -> m.put(k.toUpperCase(Locale.ROOT), v));
    }
    this.tagToEntitlement = Map.copyOf(m);
  }

  public static SensitivityEntitlements identity() {
    return new SensitivityEntitlements(Map.of());
  }

  public String requiredFor(String tag) {
    return tagToEntitlement.getOrDefault(tag.toUpperCase(Locale.ROOT), tag);
  }

  /** Tags on the column the identity is not entitled to; empty when the column is fully readable. */
  public Set<String> uncoveredTags(ColumnDef column, Identity identity) {
    if (column == null || !column.isSensitive()) return Set.of();
    Set<String> out = new TreeSet<>();
    for (String tag : column.sensitivityTags()) {
      if (identity == null || !identity.isEntitledTo(requiredFor(tag))) out.add(tag);
    }
    return out;
  }

  public boolean isCovered(ColumnDef column, Identity identity) {
    return uncoveredTags(column, identity).isEmpty();
  }
}
