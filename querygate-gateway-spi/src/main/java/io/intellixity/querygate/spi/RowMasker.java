package io.intellixity.querygate.spi;

import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.schema.ColumnDef;
import io.intellixity.querygate.schema.ResourceDef;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.validation.SensitivityEntitlements;

import java.util.*;

/**
 * Replaces values of columns whose sensitivity tags the identity is not entitled to. The strategy is
 * picked per tag; when a column carries several uncovered tags the strongest one applies
 * (NULLIFY over HASH over REDACT).
 */
public final class RowMasker {
  private final Map<String, MaskingStrategy> byTag;
  private final MaskingStrategy fallback;

  public RowMasker(Map<String, MaskingStrategy> byTag, MaskingStrategy fallback) {
    Map<String, MaskingStrategy> m = new HashMap<>();
    if (byTag != null) byTag.forEach((k, v) -> m.put(k.toUpperCase(Locale.ROOT), v));
    this.byTag = Map.copyOf(m);
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  public static RowMasker redacting() {
    return new RowMasker(Map.of(), MaskingStrategy.REDACT);
  }

  /** Column name to the strategy applied to it; columns not listed pass through. */
  public Map<String, MaskingStrategy> plan(ResourceDef resource,
                                           Collection<String> columns,
                                           Identity identity,
                                           SensitivityEntitlements entitlements) {
    Map<String, MaskingStrategy> out = new LinkedHashMap<>();
    if (resource == null) return out;
    for (String name : columns) {
      ColumnDef c = resource.column(name);
      Set<String> uncovered = entitlements.uncoveredTags(c, identity);
      if (uncovered.isEmpty()) continue;
      MaskingStrategy s = null;
      for (String tag : uncovered) s = stronger(s, byTag.getOrDefault(tag.toUpperCase(Locale.ROOT), fallback));
      out.put(name, s);
    }
    return out;
  }

  public List<Map<String, Object>> mask(List<Map<String, Object>> rows,
                                        SchemaSnapshot snapshot,
                                        String resourceName,
                                        Identity identity,
                                        SensitivityEntitlements entitlements) {
    ResourceDef resource = snapshot.resource(resourceName);
    Set<String> columns = new LinkedHashSet<>();
    for (Map<String, Object> r : rows) columns.addAll(r.keySet());
    Map<String, MaskingStrategy> plan = plan(resource, columns, identity, entitlements);
    if (plan.isEmpty()) return rows;

    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) {
      Map<String, Object> copy = new LinkedHashMap<>(r);
      plan.forEach((col, s) -> {
        if (copy.containsKey(col)) copy.put(col, s.mask(copy.get(col)));
      });
      out.add(copy);
    }
    return out;
  }

  private static MaskingStrategy stronger(MaskingStrategy a, MaskingStrategy b) {
    if (a == null) return b;
    return rank(b) > rank(a) ? b : a;
  }

  private static int rank(MaskingStrategy s) {
    return switch (s) {
      case REDACT -> 0;
      case HASH -> 1;
      case NULLIFY -> 2;
    };
  }
}
