package io.intellixity.querygate.plan;

import java.util.*;

/**
 * Collects every column a plan touches: projection, filter paths, group-by keys,
 * aggregate inputs and sort keys.
 */
public final class PlanReferences {
  private PlanReferences() {}

  /** Column name to the plan parts that reference it, in first-seen order. */
  public static Map<String, Set<String>> columnsOf(ExecutionPlan plan) {
    Objects.requireNonNull(plan, "plan");
    Map<String, Set<String>> out = new LinkedHashMap<>();
    for (String p : plan.projection()) add(out, p, "projection");
    collectFilter(plan.filter(), out);
    for (String g : plan.aggregation().groupBy()) add(out, g, "groupBy");
    for (Aggregate a : plan.aggregation().aggregates()) {
      if (a.field() != null) add(out, a.field(), "aggregate");
    }
    for (SortField sf : plan.sort()) {
      if (sf == null) continue;
      if (isAggregateAlias(plan, sf.field())) continue;
      add(out, sf.field(), "sort");
    }
    return out;
  }

  /** Sorting by an aggregate's output alias is not a column reference. */
  public static boolean isAggregateAlias(ExecutionPlan plan, String name) {
    for (Aggregate a : plan.aggregation().aggregates()) {
      if (a.alias().equals(name)) return true;
    }
    return false;
  }

  private static void collectFilter(FilterElement el, Map<String, Set<String>> out) {
    if (el == null) return;
    if (el instanceof NotElement n) {
      collectFilter(n.element(), out);
      return;
    }
    if (el instanceof LogicalGroup g) {
      for (FilterElement c : g.elements()) collectFilter(c, out);
      return;
    }
    if (el instanceof Condition c) {
      add(out, c.field(), "filter");
      return;
    }
    throw new IllegalArgumentException("Unsupported FilterElement: " + el.getClass().getName());
  }

  private static void add(Map<String, Set<String>> out, String column, String usage) {
    String key = column == null ? "" : column;
    out.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(usage);
  }
}
