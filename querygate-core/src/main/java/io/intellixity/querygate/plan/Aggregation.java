package io.intellixity.querygate.plan;

import java.util.List;

public record Aggregation(List<String> groupBy, List<Aggregate> aggregates) {
  public Aggregation {
    groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
  }

  public boolean isEmpty() { return groupBy.isEmpty() && aggregates.isEmpty(); }

  public static Aggregation groupBy(List<String> fields, Aggregate... aggregates) {
    return new Aggregation(fields, List.of(aggregates));
  }
}
