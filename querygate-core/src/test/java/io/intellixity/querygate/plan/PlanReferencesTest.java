package io.intellixity.querygate.plan;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PlanReferencesTest {
  @Test
  void collectsEveryUsage() {
    ExecutionPlan plan = ExecutionPlan.select("s", "payroll")
        .withProjection(List.of("employee_id"))
        .withFilter(PlanFilters.not(PlanFilters.and(PlanFilters.gt("salary", 100), PlanFilters.eq("dept", "x"))))
        .withAggregation(Aggregation.groupBy(List.of("dept"), Aggregate.of(AggregateFunction.AVG, "bonus"), Aggregate.count()))
        .withSort(List.of(new SortField("hired_at", SortField.Direction.ASC), new SortField("count", SortField.Direction.DESC)));

    Map<String, Set<String>> refs = PlanReferences.columnsOf(plan);
    assertEquals(List.of("employee_id", "salary", "dept", "bonus", "hired_at"), List.copyOf(refs.keySet()));
    assertEquals(Set.of("filter", "groupBy"), refs.get("dept"));
    assertFalse(refs.containsKey("count"));
  }
}
