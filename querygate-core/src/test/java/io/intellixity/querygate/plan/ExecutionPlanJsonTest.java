package io.intellixity.querygate.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutionPlanJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesGeneratedPlan() throws Exception {
    String s = """
        {
          "source": "finance_pg",
          "resource": "cost_center_variance",
          "operation": "select",
          "projection": ["cost_center_id", "variance"],
          "filter": { "and": [
            { "eq": { "field": "cost_center_id", "value": "101" } },
            { "not": { "in": { "field": "period", "values": ["2023-12"] } } }
          ] },
          "sort": [ { "field": "period", "dir": "desc" } ],
          "limit": 50
        }
        """;
    ExecutionPlan plan = JSON.readValue(s, ExecutionPlan.class);
    assertEquals("finance_pg", plan.sourceId());
    assertEquals("cost_center_variance", plan.resource());
    assertEquals(PlanOperation.SELECT, plan.operation());
    assertEquals(List.of("cost_center_id", "variance"), plan.projection());
    assertEquals(50, plan.limit());
    assertEquals(SortField.Direction.DESC, plan.sort().get(0).direction());

    LogicalGroup g = assertInstanceOf(LogicalGroup.class, plan.filter());
    assertEquals(Clause.AND, g.clause());
    Condition first = assertInstanceOf(Condition.class, g.elements().get(0));
    assertEquals("cost_center_id", first.field());
    assertEquals("101", first.value());
    NotElement not = assertInstanceOf(NotElement.class, g.elements().get(1));
    assertEquals(Operator.IN, ((Condition) not.element()).operator());
  }

  @Test
  void writeVerbsSurviveParsingAsOperations() throws Exception {
    ExecutionPlan del = JSON.readValue("{\"source\":\"s\",\"resource\":\"r\",\"operation\":\"DELETE\"}", ExecutionPlan.class);
    assertEquals(PlanOperation.DELETE, del.operation());
    ExecutionPlan odd = JSON.readValue("{\"source\":\"s\",\"resource\":\"r\",\"operation\":\"frobnicate\"}", ExecutionPlan.class);
    assertEquals(PlanOperation.UNKNOWN, odd.operation());
    assertFalse(odd.operation().isReadOnly());
  }

  @Test
  void groupByTurnsSelectIntoAggregate() throws Exception {
    String s = """
        { "source": "s", "resource": "r",
          "groupBy": { "fields": ["region"], "aggregates": [ { "fn": "sum", "field": "amount", "as": "total" }, { "fn": "count" } ] } }
        """;
    ExecutionPlan plan = JSON.readValue(s, ExecutionPlan.class);
    assertEquals(PlanOperation.AGGREGATE, plan.operation());
    assertEquals(List.of("region"), plan.aggregation().groupBy());
    assertEquals("total", plan.aggregation().aggregates().get(0).alias());
    assertEquals("count", plan.aggregation().aggregates().get(1).alias());
  }

  @Test
  void rejectsUnknownFilterOperator() {
    String s = "{\"source\":\"s\",\"resource\":\"r\",\"filter\":{\"regex_eval\":{\"field\":\"a\",\"value\":\".*\"}}}";
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue(s, ExecutionPlan.class));
    assertTrue(String.valueOf(ex.getMessage()).contains("regex_eval"));
  }

  @Test
  void writesCanonicalForm() throws Exception {
    ExecutionPlan plan = ExecutionPlan.select("s", "r")
        .withFilter(PlanFilters.or(PlanFilters.eq("a", 1), PlanFilters.range("b", 1, 5)))
        .withLimit(10);
    String json = JSON.writeValueAsString(plan);
    assertTrue(json.contains("\"or\""));
    assertTrue(json.contains("\"range\":{\"field\":\"b\",\"lower\":1,\"upper\":5}"));
    ExecutionPlan back = JSON.readValue(json, ExecutionPlan.class);
    assertEquals(10, back.limit());
    assertEquals(Clause.OR, ((LogicalGroup) back.filter()).clause());
  }
}
