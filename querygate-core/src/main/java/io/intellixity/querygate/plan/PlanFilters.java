package io.intellixity.querygate.plan;

import java.util.Collection;
import java.util.List;

public final class PlanFilters {
  private PlanFilters() {}

  public static Condition eq(String field, Object value) { return Condition.of(field, Operator.EQ, value); }
  public static Condition ne(String field, Object value) { return Condition.of(field, Operator.NE, value); }
  public static Condition gt(String field, Object value) { return Condition.of(field, Operator.GT, value); }
  public static Condition ge(String field, Object value) { return Condition.of(field, Operator.GE, value); }
  public static Condition lt(String field, Object value) { return Condition.of(field, Operator.LT, value); }
  public static Condition le(String field, Object value) { return Condition.of(field, Operator.LE, value); }

  public static Condition in(String field, Collection<?> values) { return Condition.of(field, Operator.IN, values); }
  public static Condition nin(String field, Collection<?> values) { return Condition.of(field, Operator.NIN, values); }

  public static Condition range(String field, Object lower, Object upper) { return Condition.range(field, lower, upper); }

  public static Condition like(String field, Object value) { return Condition.of(field, Operator.LIKE, value); }

  public static LogicalGroup and(FilterElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(FilterElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(FilterElement element) {
    return new NotElement(element);
  }
}
