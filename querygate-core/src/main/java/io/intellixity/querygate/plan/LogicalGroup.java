package io.intellixity.querygate.plan;

import java.util.List;
import java.util.Objects;

public final class LogicalGroup implements FilterElement {
  private final Clause clause;
  private final List<FilterElement> elements;

  public LogicalGroup(Clause clause, List<FilterElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<FilterElement> elements() { return elements; }

  @Override
  public <Q> Q accept(FilterVisitor<Q> visitor) { return visitor.visit(this); }
}
