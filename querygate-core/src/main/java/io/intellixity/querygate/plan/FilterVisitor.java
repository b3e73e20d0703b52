package io.intellixity.querygate.plan;

public interface FilterVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
  Q visit(NotElement not);
}
