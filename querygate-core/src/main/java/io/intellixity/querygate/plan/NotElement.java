package io.intellixity.querygate.plan;

import java.util.Objects;

/** Unary NOT for a filter subtree (can wrap a {@link Condition} or a {@link LogicalGroup}). */
public final class NotElement implements FilterElement {
  private final FilterElement element;

  public NotElement(FilterElement element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public FilterElement element() { return element; }

  @Override
  public <Q> Q accept(FilterVisitor<Q> visitor) {
    return visitor.visit(this);
  }
}
