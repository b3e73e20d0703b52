package io.intellixity.querygate.plan;

/** Node of a plan filter tree. */
public interface FilterElement {
  <Q> Q accept(FilterVisitor<Q> visitor);
}
