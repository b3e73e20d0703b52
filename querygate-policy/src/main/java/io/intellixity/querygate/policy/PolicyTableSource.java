package io.intellixity.querygate.policy;

/** Supplies the policy table in force for a request. */
@FunctionalInterface
public interface PolicyTableSource {
  PolicyTable current();

  static PolicyTableSource of(PolicyTable table) {
    java.util.Objects.requireNonNull(table, "table");
    return () -> table;
  }
}
