package io.intellixity.querygate.jdbc.dialect;

import io.intellixity.querygate.jdbc.SqlStatement;
import io.intellixity.querygate.plan.ExecutionPlan;

/** Renders a read-only plan into database-specific SQL. */
public interface SqlDialect {
  String id();

  /** Renders SELECT or grouped aggregate SQL against {@code schema.resource} (schema may be null). */
  SqlStatement renderSelect(ExecutionPlan plan, String schema);
}
