package io.intellixity.querygate.pipeline.plan;

import io.intellixity.querygate.model.Intent;
import io.intellixity.querygate.model.UserQuery;
import io.intellixity.querygate.plan.ExecutionPlan;

import java.util.Set;

/**
 * Produces a candidate plan. The output is untrusted; {@code authorizedScope} is a hint the generator
 * may ignore, and enforcement happens only in validation.
 */
@FunctionalInterface
public interface PlanGenerator {
  ExecutionPlan generate(UserQuery query, Intent intent, Set<String> authorizedScope);
}
