package io.intellixity.querygate.policy;

import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.model.Intent;
import io.intellixity.querygate.model.PolicyDecision;

/**
 * Pure function from (intent, identity, policy table, schema version) to a decision.
 * <p>
 * Implementations must be total (never throw, including on null inputs) and deterministic.
 */
public interface PolicyDecisionEngine {
  PolicyDecision decide(Intent intent, Identity identity, PolicyTable policyTable, long schemaVersion);
}
