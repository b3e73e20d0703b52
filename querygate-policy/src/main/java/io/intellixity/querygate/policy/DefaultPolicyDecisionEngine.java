package io.intellixity.querygate.policy;

import io.intellixity.querygate.model.*;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decision rules, first match wins:
 * <ol>
 *   <li>missing intent or policy table: DENY, unknown intent</li>
 *   <li>category OUT_OF_SCOPE, or mapped to {@link Disposition#OUT_OF_SCOPE}: DENY, out of scope</li>
 *   <li>category not registered, or confidence below the table threshold: DENY, low-confidence/unknown</li>
 *   <li>{@link Disposition#NO_DATA}: ALLOW_NO_DATA with an empty scope</li>
 *   <li>{@link Disposition#REQUIRES_AUTHORIZATION}: every grant whose roles the identity holds applies;
 *       none applies: DENY, insufficient entitlement; otherwise the scope is the intersection of the
 *       applicable grants (most restrictive wins), and an empty intersection is DENY</li>
 * </ol>
 */
public final class DefaultPolicyDecisionEngine implements PolicyDecisionEngine {
  @Override
  public PolicyDecision decide(Intent intent, Identity identity, PolicyTable table, long schemaVersion) {
    long policyVersion = table == null ? -1 : table.version();
    if (intent == null || table == null) {
      return PolicyDecision.deny(intent == null ? null : intent.category(),
          ReasonCode.LOW_CONFIDENCE_OR_UNKNOWN_INTENT, policyVersion, schemaVersion);
    }

    IntentCategory category = intent.category();
    CategoryPolicy policy = table.policyFor(category);

    if (category == IntentCategory.OUT_OF_SCOPE
        || (policy != null && policy.disposition() == Disposition.OUT_OF_SCOPE)) {
      return PolicyDecision.deny(category, ReasonCode.OUT_OF_SCOPE, policyVersion, schemaVersion);
    }

    if (policy == null || !(intent.confidence() >= table.confidenceThreshold())) {
      return PolicyDecision.deny(category, ReasonCode.LOW_CONFIDENCE_OR_UNKNOWN_INTENT, policyVersion, schemaVersion);
    }

    if (policy.disposition() == Disposition.NO_DATA) {
      return new PolicyDecision(category, Outcome.ALLOW_NO_DATA, Set.of(), ReasonCode.ALLOWED_NO_DATA,
          policyVersion, schemaVersion);
    }

    if (identity == null) {
      return PolicyDecision.deny(category, ReasonCode.INSUFFICIENT_ENTITLEMENT, policyVersion, schemaVersion);
    }

    Set<String> scope = null;
    for (Grant g : policy.grants()) {
      if (!identity.hasAllRoles(g.requiredRoles())) continue;
      if (scope == null) {
        scope = new LinkedHashSet<>(g.resourceClasses());
      } else {
        scope.retainAll(g.resourceClasses());
      }
    }

    if (scope == null) {
      return PolicyDecision.deny(category, ReasonCode.INSUFFICIENT_ENTITLEMENT, policyVersion, schemaVersion);
    }
    if (scope.isEmpty()) {
      return PolicyDecision.deny(category, ReasonCode.NO_COMMON_SCOPE, policyVersion, schemaVersion);
    }
    return new PolicyDecision(category, Outcome.ALLOW_WITH_AUTH, scope, ReasonCode.ALLOWED, policyVersion, schemaVersion);
  }
}
