package io.intellixity.querygate.model;

import java.util.Objects;
import java.util.Set;

/**
 * Verdict for one query. {@code authorizedScope} lists the resource classes a validated plan may
 * touch and is empty for anything other than {@link Outcome#ALLOW_WITH_AUTH}.
 */
public record PolicyDecision(IntentCategory category,
                             Outcome outcome,
                             Set<String> authorizedScope,
                             ReasonCode reasonCode,
                             long policyVersion,
                             long schemaVersion) {
  public PolicyDecision {
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(reasonCode, "reasonCode");
    authorizedScope = (authorizedScope == null || outcome != Outcome.ALLOW_WITH_AUTH) ? Set.of() : Set.copyOf(authorizedScope);
  }

  public static PolicyDecision deny(IntentCategory category, ReasonCode reason, long policyVersion, long schemaVersion) {
    return new PolicyDecision(category, Outcome.DENY, Set.of(), reason, policyVersion, schemaVersion);
  }
}
