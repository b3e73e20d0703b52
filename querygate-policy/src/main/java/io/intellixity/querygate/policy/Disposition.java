package io.intellixity.querygate.policy;

/** How the policy table treats an intent category. */
public enum Disposition {
  /** Answer from general knowledge only; no resource scope is ever granted. */
  NO_DATA,
  /** Data access allowed for identities holding a matching grant. */
  REQUIRES_AUTHORIZATION,
  /** Always denied; no role can override it. */
  OUT_OF_SCOPE
}
