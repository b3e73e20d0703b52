package io.intellixity.querygate.validation;

/** Why a candidate plan was rejected, in the order the checks run. */
public enum PlanValidationError {
  UNKNOWN_RESOURCE,
  SCOPE_VIOLATION,
  ENTITLEMENT_MISSING,
  UNSUPPORTED_OPERATION
}
