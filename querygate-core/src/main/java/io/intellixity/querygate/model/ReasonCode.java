package io.intellixity.querygate.model;

/** Reason attached to every policy decision and to terminal pipeline failures. */
public enum ReasonCode {
  ALLOWED_NO_DATA("general knowledge only"),
  ALLOWED("authorized"),
  LOW_CONFIDENCE_OR_UNKNOWN_INTENT("low-confidence/unknown intent"),
  INSUFFICIENT_ENTITLEMENT("insufficient entitlement"),
  OUT_OF_SCOPE("out of scope"),
  NO_COMMON_SCOPE("conflicting grants left no authorized scope"),
  PLAN_REJECTED("request could not be completed"),
  EXECUTION_FAILED("execution failed");

  private final String description;

  ReasonCode(String description) {
    this.description = description;
  }

  public String description() { return description; }
}
