package io.intellixity.querygate.audit;

public enum AuditStage {
  CLASSIFICATION,
  DECISION,
  PLAN_GENERATION,
  VALIDATION,
  EXECUTION,
  RESPONSE
}
