package io.intellixity.querygate.validation;

import java.util.Objects;

/**
 * Raised when a candidate plan fails validation.
 * <p>
 * The message names schema objects and is meant for the audit trail only, never for the caller.
 */
public final class PlanValidationException extends RuntimeException {
  private final PlanValidationError error;

  public PlanValidationException(PlanValidationError error, String message) {
    super(error + ": " + message);
    this.error = Objects.requireNonNull(error, "error");
  }

  public PlanValidationError error() { return error; }
}
