package io.intellixity.querygate.pipeline.plan;

/** The generator could not produce a parseable plan. */
public class PlanGenerationException extends RuntimeException {
  public PlanGenerationException(String message) {
    super(message);
  }

  public PlanGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
