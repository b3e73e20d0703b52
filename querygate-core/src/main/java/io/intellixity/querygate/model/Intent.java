package io.intellixity.querygate.model;

import java.util.Objects;

/**
 * Advisory classification of a query. Carries no capability; downstream code only reads
 * {@link #category()} and {@link #confidence()}.
 */
public record Intent(IntentCategory category, double confidence, String rationale) {
  public Intent {
    Objects.requireNonNull(category, "category");
    if (Double.isNaN(confidence)) confidence = 0.0;
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    rationale = rationale == null ? "" : rationale;
  }

  /** Fail-closed result used on timeout, model error or malformed output. */
  public static Intent failClosed(String rationale) {
    return new Intent(IntentCategory.OUT_OF_SCOPE, 0.0, rationale);
  }
}
