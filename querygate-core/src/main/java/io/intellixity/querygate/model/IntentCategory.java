package io.intellixity.querygate.model;

import java.util.Locale;

/** Closed set of intent categories a classifier may emit. */
public enum IntentCategory {
  SAFE_KNOWLEDGE,
  DATA_QUERY,
  ANALYSIS,
  OUT_OF_SCOPE;

  /** Parses a label; anything outside the set resolves to {@link #OUT_OF_SCOPE}. */
  public static IntentCategory parseOrOutOfScope(String label) {
    if (label == null || label.isBlank()) return OUT_OF_SCOPE;
    try {
      return valueOf(label.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return OUT_OF_SCOPE;
    }
  }
}
