package io.intellixity.querygate.plan;

import java.util.Locale;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  RANGE,
  LIKE;

  /** Lenient lookup used by the plan parser; returns null for anything unknown. */
  public static Operator tryParse(String key) {
    if (key == null) return null;
    try {
      return valueOf(key.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
