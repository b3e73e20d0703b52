package io.intellixity.querygate.spi;

import io.intellixity.querygate.util.Hashes;

/** How a value of a column the identity is not entitled to is replaced in the result. */
public enum MaskingStrategy {
  REDACT {
    @Override public Object mask(Object value) { return value == null ? null : "***"; }
  },
  HASH {
    @Override public Object mask(Object value) {
      return value == null ? null : "sha256:" + Hashes.sha256Hex(String.valueOf(value)).substring(0, 12);
    }
  },
  NULLIFY {
    @Override public Object mask(Object value) { return null; }
  };

  public abstract Object mask(Object value);
}
