package io.intellixity.querygate.spi;

import java.time.Duration;
import java.util.Objects;

/** Per-request bounds every adapter must enforce. */
public record ExecutionLimits(Duration timeout, int maxRows) {
  public ExecutionLimits {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be > 0");
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
  }

  /** Rows an adapter should fetch: one past the cap so truncation is detectable. */
  public int fetchSize() {
    return maxRows == Integer.MAX_VALUE ? maxRows : maxRows + 1;
  }

  /** Whole seconds, at least one, for drivers that only take seconds. */
  public int timeoutSeconds() {
    long s = timeout.toSeconds();
    if (timeout.toMillis() % 1000 != 0) s++;
    return (int) Math.max(1, Math.min(Integer.MAX_VALUE, s));
  }
}
