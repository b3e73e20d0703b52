package io.intellixity.querygate.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with a fixed backoff. Only failures accepted by the caller's predicate are retried;
 * deterministic failures (policy, validation) must never be.
 */
public record RetryPolicy(int maxRetries, Duration backoff) {
  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  public RetryPolicy {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    Objects.requireNonNull(backoff, "backoff");
    if (backoff.isNegative()) throw new IllegalArgumentException("backoff must be >= 0");
  }

  public static RetryPolicy none() {
    return new RetryPolicy(0, Duration.ZERO);
  }

  public static RetryPolicy once(Duration backoff) {
    return new RetryPolicy(1, backoff);
  }

  public <T> T call(String operation, Supplier<T> op, Predicate<RuntimeException> retryable) {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(retryable, "retryable");
    int attempt = 0;
    while (true) {
      try {
        return op.get();
      } catch (RuntimeException e) {
        if (attempt >= maxRetries || !retryable.test(e)) throw e;
        attempt++;
        log.warn("querygate.retry op={} attempt={} backoffMs={} cause={}", operation, attempt, backoff.toMillis(), e.toString());
        sleep(e);
      }
    }
  }

  private void sleep(RuntimeException pending) {
    if (backoff.isZero()) return;
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      pending.addSuppressed(ie);
      throw pending;
    }
  }
}
