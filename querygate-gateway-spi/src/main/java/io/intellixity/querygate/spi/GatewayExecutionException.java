package io.intellixity.querygate.spi;

/**
 * Adapter, network or timeout failure while executing a validated plan. The message may contain native
 * error detail and is logged, never returned to the caller.
 */
public class GatewayExecutionException extends RuntimeException {
  private final boolean transientFailure;

  public GatewayExecutionException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  /** True for timeouts and connectivity errors that may succeed on a retry. */
  public boolean isTransient() { return transientFailure; }
}
