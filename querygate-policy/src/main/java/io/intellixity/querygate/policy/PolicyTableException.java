package io.intellixity.querygate.policy;

/** Raised when a policy table is malformed or cannot be loaded. */
public final class PolicyTableException extends RuntimeException {
  public PolicyTableException(String message) {
    super(message);
  }

  public PolicyTableException(String message, Throwable cause) {
    super(message, cause);
  }
}
