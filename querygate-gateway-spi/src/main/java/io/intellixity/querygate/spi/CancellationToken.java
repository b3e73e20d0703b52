package io.intellixity.querygate.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Request-scoped cancellation signal. Adapters register a hook that aborts the in-flight native call
 * (JDBC {@code Statement.cancel()}, closing a Mongo cursor). A hook registered after cancellation
 * runs immediately.
 */
public final class CancellationToken {
  private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

  private final List<Runnable> hooks = new ArrayList<>();
  private boolean cancelled;

  public void onCancel(Runnable hook) {
    Objects.requireNonNull(hook, "hook");
    boolean runNow;
    synchronized (this) {
      runNow = cancelled;
      if (!runNow) hooks.add(hook);
    }
    if (runNow) runHook(hook);
  }

  public void cancel() {
    List<Runnable> toRun;
    synchronized (this) {
      if (cancelled) return;
      cancelled = true;
      toRun = new ArrayList<>(hooks);
      hooks.clear();
    }
    // hooks may block on the driver; never run them under the monitor
    for (Runnable h : toRun) runHook(h);
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public void throwIfCancelled() {
    if (isCancelled()) throw new GatewayExecutionException("execution cancelled", true, null);
  }

  private static void runHook(Runnable hook) {
    try {
      hook.run();
    } catch (RuntimeException e) {
      log.warn("querygate.gateway cancel hook failed: {}", e.toString());
    }
  }
}
