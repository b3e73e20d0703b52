package io.intellixity.querygate.spi;

import io.intellixity.querygate.model.ExecutionResult;
import io.intellixity.querygate.validation.ValidatedPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The only component holding data-source capability. Accepts nothing but a {@link ValidatedPlan}.
 * <p>
 * Each call runs on a worker thread bounded by {@link ExecutionLimits#timeout()}. On timeout or
 * interruption the request's {@link CancellationToken} is cancelled so the adapter aborts the native
 * call, then the worker is interrupted. Rows past {@link ExecutionLimits#maxRows()} are dropped and the
 * result is flagged truncated. Masking runs on every result.
 */
public final class ExecutionGateway implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ExecutionGateway.class);

  private final SourceAdapterResolver adapters;
  private final ExecutionLimits limits;
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  public ExecutionGateway(SourceAdapterResolver adapters, ExecutionLimits limits) {
    this(adapters, limits, newWorkerPool(), true);
  }

  public ExecutionGateway(SourceAdapterResolver adapters, ExecutionLimits limits, ExecutorService executor) {
    this(adapters, limits, executor, false);
  }

  private ExecutionGateway(SourceAdapterResolver adapters, ExecutionLimits limits, ExecutorService executor, boolean ownsExecutor) {
    this.adapters = Objects.requireNonNull(adapters, "adapters");
    this.limits = Objects.requireNonNull(limits, "limits");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownsExecutor = ownsExecutor;
  }

  public ExecutionResult execute(ValidatedPlan plan) {
    Objects.requireNonNull(plan, "plan");
    if (!plan.plan().operation().isReadOnly()) {
      throw new IllegalStateException("Refusing non read-only operation " + plan.plan().operation());
    }
    SourceAdapter<?> adapter = adapters.resolve(plan.sourceFamily(), plan.sourceId());
    CancellationToken token = new CancellationToken();
    long t0 = System.nanoTime();

    Future<List<Map<String, Object>>> future = executor.submit(() -> translateAndRun(adapter, plan, token));
    List<Map<String, Object>> rows;
    try {
      rows = future.get(limits.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      token.cancel();
      future.cancel(true);
      log.warn("querygate.gateway timeout source={} timeoutMs={}", plan.sourceId(), limits.timeout().toMillis());
      throw new GatewayExecutionException("execution timed out after " + limits.timeout().toMillis() + "ms", true, e);
    } catch (InterruptedException e) {
      token.cancel();
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new GatewayExecutionException("execution interrupted", false, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof GatewayExecutionException ge) throw ge;
      throw new GatewayExecutionException("adapter failure: " + cause, false, cause);
    }

    boolean truncated = rows.size() > limits.maxRows();
    if (truncated) rows = rows.subList(0, limits.maxRows());

    List<Map<String, Object>> masked = adapter.applyMasking(rows, plan.snapshot(), plan.resource().name(), plan.identity());
    Set<String> maskedColumns = uncoveredColumns(plan, rows);

    if (log.isDebugEnabled()) {
      log.debug("querygate.gateway done source={} rows={} truncated={} masked={} ms={}",
          plan.sourceId(), masked.size(), truncated, maskedColumns, (System.nanoTime() - t0) / 1_000_000);
    }
    return new ExecutionResult(plan.sourceId(), plan.snapshot().version(), plan.outputColumns(), masked, truncated, maskedColumns);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private List<Map<String, Object>> translateAndRun(SourceAdapter adapter, ValidatedPlan plan, CancellationToken token) {
    token.throwIfCancelled();
    NativeStatement stmt = adapter.translate(plan);
    if (log.isDebugEnabled()) log.debug("querygate.gateway run source={} stmt={}", plan.sourceId(), stmt.describe());
    List<Map<String, Object>> rows = adapter.run(stmt, limits, token);
    return rows == null ? List.of() : rows;
  }

  private static Set<String> uncoveredColumns(ValidatedPlan plan, List<Map<String, Object>> rows) {
    Set<String> seen = new LinkedHashSet<>(plan.outputColumns());
    for (Map<String, Object> r : rows) seen.addAll(r.keySet());
    Set<String> out = new TreeSet<>();
    for (String col : seen) {
      if (!plan.entitlements().isCovered(plan.resource().column(col), plan.identity())) out.add(col);
    }
    return out;
  }

  @Override
  public void close() {
    if (ownsExecutor) executor.shutdownNow();
  }

  private static ExecutorService newWorkerPool() {
    AtomicInteger n = new AtomicInteger();
    return Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "querygate-gateway-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }
}
