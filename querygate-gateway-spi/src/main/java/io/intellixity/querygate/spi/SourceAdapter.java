package io.intellixity.querygate.spi;

import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.validation.ValidatedPlan;

import java.util.List;
import java.util.Map;

/**
 * Capability set of one data-source family. Only the {@link ExecutionGateway} calls an adapter, and
 * it only ever passes a {@link ValidatedPlan}.
 */
public interface SourceAdapter<S extends NativeStatement> {
  /** Source family this adapter serves, matching {@link SchemaSnapshot#sourceFamily()}. */
  String family();

  S translate(ValidatedPlan plan);

  /**
   * Executes read-only, honouring the timeout, fetching at most {@link ExecutionLimits#fetchSize()} rows,
   * and aborting the native call when {@code token} is cancelled. Native failures are wrapped in
   * {@link GatewayExecutionException}.
   */
  List<Map<String, Object>> run(S statement, ExecutionLimits limits, CancellationToken token);

  List<Map<String, Object>> applyMasking(List<Map<String, Object>> rows,
                                         SchemaSnapshot snapshot,
                                         String resource,
                                         Identity identity);
}
