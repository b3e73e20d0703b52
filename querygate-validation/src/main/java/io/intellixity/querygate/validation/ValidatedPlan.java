package io.intellixity.querygate.validation;

import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.model.PolicyDecision;
import io.intellixity.querygate.plan.ExecutionPlan;
import io.intellixity.querygate.schema.ResourceDef;
import io.intellixity.querygate.schema.SchemaSnapshot;

import java.util.List;

/**
 * A plan proven to reference only existing, in-scope, entitlement-covered columns of the snapshot it
 * was checked against. The constructor is package-private: {@link PlanValidator} is the only producer.
 * <p>
 * The pinned snapshot travels with the plan so that execution and masking use exactly the version
 * that validation saw.
 */
public final class ValidatedPlan {
  private final ExecutionPlan plan;
  private final SchemaSnapshot snapshot;
  private final ResourceDef resource;
  private final PolicyDecision decision;
  private final Identity identity;
  private final List<String> outputColumns;
  private final SensitivityEntitlements entitlements;
  private final String fingerprint;

  ValidatedPlan(ExecutionPlan plan,
                SchemaSnapshot snapshot,
                ResourceDef resource,
                PolicyDecision decision,
                Identity identity,
                List<String> outputColumns,
                SensitivityEntitlements entitlements,
                String fingerprint) {
    this.plan = plan;
    this.snapshot = snapshot;
    this.resource = resource;
    this.decision = decision;
    this.identity = identity;
    this.outputColumns = List.copyOf(outputColumns);
    this.entitlements = entitlements;
    this.fingerprint = fingerprint;
  }

  /** The plan as validated; an empty projection has already been expanded. */
  public ExecutionPlan plan() { return plan; }
  public SchemaSnapshot snapshot() { return snapshot; }
  public ResourceDef resource() { return resource; }
  public PolicyDecision decision() { return decision; }
  public Identity identity() { return identity; }
  /** Result column names in output order (projection, or group keys followed by aggregate aliases). */
  public List<String> outputColumns() { return outputColumns; }
  public SensitivityEntitlements entitlements() { return entitlements; }
  /** SHA-256 of the canonical plan JSON. */
  public String fingerprint() { return fingerprint; }

  public String sourceId() { return plan.sourceId(); }
  public String sourceFamily() { return snapshot.sourceFamily(); }

  @Override
  public String toString() {
    return "ValidatedPlan[" + plan.sourceId() + "/" + plan.resource() + "@" + snapshot.version() + " " + fingerprint + "]";
  }
}
