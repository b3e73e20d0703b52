package io.intellixity.querygate.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.model.Outcome;
import io.intellixity.querygate.model.PolicyDecision;
import io.intellixity.querygate.plan.*;
import io.intellixity.querygate.schema.ColumnDef;
import io.intellixity.querygate.schema.ResourceDef;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.util.Hashes;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Checks a candidate plan against a pinned schema snapshot, the policy decision and the identity.
 * <p>
 * Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>{@link PlanValidationError#UNKNOWN_RESOURCE}: source, resource and every referenced column exist</li>
 *   <li>{@link PlanValidationError#SCOPE_VIOLATION}: the resource class is in the decision's scope</li>
 *   <li>{@link PlanValidationError#ENTITLEMENT_MISSING}: every referenced sensitive column is covered</li>
 *   <li>{@link PlanValidationError#UNSUPPORTED_OPERATION}: the verb is read-only and well formed, filter
 *   operands are scalars, the limit is positive and aggregate aliases are plain identifiers that shadow no column</li>
 * </ol>
 * An empty projection on a non-aggregate plan is expanded to the columns the identity may read;
 * sensitive columns are left out rather than rejected because the caller never named them.
 */
public final class PlanValidator {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final Pattern ALIAS = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final SensitivityEntitlements entitlements;

  public PlanValidator() {
    this(SensitivityEntitlements.identity());
  }

  public PlanValidator(SensitivityEntitlements entitlements) {
    this.entitlements = Objects.requireNonNull(entitlements, "entitlements");
  }

  public ValidatedPlan validate(ExecutionPlan plan, SchemaSnapshot snapshot, PolicyDecision decision, Identity identity) {
    Objects.requireNonNull(plan, "plan");
    Objects.requireNonNull(snapshot, "snapshot");

    // (a) existence
    if (!snapshot.dataSourceId().equals(plan.sourceId())) {
      throw new PlanValidationException(PlanValidationError.UNKNOWN_RESOURCE,
          "unknown data source '" + plan.sourceId() + "'");
    }
    ResourceDef resource = snapshot.resource(plan.resource());
    if (resource == null) {
      throw new PlanValidationException(PlanValidationError.UNKNOWN_RESOURCE,
          "unknown resource '" + plan.resource() + "' in " + snapshot.dataSourceId() + "@" + snapshot.version());
    }
    Map<String, Set<String>> refs = PlanReferences.columnsOf(plan);
    for (Map.Entry<String, Set<String>> e : refs.entrySet()) {
      if (e.getKey().isBlank()) {
        throw new PlanValidationException(PlanValidationError.UNKNOWN_RESOURCE,
            "blank column in " + e.getValue() + " of '" + resource.name() + "'");
      }
      if (resource.column(e.getKey()) == null) {
        throw new PlanValidationException(PlanValidationError.UNKNOWN_RESOURCE,
            "unknown column '" + e.getKey() + "' in " + e.getValue() + " of '" + resource.name() + "'");
      }
    }

    // (b) scope
    if (decision == null || decision.outcome() != Outcome.ALLOW_WITH_AUTH) {
      throw new PlanValidationException(PlanValidationError.SCOPE_VIOLATION,
          "decision " + (decision == null ? "<none>" : decision.outcome()) + " grants no data scope");
    }
    if (!decision.authorizedScope().contains(resource.resourceClass())) {
      throw new PlanValidationException(PlanValidationError.SCOPE_VIOLATION,
          "resource '" + resource.name() + "' of class '" + resource.resourceClass() + "' outside scope " + decision.authorizedScope());
    }

    // (c) column entitlements
    for (String column : refs.keySet()) {
      Set<String> missing = entitlements.uncoveredTags(resource.column(column), identity);
      if (!missing.isEmpty()) {
        throw new PlanValidationException(PlanValidationError.ENTITLEMENT_MISSING,
            "column '" + resource.name() + "." + column + "' tagged " + missing + " not covered for user '"
                + (identity == null ? "<none>" : identity.userId()) + "'");
      }
    }

    // (d) read-only, well-formed operation
    PlanOperation op = plan.operation();
    if (!op.isReadOnly()) {
      throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION,
          "operation " + op + " is not read-only");
    }
    if (op == PlanOperation.AGGREGATE && plan.aggregation().aggregates().isEmpty() && plan.aggregation().groupBy().isEmpty()) {
      throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION,
          "AGGREGATE without group keys or aggregates");
    }
    if (plan.limit() != null && plan.limit() == 0) {
      throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION, "limit must be positive");
    }
    checkAliases(plan, resource);
    checkValues(plan.filter());
    for (SortField sf : plan.sort()) {
      if (plan.isAggregate() && !plan.aggregation().groupBy().contains(sf.field())
          && !PlanReferences.isAggregateAlias(plan, sf.field())) {
        throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION,
            "sort key '" + sf.field() + "' is neither a group key nor an aggregate");
      }
    }

    ExecutionPlan effective = plan;
    List<String> outputColumns;
    if (plan.isAggregate()) {
      effective = plan.withOperation(PlanOperation.AGGREGATE).withProjection(List.of());
      outputColumns = new ArrayList<>(plan.aggregation().groupBy());
      for (Aggregate a : plan.aggregation().aggregates()) outputColumns.add(a.alias());
    } else {
      List<String> projection = plan.projection().isEmpty() ? readableColumns(resource, identity) : plan.projection();
      if (projection.isEmpty()) {
        throw new PlanValidationException(PlanValidationError.ENTITLEMENT_MISSING,
            "no readable columns in '" + resource.name() + "'");
      }
      effective = plan.withProjection(projection);
      outputColumns = projection;
    }

    return new ValidatedPlan(effective, snapshot, resource, decision, identity, outputColumns, entitlements,
        fingerprint(effective));
  }

  private static void checkAliases(ExecutionPlan plan, ResourceDef resource) {
    Set<String> seen = new HashSet<>();
    for (Aggregate a : plan.aggregation().aggregates()) {
      String alias = a.alias();
      if (!ALIAS.matcher(alias).matches()) {
        throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION,
            "aggregate alias '" + alias + "' is not a plain identifier");
      }
      if (resource.column(alias) != null) {
        throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION,
            "aggregate alias '" + alias + "' shadows a column of '" + resource.name() + "'");
      }
      if (!seen.add(alias)) {
        throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION,
            "duplicate aggregate alias '" + alias + "'");
      }
    }
  }

  /** Filter operands must be scalars; only IN and NIN take a list, and only of scalars. */
  private static void checkValues(FilterElement el) {
    if (el == null) return;
    if (el instanceof NotElement n) {
      checkValues(n.element());
    } else if (el instanceof LogicalGroup g) {
      for (FilterElement c : g.elements()) checkValues(c);
    } else if (el instanceof Condition c) {
      if (c.operator() == Operator.IN || c.operator() == Operator.NIN) {
        if (c.value() instanceof Collection<?> values) {
          for (Object v : values) requireScalar(c, v);
        } else {
          requireScalar(c, c.value());
        }
      } else {
        requireScalar(c, c.value());
        requireScalar(c, c.lower());
        requireScalar(c, c.upper());
      }
    }
  }

  private static void requireScalar(Condition c, Object v) {
    if (v instanceof Map<?, ?> || v instanceof Collection<?> || (v != null && v.getClass().isArray())) {
      throw new PlanValidationException(PlanValidationError.UNSUPPORTED_OPERATION,
          "non-scalar operand for " + c.operator() + " on '" + c.field() + "'");
    }
  }

  private List<String> readableColumns(ResourceDef resource, Identity identity) {
    List<String> out = new ArrayList<>();
    for (ColumnDef c : resource.columns().values()) {
      if (entitlements.isCovered(c, identity)) out.add(c.name());
    }
    return out;
  }

  private static String fingerprint(ExecutionPlan plan) {
    try {
      return Hashes.sha256Hex(JSON.writeValueAsBytes(plan));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Plan is not serializable", e);
    }
  }
}
