package io.intellixity.querygate.pipeline;

import io.intellixity.querygate.audit.AuditStage;
import io.intellixity.querygate.audit.AuditTrail;
import io.intellixity.querygate.model.*;
import io.intellixity.querygate.pipeline.intent.IntentClassifier;
import io.intellixity.querygate.pipeline.plan.PlanGenerator;
import io.intellixity.querygate.pipeline.response.ResponseSynthesizer;
import io.intellixity.querygate.plan.ExecutionPlan;
import io.intellixity.querygate.policy.PolicyDecisionEngine;
import io.intellixity.querygate.policy.PolicyTable;
import io.intellixity.querygate.policy.PolicyTableSource;
import io.intellixity.querygate.schema.SchemaCatalog;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.schema.SchemaSnapshotNotFoundException;
import io.intellixity.querygate.spi.ExecutionGateway;
import io.intellixity.querygate.spi.GatewayExecutionException;
import io.intellixity.querygate.validation.PlanValidationException;
import io.intellixity.querygate.validation.PlanValidator;
import io.intellixity.querygate.validation.ValidatedPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Runs one query through classify, decide, plan, validate, execute and respond.
 * <p>
 * The policy decision is the only gate to data: nothing past {@code decide} runs unless the outcome is
 * {@link Outcome#ALLOW_WITH_AUTH}, and nothing reaches the gateway without a {@link ValidatedPlan}.
 * Every stage reached leaves one record in the request's audit chain; audit summaries carry names,
 * counts and hashes, never row values or query text.
 */
public final class IntentGatedPipeline {
  private static final Logger log = LoggerFactory.getLogger(IntentGatedPipeline.class);

  private final IntentClassifier classifier;
  private final PolicyDecisionEngine policyEngine;
  private final PolicyTableSource policySource;
  private final PlanGenerator planGenerator;
  private final SchemaCatalog catalog;
  private final PlanValidator validator;
  private final ExecutionGateway gateway;
  private final ResponseSynthesizer synthesizer;
  private final AuditTrail audit;
  private final RetryPolicy executionRetry;
  private final Clock clock;

  private IntentGatedPipeline(Builder b) {
    this.classifier = Objects.requireNonNull(b.classifier, "classifier");
    this.policyEngine = Objects.requireNonNull(b.policyEngine, "policyEngine");
    this.policySource = Objects.requireNonNull(b.policySource, "policySource");
    this.planGenerator = Objects.requireNonNull(b.planGenerator, "planGenerator");
    this.catalog = Objects.requireNonNull(b.catalog, "catalog");
    this.validator = b.validator == null ? new PlanValidator() : b.validator;
    this.gateway = Objects.requireNonNull(b.gateway, "gateway");
    this.synthesizer = Objects.requireNonNull(b.synthesizer, "synthesizer");
    this.audit = Objects.requireNonNull(b.audit, "audit");
    this.executionRetry = b.executionRetry == null ? RetryPolicy.none() : b.executionRetry;
    this.clock = b.clock == null ? Clock.systemUTC() : b.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  public PipelineResponse handle(UserQuery query) {
    Objects.requireNonNull(query, "query");
    Identity identity = query.identity();
    AuditTrail.RequestAudit trail = audit.forRequest(query.requestId());

    Intent intent = classify(query);
    trail.record(AuditStage.CLASSIFICATION, Map.of(
        "category", intent.category().name(),
        "confidence", intent.confidence()), identity, clock.instant());

    PolicyDecision decision = decide(intent, identity);
    trail.record(AuditStage.DECISION, decisionSummary(decision), identity, clock.instant());
    log.debug("querygate.pipeline op=decide requestId={} category={} outcome={} reason={}",
        query.requestId(), intent.category(), decision.outcome(), decision.reasonCode());

    if (decision.outcome() != Outcome.ALLOW_WITH_AUTH) {
      return respond(trail, query, decision, null);
    }

    ExecutionPlan plan;
    try {
      plan = planGenerator.generate(query, intent, decision.authorizedScope());
      Objects.requireNonNull(plan, "plan");
    } catch (RuntimeException e) {
      trail.record(AuditStage.PLAN_GENERATION, Map.of("status", "FAILED", "error", e.getClass().getSimpleName()),
          identity, clock.instant());
      log.warn("querygate.pipeline op=plan requestId={} status=failed cause={}", query.requestId(), e.toString());
      return respond(trail, query, rejected(decision, ReasonCode.PLAN_REJECTED), null);
    }
    trail.record(AuditStage.PLAN_GENERATION, Map.of(
        "status", "OK",
        "sourceId", plan.sourceId(),
        "resource", plan.resource(),
        "operation", plan.operation().name()), identity, clock.instant());

    ValidatedPlan validated;
    try {
      SchemaSnapshot pinned = catalog.getSnapshot(plan.sourceId());
      validated = validator.validate(plan, pinned, decision, identity);
    } catch (PlanValidationException e) {
      trail.record(AuditStage.VALIDATION, Map.of("status", "REJECTED", "error", e.error().name()),
          identity, clock.instant());
      log.info("querygate.pipeline op=validate requestId={} status=rejected error={}", query.requestId(), e.error());
      return respond(trail, query, rejected(decision, ReasonCode.PLAN_REJECTED), null);
    } catch (SchemaSnapshotNotFoundException e) {
      trail.record(AuditStage.VALIDATION, Map.of("status", "REJECTED", "error", "UNKNOWN_SOURCE"),
          identity, clock.instant());
      log.info("querygate.pipeline op=validate requestId={} status=rejected error=UNKNOWN_SOURCE", query.requestId());
      return respond(trail, query, rejected(decision, ReasonCode.PLAN_REJECTED), null);
    }
    trail.record(AuditStage.VALIDATION, Map.of(
        "status", "OK",
        "fingerprint", validated.fingerprint(),
        "snapshotVersion", validated.snapshot().version()), identity, clock.instant());

    ExecutionResult result;
    try {
      result = executionRetry.call("execute", () -> gateway.execute(validated), IntentGatedPipeline::isTransient);
    } catch (RuntimeException e) {
      trail.record(AuditStage.EXECUTION, Map.of(
          "status", "FAILED",
          "transient", isTransient(e),
          "error", e.getClass().getSimpleName()), identity, clock.instant());
      log.warn("querygate.pipeline op=execute requestId={} status=failed fingerprint={} cause={}",
          query.requestId(), validated.fingerprint(), e.toString());
      return respond(trail, query, rejected(decision, ReasonCode.EXECUTION_FAILED), null);
    }
    trail.record(AuditStage.EXECUTION, Map.of(
        "status", "OK",
        "sourceId", result.sourceId(),
        "rowCount", result.rowCount(),
        "truncated", result.truncated(),
        "maskedColumns", new ArrayList<>(new TreeSet<>(result.maskedColumns()))), identity, clock.instant());

    return respond(trail, query, decision, result);
  }

  private Intent classify(UserQuery query) {
    try {
      Intent intent = classifier.classify(query.text(), query.context());
      return intent == null ? Intent.failClosed("classifier returned nothing") : intent;
    } catch (RuntimeException e) {
      log.warn("querygate.pipeline op=classify requestId={} status=failed cause={}", query.requestId(), e.toString());
      return Intent.failClosed("classifier failed: " + e.getClass().getSimpleName());
    }
  }

  private PolicyDecision decide(Intent intent, Identity identity) {
    PolicyTable table = policySource.current();
    return policyEngine.decide(intent, identity, table, catalog.catalogVersion());
  }

  private PipelineResponse respond(AuditTrail.RequestAudit trail, UserQuery query, PolicyDecision decision,
                                   ExecutionResult result) {
    String text = synthesizer.synthesize(decision, result, query);
    trail.record(AuditStage.RESPONSE, Map.of(
        "outcome", decision.outcome().name(),
        "reasonCode", decision.reasonCode().name(),
        "length", text.length()), query.identity(), clock.instant());
    return new PipelineResponse(text, decision.outcome(), decision.reasonCode(), trail.requestId());
  }

  private static PolicyDecision rejected(PolicyDecision allowed, ReasonCode reason) {
    return PolicyDecision.deny(allowed.category(), reason, allowed.policyVersion(), allowed.schemaVersion());
  }

  private static Map<String, Object> decisionSummary(PolicyDecision d) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("outcome", d.outcome().name());
    m.put("reasonCode", d.reasonCode().name());
    m.put("category", d.category() == null ? "NONE" : d.category().name());
    m.put("policyVersion", d.policyVersion());
    m.put("schemaVersion", d.schemaVersion());
    m.put("authorizedScope", new ArrayList<>(new TreeSet<>(d.authorizedScope())));
    return m;
  }

  private static boolean isTransient(RuntimeException e) {
    return e instanceof GatewayExecutionException g && g.isTransient();
  }

  public static final class Builder {
    private IntentClassifier classifier;
    private PolicyDecisionEngine policyEngine;
    private PolicyTableSource policySource;
    private PlanGenerator planGenerator;
    private SchemaCatalog catalog;
    private PlanValidator validator;
    private ExecutionGateway gateway;
    private ResponseSynthesizer synthesizer;
    private AuditTrail audit;
    private RetryPolicy executionRetry;
    private Clock clock;

    private Builder() {}

    public Builder classifier(IntentClassifier v) { this.classifier = v; return this; }
    public Builder policyEngine(PolicyDecisionEngine v) { this.policyEngine = v; return this; }
    public Builder policySource(PolicyTableSource v) { this.policySource = v; return this; }
    public Builder planGenerator(PlanGenerator v) { this.planGenerator = v; return this; }
    public Builder catalog(SchemaCatalog v) { this.catalog = v; return this; }
    public Builder validator(PlanValidator v) { this.validator = v; return this; }
    public Builder gateway(ExecutionGateway v) { this.gateway = v; return this; }
    public Builder synthesizer(ResponseSynthesizer v) { this.synthesizer = v; return this; }
    public Builder audit(AuditTrail v) { this.audit = v; return this; }
    public Builder executionRetry(RetryPolicy v) { this.executionRetry = v; return this; }
    public Builder clock(Clock v) { this.clock = v; return this; }

    public IntentGatedPipeline build() {
      return new IntentGatedPipeline(this);
    }
  }
}
