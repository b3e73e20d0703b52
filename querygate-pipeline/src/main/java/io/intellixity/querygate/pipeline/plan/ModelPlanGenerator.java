package io.intellixity.querygate.pipeline.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querygate.model.Intent;
import io.intellixity.querygate.model.UserQuery;
import io.intellixity.querygate.pipeline.model.ModelClient;
import io.intellixity.querygate.pipeline.model.ModelClientException;
import io.intellixity.querygate.pipeline.model.ModelOutputs;
import io.intellixity.querygate.plan.ExecutionPlan;
import io.intellixity.querygate.schema.ColumnDef;
import io.intellixity.querygate.schema.ResourceDef;
import io.intellixity.querygate.schema.SchemaCatalog;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.schema.SchemaSnapshotNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Asks a language model for a plan in the JSON plan format and parses it with the plan codec.
 * <p>
 * The prompt lists the resources whose class is in the authorized scope, with column names and types.
 * Sensitivity tags are not disclosed.
 */
public final class ModelPlanGenerator implements PlanGenerator {
  private static final Logger log = LoggerFactory.getLogger(ModelPlanGenerator.class);

  static final String INSTRUCTIONS = String.join("\n",
      "Translate the request into one read-only query plan over the resources listed.",
      "Answer with JSON only, in this shape:",
      "{\"source\": \"<data source id>\", \"resource\": \"<resource>\", \"operation\": \"SELECT\",",
      " \"projection\": [\"col\", ...],",
      " \"filter\": {\"and\": [{\"eq\": {\"field\": \"col\", \"value\": \"v\"}}]},",
      " \"groupBy\": {\"fields\": [\"col\"], \"aggregates\": [{\"fn\": \"SUM\", \"field\": \"col\", \"as\": \"alias\"}]},",
      " \"sort\": [{\"field\": \"col\", \"dir\": \"DESC\"}], \"limit\": 100}",
      "Operators: eq, ne, gt, ge, lt, le, in, nin, range (lower/upper), like. Omit keys you do not need.");

  private final ModelClient model;
  private final ObjectMapper mapper;
  private final SchemaCatalog catalog;
  private final List<String> dataSourceIds;

  public ModelPlanGenerator(ModelClient model, ObjectMapper mapper, SchemaCatalog catalog, Collection<String> dataSourceIds) {
    this.model = Objects.requireNonNull(model, "model");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.dataSourceIds = List.copyOf(dataSourceIds);
  }

  @Override
  public ExecutionPlan generate(UserQuery query, Intent intent, Set<String> authorizedScope) {
    String input = describeScope(authorizedScope) + "\nRequest:\n" + query.text();
    String raw;
    try {
      raw = model.complete(INSTRUCTIONS, input);
    } catch (ModelClientException e) {
      throw new PlanGenerationException("plan model failure: " + e.getMessage(), e);
    }
    try {
      String json = ModelOutputs.extractJsonObject(raw);
      ExecutionPlan plan = mapper.readValue(json, ExecutionPlan.class);
      if (log.isDebugEnabled()) {
        log.debug("querygate.plan generated requestId={} source={} resource={} op={}",
            query.requestId(), plan.sourceId(), plan.resource(), plan.operation());
      }
      return plan;
    } catch (ModelClientException | IllegalArgumentException | NullPointerException e) {
      throw new PlanGenerationException("unparseable plan: " + e.getMessage(), e);
    } catch (JsonProcessingException e) {
      throw new PlanGenerationException("unparseable plan: " + e.getOriginalMessage(), e);
    }
  }

  String describeScope(Set<String> authorizedScope) {
    StringBuilder sb = new StringBuilder("Resources:\n");
    for (String id : dataSourceIds) {
      SchemaSnapshot s;
      try {
        s = catalog.getSnapshot(id);
      } catch (SchemaSnapshotNotFoundException e) {
        log.warn("querygate.plan missing snapshot dataSource={}", id);
        continue;
      }
      for (ResourceDef r : s.resources().values()) {
        if (!authorizedScope.contains(r.resourceClass())) continue;
        sb.append("- ").append(id).append('.').append(r.name()).append(" (");
        List<String> cols = new ArrayList<>();
        for (ColumnDef c : r.columns().values()) cols.add(c.name() + " " + c.type());
        sb.append(String.join(", ", cols)).append(")\n");
      }
    }
    return sb.toString();
  }
}
