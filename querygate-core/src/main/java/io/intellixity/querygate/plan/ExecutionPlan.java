package io.intellixity.querygate.plan;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.List;
import java.util.Objects;

/**
 * Candidate plan for a single read against one resource of one data source.
 * <p>
 * Produced by a plan generator and therefore untrusted: it may name resources or columns that do not
 * exist, fall outside the authorized scope, or request a write verb. Only a validator may turn it
 * into something executable.
 */
@JsonSerialize(using = ExecutionPlanJsonSerializer.class)
@JsonDeserialize(using = ExecutionPlanJsonDeserializer.class)
public record ExecutionPlan(String sourceId,
                            String resource,
                            PlanOperation operation,
                            List<String> projection,
                            FilterElement filter,
                            Aggregation aggregation,
                            List<SortField> sort,
                            Integer limit) {
  public ExecutionPlan {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(resource, "resource");
    operation = operation == null ? PlanOperation.SELECT : operation;
    projection = projection == null ? List.of() : List.copyOf(projection);
    aggregation = aggregation == null ? new Aggregation(List.of(), List.of()) : aggregation;
    sort = sort == null ? List.of() : List.copyOf(sort);
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
  }

  public static ExecutionPlan select(String sourceId, String resource) {
    return new ExecutionPlan(sourceId, resource, PlanOperation.SELECT, List.of(), null, null, List.of(), null);
  }

  public ExecutionPlan withOperation(PlanOperation operation) {
    return new ExecutionPlan(sourceId, resource, operation, projection, filter, aggregation, sort, limit);
  }

  public ExecutionPlan withProjection(List<String> projection) {
    return new ExecutionPlan(sourceId, resource, operation, projection, filter, aggregation, sort, limit);
  }

  public ExecutionPlan withFilter(FilterElement filter) {
    return new ExecutionPlan(sourceId, resource, operation, projection, filter, aggregation, sort, limit);
  }

  public ExecutionPlan withAggregation(Aggregation aggregation) {
    PlanOperation op = (aggregation != null && !aggregation.isEmpty() && operation == PlanOperation.SELECT)
        ? PlanOperation.AGGREGATE
        : operation;
    return new ExecutionPlan(sourceId, resource, op, projection, filter, aggregation, sort, limit);
  }

  public ExecutionPlan withSort(List<SortField> sort) {
    return new ExecutionPlan(sourceId, resource, operation, projection, filter, aggregation, sort, limit);
  }

  public ExecutionPlan withLimit(Integer limit) {
    return new ExecutionPlan(sourceId, resource, operation, projection, filter, aggregation, sort, limit);
  }

  public boolean isAggregate() { return !aggregation.isEmpty(); }
}
