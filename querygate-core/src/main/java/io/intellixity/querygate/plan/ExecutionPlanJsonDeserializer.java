package io.intellixity.querygate.plan;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link ExecutionPlan}.
 * <p>
 * Strict on structure (unknown filter operators or aggregate functions fail the parse) and lenient on
 * the operation verb, which is mapped through {@link PlanOperation#parse(String)} so that write verbs
 * survive parsing and are rejected later by validation.
 */
public final class ExecutionPlanJsonDeserializer extends JsonDeserializer<ExecutionPlan> {
  @Override
  public ExecutionPlan deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Plan JSON must be an object");

    String source = textOrNull(root.get("source"));
    if (source == null) source = textOrNull(root.get("sourceId"));
    String resource = textOrNull(root.get("resource"));
    if (source == null || source.isBlank()) throw new IllegalArgumentException("Plan requires 'source'");
    if (resource == null || resource.isBlank()) throw new IllegalArgumentException("Plan requires 'resource'");

    PlanOperation op = PlanOperation.parse(textOrNull(root.get("operation")));

    List<String> projection = new ArrayList<>();
    JsonNode proj = root.get("projection");
    if (proj != null && proj.isArray()) {
      for (JsonNode x : proj) if (x.isTextual()) projection.add(x.asText());
    }

    FilterElement filter = null;
    JsonNode f = root.get("filter");
    if (f != null && !f.isNull()) filter = parseElement(f, codec);

    Aggregation aggregation = null;
    JsonNode gb = root.get("groupBy");
    if (gb != null && gb.isObject()) aggregation = parseAggregation(gb);

    List<SortField> sort = new ArrayList<>();
    JsonNode s = root.get("sort");
    if (s != null && s.isArray()) {
      for (JsonNode x : s) {
        if (!x.isObject()) continue;
        String field = textOrNull(x.get("field"));
        String dir = textOrNull(x.get("dir"));
        if (field == null) continue;
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        sort.add(new SortField(field, d));
      }
    }

    Integer limit = null;
    JsonNode l = root.get("limit");
    if (l != null && !l.isNull()) limit = l.isNumber() ? l.intValue() : Integer.parseInt(l.asText());

    ExecutionPlan plan = new ExecutionPlan(source, resource, op, projection, filter, null, sort, limit);
    return aggregation == null ? plan : plan.withAggregation(aggregation);
  }

  private static Aggregation parseAggregation(JsonNode gb) {
    List<String> fields = new ArrayList<>();
    JsonNode f = gb.get("fields");
    if (f != null && f.isArray()) {
      for (JsonNode x : f) if (x.isTextual()) fields.add(x.asText());
    }
    List<Aggregate> aggregates = new ArrayList<>();
    JsonNode a = gb.get("aggregates");
    if (a != null && a.isArray()) {
      for (JsonNode x : a) {
        String fn = textOrNull(x.get("fn"));
        if (fn == null) throw new IllegalArgumentException("aggregate requires 'fn'");
        AggregateFunction function;
        try {
          function = AggregateFunction.valueOf(fn.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Unsupported aggregate function: " + fn, e);
        }
        aggregates.add(new Aggregate(function, textOrNull(x.get("field")), textOrNull(x.get("as"))));
      }
    }
    return new Aggregation(fields, aggregates);
  }

  private static FilterElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new IllegalArgumentException("Unsupported filter element: " + n);

    // Group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.has("and")) return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    if (n.has("or")) return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));

    // NOT form: { "not": <element> }
    if (n.has("not")) {
      FilterElement child = parseElement(n.get("not"), codec);
      if (child == null) return null;
      return new NotElement(child);
    }

    // Condition form: { "eq": { field:..., value:..., not?:... } }
    Iterator<String> it = n.fieldNames();
    if (!it.hasNext()) throw new IllegalArgumentException("Empty filter element");
    String k = it.next();
    Operator op = Operator.tryParse(k);
    if (op == null) throw new IllegalArgumentException("Unsupported filter operator: " + k);
    JsonNode body = n.get(k);
    if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
    return parseCondition(op, body, codec);
  }

  private static List<FilterElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<FilterElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      FilterElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static FilterElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new IllegalArgumentException(op + " requires field");
    boolean not = body.has("not") && body.get("not").asBoolean(false);

    if (op == Operator.RANGE) {
      Object lower = decodeValue(body.get("lower"), codec);
      Object upper = decodeValue(body.get("upper"), codec);
      return new Condition(field, op, null, lower, upper, not);
    }
    if (op == Operator.IN || op == Operator.NIN) {
      return new Condition(field, op, decodeValue(body.get("values"), codec), null, null, not);
    }
    return new Condition(field, op, decodeValue(body.get("value"), codec), null, null, not);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
