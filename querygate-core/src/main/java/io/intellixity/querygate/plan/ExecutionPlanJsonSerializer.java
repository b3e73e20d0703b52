package io.intellixity.querygate.plan;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Locale;

/** Canonical JSON serializer for {@link ExecutionPlan}. */
public final class ExecutionPlanJsonSerializer extends JsonSerializer<ExecutionPlan> {
  @Override
  public void serialize(ExecutionPlan plan, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (plan == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("source", plan.sourceId());
    g.writeStringField("resource", plan.resource());
    g.writeStringField("operation", plan.operation().name().toLowerCase(Locale.ROOT));

    if (!plan.projection().isEmpty()) {
      g.writeObjectField("projection", plan.projection());
    }

    if (plan.filter() != null) {
      g.writeFieldName("filter");
      writeElement(plan.filter(), g, serializers);
    }

    Aggregation agg = plan.aggregation();
    if (!agg.isEmpty()) {
      g.writeObjectFieldStart("groupBy");
      g.writeObjectField("fields", agg.groupBy());
      g.writeArrayFieldStart("aggregates");
      for (Aggregate a : agg.aggregates()) {
        g.writeStartObject();
        g.writeStringField("fn", a.function().name());
        if (a.field() != null) g.writeStringField("field", a.field());
        g.writeStringField("as", a.alias());
        g.writeEndObject();
      }
      g.writeEndArray();
      g.writeEndObject();
    }

    if (!plan.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : plan.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (plan.limit() != null) {
      g.writeNumberField("limit", plan.limit());
    }

    g.writeEndObject();
  }

  private static void writeElement(FilterElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (FilterElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      String opKey = c.operator().name().toLowerCase(Locale.ROOT);
      g.writeStartObject();
      g.writeObjectFieldStart(opKey);
      g.writeStringField("field", c.field());
      if (c.not()) g.writeBooleanField("not", true);
      if (c.operator() == Operator.RANGE) {
        g.writeFieldName("lower");
        serializers.defaultSerializeValue(c.lower(), g);
        g.writeFieldName("upper");
        serializers.defaultSerializeValue(c.upper(), g);
      } else if (c.operator() == Operator.IN || c.operator() == Operator.NIN) {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(c.value(), g);
      } else {
        g.writeFieldName("value");
        serializers.defaultSerializeValue(c.value(), g);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    serializers.defaultSerializeValue(el, g);
  }
}
