package io.intellixity.querygate.mongo;

import io.intellixity.querygate.plan.*;
import org.bson.Document;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders a read-only plan to a find or an aggregation pipeline.
 * <p>
 * Filters apply De Morgan for NOT groups and wrap negated conditions in {@code $nor}. SQL LIKE
 * patterns become anchored regexes. Grouped plans render as {@code $match, $group, $project, $sort,
 * $limit}, exposing group keys and aggregate aliases as top-level fields.
 */
final class MongoPlanRenderer {
  private MongoPlanRenderer() {}

  static MongoStatement render(ExecutionPlan plan) {
    Objects.requireNonNull(plan, "plan");
    Document filter = toBson(plan.filter());
    Document sort = sortDoc(plan.sort());

    if (!plan.isAggregate()) {
      Document projection = new Document();
      for (String p : plan.projection()) projection.append(p, 1);
      if (!plan.projection().contains("_id")) projection.append("_id", 0);
      return new MongoStatement(MongoStatement.Kind.FIND, plan.resource(), filter, projection, null, sort, plan.limit());
    }

    List<Document> pipeline = new ArrayList<>();
    if (!filter.isEmpty()) pipeline.add(new Document("$match", filter));

    List<String> keys = plan.aggregation().groupBy();
    Object id;
    if (keys.isEmpty()) {
      id = null;
    } else {
      Document idDoc = new Document();
      for (String k : keys) idDoc.append(k, "$" + k);
      id = idDoc;
    }
    Document group = new Document("_id", id);
    for (Aggregate a : plan.aggregation().aggregates()) group.append(a.alias(), accumulator(a));
    pipeline.add(new Document("$group", group));

    Document project = new Document("_id", 0);
    for (String k : keys) project.append(k, "$_id." + k);
    for (Aggregate a : plan.aggregation().aggregates()) project.append(a.alias(), 1);
    pipeline.add(new Document("$project", project));

    if (!sort.isEmpty()) pipeline.add(new Document("$sort", sort));
    if (plan.limit() != null) pipeline.add(new Document("$limit", plan.limit()));
    return new MongoStatement(MongoStatement.Kind.AGGREGATE, plan.resource(), filter, null, pipeline, sort, plan.limit());
  }

  static Document toBson(FilterElement filter) {
    if (filter == null) return new Document();
    return render(filter, false);
  }

  private static Document accumulator(Aggregate a) {
    String field = a.field() == null ? null : "$" + a.field();
    return switch (a.function()) {
      case COUNT -> (field == null)
          ? new Document("$sum", 1)
          : new Document("$sum", new Document("$cond", List.of(new Document("$ne", Arrays.asList(field, null)), 1, 0)));
      case SUM -> new Document("$sum", field);
      case AVG -> new Document("$avg", field);
      case MIN -> new Document("$min", field);
      case MAX -> new Document("$max", field);
    };
  }

  private static Document sortDoc(List<SortField> sort) {
    Document d = new Document();
    for (SortField sf : sort) d.append(sf.field(), sf.direction() == SortField.Direction.DESC ? -1 : 1);
    return d;
  }

  private static Document render(FilterElement el, boolean negate) {
    if (el == null) return new Document();

    if (el instanceof NotElement n) {
      return render(n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause() == null ? Clause.AND : g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;

      List<Document> parts = new ArrayList<>();
      for (FilterElement child : g.elements()) {
        Document d = render(child, negate);
        if (d != null && !d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document((clause == Clause.OR) ? "$or" : "$and", parts);
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported FilterElement in filter: " + el.getClass().getName());
    }

    String path = c.field();
    boolean not = c.not() ^ negate;
    Operator op = c.operator();

    Document positive = switch (op) {
      case EQ -> new Document(path, c.value());
      case NE -> new Document(path, new Document("$ne", c.value()));
      case GT -> new Document(path, new Document("$gt", requireNonNull(op, c.value())));
      case GE -> new Document(path, new Document("$gte", requireNonNull(op, c.value())));
      case LT -> new Document(path, new Document("$lt", requireNonNull(op, c.value())));
      case LE -> new Document(path, new Document("$lte", requireNonNull(op, c.value())));
      case IN -> new Document(path, new Document("$in", toList(c.value())));
      case NIN -> new Document(path, new Document("$nin", toList(c.value())));
      case RANGE -> new Document(path,
          new Document("$gte", requireNonNull("RANGE.lower", c.lower()))
              .append("$lte", requireNonNull("RANGE.upper", c.upper())));
      case LIKE -> likePositive(path, String.valueOf(requireNonNull(op, c.value())));
    };

    return not ? new Document("$nor", List.of(positive)) : positive;
  }

  private static Object requireNonNull(Object label, Object v) {
    if (v == null) throw new IllegalArgumentException(label + " requires non-null value");
    return v;
  }

  static Document likePositive(String path, String likePattern) {
    // '%' -> '.*', '_' -> '.', everything else literal
    StringBuilder re = new StringBuilder("^");
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          re.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        re.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) re.append(Pattern.quote(literal.toString()));
    re.append("$");
    return new Document(path, new Document("$regex", re.toString()));
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
