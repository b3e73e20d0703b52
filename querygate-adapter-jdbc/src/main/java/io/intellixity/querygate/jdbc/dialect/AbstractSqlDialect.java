package io.intellixity.querygate.jdbc.dialect;

import io.intellixity.querygate.jdbc.SqlStatement;
import io.intellixity.querygate.plan.*;

import java.util.*;

/**
 * JDBC-generic SQL rendering for read-only plans.
 * <p>
 * Renders projection or group-by/aggregate select lists, the filter tree with NOT pushed down
 * through AND/OR (De Morgan), ORDER BY and a row limit. Every literal becomes a named bind
 * ({@code :b1, :b2, ...}); identifiers are always quoted. Database dialects override quoting and the
 * limit clause.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Object> binds = new ArrayList<>();

    public String add(Object value) {
      binds.add(value);
      return ":b" + (n++);
    }

    public List<Object> binds() { return binds; }
  }

  @Override
  public final SqlStatement renderSelect(ExecutionPlan plan, String schema) {
    Objects.requireNonNull(plan, "plan");
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT ");
    sql.append(String.join(", ", selectItems(plan)));
    sql.append(" FROM ").append(qualifiedTable(schema, plan.resource()));

    String where = renderPredicate(plan.filter(), ctx, false);
    if (!where.isBlank()) sql.append(" WHERE ").append(stripParensIfAny(where));

    if (plan.isAggregate() && !plan.aggregation().groupBy().isEmpty()) {
      List<String> keys = new ArrayList<>();
      for (String g : plan.aggregation().groupBy()) keys.add(quoteIdent(g));
      sql.append(" GROUP BY ").append(String.join(", ", keys));
    }

    if (!plan.sort().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (SortField sf : plan.sort()) {
        parts.add(quoteIdent(sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
      }
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }

    String out = sql.toString();
    if (plan.limit() != null) out = applyLimit(out, plan.limit());
    return new SqlStatement(out, ctx.binds());
  }

  protected List<String> selectItems(ExecutionPlan plan) {
    List<String> items = new ArrayList<>();
    if (plan.isAggregate()) {
      for (String g : plan.aggregation().groupBy()) items.add(quoteIdent(g));
      for (Aggregate a : plan.aggregation().aggregates()) {
        String arg = a.field() == null ? "*" : quoteIdent(a.field());
        items.add(a.function().name() + "(" + arg + ") AS " + quoteIdent(a.alias()));
      }
      return items;
    }
    if (plan.projection().isEmpty()) throw new IllegalArgumentException("Empty projection for " + plan.resource());
    for (String p : plan.projection()) items.add(quoteIdent(p));
    return items;
  }

  protected String qualifiedTable(String schema, String table) {
    return (schema == null) ? quoteIdent(table) : quoteIdent(schema) + "." + quoteIdent(table);
  }

  /** ANSI row limit; dialects override (Postgres LIMIT, MSSQL TOP, etc.). */
  protected String applyLimit(String sql, int limit) {
    return sql + " FETCH FIRST " + limit + " ROWS ONLY";
  }

  protected abstract String quoteIdent(String ident);

  private String renderPredicate(FilterElement el, RenderCtx ctx, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicate(n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause() == null ? Clause.AND : g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (FilterElement c : g.elements()) {
        String s = renderPredicate(c, ctx, negate);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported FilterElement in filter: " + el.getClass().getName());
    }

    String expr = quoteIdent(c.field());
    boolean not = c.not() ^ negate;
    Object value = c.value();

    return switch (c.operator()) {
      case EQ -> (value == null) ? nullCheckSql(expr, true, not) : unarySql(expr, "=", value, not, ctx);
      case NE -> (value == null) ? nullCheckSql(expr, false, not) : unarySql(expr, "<>", value, not, ctx);
      case GT -> unaryNonNull(expr, ">", value, not, ctx);
      case GE -> unaryNonNull(expr, ">=", value, not, ctx);
      case LT -> unaryNonNull(expr, "<", value, not, ctx);
      case LE -> unaryNonNull(expr, "<=", value, not, ctx);
      case LIKE -> unaryNonNull(expr, "LIKE", value, not, ctx);
      case IN -> listSql(expr, false, toList(value), not, ctx);
      case NIN -> listSql(expr, true, toList(value), not, ctx);
      case RANGE -> {
        if (c.lower() == null || c.upper() == null) {
          throw new IllegalArgumentException("RANGE requires non-null lower+upper for '" + c.field() + "'");
        }
        String sql = expr + " BETWEEN " + ctx.add(c.lower()) + " AND " + ctx.add(c.upper());
        yield not ? "NOT (" + sql + ")" : sql;
      }
    };
  }

  private static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unarySql(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    String sql = expr + " " + op + " " + ctx.add(value);
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unaryNonNull(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    if (value == null) throw new IllegalArgumentException(op + " requires non-null value");
    return unarySql(expr, op, value, not, ctx);
  }

  private static String listSql(String expr, boolean notIn, List<Object> vals, boolean not, RenderCtx ctx) {
    if (vals.isEmpty()) {
      // IN () matches nothing, NOT IN () matches everything
      return (notIn ^ not) ? "1 = 1" : "1 = 0";
    }
    List<String> ph = new ArrayList<>();
    for (Object v : vals) ph.add(ctx.add(v));
    String sql = expr + (notIn ? " NOT IN (" : " IN (") + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }

  protected String stripParensIfAny(String s) {
    String t = s.trim();
    if (t.startsWith("(") && t.endsWith(")") && balancedInside(t)) return t.substring(1, t.length() - 1);
    return t;
  }

  // "(a) OR (b)" starts and ends with parens but is not one group
  private static boolean balancedInside(String t) {
    int depth = 0;
    for (int i = 0; i < t.length() - 1; i++) {
      char ch = t.charAt(i);
      if (ch == '(') depth++;
      else if (ch == ')') depth--;
      if (depth == 0) return false;
    }
    return true;
  }
}
