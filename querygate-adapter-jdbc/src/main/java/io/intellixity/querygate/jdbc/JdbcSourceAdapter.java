package io.intellixity.querygate.jdbc;

import io.intellixity.querygate.jdbc.dialect.SqlDialect;
import io.intellixity.querygate.spi.*;
import io.intellixity.querygate.validation.SensitivityEntitlements;
import io.intellixity.querygate.validation.ValidatedPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/**
 * Relational adapter over a {@link DataSource}.
 * <p>
 * Every statement runs on a read-only connection with auto-commit off and is rolled back afterwards,
 * so nothing it does can persist. The driver enforces the query timeout and the row cap; cancellation
 * calls {@link Statement#cancel()} on the in-flight statement.
 */
public final class JdbcSourceAdapter extends AbstractSourceAdapter<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcSourceAdapter.class);

  public static final String FAMILY = "jdbc";

  private final SqlDialect dialect;
  private final DataSource ds;

  public JdbcSourceAdapter(JdbcHandle handle, SqlDialect dialect, RowMasker masker, SensitivityEntitlements entitlements) {
    super(handle, masker, entitlements);
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.ds = handle.client();
  }

  public JdbcSourceAdapter(JdbcHandle handle, SqlDialect dialect) {
    this(handle, dialect, null, null);
  }

  @Override public String family() { return FAMILY; }

  @Override
  public SqlStatement translate(ValidatedPlan plan) {
    return dialect.renderSelect(plan.plan(), handle().schema());
  }

  @Override
  public List<Map<String, Object>> run(SqlStatement ss, ExecutionLimits limits, CancellationToken token) {
    token.throwIfCancelled();
    String jdbcSql = NamedParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(ss, jdbcSql);
    try (Connection c = ds.getConnection()) {
      c.setReadOnly(true);
      c.setAutoCommit(false);
      try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
        ps.setQueryTimeout(limits.timeoutSeconds());
        ps.setMaxRows(limits.fetchSize());
        token.onCancel(() -> cancelQuietly(ps));
        for (int i = 0; i < ss.binds().size(); i++) {
          ps.setObject(i + 1, ss.binds().get(i));
        }
        List<Map<String, Object>> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
          ResultSetMetaData md = rs.getMetaData();
          int cols = md.getColumnCount();
          while (out.size() < limits.fetchSize() && rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= cols; i++) row.put(md.getColumnLabel(i), readValue(rs.getObject(i)));
            out.add(row);
          }
        }
        debugDone(jdbcSql, out.size(), System.nanoTime() - start);
        return out;
      } finally {
        c.rollback();
      }
    } catch (SQLException e) {
      if (token.isCancelled()) throw new GatewayExecutionException("statement cancelled", true, e);
      throw new GatewayExecutionException("jdbc failure sqlState=" + e.getSQLState() + ": " + e.getMessage(), isTransient(e), e);
    }
  }

  /** Timeouts, cancellations and connection-class failures may succeed on retry. */
  static boolean isTransient(SQLException e) {
    if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) return true;
    String state = e.getSQLState();
    if (state == null) return false;
    return state.startsWith("08") || state.equals("57014") || state.equals("40001") || state.equals("40P01");
  }

  private static Object readValue(Object v) {
    if (v instanceof Timestamp ts) return ts.toInstant();
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof Time t) return t.toLocalTime();
    return v;
  }

  private void cancelQuietly(PreparedStatement ps) {
    try {
      ps.cancel();
      log.debug("querygate.jdbc cancel handleId={}", handle().id());
    } catch (SQLException e) {
      log.warn("querygate.jdbc cancel failed handleId={} sqlState={}", handle().id(), e.getSQLState());
    }
  }

  private void debugSql(SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("querygate.jdbc op=SELECT dialect={} bindCount={} handleId={} schema={} sql={}",
        dialect.id(), ss.binds().size(), h.id(), h.schema(), jdbcSql);

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        log.trace("querygate.jdbc bind index={} valueType={}", idx++, v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private void debugDone(String jdbcSql, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("querygate.jdbc_done op=SELECT durationMs={} rows={} sqlLen={}",
        durationNanos / 1_000_000.0, rows, jdbcSql.length());
  }
}
