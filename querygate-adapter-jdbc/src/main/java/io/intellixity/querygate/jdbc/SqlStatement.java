package io.intellixity.querygate.jdbc;

import io.intellixity.querygate.spi.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL with named placeholders ({@code :b1, :b2, ...}) and the values bound to them in order.
 * Bind values may be null.
 */
public record SqlStatement(String sql, List<Object> binds) implements NativeStatement {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
  }

  @Override
  public String describe() {
    return sql + " binds=" + binds.size();
  }
}
