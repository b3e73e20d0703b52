package io.intellixity.querygate.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParamCompilerTest {
  @Test
  void replacesNamedParamsOutsideQuotes() {
    String sql = "SELECT \"a:b\", 'x:y' FROM t WHERE c = :b1 AND d::text = :b2";
    assertEquals("SELECT \"a:b\", 'x:y' FROM t WHERE c = ? AND d::text = ?", NamedParamCompiler.toJdbcSql(sql));
    assertEquals(2, NamedParamCompiler.countParams(sql));
  }

  @Test
  void doubledQuotesStayInsideLiteral() {
    String sql = "SELECT 'it''s :not' FROM t WHERE a = :b1";
    assertEquals("SELECT 'it''s :not' FROM t WHERE a = ?", NamedParamCompiler.toJdbcSql(sql));
  }
}
