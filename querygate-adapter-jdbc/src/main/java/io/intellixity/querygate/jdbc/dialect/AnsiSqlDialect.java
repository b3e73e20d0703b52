package io.intellixity.querygate.jdbc.dialect;

/** Standard SQL: double-quoted identifiers, FETCH FIRST row limit. */
public class AnsiSqlDialect extends AbstractSqlDialect {
  @Override public String id() { return "ansi"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
