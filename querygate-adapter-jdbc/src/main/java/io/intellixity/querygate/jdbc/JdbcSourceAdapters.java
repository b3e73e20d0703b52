package io.intellixity.querygate.jdbc;

import io.intellixity.querygate.jdbc.dialect.SqlDialect;
import io.intellixity.querygate.spi.RowMasker;
import io.intellixity.querygate.spi.SourceAdapter;
import io.intellixity.querygate.spi.SourceHandle;
import io.intellixity.querygate.validation.SensitivityEntitlements;

import java.util.Objects;

/** Builds {@link JdbcSourceAdapter}s for the adapter resolver. */
public final class JdbcSourceAdapters {
  private JdbcSourceAdapters() {}

  public static SourceAdapter<?> create(SourceHandle<?> handle,
                                        SqlDialect dialect,
                                        RowMasker masker,
                                        SensitivityEntitlements entitlements) {
    Objects.requireNonNull(handle, "handle");
    if (!(handle instanceof JdbcHandle jh)) {
      throw new IllegalArgumentException("Expected JdbcHandle but got " + handle.getClass().getName());
    }
    return new JdbcSourceAdapter(jh, dialect, masker, entitlements);
  }
}
