package io.intellixity.querygate.mongo;

import io.intellixity.querygate.spi.RowMasker;
import io.intellixity.querygate.spi.SourceAdapter;
import io.intellixity.querygate.spi.SourceHandle;
import io.intellixity.querygate.validation.SensitivityEntitlements;

import java.util.Objects;

/** Builds {@link MongoSourceAdapter}s for the adapter resolver. */
public final class MongoSourceAdapters {
  private MongoSourceAdapters() {}

  public static SourceAdapter<?> create(SourceHandle<?> handle, RowMasker masker, SensitivityEntitlements entitlements) {
    Objects.requireNonNull(handle, "handle");
    if (!(handle instanceof MongoHandle mh)) {
      throw new IllegalArgumentException("Expected MongoHandle but got " + handle.getClass().getName());
    }
    return new MongoSourceAdapter(mh, masker, entitlements);
  }
}
