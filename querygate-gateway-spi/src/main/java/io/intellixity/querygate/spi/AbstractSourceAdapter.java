package io.intellixity.querygate.spi;

import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.validation.SensitivityEntitlements;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Shared handle and masking plumbing for adapters. */
public abstract class AbstractSourceAdapter<S extends NativeStatement, H extends SourceHandle<?>> implements SourceAdapter<S> {
  private final H handle;
  private final RowMasker masker;
  private final SensitivityEntitlements entitlements;

  protected AbstractSourceAdapter(H handle, RowMasker masker, SensitivityEntitlements entitlements) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.masker = (masker == null) ? RowMasker.redacting() : masker;
    this.entitlements = (entitlements == null) ? SensitivityEntitlements.identity() : entitlements;
  }

  public final H handle() { return handle; }

  @Override
  public List<Map<String, Object>> applyMasking(List<Map<String, Object>> rows,
                                                SchemaSnapshot snapshot,
                                                String resource,
                                                Identity identity) {
    return masker.mask(rows, snapshot, resource, identity, entitlements);
  }
}
