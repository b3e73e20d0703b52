package io.intellixity.querygate.policy;

import io.intellixity.querygate.model.IntentCategory;

import java.util.List;
import java.util.Objects;

public record CategoryPolicy(IntentCategory category, Disposition disposition, List<Grant> grants) {
  public CategoryPolicy {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(disposition, "disposition");
    grants = grants == null ? List.of() : List.copyOf(grants);
  }

  public static CategoryPolicy noData(IntentCategory category) {
    return new CategoryPolicy(category, Disposition.NO_DATA, List.of());
  }

  public static CategoryPolicy outOfScope(IntentCategory category) {
    return new CategoryPolicy(category, Disposition.OUT_OF_SCOPE, List.of());
  }

  public static CategoryPolicy authorized(IntentCategory category, Grant... grants) {
    return new CategoryPolicy(category, Disposition.REQUIRES_AUTHORIZATION, List.of(grants));
  }
}
