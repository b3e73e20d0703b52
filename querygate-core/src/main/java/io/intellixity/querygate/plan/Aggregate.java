package io.intellixity.querygate.plan;

import java.util.Locale;
import java.util.Objects;

/** One aggregate output column. A {@code null} field is only legal for {@link AggregateFunction#COUNT}. */
public record Aggregate(AggregateFunction function, String field, String alias) {
  public Aggregate {
    Objects.requireNonNull(function, "function");
    if (field == null && function != AggregateFunction.COUNT) {
      throw new IllegalArgumentException(function + " requires a field");
    }
    if (alias == null || alias.isBlank()) {
      alias = function.name().toLowerCase(Locale.ROOT) + (field == null ? "" : "_" + field);
    }
  }

  public static Aggregate count() { return new Aggregate(AggregateFunction.COUNT, null, null); }
  public static Aggregate of(AggregateFunction function, String field) { return new Aggregate(function, field, null); }
}
