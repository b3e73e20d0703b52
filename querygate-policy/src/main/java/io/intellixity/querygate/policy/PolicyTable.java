package io.intellixity.querygate.policy;

import io.intellixity.querygate.model.IntentCategory;

import java.util.*;

/**
 * Versioned mapping of intent category to disposition and grants. Pure data; loaded from
 * configuration and never mutated.
 */
public record PolicyTable(long version, double confidenceThreshold, Map<IntentCategory, CategoryPolicy> categories) {
  public PolicyTable {
    if (version < 0) throw new PolicyTableException("version must be >= 0");
    if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
      throw new PolicyTableException("confidenceThreshold must be within [0,1]: " + confidenceThreshold);
    }
    Map<IntentCategory, CategoryPolicy> m = new EnumMap<>(IntentCategory.class);
    if (categories != null) {
      for (Map.Entry<IntentCategory, CategoryPolicy> e : categories.entrySet()) {
        CategoryPolicy p = e.getValue();
        if (p.category() != e.getKey()) {
          throw new PolicyTableException("Category key " + e.getKey() + " does not match entry " + p.category());
        }
        checkConsistent(p);
        m.put(e.getKey(), p);
      }
    }
    categories = Collections.unmodifiableMap(m);
  }

  /** Entry for a category, or null when the category is not registered. */
  public CategoryPolicy policyFor(IntentCategory category) {
    return category == null ? null : categories.get(category);
  }

  public static PolicyTable of(long version, double confidenceThreshold, CategoryPolicy... policies) {
    Map<IntentCategory, CategoryPolicy> m = new EnumMap<>(IntentCategory.class);
    for (CategoryPolicy p : policies) m.put(p.category(), p);
    return new PolicyTable(version, confidenceThreshold, m);
  }

  private static void checkConsistent(CategoryPolicy p) {
    if (p.category() == IntentCategory.OUT_OF_SCOPE && p.disposition() != Disposition.OUT_OF_SCOPE) {
      throw new PolicyTableException("OUT_OF_SCOPE can only be mapped to disposition OUT_OF_SCOPE");
    }
    if (p.category() == IntentCategory.SAFE_KNOWLEDGE && p.disposition() == Disposition.REQUIRES_AUTHORIZATION) {
      throw new PolicyTableException("SAFE_KNOWLEDGE cannot grant data access");
    }
    if (p.disposition() != Disposition.REQUIRES_AUTHORIZATION && !p.grants().isEmpty()) {
      throw new PolicyTableException("Grants are only allowed for REQUIRES_AUTHORIZATION: " + p.category());
    }
  }
}
