package io.intellixity.querygate.policy;

import java.util.Set;

/** Roles an identity must hold (all of them) to be granted the listed resource classes. */
public record Grant(Set<String> requiredRoles, Set<String> resourceClasses) {
  public Grant {
    requiredRoles = requiredRoles == null ? Set.of() : Set.copyOf(requiredRoles);
    resourceClasses = resourceClasses == null ? Set.of() : Set.copyOf(resourceClasses);
  }
}
