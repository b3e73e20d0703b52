package io.intellixity.querygate.model;

import java.util.Objects;
import java.util.Set;

/**
 * Requesting principal as asserted by the upstream transport.
 *
 * <p>Roles drive the policy decision; entitlements (e.g. {@code PII}) drive the column-level
 * sensitivity checks in plan validation and masking.</p>
 */
public record Identity(String userId, String tenant, Set<String> roles, Set<String> entitlements) {
  public Identity {
    Objects.requireNonNull(userId, "userId");
    roles = roles == null ? Set.of() : Set.copyOf(roles);
    entitlements = entitlements == null ? Set.of() : Set.copyOf(entitlements);
  }

  public boolean hasAllRoles(Set<String> required) {
    return required == null || roles.containsAll(required);
  }

  public boolean isEntitledTo(String entitlement) {
    return entitlement != null && entitlements.contains(entitlement);
  }

  public static Identity of(String userId, String tenant, Set<String> roles) {
    return new Identity(userId, tenant, roles, Set.of());
  }
}
