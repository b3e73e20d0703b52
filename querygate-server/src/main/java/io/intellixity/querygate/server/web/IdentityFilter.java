package io.intellixity.querygate.server.web;

import io.intellixity.querygate.model.Identity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds the request {@link Identity} from upstream-authenticated headers. The gateway in front of this
 * service is trusted to have verified the caller; this filter only requires that the headers are present.
 */
@Component
public final class IdentityFilter extends OncePerRequestFilter {
  public static final String USER_HEADER = "X-User-Id";
  public static final String TENANT_HEADER = "X-Tenant-Id";
  public static final String ROLES_HEADER = "X-Roles";
  public static final String ENTITLEMENTS_HEADER = "X-Entitlements";

  public static final String IDENTITY_ATTRIBUTE = "querygate.identity";

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String userId = trimmed(request.getHeader(USER_HEADER));
    if (userId == null) {
      response.sendError(401, "Missing required header: " + USER_HEADER);
      return;
    }
    String tenant = trimmed(request.getHeader(TENANT_HEADER));
    if (tenant == null) {
      response.sendError(400, "Missing required header: " + TENANT_HEADER);
      return;
    }

    Identity identity = new Identity(userId, tenant,
        csv(request.getHeader(ROLES_HEADER)), csv(request.getHeader(ENTITLEMENTS_HEADER)));
    request.setAttribute(IDENTITY_ATTRIBUTE, identity);
    filterChain.doFilter(request, response);
  }

  static Set<String> csv(String raw) {
    Set<String> out = new LinkedHashSet<>();
    if (raw == null) return out;
    for (String s : raw.split(",")) {
      String t = s.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }

  private static String trimmed(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
