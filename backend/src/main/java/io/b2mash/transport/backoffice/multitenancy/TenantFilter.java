package io.b2mash.transport.backoffice.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller's organization from the {@code X-Organization-Id} header into {@link
 * TenantContext} and the logging MDC. Authentication happens upstream; this filter only carries
 * the already-resolved organization through the request.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  public static final String ORGANIZATION_HEADER = "X-Organization-Id";

  private static final String MDC_ORGANIZATION_ID = "organizationId";
  private static final String MDC_REQUEST_ID = "requestId";
  private static final Pattern ORG_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String organizationId = request.getHeader(ORGANIZATION_HEADER);
    if (organizationId != null && !ORG_ID_PATTERN.matcher(organizationId).matches()) {
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Invalid organization id");
      return;
    }

    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
      if (organizationId != null) {
        TenantContext.setOrganizationId(organizationId);
        MDC.put(MDC_ORGANIZATION_ID, organizationId);
      }
      filterChain.doFilter(request, response);
    } finally {
      TenantContext.clear();
      MDC.remove(MDC_ORGANIZATION_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }
}
