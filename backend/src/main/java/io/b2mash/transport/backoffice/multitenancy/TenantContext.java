package io.b2mash.transport.backoffice.multitenancy;

import io.b2mash.transport.backoffice.exception.MissingOrganizationContextException;

/**
 * Thread-bound organization id for the current request. Bound by {@link TenantFilter}, read by
 * controllers, which pass it explicitly to services and repositories.
 */
public final class TenantContext {

  private static final ThreadLocal<String> CURRENT_ORGANIZATION = new ThreadLocal<>();

  private TenantContext() {}

  public static void setOrganizationId(String organizationId) {
    CURRENT_ORGANIZATION.set(organizationId);
  }

  public static String getOrganizationId() {
    return CURRENT_ORGANIZATION.get();
  }

  /** Returns the bound organization id. Throws if the filter chain did not bind one. */
  public static String requireOrganizationId() {
    String organizationId = CURRENT_ORGANIZATION.get();
    if (organizationId == null) {
      throw new MissingOrganizationContextException();
    }
    return organizationId;
  }

  public static void clear() {
    CURRENT_ORGANIZATION.remove();
  }
}
