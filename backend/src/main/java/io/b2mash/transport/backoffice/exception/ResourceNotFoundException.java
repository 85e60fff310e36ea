package io.b2mash.transport.backoffice.exception;

import org.springframework.http.HttpStatus;

/**
 * Lookup miss inside the caller's organization. Rows owned by another organization are reported
 * the same way, so tenants cannot probe each other's ids.
 */
public class ResourceNotFoundException extends BackofficeProblemException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        "not_found",
        resourceType + " not found",
        "No " + humanize(resourceType) + " with id " + id + " in this organization");
  }

  // "VehicleCategory" -> "vehicle category"
  private static String humanize(String resourceType) {
    return resourceType.replaceAll("(?<=[a-z])(?=[A-Z])", " ").toLowerCase();
  }
}
