package io.b2mash.transport.backoffice.exception;

import org.springframework.http.HttpStatus;

/** Thrown when tenant-scoped code runs without an organization bound to the request. */
public class MissingOrganizationContextException extends BackofficeProblemException {

  public MissingOrganizationContextException() {
    super(
        HttpStatus.UNAUTHORIZED,
        "missing_organization",
        "Missing organization context",
        "Send the X-Organization-Id header with the caller's organization id");
  }
}
