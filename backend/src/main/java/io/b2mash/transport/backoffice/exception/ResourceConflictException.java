package io.b2mash.transport.backoffice.exception;

import org.springframework.http.HttpStatus;

/** The write would duplicate work that already exists, such as a second mission for a line. */
public class ResourceConflictException extends BackofficeProblemException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, "conflict", title, detail);
  }
}
