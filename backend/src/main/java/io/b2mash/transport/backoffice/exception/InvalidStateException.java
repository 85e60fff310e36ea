package io.b2mash.transport.backoffice.exception;

import org.springframework.http.HttpStatus;

public class InvalidStateException extends BackofficeProblemException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, "invalid_state", title, detail);
  }
}
