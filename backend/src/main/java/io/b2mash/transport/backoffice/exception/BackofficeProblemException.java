package io.b2mash.transport.backoffice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Domain failure rendered as an RFC 7807 problem with a stable {@code code} property. */
public abstract class BackofficeProblemException extends ErrorResponseException {

  protected BackofficeProblemException(
      HttpStatus status, String code, String title, String detail) {
    super(status, problem(status, code, title, detail), null);
  }

  private static ProblemDetail problem(
      HttpStatus status, String code, String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    problem.setProperty("code", code);
    return problem;
  }
}
