package io.b2mash.tender.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an operation is attempted on the wrong side of a tender's submission deadline.
 * Results in HTTP 422 Unprocessable Entity carrying the deadline that was violated.
 */
public class DeadlineViolationException extends ErrorResponseException {

  public DeadlineViolationException(String detail, Instant deadline) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail, deadline), null);
  }

  public ErrorKind getKind() {
    return ErrorKind.DEADLINE_VIOLATION;
  }

  private static ProblemDetail createProblem(String detail, Instant deadline) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Deadline violation");
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.DEADLINE_VIOLATION.name());
    problem.setProperty("deadline", deadline.toString());
    return problem;
  }
}
