package io.b2mash.tender.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidInputException extends ErrorResponseException {

  public InvalidInputException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  public ErrorKind getKind() {
    return ErrorKind.INVALID_INPUT;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.INVALID_INPUT.name());
    return problem;
  }
}
