package io.b2mash.tender.exception;

import io.b2mash.tender.context.CallerContextNotBoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders every rejected call as a {@link ProblemDetail} carrying a stable {@code kind} property.
 * Domain exceptions set their own kind; framework 400s (bean validation, unreadable bodies, type
 * mismatches) are reported as {@link ErrorKind#INVALID_INPUT}.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(CallerContextNotBoundException.class)
  public ResponseEntity<ProblemDetail> handleCallerContextNotBound(
      CallerContextNotBoundException ex) {
    log.error("Caller context invariant violation: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Caller context not available");
    problem.setDetail("Unable to resolve caller identity for request");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleExceptionInternal(
      Exception ex,
      Object body,
      HttpHeaders headers,
      HttpStatusCode statusCode,
      WebRequest request) {
    if (body == null && ex instanceof ErrorResponse errorResponse) {
      body = errorResponse.updateAndGetBody(getMessageSource(), LocaleContextHolder.getLocale());
    }
    if (body instanceof ProblemDetail problem) {
      if (statusCode.value() == HttpStatus.BAD_REQUEST.value() && !hasKind(problem)) {
        problem.setProperty(ErrorKind.PROPERTY, ErrorKind.INVALID_INPUT.name());
      }
      log.warn(
          "Request rejected: path={}, status={}, kind={}, detail={}",
          describePath(request),
          statusCode.value(),
          problem.getProperties() != null ? problem.getProperties().get(ErrorKind.PROPERTY) : null,
          problem.getDetail());
    }
    return super.handleExceptionInternal(ex, body, headers, statusCode, request);
  }

  private static boolean hasKind(ProblemDetail problem) {
    return problem.getProperties() != null
        && problem.getProperties().containsKey(ErrorKind.PROPERTY);
  }

  private static String describePath(WebRequest request) {
    if (request instanceof ServletWebRequest servletRequest) {
      return servletRequest.getRequest().getMethod()
          + " "
          + servletRequest.getRequest().getRequestURI();
    }
    return request.getDescription(false);
  }
}
