package io.b2mash.tender.accesscontrol;

import io.b2mash.tender.exception.ForbiddenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The authorization check every mutating entry point calls before touching state. Decisions are
 * made from the caller identity and the operation kind alone; there is no ambient security
 * context.
 */
@Component
public class AccessPolicy {

  private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

  private final AccessRegistry registry;

  public AccessPolicy(AccessRegistry registry) {
    this.registry = registry;
  }

  /** Returns true if {@code caller} holds the role {@code operation} requires. */
  public boolean isAllowed(String caller, TenderOperation operation) {
    if (caller == null) {
      return false;
    }
    return switch (operation.requiredRole()) {
      case AUTHORITY -> registry.isAuthority(caller);
      case EVALUATOR -> registry.isEvaluator(caller);
      case ANY -> true;
    };
  }

  /** Throws {@link ForbiddenException} unless {@code caller} may perform {@code operation}. */
  public void authorize(String caller, TenderOperation operation) {
    if (!isAllowed(caller, operation)) {
      log.warn(
          "Access denied: caller={}, operation={}, requiredRole={}",
          caller,
          operation,
          operation.requiredRole());
      throw new ForbiddenException("Unauthorized", denialMessage(operation));
    }
  }

  private static String denialMessage(TenderOperation operation) {
    return switch (operation.requiredRole()) {
      case AUTHORITY -> "Only the authority may " + operation.action();
      case EVALUATOR -> "Only the evaluators may " + operation.action();
      case ANY -> "An identified caller is required to " + operation.action();
    };
  }
}
