package io.b2mash.tender.context;

/**
 * Thrown when code requires a caller identity but the request was not authenticated through the
 * JWT filter chain. Indicates a wiring bug rather than a client error.
 */
public class CallerContextNotBoundException extends IllegalStateException {

  public CallerContextNotBoundException() {
    super("Caller context not available: CALLER not bound");
  }
}
