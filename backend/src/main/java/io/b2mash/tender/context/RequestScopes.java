package io.b2mash.tender.context;

/**
 * Request-scoped caller identity. Bound by {@link CallerFilter}, read by controllers and by the
 * audit builder. Services never read it directly; controllers pass the caller explicitly.
 */
public final class RequestScopes {

  private static final ThreadLocal<String> CALLER = new ThreadLocal<>();

  /** Returns the authenticated caller identity. Throws if not bound by the filter chain. */
  public static String requireCaller() {
    String caller = CALLER.get();
    if (caller == null) {
      throw new CallerContextNotBoundException();
    }
    return caller;
  }

  /** Returns the caller identity, or null if not bound. */
  public static String getCallerOrNull() {
    return CALLER.get();
  }

  static void bindCaller(String caller) {
    CALLER.set(caller);
  }

  static void clear() {
    CALLER.remove();
  }

  private RequestScopes() {}
}
