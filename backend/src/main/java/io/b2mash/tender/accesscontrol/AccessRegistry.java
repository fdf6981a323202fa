package io.b2mash.tender.accesscontrol;

import io.b2mash.tender.security.CallerIdentities;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the current authority and the evaluator set. Initialized from {@link
 * AccessControlProperties} at startup; state lives for the lifetime of the process. Role checks
 * and mutations here are unguarded: callers go through {@link AccessControlService}.
 */
@Component
public class AccessRegistry {

  private static final Logger log = LoggerFactory.getLogger(AccessRegistry.class);

  private final AtomicReference<String> authority = new AtomicReference<>();
  private final Set<String> evaluators = new LinkedHashSet<>();

  public AccessRegistry(AccessControlProperties properties) {
    String initialAuthority = CallerIdentities.normalizeOrNull(properties.initialAuthority());
    if (initialAuthority == null) {
      log.warn("No initial authority configured; authority-gated operations will be rejected");
    }
    authority.set(initialAuthority);
    for (String evaluator : properties.initialEvaluators()) {
      String normalized = CallerIdentities.normalizeOrNull(evaluator);
      if (normalized != null) {
        evaluators.add(normalized);
      }
    }
    log.info(
        "Access registry initialized: authority={}, evaluators={}",
        initialAuthority,
        evaluators.size());
  }

  public Optional<String> currentAuthority() {
    return Optional.ofNullable(authority.get());
  }

  public boolean isAuthority(String identity) {
    return identity != null && identity.equals(authority.get());
  }

  /** Replaces the authority only if it is still {@code expected}. Null clears the role. */
  boolean replaceAuthority(String expected, String replacement) {
    return authority.compareAndSet(expected, replacement);
  }

  public boolean isEvaluator(String identity) {
    if (identity == null) {
      return false;
    }
    synchronized (evaluators) {
      return evaluators.contains(identity);
    }
  }

  /** Evaluators in the order they were added. */
  public List<String> listEvaluators() {
    synchronized (evaluators) {
      return List.copyOf(evaluators);
    }
  }

  boolean addEvaluator(String identity) {
    synchronized (evaluators) {
      return evaluators.add(identity);
    }
  }

  boolean removeEvaluator(String identity) {
    synchronized (evaluators) {
      return evaluators.remove(identity);
    }
  }
}
