package io.b2mash.tender.accesscontrol;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Startup configuration for the access-control registry.
 *
 * @param initialAuthority identity granted the authority role when the service starts; when blank
 *     the service starts without an authority and every authority-gated call is rejected
 * @param initialEvaluators identities seeded into the evaluator set at startup
 */
@ConfigurationProperties(prefix = "tender.access")
public record AccessControlProperties(String initialAuthority, List<String> initialEvaluators) {

  public AccessControlProperties {
    initialEvaluators = initialEvaluators != null ? List.copyOf(initialEvaluators) : List.of();
  }
}
