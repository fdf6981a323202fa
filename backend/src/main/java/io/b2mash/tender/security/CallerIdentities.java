package io.b2mash.tender.security;

import io.b2mash.tender.exception.InvalidInputException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Extracts and normalizes caller identities. Identities are opaque strings compared exactly after
 * trimming surrounding whitespace.
 */
@Component
public class CallerIdentities {

  private final IdentityProperties properties;

  public CallerIdentities(IdentityProperties properties) {
    this.properties = properties;
  }

  /** Returns the normalized identity carried by the token, or null if the claim is absent. */
  public String fromJwt(Jwt jwt) {
    String raw =
        "sub".equals(properties.identityClaim())
            ? jwt.getSubject()
            : jwt.getClaimAsString(properties.identityClaim());
    return normalizeOrNull(raw);
  }

  /** Trims the identity; returns null for null or blank input. */
  public static String normalizeOrNull(String identity) {
    if (identity == null || identity.isBlank()) {
      return null;
    }
    return identity.trim();
  }

  /** Trims the identity; throws {@link InvalidInputException} for null or blank input. */
  public static String require(String identity, String field) {
    String normalized = normalizeOrNull(identity);
    if (normalized == null) {
      throw new InvalidInputException("Invalid identity", field + " must not be blank");
    }
    return normalized;
  }
}
