package io.b2mash.tender.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for resolving caller identities from bearer tokens.
 *
 * @param identityClaim JWT claim holding the caller's account identity; {@code sub} by default
 */
@ConfigurationProperties(prefix = "tender.security")
public record IdentityProperties(@DefaultValue("sub") String identityClaim) {}
