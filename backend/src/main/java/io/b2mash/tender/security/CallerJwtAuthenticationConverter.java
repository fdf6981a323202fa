package io.b2mash.tender.security;

import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Converts a validated JWT into an authentication named after the caller identity. No authorities
 * are granted here: tender roles (authority, evaluator) are dynamic and checked per operation by
 * {@link io.b2mash.tender.accesscontrol.AccessPolicy}.
 */
@Component
public class CallerJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private final CallerIdentities callerIdentities;

  public CallerJwtAuthenticationConverter(CallerIdentities callerIdentities) {
    this.callerIdentities = callerIdentities;
  }

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    String identity = callerIdentities.fromJwt(jwt);
    return new JwtAuthenticationToken(
        jwt, List.of(), identity != null ? identity : jwt.getSubject());
  }
}
