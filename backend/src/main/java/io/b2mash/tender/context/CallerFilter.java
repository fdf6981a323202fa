package io.b2mash.tender.context;

import io.b2mash.tender.security.CallerIdentities;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the authenticated caller identity into {@link RequestScopes} for the rest of the request.
 * The identity is read from the configured JWT claim and normalized by {@link CallerIdentities}.
 */
@Component
public class CallerFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(CallerFilter.class);

  private final CallerIdentities callerIdentities;

  public CallerFilter(CallerIdentities callerIdentities) {
    this.callerIdentities = callerIdentities;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String caller = resolveCaller();
    if (caller == null) {
      // Unauthenticated requests are rejected later by the security chain
      filterChain.doFilter(request, response);
      return;
    }

    RequestScopes.bindCaller(caller);
    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private String resolveCaller() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }
    String caller = callerIdentities.fromJwt(jwtAuth.getToken());
    if (caller == null) {
      log.warn("Authenticated token carries no usable identity claim");
    }
    return caller;
  }
}
