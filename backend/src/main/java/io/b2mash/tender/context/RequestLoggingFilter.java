package io.b2mash.tender.context;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_CALLER = "caller";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String caller = RequestScopes.getCallerOrNull();
      if (caller != null) {
        MDC.put(MDC_CALLER, caller);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_CALLER);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
