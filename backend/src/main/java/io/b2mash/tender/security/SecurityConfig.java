package io.b2mash.tender.security;

import io.b2mash.tender.audit.AuditAuthenticationEntryPoint;
import io.b2mash.tender.context.CallerFilter;
import io.b2mash.tender.context.RequestLoggingFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final CallerJwtAuthenticationConverter jwtAuthConverter;
  private final CallerFilter callerFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final AuditAuthenticationEntryPoint auditAuthEntryPoint;

  public SecurityConfig(
      CallerJwtAuthenticationConverter jwtAuthConverter,
      CallerFilter callerFilter,
      RequestLoggingFilter requestLoggingFilter,
      AuditAuthenticationEntryPoint auditAuthEntryPoint) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.callerFilter = callerFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.auditAuthEntryPoint = auditAuthEntryPoint;
  }

  /**
   * Single stateless chain: {@code /api/**} requires a bearer JWT, actuator health is public,
   * everything else is denied. The caller identity is bound after token authentication.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(auditAuthEntryPoint))
        .addFilterAfter(callerFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, CallerFilter.class);

    return http.build();
  }
}
