package io.b2mash.tender.audit;

import io.b2mash.tender.context.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source, IP address,
 * and user agent from the current request context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("tender.created")
 *     .entityType("tender")
 *     .entityId(tender.getId())
 *     .actorId(caller)
 *     .details(Map.of("max_price", tender.getMaxPrice()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private String entityId;
  private String actorId;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(Object entityId) {
    this.entityId = entityId != null ? entityId.toString() : null;
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record, filling in the derived fields:
   *
   * <ul>
   *   <li>{@code actorId} from {@link RequestScopes} if not set and a caller is bound
   *   <li>{@code actorType} = "USER" if an actor is known, "SYSTEM" otherwise
   *   <li>{@code source} = "API" if in HTTP request context, "INTERNAL" otherwise
   *   <li>{@code ipAddress} and {@code userAgent} from the current servlet request
   * </ul>
   */
  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }

    String resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      resolvedActorId = RequestScopes.getCallerOrNull();
    }

    String resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String resolvedSource = request != null ? "API" : "INTERNAL";

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
