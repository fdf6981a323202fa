package io.b2mash.tender.audit;

import java.util.Map;

/**
 * DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder} which auto-populates actor, source, and request metadata.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited ("tender", "offer", "evaluator", "authority")
 * @param entityId identifier of the affected entity, rendered as text
 * @param actorId identity of the acting caller; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details key field values; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    String entityId,
    String actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
