package io.b2mash.tender.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable audit event as stored in the trail. {@code sequence} is assigned on append and gives a
 * total order over all events.
 */
public record AuditEvent(
    long sequence,
    String eventType,
    String entityType,
    String entityId,
    String actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details,
    Instant occurredAt) {

  static AuditEvent from(long sequence, AuditEventRecord record, Instant occurredAt) {
    return new AuditEvent(
        sequence,
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId(),
        record.actorType(),
        record.source(),
        record.ipAddress(),
        record.userAgent(),
        record.details() != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(record.details()))
            : Map.of(),
        occurredAt);
  }
}
