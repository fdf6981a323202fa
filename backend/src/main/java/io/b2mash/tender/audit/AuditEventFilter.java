package io.b2mash.tender.audit;

/**
 * Optional filters for querying the audit trail. Null means "no filter on this field".
 *
 * @param entityType entity kind, e.g. "tender"
 * @param entityId entity identifier as text
 * @param actorId acting caller identity
 * @param eventType event type prefix, e.g. "offer." matches all offer events
 */
public record AuditEventFilter(
    String entityType, String entityId, String actorId, String eventType) {

  boolean matches(AuditEvent event) {
    return (entityType == null || entityType.equals(event.entityType()))
        && (entityId == null || entityId.equals(event.entityId()))
        && (actorId == null || actorId.equals(event.actorId()))
        && (eventType == null || event.eventType().startsWith(eventType));
  }
}
