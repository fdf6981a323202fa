package io.b2mash.tender.audit;

import java.util.List;

/** Records and queries the append-only audit trail of tender workflow mutations. */
public interface AuditService {

  /**
   * Appends a single audit event. Callers log only after a mutation has fully applied, so the trail
   * never contains events for rejected calls.
   *
   * @param record the audit event data
   */
  void log(AuditEventRecord record);

  /**
   * Returns events matching the filter in append order.
   *
   * @param filter query filter; every field is optional
   * @return matching events, oldest first
   */
  List<AuditEvent> findEvents(AuditEventFilter filter);
}
