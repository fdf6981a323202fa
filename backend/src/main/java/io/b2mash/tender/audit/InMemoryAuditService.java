package io.b2mash.tender.audit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-process implementation of {@link AuditService}. Events live for the lifetime of the service
 * process, like the tender and offer stores they describe.
 */
@Service
public class InMemoryAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuditService.class);

  private final Clock clock;
  private final List<AuditEvent> events = new ArrayList<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public InMemoryAuditService(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void log(AuditEventRecord record) {
    lock.writeLock().lock();
    try {
      events.add(AuditEvent.from(events.size() + 1L, record, clock.instant()));
    } finally {
      lock.writeLock().unlock();
    }
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId());
  }

  @Override
  public List<AuditEvent> findEvents(AuditEventFilter filter) {
    lock.readLock().lock();
    try {
      return events.stream().filter(filter::matches).toList();
    } finally {
      lock.readLock().unlock();
    }
  }
}
