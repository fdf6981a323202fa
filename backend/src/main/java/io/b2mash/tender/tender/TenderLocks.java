package io.b2mash.tender.tender;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Per-tender read/write locks. Every mutation of a tender, its offers or its participant list runs
 * under that tender's write lock; reads run under the read lock. Operations on different tenders
 * never contend.
 *
 * <p>Callers must check the tender exists before locking so unknown ids do not allocate locks.
 */
@Component
public class TenderLocks {

  private final Map<Long, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

  public <T> T write(long tenderId, Supplier<T> action) {
    var lock = lockFor(tenderId).writeLock();
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public <T> T read(long tenderId, Supplier<T> action) {
    var lock = lockFor(tenderId).readLock();
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private ReentrantReadWriteLock lockFor(long tenderId) {
    return locks.computeIfAbsent(tenderId, id -> new ReentrantReadWriteLock());
  }
}
