package io.b2mash.tender.tender;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reports OPEN tenders whose deadline has passed without a single offer. Such a
 * tender can never be closed, so it stays OPEN; the monitor only surfaces it and never changes
 * state.
 */
@Component
public class StaleTenderMonitor {

  private static final Logger log = LoggerFactory.getLogger(StaleTenderMonitor.class);

  private final TenderRepository tenderRepository;
  private final TenderLocks tenderLocks;
  private final Clock clock;

  public StaleTenderMonitor(TenderRepository tenderRepository, TenderLocks tenderLocks, Clock clock) {
    this.tenderRepository = tenderRepository;
    this.tenderLocks = tenderLocks;
    this.clock = clock;
  }

  /** Returns the number of stale tenders found. */
  @Scheduled(fixedDelayString = "${tender.monitor.stale-scan-interval-ms:3600000}")
  public int reportStaleTenders() {
    Instant now = clock.instant();
    int stale = 0;
    for (var tender : tenderRepository.findAll()) {
      boolean isStale =
          tenderLocks.read(
              tender.getId(),
              () ->
                  tender.getStatus() == TenderStatus.OPEN
                      && tender.isDeadlinePassed(now)
                      && tender.getParticipantCount() == 0);
      if (isStale) {
        stale++;
        log.warn(
            "Tender {} passed its deadline {} without offers and cannot be closed",
            tender.getId(),
            tender.getDeadline());
      }
    }
    if (stale > 0) {
      log.info("Stale tender scan completed: {} stale tenders", stale);
    } else {
      log.debug("Stale tender scan completed: no stale tenders");
    }
    return stale;
  }
}
