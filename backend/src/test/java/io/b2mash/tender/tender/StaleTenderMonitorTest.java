package io.b2mash.tender.tender;

import static io.b2mash.tender.testutil.TenderTestHarness.AUTHORITY;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.tender.testutil.TenderTestHarness;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StaleTenderMonitorTest {

  private TenderTestHarness harness;
  private StaleTenderMonitor monitor;

  @BeforeEach
  void setUp() {
    harness = new TenderTestHarness();
    monitor = new StaleTenderMonitor(harness.tenderRepository, harness.tenderLocks, harness.clock);
  }

  @Test
  void reportsOnlyExpiredTendersWithoutOffers() {
    long empty = harness.openTender(1000, 60, 40);
    long withOffer = harness.openTender(1000, 60, 40);
    harness.offerService.submitOffer("alice", withOffer, 500, "doc");
    harness.tenderService.createTender(AUTHORITY, "Long running", 1000, 30, 60, 40);

    assertThat(monitor.reportStaleTenders()).isZero();

    harness.clock.advance(Duration.ofDays(8));

    assertThat(monitor.reportStaleTenders()).isEqualTo(1);
    assertThat(harness.tenderService.getTender(empty).status()).isEqualTo(TenderStatus.OPEN);
  }
}
