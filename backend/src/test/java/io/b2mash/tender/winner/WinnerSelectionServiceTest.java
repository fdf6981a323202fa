package io.b2mash.tender.winner;

import static io.b2mash.tender.testutil.TenderTestHarness.AUTHORITY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.b2mash.tender.exception.ErrorKind;
import io.b2mash.tender.exception.ForbiddenException;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.ResourceConflictException;
import io.b2mash.tender.tender.TenderStatus;
import io.b2mash.tender.testutil.TenderTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WinnerSelectionServiceTest {

  private TenderTestHarness harness;
  private WinnerSelectionService service;

  @BeforeEach
  void setUp() {
    harness = new TenderTestHarness();
    service = harness.winnerSelectionService;
  }

  private long evaluatedTender(int weightPrice, int weightQuality, Object... offers) {
    long tenderId = harness.openTender(1000, weightPrice, weightQuality);
    for (int i = 0; i < offers.length; i += 3) {
      harness.offerService.submitOffer((String) offers[i], tenderId, (Long) offers[i + 1], "doc");
    }
    harness.close(tenderId);
    for (int i = 0; i < offers.length; i += 3) {
      harness.evaluate(tenderId, (String) offers[i], (Integer) offers[i + 2]);
    }
    harness.tenderService.markAsEvaluated(AUTHORITY, tenderId);
    return tenderId;
  }

  @Test
  void calculateWinner_picksHighestCombinedScore() {
    long tenderId = evaluatedTender(60, 40, "A", 500L, 50, "B", 1000L, 90);

    var selection = service.calculateWinner(AUTHORITY, tenderId);

    assertThat(selection.winner()).isEqualTo("B");
    assertThat(selection.winningScore()).isEqualTo(96);
    assertThat(selection.scoredOffers())
        .extracting(ScoredOffer::provider, ScoredOffer::priceScore, ScoredOffer::combinedScore)
        .containsExactly(
            tuple("A", 100, 80),
            tuple("B", 100, 96));

    var tender = harness.tenderService.getTender(tenderId);
    assertThat(tender.status()).isEqualTo(TenderStatus.FINALIZED);
    assertThat(tender.winner()).isEqualTo("B");
    verify(harness.auditService)
        .log(argThat(record -> "tender.finalized".equals(record.eventType())));
  }

  @Test
  void calculateWinner_tieGoesToEarliestSubmission() {
    long tenderId = evaluatedTender(50, 50, "zeta", 800L, 70, "alpha", 900L, 70, "mid", 700L, 60);

    var selection = service.calculateWinner(AUTHORITY, tenderId);

    // both leaders score 85; the first submitted keeps the lead
    assertThat(selection.winner()).isEqualTo("zeta");
    assertThat(selection.winningScore()).isEqualTo(85);
  }

  @Test
  void calculateWinner_allZeroScores_stillPicksFirstParticipant() {
    long tenderId = evaluatedTender(0, 100, "first", 900L, 0, "second", 500L, 0);

    var selection = service.calculateWinner(AUTHORITY, tenderId);

    assertThat(selection.winner()).isEqualTo("first");
    assertThat(selection.winningScore()).isZero();
  }

  @Test
  void calculateWinner_twice_isConflictAndStateUnchanged() {
    long tenderId = evaluatedTender(60, 40, "A", 500L, 50, "B", 1000L, 90);
    service.calculateWinner(AUTHORITY, tenderId);
    var before = harness.tenderService.getTender(tenderId);

    assertThatThrownBy(() -> service.calculateWinner(AUTHORITY, tenderId))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.ALREADY_EXISTS));

    assertThat(harness.tenderService.getTender(tenderId)).isEqualTo(before);
    verify(harness.auditService, times(1))
        .log(argThat(record -> "tender.finalized".equals(record.eventType())));
  }

  @Test
  void calculateWinner_beforeEvaluated_isInvalidState() {
    long tenderId = harness.openTender(1000, 60, 40);
    harness.offerService.submitOffer("A", tenderId, 500, "doc");
    harness.close(tenderId);
    harness.evaluate(tenderId, "A", 50);

    assertThatThrownBy(() -> service.calculateWinner(AUTHORITY, tenderId))
        .isInstanceOf(InvalidStateException.class);
    assertThat(harness.tenderService.getTender(tenderId).winner()).isNull();
  }

  @Test
  void calculateWinner_nonAuthority_isUnauthorized() {
    long tenderId = evaluatedTender(60, 40, "A", 500L, 50);

    assertThatThrownBy(() -> service.calculateWinner("A", tenderId))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void calculateWinner_afterAuthorityRenounced_isUnauthorized() {
    long tenderId = evaluatedTender(60, 40, "A", 500L, 50);
    harness.accessControlService.renounceAuthority(AUTHORITY);

    assertThatThrownBy(() -> service.calculateWinner(AUTHORITY, tenderId))
        .isInstanceOf(ForbiddenException.class);
  }
}
