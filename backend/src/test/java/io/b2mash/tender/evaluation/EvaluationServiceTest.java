package io.b2mash.tender.evaluation;

import static io.b2mash.tender.testutil.TenderTestHarness.EVALUATOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;

import io.b2mash.tender.exception.ForbiddenException;
import io.b2mash.tender.exception.InvalidInputException;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.ResourceConflictException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.testutil.TenderTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EvaluationServiceTest {

  private TenderTestHarness harness;
  private EvaluationService service;
  private long tenderId;

  @BeforeEach
  void setUp() {
    harness = new TenderTestHarness();
    service = harness.evaluationService;
    tenderId = harness.openTender(1000, 60, 40);
    harness.offerService.submitOffer("alice", tenderId, 500, "doc-a");
  }

  @Test
  void evaluateOffer_onClosedTender_recordsScore() {
    harness.close(tenderId);

    var offer = service.evaluateOffer(EVALUATOR, tenderId, "alice", 85);

    assertThat(offer.evaluated()).isTrue();
    assertThat(offer.qualityScore()).isEqualTo(85);
    assertThat(offer.evaluatedBy()).isEqualTo(EVALUATOR);
    verify(harness.auditService)
        .log(argThat(record -> "offer.evaluated".equals(record.eventType())));
  }

  @Test
  void evaluateOffer_boundaryScores_areAccepted() {
    harness.offerService.submitOffer("bob", tenderId, 600, "doc-b");
    harness.close(tenderId);

    assertThat(service.evaluateOffer(EVALUATOR, tenderId, "alice", 0).qualityScore()).isZero();
    assertThat(service.evaluateOffer(EVALUATOR, tenderId, "bob", 100).qualityScore())
        .isEqualTo(100);
  }

  @Test
  void evaluateOffer_whileOpen_isInvalidState() {
    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, tenderId, "alice", 85))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void evaluateOffer_twice_isConflictAndKeepsFirstScore() {
    harness.close(tenderId);
    service.evaluateOffer(EVALUATOR, tenderId, "alice", 85);

    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, tenderId, "alice", 10))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(harness.offerService.getOffer(tenderId, "alice").qualityScore()).isEqualTo(85);
  }

  @Test
  void evaluateOffer_scoreAbove100_isInvalidInput() {
    harness.close(tenderId);

    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, tenderId, "alice", 101))
        .isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, tenderId, "alice", -1))
        .isInstanceOf(InvalidInputException.class);
    assertThat(harness.offerService.getOffer(tenderId, "alice").evaluated()).isFalse();
  }

  @Test
  void evaluateOffer_nonEvaluator_isUnauthorized() {
    harness.close(tenderId);

    assertThatThrownBy(
            () -> service.evaluateOffer(TenderTestHarness.AUTHORITY, tenderId, "alice", 85))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void evaluateOffer_removedEvaluator_isUnauthorized() {
    harness.close(tenderId);
    harness.accessControlService.removeEvaluator(TenderTestHarness.AUTHORITY, EVALUATOR);

    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, tenderId, "alice", 85))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void evaluateOffer_unknownProvider_isNotFound() {
    harness.close(tenderId);

    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, tenderId, "nobody", 85))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void evaluateOffer_providerWithSurroundingWhitespace_matchesStoredOffer() {
    harness.close(tenderId);

    var offer = service.evaluateOffer(EVALUATOR, tenderId, "  alice ", 85);

    assertThat(offer.provider()).isEqualTo("alice");
    assertThat(harness.offerService.getOffer(tenderId, "alice ").qualityScore()).isEqualTo(85);
  }

  @Test
  void evaluateOffer_blankProvider_isInvalidInput() {
    harness.close(tenderId);

    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, tenderId, "  ", 85))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void evaluateOffer_unknownTender_isNotFound() {
    assertThatThrownBy(() -> service.evaluateOffer(EVALUATOR, 404L, "alice", 85))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
