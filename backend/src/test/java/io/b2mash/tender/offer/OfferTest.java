package io.b2mash.tender.offer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.tender.exception.ResourceConflictException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class OfferTest {

  private static final Instant SUBMITTED_AT = Instant.parse("2026-03-03T10:15:00Z");

  private Offer buildOffer() {
    return new Offer(7L, "alice", 500L, "ipfs://offer-docs", SUBMITTED_AT);
  }

  @Test
  void newOffer_isNotEvaluated() {
    var offer = buildOffer();

    assertThat(offer.isEvaluated()).isFalse();
    assertThat(offer.getQualityScore()).isZero();
    assertThat(offer.getEvaluatedBy()).isNull();
    assertThat(offer.getKey()).isEqualTo(new OfferKey(7L, "alice"));
  }

  @Test
  void recordEvaluation_zeroScoreCountsAsEvaluated() {
    var offer = buildOffer();

    offer.recordEvaluation(0, "evaluator-1", SUBMITTED_AT.plusSeconds(3600));

    assertThat(offer.isEvaluated()).isTrue();
    assertThat(offer.getQualityScore()).isZero();
    assertThat(offer.getEvaluatedBy()).isEqualTo("evaluator-1");
    assertThat(offer.getEvaluatedAt()).isEqualTo(SUBMITTED_AT.plusSeconds(3600));
  }

  @Test
  void recordEvaluation_secondCall_throwsConflictAndKeepsFirstScore() {
    var offer = buildOffer();
    offer.recordEvaluation(70, "evaluator-1", SUBMITTED_AT);

    assertThatThrownBy(() -> offer.recordEvaluation(90, "evaluator-2", SUBMITTED_AT))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(offer.getQualityScore()).isEqualTo(70);
    assertThat(offer.getEvaluatedBy()).isEqualTo("evaluator-1");
  }

  @Test
  void recordEvaluation_outOfRange_throws() {
    var offer = buildOffer();

    assertThatThrownBy(() -> offer.recordEvaluation(101, "evaluator-1", SUBMITTED_AT))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(offer.isEvaluated()).isFalse();
  }
}
