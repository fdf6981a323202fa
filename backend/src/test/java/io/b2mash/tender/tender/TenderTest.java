package io.b2mash.tender.tender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.tender.exception.InvalidStateException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TenderTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-02T09:00:00Z");
  private static final Instant DEADLINE = CREATED_AT.plus(Duration.ofDays(7));

  private Tender buildTender() {
    return new Tender(1L, "authority", "Bridge inspection", 1000L, DEADLINE, 60, 40, CREATED_AT);
  }

  @Test
  void constructor_setsOpenStatus() {
    var tender = buildTender();

    assertThat(tender.getStatus()).isEqualTo(TenderStatus.OPEN);
    assertThat(tender.getId()).isEqualTo(1L);
    assertThat(tender.getCreator()).isEqualTo("authority");
    assertThat(tender.getMaxPrice()).isEqualTo(1000L);
    assertThat(tender.getDeadline()).isEqualTo(DEADLINE);
    assertThat(tender.getWeightPrice() + tender.getWeightQuality()).isEqualTo(100);
    assertThat(tender.getParticipants()).isEmpty();
    assertThat(tender.getWinner()).isNull();
    assertThat(tender.hasWinner()).isFalse();
  }

  @Test
  void constructor_rejectsWeightsNotSummingTo100() {
    assertThatThrownBy(
            () -> new Tender(1L, "authority", "Bad", 1000L, DEADLINE, 50, 40, CREATED_AT))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void addParticipant_keepsSubmissionOrder() {
    var tender = buildTender();

    tender.addParticipant("carol");
    tender.addParticipant("alice");
    tender.addParticipant("bob");

    assertThat(tender.getParticipants()).containsExactly("carol", "alice", "bob");
    assertThat(tender.getParticipantCount()).isEqualTo(3);
  }

  @Test
  void addParticipant_rejectsDuplicate() {
    var tender = buildTender();
    tender.addParticipant("alice");

    assertThatThrownBy(() -> tender.addParticipant("alice"))
        .isInstanceOf(IllegalStateException.class);
    assertThat(tender.getParticipantCount()).isEqualTo(1);
  }

  @Test
  void addParticipant_whenClosed_throws() {
    var tender = buildTender();
    tender.addParticipant("alice");
    tender.markClosed(DEADLINE.plusSeconds(1));

    assertThatThrownBy(() -> tender.addParticipant("bob"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void getParticipants_returnsDetachedCopy() {
    var tender = buildTender();
    tender.addParticipant("alice");

    var participants = tender.getParticipants();

    assertThatThrownBy(() -> participants.add("mallory"))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThat(tender.getParticipants()).containsExactly("alice");
  }

  @Test
  void isAcceptingOffers_untilDeadlineInclusive() {
    var tender = buildTender();

    assertThat(tender.isAcceptingOffers(CREATED_AT)).isTrue();
    assertThat(tender.isAcceptingOffers(DEADLINE)).isTrue();
    assertThat(tender.isAcceptingOffers(DEADLINE.plusMillis(1))).isFalse();
    assertThat(tender.isDeadlinePassed(DEADLINE)).isFalse();
    assertThat(tender.isDeadlinePassed(DEADLINE.plusMillis(1))).isTrue();
  }

  @Test
  void fullLifecycle_reachesFinalized() {
    var tender = buildTender();
    tender.addParticipant("alice");
    var closedAt = DEADLINE.plusSeconds(60);

    tender.markClosed(closedAt);
    tender.markEvaluated(closedAt.plusSeconds(60));
    tender.markFinalized("alice", closedAt.plusSeconds(120));

    assertThat(tender.getStatus()).isEqualTo(TenderStatus.FINALIZED);
    assertThat(tender.getWinner()).isEqualTo("alice");
    assertThat(tender.getClosedAt()).isEqualTo(closedAt);
    assertThat(tender.getEvaluatedAt()).isEqualTo(closedAt.plusSeconds(60));
    assertThat(tender.getFinalizedAt()).isEqualTo(closedAt.plusSeconds(120));
  }

  @Test
  void markClosed_twice_throws() {
    var tender = buildTender();
    tender.markClosed(DEADLINE.plusSeconds(1));

    assertThatThrownBy(() -> tender.markClosed(DEADLINE.plusSeconds(2)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void markEvaluated_fromOpen_throws() {
    var tender = buildTender();

    assertThatThrownBy(() -> tender.markEvaluated(CREATED_AT))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void markFinalized_fromClosed_throws() {
    var tender = buildTender();
    tender.markClosed(DEADLINE.plusSeconds(1));

    assertThatThrownBy(() -> tender.markFinalized("alice", DEADLINE.plusSeconds(2)))
        .isInstanceOf(InvalidStateException.class);
    assertThat(tender.getWinner()).isNull();
  }
}
