package io.b2mash.tender.tender;

import io.b2mash.tender.exception.InvalidStateException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A procurement tender.
 *
 * <p>Lifecycle: OPEN → CLOSED → EVALUATED → FINALIZED. Terms (description, max price, deadline,
 * weights) are fixed at creation. The participant list grows only while OPEN, in submission order,
 * and is the source of truth for who may be scored and for tie-breaks.
 *
 * <p>Not thread-safe: every access goes through {@link TenderLocks}.
 */
public class Tender {

  public static final int WEIGHT_TOTAL = 100;

  private final long id;
  private final String creator;
  private final String description;
  private final long maxPrice;
  private final Instant deadline;
  private final int weightPrice;
  private final int weightQuality;
  private final Instant createdAt;
  private final List<String> participants = new ArrayList<>();

  private TenderStatus status;
  private String winner;
  private Instant closedAt;
  private Instant evaluatedAt;
  private Instant finalizedAt;

  public Tender(
      long id,
      String creator,
      String description,
      long maxPrice,
      Instant deadline,
      int weightPrice,
      int weightQuality,
      Instant createdAt) {
    if (weightPrice + weightQuality != WEIGHT_TOTAL) {
      throw new IllegalArgumentException("weights must sum to " + WEIGHT_TOTAL);
    }
    this.id = id;
    this.creator = Objects.requireNonNull(creator, "creator must not be null");
    this.description = Objects.requireNonNull(description, "description must not be null");
    this.maxPrice = maxPrice;
    this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
    this.weightPrice = weightPrice;
    this.weightQuality = weightQuality;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    this.status = TenderStatus.OPEN;
  }

  // --- Lifecycle methods ---

  /** Appends a provider to the participant list. Only valid while OPEN. */
  public void addParticipant(String provider) {
    requireStatus(TenderStatus.OPEN, "add participants to");
    Objects.requireNonNull(provider, "provider must not be null");
    if (participants.contains(provider)) {
      throw new IllegalStateException("provider " + provider + " already participates");
    }
    participants.add(provider);
  }

  /** Ends the offer period. Only valid from OPEN. */
  public void markClosed(Instant now) {
    requireStatus(TenderStatus.OPEN, "close");
    this.status = TenderStatus.CLOSED;
    this.closedAt = now;
  }

  /** Records that every offer has been scored. Only valid from CLOSED. */
  public void markEvaluated(Instant now) {
    requireStatus(TenderStatus.CLOSED, "mark as evaluated");
    this.status = TenderStatus.EVALUATED;
    this.evaluatedAt = now;
  }

  /** Commits the winner. Only valid from EVALUATED, and only once. */
  public void markFinalized(String winner, Instant now) {
    requireStatus(TenderStatus.EVALUATED, "finalize");
    if (this.winner != null) {
      throw new IllegalStateException("winner already set for tender " + id);
    }
    this.winner = Objects.requireNonNull(winner, "winner must not be null");
    this.status = TenderStatus.FINALIZED;
    this.finalizedAt = now;
  }

  // --- Guards ---

  public boolean isAcceptingOffers(Instant now) {
    return status == TenderStatus.OPEN && !now.isAfter(deadline);
  }

  public boolean isDeadlinePassed(Instant now) {
    return now.isAfter(deadline);
  }

  public boolean hasWinner() {
    return winner != null;
  }

  // --- Getters ---

  public long getId() {
    return id;
  }

  public String getCreator() {
    return creator;
  }

  public String getDescription() {
    return description;
  }

  public long getMaxPrice() {
    return maxPrice;
  }

  public Instant getDeadline() {
    return deadline;
  }

  public int getWeightPrice() {
    return weightPrice;
  }

  public int getWeightQuality() {
    return weightQuality;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public TenderStatus getStatus() {
    return status;
  }

  public String getWinner() {
    return winner;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public Instant getEvaluatedAt() {
    return evaluatedAt;
  }

  public Instant getFinalizedAt() {
    return finalizedAt;
  }

  /** Participants in submission order. */
  public List<String> getParticipants() {
    return List.copyOf(participants);
  }

  public int getParticipantCount() {
    return participants.size();
  }

  // --- Private helpers ---

  private void requireStatus(TenderStatus required, String action) {
    if (this.status != required) {
      throw new InvalidStateException(
          "Invalid tender state", "Cannot " + action + " tender " + id + " in status " + status);
    }
  }
}
