package io.b2mash.tender.tender;

import java.time.Instant;

/** Consistent, immutable view of a tender taken under its read or write lock. */
public record TenderSnapshot(
    long id,
    String creator,
    String description,
    long maxPrice,
    Instant deadline,
    int weightPrice,
    int weightQuality,
    TenderStatus status,
    String winner,
    int participantCount,
    Instant createdAt,
    Instant closedAt,
    Instant evaluatedAt,
    Instant finalizedAt) {

  public static TenderSnapshot of(Tender tender) {
    return new TenderSnapshot(
        tender.getId(),
        tender.getCreator(),
        tender.getDescription(),
        tender.getMaxPrice(),
        tender.getDeadline(),
        tender.getWeightPrice(),
        tender.getWeightQuality(),
        tender.getStatus(),
        tender.getWinner(),
        tender.getParticipantCount(),
        tender.getCreatedAt(),
        tender.getClosedAt(),
        tender.getEvaluatedAt(),
        tender.getFinalizedAt());
  }
}
