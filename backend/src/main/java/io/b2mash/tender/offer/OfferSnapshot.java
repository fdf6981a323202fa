package io.b2mash.tender.offer;

import java.time.Instant;

/** Immutable view of an offer taken under its tender's lock. */
public record OfferSnapshot(
    long tenderId,
    String provider,
    long price,
    String documentationReference,
    int qualityScore,
    boolean evaluated,
    Instant submittedAt,
    String evaluatedBy,
    Instant evaluatedAt) {

  public static OfferSnapshot of(Offer offer) {
    return new OfferSnapshot(
        offer.getTenderId(),
        offer.getProvider(),
        offer.getPrice(),
        offer.getDocumentationReference(),
        offer.getQualityScore(),
        offer.isEvaluated(),
        offer.getSubmittedAt(),
        offer.getEvaluatedBy(),
        offer.getEvaluatedAt());
  }
}
