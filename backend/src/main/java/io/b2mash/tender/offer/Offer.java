package io.b2mash.tender.offer;

import io.b2mash.tender.exception.ResourceConflictException;
import java.time.Instant;
import java.util.Objects;

/**
 * A provider's sealed bid against a tender. Price and documentation reference are fixed at
 * submission; the quality score is written exactly once by an evaluator.
 *
 * <p>An offer's existence is its presence in {@link OfferRepository}. A score of 0 is a valid
 * evaluated state, distinguished from "not yet scored" by {@link #isEvaluated()}.
 */
public class Offer {

  public static final int MAX_QUALITY_SCORE = 100;

  private final long tenderId;
  private final String provider;
  private final long price;
  private final String documentationReference;
  private final Instant submittedAt;

  private int qualityScore;
  private boolean evaluated;
  private String evaluatedBy;
  private Instant evaluatedAt;

  public Offer(
      long tenderId,
      String provider,
      long price,
      String documentationReference,
      Instant submittedAt) {
    this.tenderId = tenderId;
    this.provider = Objects.requireNonNull(provider, "provider must not be null");
    this.price = price;
    this.documentationReference =
        Objects.requireNonNull(documentationReference, "documentationReference must not be null");
    this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt must not be null");
  }

  /** Records the quality score. Throws {@link ResourceConflictException} on a second call. */
  public void recordEvaluation(int qualityScore, String evaluator, Instant now) {
    if (evaluated) {
      throw new ResourceConflictException(
          "Offer already evaluated",
          "Offer from " + provider + " on tender " + tenderId + " is already evaluated");
    }
    if (qualityScore < 0 || qualityScore > MAX_QUALITY_SCORE) {
      throw new IllegalArgumentException("qualityScore out of range: " + qualityScore);
    }
    this.qualityScore = qualityScore;
    this.evaluated = true;
    this.evaluatedBy = Objects.requireNonNull(evaluator, "evaluator must not be null");
    this.evaluatedAt = now;
  }

  public OfferKey getKey() {
    return new OfferKey(tenderId, provider);
  }

  public long getTenderId() {
    return tenderId;
  }

  public String getProvider() {
    return provider;
  }

  public long getPrice() {
    return price;
  }

  public String getDocumentationReference() {
    return documentationReference;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public int getQualityScore() {
    return qualityScore;
  }

  public boolean isEvaluated() {
    return evaluated;
  }

  public String getEvaluatedBy() {
    return evaluatedBy;
  }

  public Instant getEvaluatedAt() {
    return evaluatedAt;
  }
}
