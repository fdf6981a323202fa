package io.b2mash.tender.winner;

/** One participant's scores as used for winner selection. */
public record ScoredOffer(
    String provider, long price, int priceScore, int qualityScore, int combinedScore) {}
