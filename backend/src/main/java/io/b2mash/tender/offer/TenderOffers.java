package io.b2mash.tender.offer;

import java.util.List;

/**
 * All offers of one tender as parallel sequences in participant order: element {@code i} of every
 * list describes the same provider. Combined scores are 0 for offers not yet evaluated.
 */
public record TenderOffers(
    long tenderId,
    List<String> providers,
    List<Long> prices,
    List<Integer> qualityScores,
    List<Integer> combinedScores) {

  public TenderOffers {
    providers = List.copyOf(providers);
    prices = List.copyOf(prices);
    qualityScores = List.copyOf(qualityScores);
    combinedScores = List.copyOf(combinedScores);
  }

  public static TenderOffers empty(long tenderId) {
    return new TenderOffers(tenderId, List.of(), List.of(), List.of(), List.of());
  }

  public int size() {
    return providers.size();
  }
}
