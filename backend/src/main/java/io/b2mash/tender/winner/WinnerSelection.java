package io.b2mash.tender.winner;

import java.util.List;

/**
 * Outcome of winner selection: the winner, its combined score, and every participant's scores in
 * submission order.
 */
public record WinnerSelection(
    long tenderId, String winner, int winningScore, List<ScoredOffer> scoredOffers) {

  public WinnerSelection {
    scoredOffers = List.copyOf(scoredOffers);
  }
}
