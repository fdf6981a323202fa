package io.b2mash.tender.winner;

import java.math.BigInteger;

/**
 * Integer score arithmetic for winner selection. All divisions floor; results are reproducible
 * bit-for-bit across runs.
 */
public final class ScoreCalculator {

  public static final int MAX_SCORE = 100;

  private static final BigInteger HUNDRED = BigInteger.valueOf(MAX_SCORE);

  /**
   * Price competitiveness relative to the tender's maximum price: {@code min(100, floor(maxPrice *
   * 100 / price))}. Exact for any positive {@code long} inputs.
   *
   * @throws IllegalArgumentException if {@code price} is not positive
   */
  public static int priceScore(long maxPrice, long price) {
    if (price <= 0) {
      throw new IllegalArgumentException("price must be positive, got " + price);
    }
    BigInteger ratio =
        BigInteger.valueOf(maxPrice).multiply(HUNDRED).divide(BigInteger.valueOf(price));
    return ratio.min(HUNDRED).intValue();
  }

  /** Weighted blend {@code floor((priceScore * weightPrice + qualityScore * weightQuality) / 100)}. */
  public static int combinedScore(
      int priceScore, int qualityScore, int weightPrice, int weightQuality) {
    return (priceScore * weightPrice + qualityScore * weightQuality) / MAX_SCORE;
  }

  /** Combined score of an offer on a tender, from raw price and quality score. */
  public static int combinedScore(
      long maxPrice, long price, int qualityScore, int weightPrice, int weightQuality) {
    return combinedScore(priceScore(maxPrice, price), qualityScore, weightPrice, weightQuality);
  }

  private ScoreCalculator() {}
}
