package com.ospicorp.growthcurves.curves.service;

/**
 * Sampling budget of the band estimator. Up to {@code maxExactReplicates} wells every bootstrap
 * composition is enumerated (their count grows as C(2n-1, n)); beyond that a seeded Monte-Carlo
 * bootstrap of {@code monteCarloResamples} draws is used instead.
 */
public record BandSettings(
    int maxExactReplicates,
    int monteCarloResamples,
    long seed
) {

  public static final int DEFAULT_MAX_EXACT_REPLICATES = 8;
  public static final int DEFAULT_MONTE_CARLO_RESAMPLES = 2000;
  public static final long DEFAULT_SEED = 20240601L;

  public BandSettings {
    if (maxExactReplicates < 2) {
      throw new IllegalArgumentException("maxExactReplicates must be at least 2");
    }
    if (monteCarloResamples < 1) {
      throw new IllegalArgumentException("monteCarloResamples must be positive");
    }
  }

  public static BandSettings defaults() {
    return new BandSettings(DEFAULT_MAX_EXACT_REPLICATES, DEFAULT_MONTE_CARLO_RESAMPLES,
        DEFAULT_SEED);
  }
}
