package com.ospicorp.growthcurves.curves.service;

import java.util.List;

/**
 * Settings of the growth-parameter statistics: confidence level {@code 1 - alpha}, the seeded
 * bootstrap of the replicate mean, and the OD thresholds whose crossing times are reported.
 */
public record ParameterSettings(
    double alpha,
    int bootstrapIterations,
    long seed,
    List<Double> detectionThresholds
) {

  public static final double DEFAULT_ALPHA = 0.05;
  public static final int DEFAULT_BOOTSTRAP_ITERATIONS = 2000;
  public static final long DEFAULT_SEED = 20240601L;
  public static final List<Double> DEFAULT_DETECTION_THRESHOLDS = List.of(0.05, 0.1);

  public ParameterSettings {
    if (!(alpha > 0d && alpha < 1d)) {
      throw new IllegalArgumentException("alpha must lie in (0, 1)");
    }
    if (bootstrapIterations < 0) {
      throw new IllegalArgumentException("bootstrapIterations must not be negative");
    }
    detectionThresholds = detectionThresholds == null
        ? List.of()
        : List.copyOf(detectionThresholds);
  }

  public static ParameterSettings defaults() {
    return new ParameterSettings(DEFAULT_ALPHA, DEFAULT_BOOTSTRAP_ITERATIONS, DEFAULT_SEED,
        DEFAULT_DETECTION_THRESHOLDS);
  }
}
