package com.ospicorp.growthcurves.curves.service;

import java.util.List;

/**
 * Result of {@link LogPhaseDetector#detect}. When nothing was detected {@code indices} is empty
 * and the time bounds, slope and r2 are null; {@code muMax} and {@code kEstimate} may still be
 * set for diagnostics.
 *
 * @param indices   source-point indices covered by the selected run, in time order
 * @param slope     growth rate of an OLS fit of ln(y) on x over the whole run
 * @param muMax     largest slope among windows passing the r2 and plateau filters
 * @param muMean    mean slope of the accepted windows overlapping the run
 * @param kEstimate carrying-capacity estimate, the median of the last five usable values
 */
public record LogPhaseDetection(
    List<Integer> indices,
    Double startTime,
    Double endTime,
    Double slope,
    Double r2,
    Double muMax,
    Double muMean,
    Double kEstimate
) {

  public LogPhaseDetection {
    indices = List.copyOf(indices);
  }

  static LogPhaseDetection none(Double muMax, Double kEstimate) {
    return new LogPhaseDetection(List.of(), null, null, null, null, muMax, null, kEstimate);
  }

  public boolean detected() {
    return !indices.isEmpty() && startTime != null && endTime != null;
  }
}
