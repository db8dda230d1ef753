package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Parameters for one LOESS application.
 *
 * <p>{@code span} is a fraction of the points when {@code <= 1}, an absolute neighbourhood size
 * otherwise. Construction never validates; call {@link #validate()} before running anything.
 */
public record SmoothingParameters(
    double span,
    int degree,
    int robustIterations,
    int maxRefinements,
    double convergenceTolerance
) {

  public static final double DEFAULT_SPAN = 0.25;
  public static final int DEFAULT_DEGREE = 1;
  public static final int DEFAULT_ROBUST_ITERATIONS = 3;
  public static final int DEFAULT_MAX_REFINEMENTS = 3;
  public static final double DEFAULT_TOLERANCE = 1e-4;

  public static SmoothingParameters defaults() {
    return new SmoothingParameters(DEFAULT_SPAN, DEFAULT_DEGREE, DEFAULT_ROBUST_ITERATIONS,
        DEFAULT_MAX_REFINEMENTS, DEFAULT_TOLERANCE);
  }

  public SmoothingParameters withSpanAndDegree(double newSpan, int newDegree) {
    return new SmoothingParameters(newSpan, newDegree, robustIterations, maxRefinements,
        convergenceTolerance);
  }

  @JsonIgnore
  public SmoothingParameters validate() {
    if (!Double.isFinite(span) || span <= 0d) {
      throw new InvalidParameterException("Invalid span. Must be a positive number.", 1101);
    }
    if (degree != 1 && degree != 2) {
      throw new InvalidParameterException("Invalid degree. Supported values: 1,2.", 1102);
    }
    if (robustIterations < 1) {
      throw new InvalidParameterException(
          "Invalid robustIterations. Must be greater than or equal to 1.", 1103);
    }
    if (maxRefinements < 1) {
      throw new InvalidParameterException(
          "Invalid maxRefinements. Must be greater than or equal to 1.", 1104);
    }
    if (!Double.isFinite(convergenceTolerance) || convergenceTolerance <= 0d) {
      throw new InvalidParameterException(
          "Invalid convergenceTolerance. Must be a positive number.", 1105);
    }
    return this;
  }
}
