package com.ospicorp.growthcurves.curves.model;

import java.util.List;

/**
 * Per-point residuals and robustness weights of the final LOESS pass, in the same order as the
 * smoothed points.
 */
public record LoessDiagnostics(
    List<Double> residuals,
    List<Double> robustnessWeights,
    int windowSize
) {}
