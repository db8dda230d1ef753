package com.ospicorp.growthcurves.curves.service;

/**
 * Outcome of {@link LoessRefiner#refine}: the last smoother output, how many smoother runs were
 * made, and whether two successive runs agreed within tolerance. {@code maxDiff} is the last
 * observed difference, NaN when only one run happened.
 */
public record Refinement(
    LoessResult result,
    int loops,
    boolean converged,
    double maxDiff
) {}
