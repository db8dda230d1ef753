package com.ospicorp.growthcurves.curves.service;

/**
 * Summary of a batch operation over samples.
 *
 * @param applied       samples whose history changed
 * @param skipped       targeted samples left untouched (too few points, or already at raw)
 * @param averagePasses mean smoother runs per applied sample; 0 for step-back
 * @param detected      changed samples that ended up with an automatic log phase
 */
public record SmoothingReport(
    int applied,
    int skipped,
    double averagePasses,
    int detected
) {}
