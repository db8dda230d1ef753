package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.Point;
import com.ospicorp.growthcurves.curves.model.SmoothingParameters;
import java.util.List;

/**
 * Re-runs the smoother on the same input until two successive outputs agree within the
 * convergence tolerance, or {@code maxRefinements} runs have been made.
 */
public final class LoessRefiner {
  private LoessRefiner() {
  }

  public static Refinement refine(List<Point> points, double span, int degree,
      int robustIterations, int maxRefinements, double tolerance) {
    return refine(points,
        new SmoothingParameters(span, degree, robustIterations, maxRefinements, tolerance));
  }

  public static Refinement refine(List<Point> points, SmoothingParameters params) {
    params.validate();
    LoessResult previous = null;
    double maxDiff = Double.NaN;
    for (int loop = 1; loop <= params.maxRefinements(); loop++) {
      LoessResult result = Loess.smooth(points, params.span(), params.degree(),
          params.robustIterations());
      if (previous != null && previous.points().size() == result.points().size()) {
        maxDiff = maxAbsDiff(previous.points(), result.points());
        if (maxDiff <= params.convergenceTolerance()) {
          return new Refinement(result, loop, true, maxDiff);
        }
      }
      previous = result;
    }
    return new Refinement(previous, params.maxRefinements(), false, maxDiff);
  }

  private static double maxAbsDiff(List<Point> a, List<Point> b) {
    double max = 0d;
    for (int i = 0; i < a.size(); i++) {
      max = Math.max(max, Math.abs(a.get(i).y() - b.get(i).y()));
    }
    return max;
  }
}
