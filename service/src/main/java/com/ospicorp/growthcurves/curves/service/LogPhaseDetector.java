package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.LogPhaseDetectionOptions;
import com.ospicorp.growthcurves.curves.model.Point;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Sliding-window detector for the exponential growth phase.
 *
 * <p>Every run of {@code windowSize} consecutive usable points gets an OLS fit of ln(y) on time.
 * A window is accepted when its slope is positive, its r2 reaches {@code r2Min}, it stays below
 * {@code fracKMax} of the plateau estimate K, and its slope relative to the steepest such window
 * lies in {@code [muRelMin, muRelMax]}. Overlapping or touching accepted windows merge into
 * runs; the run with the widest time extent wins, ties going to the earliest start and then to
 * the run with more points.
 */
public final class LogPhaseDetector {
  private static final int K_TAIL = 5;

  private LogPhaseDetector() {
  }

  public static LogPhaseDetection detect(List<Point> points) {
    return detect(points, LogPhaseDetectionOptions.defaults());
  }

  public static LogPhaseDetection detect(List<Point> points, LogPhaseDetectionOptions options) {
    LogPhaseDetectionOptions opts = options.clamped();
    if (points == null || points.isEmpty()) {
      return LogPhaseDetection.none(null, null);
    }

    List<Integer> order = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); i++) {
      Point p = points.get(i);
      if (p != null && p.isFinite() && p.y() > 0d && p.y() >= opts.odMin()) {
        order.add(i);
      }
    }
    order.sort(Comparator.comparingDouble(i -> points.get(i).x()));
    int m = order.size();
    int w = opts.windowSize();
    if (m < w) {
      return LogPhaseDetection.none(null, null);
    }

    double[] xs = new double[m];
    double[] ys = new double[m];
    double[] logYs = new double[m];
    for (int j = 0; j < m; j++) {
      Point p = points.get(order.get(j));
      xs[j] = p.x();
      ys[j] = p.y();
      logYs[j] = Math.log(p.y());
    }

    double kEstimate = new Median().evaluate(Arrays.copyOfRange(ys, Math.max(0, m - K_TAIL), m));

    List<Window> good = new ArrayList<>();
    for (int start = 0; start + w <= m; start++) {
      int end = start + w - 1;
      double maxY = Double.NEGATIVE_INFINITY;
      for (int j = start; j <= end; j++) {
        maxY = Math.max(maxY, ys[j]);
      }
      if (maxY / kEstimate >= opts.fracKMax()) {
        continue;
      }
      Fit fit = fit(xs, logYs, start, end);
      if (fit == null || fit.slope() <= 0d || fit.r2() < opts.r2Min()) {
        continue;
      }
      good.add(new Window(start, end, fit.slope()));
    }
    if (good.isEmpty()) {
      return LogPhaseDetection.none(null, kEstimate);
    }

    double muMax = good.stream().mapToDouble(Window::slope).max().orElseThrow();
    List<Window> accepted = good.stream()
        .filter(win -> {
          double muRel = win.slope() / muMax;
          return muRel >= opts.muRelMin() && muRel <= opts.muRelMax();
        })
        .toList();
    if (accepted.isEmpty()) {
      return LogPhaseDetection.none(muMax, kEstimate);
    }

    boolean[] covered = new boolean[m];
    for (Window win : accepted) {
      Arrays.fill(covered, win.start(), win.end() + 1, true);
    }
    int[] best = selectRun(covered, xs);

    List<Integer> indices = new ArrayList<>(best[1] - best[0] + 1);
    for (int j = best[0]; j <= best[1]; j++) {
      indices.add(order.get(j));
    }
    double muMean = accepted.stream()
        .filter(win -> win.end() >= best[0] && win.start() <= best[1])
        .mapToDouble(Window::slope)
        .average()
        .orElse(muMax);
    Fit runFit = fit(xs, logYs, best[0], best[1]);

    return new LogPhaseDetection(indices, xs[best[0]], xs[best[1]],
        runFit == null ? null : runFit.slope(),
        runFit == null ? null : runFit.r2(),
        muMax, muMean, kEstimate);
  }

  private static int[] selectRun(boolean[] covered, double[] xs) {
    int[] best = null;
    int j = 0;
    while (j < covered.length) {
      if (!covered[j]) {
        j++;
        continue;
      }
      int start = j;
      while (j < covered.length && covered[j]) {
        j++;
      }
      int[] run = {start, j - 1};
      if (best == null || better(run, best, xs)) {
        best = run;
      }
    }
    return best;
  }

  private static boolean better(int[] run, int[] best, double[] xs) {
    int byExtent = Double.compare(xs[run[1]] - xs[run[0]], xs[best[1]] - xs[best[0]]);
    if (byExtent != 0) {
      return byExtent > 0;
    }
    int byStart = Double.compare(xs[run[0]], xs[best[0]]);
    if (byStart != 0) {
      return byStart < 0;
    }
    return run[1] - run[0] > best[1] - best[0];
  }

  private static Fit fit(double[] xs, double[] logYs, int start, int end) {
    SimpleRegression regression = new SimpleRegression();
    for (int j = start; j <= end; j++) {
      regression.addData(xs[j], logYs[j]);
    }
    double slope = regression.getSlope();
    if (!Double.isFinite(slope)) {
      return null;
    }
    double r2 = regression.getTotalSumSquares() == 0d ? 1d : regression.getRSquare();
    return new Fit(slope, r2);
  }

  private record Window(int start, int end, double slope) {}

  private record Fit(double slope, double r2) {}
}
