package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.BandMode;
import com.ospicorp.growthcurves.curves.model.BandPoint;
import com.ospicorp.growthcurves.curves.model.Point;
import com.ospicorp.growthcurves.curves.model.ReplicateWell;
import com.ospicorp.growthcurves.curves.model.SmoothingParameters;
import com.ospicorp.growthcurves.curves.model.UncertaintyBand;
import com.ospicorp.growthcurves.curves.model.UncertaintyBand.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstrap confidence bands for a sample's smoothed curve, resampling whole replicate wells.
 *
 * <p>With {@code n} wells every composition of {@code n} draws is enumerated and weighted
 * exactly, so the cost grows as C(2n-1, n) smoother runs: 3 for two wells, 126 for five, 6435
 * for eight. Past {@link BandSettings#maxExactReplicates()} a seeded Monte-Carlo bootstrap is
 * used instead.
 *
 * <p>When resampling yields nothing usable the band falls back to mean ± one standard deviation
 * of the interpolated wells, then to a zero-width band on the main fit.
 */
public final class BootstrapBands {
  private static final Logger log = LoggerFactory.getLogger(BootstrapBands.class);

  static final double LOWER_PERCENTILE = 2.5;
  static final double UPPER_PERCENTILE = 97.5;
  static final double SIMULTANEOUS_PERCENTILE = 95;
  private static final double CUMULATIVE_SLACK = 1e-12;

  private BootstrapBands() {
  }

  public static Optional<UncertaintyBand> band(String sample, List<Point> rawPoints,
      List<ReplicateWell> wells, SmoothingParameters params, BandMode mode) {
    return band(sample, rawPoints, wells, params, mode, BandSettings.defaults());
  }

  public static Optional<UncertaintyBand> band(String sample, List<Point> rawPoints,
      List<ReplicateWell> wells, SmoothingParameters params, BandMode mode,
      BandSettings settings) {
    if (mode == null || mode == BandMode.NONE || wells == null || wells.size() < 2) {
      return Optional.empty();
    }
    params.validate();

    double[] grid = Interpolation.unionGrid(wells.stream().map(ReplicateWell::points).toList());
    if (grid.length == 0) {
      return Optional.empty();
    }

    double[] mainPred = predict(rawPoints, params, grid);

    int n = wells.size();
    boolean exact = n <= settings.maxExactReplicates();
    List<Composition> compositions = exact
        ? Composition.enumerate(n)
        : Composition.sample(n, settings.monteCarloResamples(), settings.seed());
    log.debug("Band for {}: {} wells, {} {} compositions", sample, n, compositions.size(),
        exact ? "exact" : "sampled");

    List<double[]> predictions = new ArrayList<>(compositions.size());
    List<Double> weights = new ArrayList<>(compositions.size());
    for (Composition composition : compositions) {
      if (!(composition.weight() > 0d)) {
        continue;
      }
      List<Point> pseudo = pseudoReplicate(wells, composition);
      if (pseudo.isEmpty()) {
        continue;
      }
      double[] pred = predict(pseudo, params, grid);
      if (Arrays.stream(pred).noneMatch(Double::isFinite)) {
        continue;
      }
      predictions.add(pred);
      weights.add(composition.weight());
    }

    List<BandPoint> points = mode == BandMode.POINTWISE
        ? pointwise(grid, predictions, weights)
        : simultaneous(grid, mainPred, predictions, weights);
    if (!points.isEmpty()) {
      return Optional.of(new UncertaintyBand(sample, mode,
          exact ? Method.BOOTSTRAP : Method.MONTE_CARLO, points));
    }

    log.warn("Bootstrap band for {} is empty; falling back to well standard deviation", sample);
    points = wellSpread(grid, wells);
    if (!points.isEmpty()) {
      return Optional.of(new UncertaintyBand(sample, mode, Method.WELL_SD, points));
    }

    log.warn("Well spread for {} is empty; returning a zero-width band", sample);
    points = degenerate(grid, mainPred);
    if (!points.isEmpty()) {
      return Optional.of(new UncertaintyBand(sample, mode, Method.DEGENERATE, points));
    }
    return Optional.empty();
  }

  /**
   * Weighted percentile: values are sorted ascending and the first one whose cumulative weight
   * reaches {@code p} percent of the total is returned. Non-finite values and non-positive
   * weights are ignored; NaN when nothing is left.
   */
  public static double weightedPercentile(double[] values, double[] weights, double p) {
    List<double[]> paired = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      double w = i < weights.length ? weights[i] : 0d;
      if (Double.isFinite(values[i]) && w > 0d) {
        paired.add(new double[] {values[i], w});
      }
    }
    if (paired.isEmpty()) {
      return Double.NaN;
    }
    paired.sort(Comparator.comparingDouble(pair -> pair[0]));
    double total = 0d;
    for (double[] pair : paired) {
      total += pair[1];
    }
    double target = (p / 100d) * total;
    double acc = 0d;
    for (double[] pair : paired) {
      acc += pair[1];
      if (acc >= target - CUMULATIVE_SLACK) {
        return pair[0];
      }
    }
    return paired.get(paired.size() - 1)[0];
  }

  private static double[] predict(List<Point> points, SmoothingParameters params, double[] grid) {
    try {
      Refinement refinement = LoessRefiner.refine(points, params);
      return Interpolation.onGrid(refinement.result().points(), grid);
    } catch (InsufficientDataException ex) {
      log.debug("Skipping fit on {} points: {}", points.size(), ex.getMessage());
      double[] nan = new double[grid.length];
      Arrays.fill(nan, Double.NaN);
      return nan;
    }
  }

  private static List<Point> pseudoReplicate(List<ReplicateWell> wells, Composition composition) {
    List<Point> out = new ArrayList<>();
    for (int i = 0; i < wells.size(); i++) {
      int copies = composition.count(i);
      for (int c = 0; c < copies; c++) {
        out.addAll(wells.get(i).points());
      }
    }
    return out;
  }

  private static List<BandPoint> pointwise(double[] grid, List<double[]> predictions,
      List<Double> weights) {
    List<BandPoint> out = new ArrayList<>(grid.length);
    if (predictions.isEmpty()) {
      return out;
    }
    double[] w = weights.stream().mapToDouble(Double::doubleValue).toArray();
    double[] values = new double[predictions.size()];
    for (int g = 0; g < grid.length; g++) {
      for (int r = 0; r < values.length; r++) {
        values[r] = predictions.get(r)[g];
      }
      double low = weightedPercentile(values, w, LOWER_PERCENTILE);
      double high = weightedPercentile(values, w, UPPER_PERCENTILE);
      addIfFinite(out, grid[g], low, high);
    }
    return out;
  }

  private static List<BandPoint> simultaneous(double[] grid, double[] mainPred,
      List<double[]> predictions, List<Double> weights) {
    double[] diffs = new double[predictions.size()];
    for (int r = 0; r < diffs.length; r++) {
      double[] pred = predictions.get(r);
      double max = 0d;
      for (int g = 0; g < grid.length; g++) {
        double d = Math.abs(pred[g] - mainPred[g]);
        if (Double.isFinite(d)) {
          max = Math.max(max, d);
        }
      }
      diffs[r] = max;
    }
    double c = weightedPercentile(diffs,
        weights.stream().mapToDouble(Double::doubleValue).toArray(), SIMULTANEOUS_PERCENTILE);
    List<BandPoint> out = new ArrayList<>(grid.length);
    for (int g = 0; g < grid.length; g++) {
      addIfFinite(out, grid[g], mainPred[g] - c, mainPred[g] + c);
    }
    return out;
  }

  private static List<BandPoint> wellSpread(double[] grid, List<ReplicateWell> wells) {
    List<double[]> perWell = wells.stream()
        .map(well -> Interpolation.onGrid(well.points(), grid))
        .toList();
    List<BandPoint> out = new ArrayList<>(grid.length);
    for (int g = 0; g < grid.length; g++) {
      DescriptiveStatistics stats = new DescriptiveStatistics();
      for (double[] row : perWell) {
        if (Double.isFinite(row[g])) {
          stats.addValue(row[g]);
        }
      }
      if (stats.getN() < 2) {
        continue;
      }
      double mean = stats.getMean();
      double sd = stats.getStandardDeviation();
      addIfFinite(out, grid[g], mean - sd, mean + sd);
    }
    return out;
  }

  private static List<BandPoint> degenerate(double[] grid, double[] mainPred) {
    List<BandPoint> out = new ArrayList<>(grid.length);
    for (int g = 0; g < grid.length; g++) {
      addIfFinite(out, grid[g], mainPred[g], mainPred[g]);
    }
    return out;
  }

  private static void addIfFinite(List<BandPoint> out, double x, double low, double high) {
    if (Double.isFinite(x) && Double.isFinite(low) && Double.isFinite(high)) {
      out.add(new BandPoint(x, low, high));
    }
  }
}
