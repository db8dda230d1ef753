package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.GrowthParameters;
import com.ospicorp.growthcurves.curves.model.GrowthParameters.LambdaMethod;
import com.ospicorp.growthcurves.curves.model.ParameterSpread;
import com.ospicorp.growthcurves.curves.model.Point;
import com.ospicorp.growthcurves.curves.model.SampleParameters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Derives growth parameters (maximum rate, doubling time, lag, carrying capacity, inflection,
 * area under the curve, threshold crossing times) from a single well's curve, and summarizes
 * them across the replicate wells of a sample.
 *
 * <p>Growth rates come from an OLS fit of ln(OD) on time over a centred window of seven points
 * around each point. OD values are floored at {@value #MIN_OD} before taking logs.
 */
public final class GrowthParameterCalculator {
  static final double MIN_OD = 1e-6;
  private static final int MU_HALF_WINDOW = 3;
  private static final int MIN_POINTS_FOR_PERCENTILE = 5;
  private static final double UPPER_PERCENTILE = 95;
  private static final double LAG_RATE_FRACTION = 0.1;
  private static final int LAG_RUN = 3;
  private static final int BASELINE_POINTS = 3;

  private static final Map<String, Function<GrowthParameters, Double>> SUMMARIZED;

  static {
    Map<String, Function<GrowthParameters, Double>> fields = new LinkedHashMap<>();
    fields.put("muMax", GrowthParameters::muMax);
    fields.put("td", GrowthParameters::td);
    fields.put("lambda", GrowthParameters::lambda);
    fields.put("kHat", GrowthParameters::kHat);
    fields.put("odMax", GrowthParameters::odMax);
    fields.put("tInflection", GrowthParameters::tInflection);
    fields.put("tMid", GrowthParameters::tMid);
    fields.put("slopeAtInflection", GrowthParameters::slopeAtInflection);
    fields.put("auc", GrowthParameters::auc);
    fields.put("logStart", GrowthParameters::logStart);
    fields.put("logEnd", GrowthParameters::logEnd);
    fields.put("tLogDuration", GrowthParameters::tLogDuration);
    SUMMARIZED = Collections.unmodifiableMap(fields);
  }

  private GrowthParameterCalculator() {
  }

  /**
   * Parameters of one well. When both {@code logStart} and {@code logEnd} are given, only rates
   * inside that range count towards {@code muMax}. Empty when fewer than two finite points remain.
   */
  public static Optional<GrowthParameters> compute(String wellId, int replicateIndex,
      List<Point> curve, Double logStart, Double logEnd, List<Double> detectionThresholds) {
    List<Point> sorted = Point.finiteSorted(curve);
    int n = sorted.size();
    if (n < 2) {
      return Optional.empty();
    }
    double[] ts = new double[n];
    double[] od = new double[n];
    double[] ln = new double[n];
    for (int i = 0; i < n; i++) {
      ts[i] = sorted.get(i).x();
      od[i] = Math.max(MIN_OD, sorted.get(i).y());
      ln[i] = Math.log(od[i]);
    }
    double[] mu = slidingRates(ts, ln);
    boolean restricted = logStart != null && logEnd != null;

    List<Double> candidates = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (Double.isFinite(mu[i]) && (!restricted || (ts[i] >= logStart && ts[i] <= logEnd))) {
        candidates.add(mu[i]);
      }
    }
    Double muMax = null;
    if (candidates.size() >= MIN_POINTS_FOR_PERCENTILE) {
      muMax = percentile(candidates.stream().mapToDouble(Double::doubleValue).toArray(),
          UPPER_PERCENTILE);
    } else if (!candidates.isEmpty()) {
      muMax = Collections.max(candidates);
    }
    Double td = muMax != null && muMax > 0d ? Math.log(2d) / muMax : null;

    Double lagByThreshold = lagByThreshold(ts, mu, muMax);

    int best = -1;
    for (int i = 0; i < n; i++) {
      if (Double.isFinite(mu[i]) && (best < 0 || mu[i] > mu[best])) {
        best = i;
      }
    }
    Double tInflection = best >= 0 ? ts[best] : null;
    Double slopeAtInflection = best >= 0 ? mu[best] : null;
    Double lagByTangent = null;
    if (best >= 0 && mu[best] > 0d) {
      double baseline = 0d;
      int baselinePoints = Math.min(BASELINE_POINTS, n);
      for (int i = 0; i < baselinePoints; i++) {
        baseline += ln[i];
      }
      baseline /= baselinePoints;
      lagByTangent = (ln[best] - baseline) / mu[best];
    }

    Double lambda = null;
    LambdaMethod lambdaMethod = null;
    boolean thresholdUsable = lagByThreshold != null && lagByThreshold >= 0d;
    boolean tangentUsable = lagByTangent != null && lagByTangent >= 0d;
    if (thresholdUsable && (!tangentUsable || lagByThreshold <= lagByTangent)) {
      lambda = lagByThreshold;
      lambdaMethod = LambdaMethod.THRESHOLD;
    } else if (tangentUsable) {
      lambda = lagByTangent;
      lambdaMethod = LambdaMethod.TANGENT;
    } else if (lagByThreshold != null) {
      lambda = lagByThreshold;
      lambdaMethod = LambdaMethod.THRESHOLD;
    } else if (lagByTangent != null) {
      lambda = lagByTangent;
      lambdaMethod = LambdaMethod.TANGENT;
    }

    double kHat = percentile(od, UPPER_PERCENTILE);
    double odMax = Arrays.stream(od).max().orElseThrow();
    Double tMid = crossingTime(ts, od, kHat / 2d);
    if (tMid == null) {
      tMid = closestTime(ts, od, kHat / 2d);
    }

    double auc = 0d;
    for (int i = 0; i < n - 1; i++) {
      auc += 0.5 * (od[i] + od[i + 1]) * (ts[i + 1] - ts[i]);
    }

    Map<String, Double> detection = new LinkedHashMap<>();
    for (Double threshold : detectionThresholds) {
      if (threshold != null) {
        detection.put(thresholdKey(threshold), crossingTime(ts, od, threshold));
      }
    }

    Double duration = restricted ? Math.max(0d, logEnd - logStart) : null;
    return Optional.of(new GrowthParameters(wellId, replicateIndex, muMax, td, lambda,
        lambdaMethod, kHat, odMax, tInflection, tMid, slopeAtInflection, auc,
        Collections.unmodifiableMap(detection), restricted ? logStart : null,
        restricted ? logEnd : null, duration));
  }

  /** Mean, median, SD, SEM, t interval and seeded bootstrap interval of the finite values. */
  public static ParameterSpread spread(List<Double> values, ParameterSettings settings) {
    double[] finite = values.stream()
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .filter(Double::isFinite)
        .toArray();
    int n = finite.length;
    if (n == 0) {
      return ParameterSpread.empty();
    }
    DescriptiveStatistics stats = new DescriptiveStatistics(finite);
    double mean = stats.getMean();
    double sd = n > 1 ? stats.getStandardDeviation() : 0d;
    double sem = sd / Math.sqrt(n);
    double t = n > 1
        ? new TDistribution(n - 1).inverseCumulativeProbability(1d - settings.alpha() / 2d)
        : 0d;
    double halfWidth = t * sem;

    Double bootLow = null;
    Double bootHigh = null;
    int iterations = settings.bootstrapIterations();
    if (iterations > 0) {
      RandomGenerator rng = new MersenneTwister(settings.seed());
      double[] means = new double[iterations];
      for (int r = 0; r < iterations; r++) {
        double sum = 0d;
        for (int j = 0; j < n; j++) {
          sum += finite[rng.nextInt(n)];
        }
        means[r] = sum / n;
      }
      Arrays.sort(means);
      int lower = (int) Math.floor(settings.alpha() / 2d * (iterations - 1));
      int upper = (int) Math.min(Math.ceil((1d - settings.alpha() / 2d) * (iterations - 1)),
          iterations - 1);
      bootLow = means[lower];
      bootHigh = means[upper];
    }
    return new ParameterSpread(mean, new Median().evaluate(finite), sd, sem, mean - halfWidth,
        mean + halfWidth, bootLow, bootHigh, n);
  }

  /**
   * Per-parameter spreads across the given wells. The lag method reported is the one most wells
   * used, the first seen on a tie.
   */
  public static SampleParameters summarize(String sample, boolean smoothed, int replicatesTotal,
      List<GrowthParameters> wells, ParameterSettings settings) {
    Map<String, ParameterSpread> summary = new LinkedHashMap<>();
    SUMMARIZED.forEach((name, field) ->
        summary.put(name, spread(wells.stream().map(field).toList(), settings)));

    Map<String, ParameterSpread> detection = new LinkedHashMap<>();
    for (Double threshold : settings.detectionThresholds()) {
      String key = thresholdKey(threshold);
      detection.put(key, spread(wells.stream().map(w -> w.detection().get(key)).toList(),
          settings));
    }

    Map<LambdaMethod, Integer> methodCounts = new LinkedHashMap<>();
    for (GrowthParameters well : wells) {
      if (well.lambdaMethod() != null) {
        methodCounts.merge(well.lambdaMethod(), 1, Integer::sum);
      }
    }
    LambdaMethod lambdaMethod = null;
    int bestCount = 0;
    for (Map.Entry<LambdaMethod, Integer> entry : methodCounts.entrySet()) {
      if (entry.getValue() > bestCount) {
        lambdaMethod = entry.getKey();
        bestCount = entry.getValue();
      }
    }

    return new SampleParameters(sample, smoothed, settings.alpha(),
        settings.bootstrapIterations(), replicatesTotal, lambdaMethod, wells,
        Collections.unmodifiableMap(summary), Collections.unmodifiableMap(detection));
  }

  /** Threshold rendered with at most three decimals and no trailing zeros, e.g. "0.05". */
  static String thresholdKey(double threshold) {
    return String.format(Locale.ROOT, "%.3f", threshold)
        .replaceAll("0+$", "")
        .replaceAll("\\.$", "");
  }

  private static double[] slidingRates(double[] ts, double[] ln) {
    int n = ts.length;
    double[] mu = new double[n];
    for (int i = 0; i < n; i++) {
      SimpleRegression regression = new SimpleRegression();
      int from = Math.max(0, i - MU_HALF_WINDOW);
      int to = Math.min(n - 1, i + MU_HALF_WINDOW);
      for (int j = from; j <= to; j++) {
        regression.addData(ts[j], ln[j]);
      }
      mu[i] = regression.getSlope();
    }
    return mu;
  }

  // First of LAG_RUN consecutive rates reaching a tenth of muMax, measured from the first time.
  private static Double lagByThreshold(double[] ts, double[] mu, Double muMax) {
    if (muMax == null || !(muMax > 0d)) {
      return null;
    }
    double threshold = LAG_RATE_FRACTION * muMax;
    for (int i = 0; i + LAG_RUN <= mu.length; i++) {
      boolean above = true;
      for (int j = i; j < i + LAG_RUN; j++) {
        if (!(mu[j] >= threshold)) {
          above = false;
          break;
        }
      }
      if (above) {
        return ts[i] - ts[0];
      }
    }
    return null;
  }

  private static double percentile(double[] values, double p) {
    return new Percentile(p).withEstimationType(Percentile.EstimationType.R_7).evaluate(values);
  }

  private static Double crossingTime(double[] ts, double[] ys, double target) {
    for (int i = 0; i < ys.length - 1; i++) {
      double y0 = ys[i];
      double y1 = ys[i + 1];
      if (y0 == y1) {
        if (y0 == target) {
          return ts[i];
        }
        continue;
      }
      if (target < Math.min(y0, y1) || target > Math.max(y0, y1)) {
        continue;
      }
      double ratio = (target - y0) / (y1 - y0);
      return ts[i] + ratio * (ts[i + 1] - ts[i]);
    }
    return null;
  }

  private static Double closestTime(double[] ts, double[] ys, double target) {
    int best = 0;
    for (int i = 1; i < ys.length; i++) {
      if (Math.abs(ys[i] - target) < Math.abs(ys[best] - target)) {
        best = i;
      }
    }
    return ts[best];
  }
}
