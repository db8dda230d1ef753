package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.InvalidParameterException;
import com.ospicorp.growthcurves.curves.model.LoessDiagnostics;
import com.ospicorp.growthcurves.curves.model.Point;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Locally weighted polynomial regression with bisquare robustness reweighting.
 *
 * <p>Points are filtered to finite values and stably sorted by x before fitting; the result is
 * returned in that ascending-x order, one smoothed value per retained input point. Each target
 * point is fitted on its {@code k} nearest neighbours in x, ties going to the lower index.
 */
public final class Loess {
  private static final double EPS = 1e-12;
  // Cumulative rounding in span * n must not push ceil() up by one
  private static final double SPAN_ROUNDING = 1e-9;

  private Loess() {
  }

  public static LoessResult smooth(List<Point> in, double span, int degree, int robustIterations) {
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

    List<Point> sorted = Point.finiteSorted(in);
    int n = sorted.size();
    if (n < degree + 1) {
      throw new InsufficientDataException(n, degree + 1);
    }

    double[] xs = new double[n];
    double[] ys = new double[n];
    for (int i = 0; i < n; i++) {
      xs[i] = sorted.get(i).x();
      ys[i] = sorted.get(i).y();
    }

    int k = windowSize(span, n, degree);
    int[] lo = new int[n];
    int[] hi = new int[n];
    for (int i = 0; i < n; i++) {
      neighbourhood(xs, i, k, lo, hi);
    }

    double[] robustness = new double[n];
    Arrays.fill(robustness, 1d);
    double[] fitted = new double[n];
    double[] residuals = new double[n];

    for (int iter = 0; iter < robustIterations; iter++) {
      for (int i = 0; i < n; i++) {
        fitted[i] = fitAt(xs, ys, lo[i], hi[i], robustness, degree, xs[i]);
      }
      for (int i = 0; i < n; i++) {
        residuals[i] = ys[i] - fitted[i];
      }
      if (iter == robustIterations - 1) {
        break;
      }
      robustness = bisquareWeights(residuals);
    }

    List<Point> out = new ArrayList<>(n);
    List<Double> residualList = new ArrayList<>(n);
    List<Double> weightList = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      out.add(new Point(xs[i], fitted[i]));
      residualList.add(residuals[i]);
      weightList.add(robustness[i]);
    }
    return new LoessResult(out, new LoessDiagnostics(residualList, weightList, k));
  }

  static int windowSize(double span, int n, int degree) {
    long k = span <= 1d
        ? (long) Math.ceil(span * n - SPAN_ROUNDING)
        : Math.round(span);
    return (int) Math.max(degree + 1, Math.min(n, k));
  }

  // The k nearest points of a sorted array always form a contiguous range around i.
  private static void neighbourhood(double[] xs, int i, int k, int[] lo, int[] hi) {
    int n = xs.length;
    int left = i;
    int right = i;
    while (right - left + 1 < k) {
      if (left == 0) {
        right++;
      } else if (right == n - 1) {
        left--;
      } else {
        double dl = xs[i] - xs[left - 1];
        double dr = xs[right + 1] - xs[i];
        if (dl <= dr) {
          left--;
        } else {
          right++;
        }
      }
    }
    lo[i] = left;
    hi[i] = right;
  }

  private static double fitAt(double[] xs, double[] ys, int from, int to, double[] robustness,
      int degree, double x0) {
    double maxDist = Math.max(x0 - xs[from], xs[to] - x0);
    int len = to - from + 1;
    double[] weights = new double[len];
    for (int j = 0; j < len; j++) {
      double w = 1d;
      if (maxDist > 0d) {
        double u = Math.abs(xs[from + j] - x0) / maxDist;
        double tricube = 1d - u * u * u;
        w = Math.max(0d, tricube * tricube * tricube);
      }
      weights[j] = w * robustness[from + j];
    }

    int order = degree + 1;
    double[][] normal = new double[order][order];
    double[] rhs = new double[order];
    double weightSum = 0d;
    double[] basis = new double[order];
    for (int j = 0; j < len; j++) {
      double w = weights[j];
      if (!(w > 0d)) {
        continue;
      }
      weightSum += w;
      double dx = xs[from + j] - x0;
      basis[0] = 1d;
      for (int p = 1; p < order; p++) {
        basis[p] = basis[p - 1] * dx;
      }
      for (int r = 0; r < order; r++) {
        for (int c = 0; c < order; c++) {
          normal[r][c] += w * basis[r] * basis[c];
        }
        rhs[r] += w * basis[r] * ys[from + j];
      }
    }
    if (!(weightSum > 0d)) {
      return ys[from + len / 2];
    }

    RealMatrix matrix = new Array2DRowRealMatrix(normal, false);
    DecompositionSolver solver = new LUDecomposition(matrix, EPS).getSolver();
    if (solver.isNonSingular()) {
      RealVector solution = solver.solve(new ArrayRealVector(rhs, false));
      double intercept = solution.getEntry(0);
      if (Double.isFinite(intercept)) {
        return intercept;
      }
    }
    return weightedMean(ys, from, weights, weightSum);
  }

  private static double weightedMean(double[] ys, int from, double[] weights, double weightSum) {
    double acc = 0d;
    for (int j = 0; j < weights.length; j++) {
      if (weights[j] > 0d) {
        acc += weights[j] * ys[from + j];
      }
    }
    return acc / weightSum;
  }

  private static double[] bisquareWeights(double[] residuals) {
    int n = residuals.length;
    double[] abs = new double[n];
    for (int i = 0; i < n; i++) {
      abs[i] = Math.abs(residuals[i]);
    }
    double[] weights = new double[n];
    double mad = new Median().evaluate(abs);
    if (!(mad >= EPS)) {
      Arrays.fill(weights, 1d);
      return weights;
    }
    double scale = 6d * mad;
    for (int i = 0; i < n; i++) {
      double ratio = abs[i] / scale;
      if (ratio >= 1d) {
        weights[i] = 0d;
      } else {
        double v = 1d - ratio * ratio;
        weights[i] = v * v;
      }
    }
    return weights;
  }
}
