package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.Point;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Interpolation {
  private Interpolation() {
  }

  /**
   * Evaluates the polyline through {@code curve} at each grid x, holding the first and last
   * values outside the curve's range. Points sharing an x are averaged first. An empty curve
   * yields NaN everywhere.
   */
  public static double[] onGrid(List<Point> curve, double[] grid) {
    double[] out = new double[grid.length];
    List<Point> nodes = collapseDuplicates(Point.finiteSorted(curve));
    if (nodes.isEmpty()) {
      Arrays.fill(out, Double.NaN);
      return out;
    }
    int n = nodes.size();
    double[] xs = new double[n];
    double[] ys = new double[n];
    for (int i = 0; i < n; i++) {
      xs[i] = nodes.get(i).x();
      ys[i] = nodes.get(i).y();
    }
    for (int g = 0; g < grid.length; g++) {
      double x = grid[g];
      if (x <= xs[0]) {
        out[g] = ys[0];
      } else if (x >= xs[n - 1]) {
        out[g] = ys[n - 1];
      } else {
        int idx = Arrays.binarySearch(xs, x);
        if (idx >= 0) {
          out[g] = ys[idx];
        } else {
          int right = -idx - 1;
          int left = right - 1;
          double t = (x - xs[left]) / (xs[right] - xs[left]);
          out[g] = ys[left] * (1d - t) + ys[right] * t;
        }
      }
    }
    return out;
  }

  /** Sorted distinct x values over all given point lists. */
  public static double[] unionGrid(List<List<Point>> series) {
    return series.stream()
        .flatMap(List::stream)
        .filter(Point::isFinite)
        .mapToDouble(Point::x)
        .sorted()
        .distinct()
        .toArray();
  }

  private static List<Point> collapseDuplicates(List<Point> sorted) {
    List<Point> out = new ArrayList<>(sorted.size());
    int i = 0;
    while (i < sorted.size()) {
      double x = sorted.get(i).x();
      double sum = 0d;
      int count = 0;
      while (i < sorted.size() && sorted.get(i).x() == x) {
        sum += sorted.get(i).y();
        count++;
        i++;
      }
      out.add(new Point(x, sum / count));
    }
    return out;
  }
}
