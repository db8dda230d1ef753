package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

// Value object for a single (time, measurement) observation; time in minutes
public record Point(double x, double y) {

  public static final Comparator<Point> BY_X = Comparator.comparingDouble(Point::x);

  @JsonIgnore
  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y);
  }

  /**
   * Drops non-finite points and returns the rest sorted by x. The sort is stable, so points
   * sharing an x keep their input order.
   */
  public static List<Point> finiteSorted(Collection<Point> in) {
    List<Point> out = new ArrayList<>(in.size());
    for (Point p : in) {
      if (p != null && p.isFinite()) {
        out.add(p);
      }
    }
    out.sort(BY_X);
    return out;
  }
}
