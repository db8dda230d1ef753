package com.ospicorp.growthcurves.curves.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.growthcurves.curves.model.InvalidParameterException;
import com.ospicorp.growthcurves.curves.model.Point;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoessTest {

  private static List<Point> line(int n, double slope, double intercept) {
    List<Point> points = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      points.add(new Point(i, slope * i + intercept));
    }
    return points;
  }

  @Test
  void linearDataIsReproducedForAnySpan() {
    var input = line(20, 2d, 1d);
    for (double span : new double[] {0.3, 0.5, 1.0, 3, 5}) {
      var out = Loess.smooth(input, span, 1, 3);
      assertEquals(20, out.points().size());
      for (Point p : out.points()) {
        assertEquals(2d * p.x() + 1d, p.y(), 1e-9, "span " + span + " at x=" + p.x());
      }
    }
  }

  @Test
  void quadraticDataIsReproducedWithDegreeTwo() {
    List<Point> input = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      input.add(new Point(i, 0.5 * i * i - 3 * i + 2));
    }

    var out = Loess.smooth(input, 0.4, 2, 1);

    for (Point p : out.points()) {
      assertEquals(0.5 * p.x() * p.x() - 3 * p.x() + 2, p.y(), 1e-9);
    }
  }

  @Test
  void outputIsSortedByXAndSkipsNonFinitePoints() {
    var input = List.of(
        new Point(3, 3d),
        new Point(1, 1d),
        new Point(Double.NaN, 5d),
        new Point(2, 2d),
        new Point(0, Double.POSITIVE_INFINITY),
        new Point(0, 0d));

    var out = Loess.smooth(input, 1.0, 1, 1);

    assertEquals(4, out.points().size());
    assertEquals(List.of(0d, 1d, 2d, 3d), out.points().stream().map(Point::x).toList());
    assertEquals(4, out.diagnostics().residuals().size());
    assertEquals(4, out.diagnostics().robustnessWeights().size());
  }

  @Test
  void robustPassesDownweightAnOutlier() {
    List<Point> input = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      input.add(new Point(i, i + 0.5 * Math.sin(i)));
    }
    input.set(20, new Point(20, 50d));

    var plain = Loess.smooth(input, 0.75, 1, 1);
    var robust = Loess.smooth(input, 0.75, 1, 2);

    double plainError = Math.abs(plain.points().get(20).y() - 20d);
    double robustError = Math.abs(robust.points().get(20).y() - 20d);
    assertTrue(plainError > 1d);
    assertTrue(robustError < 0.5, "robust error " + robustError);
    assertEquals(0d, robust.diagnostics().robustnessWeights().get(20));
  }

  @Test
  void windowSizeUsesFractionOrAbsoluteCount() {
    assertEquals(8, Loess.windowSize(0.6, 12, 1));
    assertEquals(3, Loess.windowSize(0.1, 30, 1));
    assertEquals(12, Loess.windowSize(1.0, 12, 1));
    assertEquals(5, Loess.windowSize(5, 12, 1));
    assertEquals(12, Loess.windowSize(40, 12, 1));
    assertEquals(3, Loess.windowSize(0.01, 12, 2));
  }

  @Test
  void identicalInputGivesIdenticalOutput() {
    List<Point> input = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      input.add(new Point(i % 10, Math.cos(i)));
    }
    assertEquals(Loess.smooth(input, 0.4, 2, 3), Loess.smooth(input, 0.4, 2, 3));
  }

  @Test
  void tooFewPointsSignalInsufficientData() {
    var input = List.of(new Point(0, 1d), new Point(1, 2d));
    var ex = assertThrows(InsufficientDataException.class, () -> Loess.smooth(input, 0.5, 2, 1));
    assertEquals(2, ex.available());
    assertEquals(3, ex.required());
  }

  @Test
  void invalidParametersAreRejected() {
    var input = line(10, 1d, 0d);
    assertEquals(1101,
        assertThrows(InvalidParameterException.class, () -> Loess.smooth(input, 0d, 1, 1))
            .errorCode());
    assertEquals(1102,
        assertThrows(InvalidParameterException.class, () -> Loess.smooth(input, 0.5, 3, 1))
            .errorCode());
    assertEquals(1103,
        assertThrows(InvalidParameterException.class, () -> Loess.smooth(input, 0.5, 1, 0))
            .errorCode());
  }
}
