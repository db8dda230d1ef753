package com.ospicorp.growthcurves.curves.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.growthcurves.curves.model.BandMode;
import com.ospicorp.growthcurves.curves.model.BandPoint;
import com.ospicorp.growthcurves.curves.model.Point;
import com.ospicorp.growthcurves.curves.model.ReplicateWell;
import com.ospicorp.growthcurves.curves.model.SmoothingParameters;
import com.ospicorp.growthcurves.curves.model.UncertaintyBand;
import com.ospicorp.growthcurves.curves.model.UncertaintyBand.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class BootstrapBandsTest {

  private static final SmoothingParameters PARAMS = new SmoothingParameters(0.6, 1, 1, 1, 1e-4);
  private static final double[] TIMES = {0, 24, 48, 72, 96, 120};

  private static ReplicateWell well(String id, int index, double offset, double bumpAt48) {
    List<Point> points = new ArrayList<>();
    for (double t : TIMES) {
      double y = 0.05 + 0.45 * t / 120d + offset + (t == 48 ? bumpAt48 : 0d);
      points.add(new Point(t, y));
    }
    return new ReplicateWell(id, index, points);
  }

  private static List<ReplicateWell> twoWells() {
    return List.of(well("A1", 1, 0d, 0d), well("A2", 2, 0.02, 0.01));
  }

  private static List<Point> aggregate(List<ReplicateWell> wells) {
    return Point.finiteSorted(wells.stream().flatMap(w -> w.points().stream()).toList());
  }

  @Test
  void pointwiseBandEnclosesMainFit() {
    var wells = twoWells();
    var raw = aggregate(wells);

    UncertaintyBand band = BootstrapBands.band("S1", raw, wells, PARAMS, BandMode.POINTWISE)
        .orElseThrow();

    assertEquals(Method.BOOTSTRAP, band.method());
    assertEquals(BandMode.POINTWISE, band.mode());
    assertEquals(6, band.points().size());
    double[] main = Interpolation.onGrid(LoessRefiner.refine(raw, PARAMS).result().points(),
        TIMES);
    for (int g = 0; g < TIMES.length; g++) {
      BandPoint p = band.points().get(g);
      assertEquals(TIMES[g], p.x());
      assertTrue(p.low() < main[g] && main[g] < p.high(), "at t=" + p.x());
    }
  }

  @Test
  void simultaneousBandHasConstantHalfWidth() {
    var wells = twoWells();

    UncertaintyBand band = BootstrapBands.band("S1", aggregate(wells), wells, PARAMS,
        BandMode.SIMULTANEOUS).orElseThrow();

    assertEquals(Method.BOOTSTRAP, band.method());
    double width = band.points().get(0).high() - band.points().get(0).low();
    assertTrue(width > 0d);
    for (BandPoint p : band.points()) {
      assertEquals(width, p.high() - p.low(), 1e-12);
    }
  }

  @Test
  void noBandForSingleWellOrNoneMode() {
    var one = List.of(well("A1", 1, 0d, 0d));
    assertTrue(BootstrapBands.band("S", aggregate(one), one, PARAMS, BandMode.POINTWISE)
        .isEmpty());
    var wells = twoWells();
    assertTrue(BootstrapBands.band("S", aggregate(wells), wells, PARAMS, BandMode.NONE)
        .isEmpty());
    assertTrue(BootstrapBands.band("S", aggregate(wells), wells, PARAMS, null).isEmpty());
  }

  @Test
  void fallsBackToWellSpreadWhenNoResampleCanBeFitted() {
    var wells = List.of(
        new ReplicateWell("A1", 1, List.of(new Point(0, 1d))),
        new ReplicateWell("A2", 2, List.of(new Point(10, 3d))));
    var params = new SmoothingParameters(1.0, 2, 1, 1, 1e-4);

    UncertaintyBand band = BootstrapBands.band("S", aggregate(wells), wells, params,
        BandMode.POINTWISE).orElseThrow();

    assertEquals(Method.WELL_SD, band.method());
    assertEquals(2, band.points().size());
    for (BandPoint p : band.points()) {
      assertEquals(2d - Math.sqrt(2d), p.low(), 1e-12);
      assertEquals(2d + Math.sqrt(2d), p.high(), 1e-12);
    }
  }

  @Test
  void fallsBackToZeroWidthBandOnMainFit() {
    var wells = List.of(
        new ReplicateWell("A1", 1, List.of(new Point(0, 1d))),
        new ReplicateWell("A2", 2, List.of()));
    var raw = List.of(new Point(0, 1d), new Point(1, 2d), new Point(2, 3d));
    var params = new SmoothingParameters(1.0, 2, 1, 1, 1e-4);

    UncertaintyBand band = BootstrapBands.band("S", raw, wells, params, BandMode.SIMULTANEOUS)
        .orElseThrow();

    assertEquals(Method.DEGENERATE, band.method());
    assertEquals(1, band.points().size());
    double main = Interpolation.onGrid(LoessRefiner.refine(raw, params).result().points(),
        new double[] {0})[0];
    assertEquals(main, band.points().get(0).low(), 1e-12);
    assertEquals(band.points().get(0).low(), band.points().get(0).high());
  }

  @Test
  void manyWellsUseSeededMonteCarlo() {
    var wells = Stream.of(0d, 0.01, 0.03).map(o -> well("W" + o, 1, o, 0d)).toList();
    var settings = new BandSettings(2, 50, 7L);

    var first = BootstrapBands.band("S", aggregate(wells), wells, PARAMS, BandMode.POINTWISE,
        settings).orElseThrow();
    var second = BootstrapBands.band("S", aggregate(wells), wells, PARAMS, BandMode.POINTWISE,
        settings).orElseThrow();

    assertEquals(Method.MONTE_CARLO, first.method());
    assertEquals(first, second);
    for (BandPoint p : first.points()) {
      assertTrue(p.low() <= p.high());
    }
  }

  @Test
  void weightedPercentilePicksFirstValueReachingTarget() {
    double[] values = {3, 1, 2};
    double[] weights = {0.2, 0.5, 0.3};

    assertEquals(1d, BootstrapBands.weightedPercentile(values, weights, 50));
    assertEquals(2d, BootstrapBands.weightedPercentile(values, weights, 60));
    assertEquals(3d, BootstrapBands.weightedPercentile(values, weights, 97.5));
    assertEquals(1d, BootstrapBands.weightedPercentile(values, weights, 0));
  }

  @Test
  void weightedPercentileIgnoresUnusableEntries() {
    assertEquals(5d, BootstrapBands.weightedPercentile(
        new double[] {Double.NaN, 5, 1}, new double[] {1, 1, 0}, 50));
    assertTrue(Double.isNaN(BootstrapBands.weightedPercentile(new double[0], new double[0], 50)));
  }
}
