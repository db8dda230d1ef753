package com.ospicorp.growthcurves.curves.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.growthcurves.curves.model.BandMode;
import com.ospicorp.growthcurves.curves.model.BandPoint;
import com.ospicorp.growthcurves.curves.model.GrowthParameters;
import com.ospicorp.growthcurves.curves.model.InvalidParameterException;
import com.ospicorp.growthcurves.curves.model.LogPhaseDetectionOptions;
import com.ospicorp.growthcurves.curves.model.LogPhaseSelection;
import com.ospicorp.growthcurves.curves.model.ParameterSpread;
import com.ospicorp.growthcurves.curves.model.Point;
import com.ospicorp.growthcurves.curves.model.ReplicateWell;
import com.ospicorp.growthcurves.curves.model.SampleInput;
import com.ospicorp.growthcurves.curves.model.SampleParameters;
import com.ospicorp.growthcurves.curves.model.SmoothedCurvesPayload;
import com.ospicorp.growthcurves.curves.model.SmoothingParameters;
import com.ospicorp.growthcurves.curves.model.SmoothingState;
import com.ospicorp.growthcurves.curves.model.UncertaintyBand;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CurveWorkspaceTest {

  private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

  private CurveWorkspace workspace;

  @BeforeEach
  void setUp() {
    workspace = workspace(LogPhaseReplacement.KEEP_MANUAL);
  }

  private static CurveWorkspace workspace(LogPhaseReplacement replacement) {
    return new CurveWorkspace(replacement, BandSettings.defaults(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static ReplicateWell exponentialWell(String id, int index) {
    List<Point> points = new ArrayList<>();
    for (int t = 0; t <= 300; t += 5) {
      points.add(new Point(t, 0.01 * Math.exp(0.02 * t)));
    }
    return new ReplicateWell(id, index, points);
  }

  private static SampleInput exponential(String name) {
    return new SampleInput(name, "#1f77b4",
        List.of(exponentialWell(name + "-1", 1), exponentialWell(name + "-2", 2)));
  }

  private static SampleInput tiny() {
    return new SampleInput("Tiny", "#ff7f0e",
        List.of(new ReplicateWell("T1", 1, List.of(new Point(0, 0.1)))));
  }

  private static SampleInput linear() {
    double[] times = {0, 24, 48, 72, 96, 120};
    List<Point> a = new ArrayList<>();
    List<Point> b = new ArrayList<>();
    for (double t : times) {
      double y = 0.05 + 0.45 * t / 120d;
      a.add(new Point(t, y));
      b.add(new Point(t, y + 0.02 + (t == 48 ? 0.01 : 0d)));
    }
    return new SampleInput("S1", null,
        List.of(new ReplicateWell("B2", 2, b), new ReplicateWell("B1", 1, a)));
  }

  @Test
  void smoothingAppendsOneEntryAndSkipsSamplesWithTooFewPoints() {
    workspace.load(List.of(exponential("Exp"), tiny()));

    SmoothingReport report = workspace.applySmoothing(null, SmoothingParameters.defaults());

    assertEquals(1, report.applied());
    assertEquals(1, report.skipped());
    assertEquals(2d, report.averagePasses());
    assertEquals(1, report.detected());
    List<SmoothingState> history = workspace.sample("Exp").history();
    assertEquals(2, history.size());
    assertEquals("LOESS span 0.25, degree 1 (passes: 2, converged)", history.get(1).label());
    assertEquals(122, history.get(1).points().size());
    assertNotNull(history.get(1).diagnostics());
    assertEquals(1, workspace.sample("Tiny").history().size());
  }

  @Test
  void smoothingTouchesOnlyNamedSamples() {
    workspace.load(List.of(exponential("Exp"), exponential("Other")));

    workspace.applySmoothing(List.of("Other"), SmoothingParameters.defaults());

    assertEquals(1, workspace.sample("Exp").history().size());
    assertEquals(2, workspace.sample("Other").history().size());
  }

  @Test
  void endToEndLinearSampleWithPointwiseBand() {
    workspace.load(List.of(linear()));
    var params = new SmoothingParameters(0.6, 1, 1, 1, 1e-4);

    workspace.applySmoothing(List.of("S1"), params);

    SampleCurves sample = workspace.sample("S1");
    assertEquals(List.of("B1", "B2"), sample.wells().stream().map(ReplicateWell::wellId).toList());
    SmoothingState latest = sample.latest();
    assertEquals(12, latest.points().size());
    assertEquals("LOESS span 0.6, degree 1 (passes: 1, not converged)", latest.label());
    assertEquals(params, workspace.lastParameters());

    UncertaintyBand band = workspace.band("S1", BandMode.POINTWISE, null, null).orElseThrow();
    assertEquals(UncertaintyBand.Method.BOOTSTRAP, band.method());
    double[] grid = band.points().stream().mapToDouble(BandPoint::x).toArray();
    assertArrayEquals(new double[] {0, 24, 48, 72, 96, 120}, grid);
    double[] main = Interpolation.onGrid(latest.points(), grid);
    for (int g = 0; g < grid.length; g++) {
      assertTrue(band.points().get(g).low() <= main[g]);
      assertTrue(main[g] <= band.points().get(g).high());
    }
  }

  @Test
  void stepBackAtRawIsNoOp() {
    workspace.load(List.of(exponential("Exp")));

    SmoothingReport report = workspace.stepBack(List.of("Exp"));

    assertEquals(0, report.applied());
    assertEquals(1, report.skipped());
    assertEquals(SmoothingState.RAW_LABEL, workspace.sample("Exp").latest().label());
  }

  @Test
  void stepBackRedetectsOnRestoredCurve() {
    workspace.load(List.of(exponential("Exp")));
    workspace.applySmoothing(null, SmoothingParameters.defaults());
    assertEquals(250d, workspace.logPhase("Exp").orElseThrow().end());

    SmoothingReport report = workspace.stepBack(null);

    assertEquals(1, report.applied());
    assertEquals(1, report.detected());
    LogPhaseSelection selection = workspace.logPhase("Exp").orElseThrow();
    assertEquals(0d, selection.start());
    assertEquals(285d, selection.end());
  }

  @Test
  void automaticLogPhaseCarriesPointsFromLatestCurve() {
    workspace.load(List.of(exponential("Exp")));
    workspace.applySmoothing(null, SmoothingParameters.defaults());

    LogPhaseSelection selection = workspace.logPhase("Exp").orElseThrow();

    assertFalse(selection.manual());
    assertEquals(NOW, selection.createdAt());
    assertEquals(0d, selection.start());
    assertEquals(250d, selection.end());
    assertEquals(102, selection.points().size());
    assertEquals(0d, selection.points().get(0).tMin());
  }

  @Test
  void manualSelectionSurvivesSmoothingWhenKeptManual() {
    workspace.load(List.of(exponential("Exp")));
    workspace.applySmoothing(null, SmoothingParameters.defaults());

    LogPhaseSelection manual = workspace.selectLogPhase("Exp", 100, 40);
    workspace.applySmoothing(null, SmoothingParameters.defaults());

    assertEquals(40d, manual.start());
    assertEquals(100d, manual.end());
    LogPhaseSelection kept = workspace.logPhase("Exp").orElseThrow();
    assertTrue(kept.manual());
    assertEquals(40d, kept.start());
    assertEquals(100d, kept.end());
  }

  @Test
  void manualSelectionIsReplacedWhenPolicyReplacesAll() {
    CurveWorkspace replacing = workspace(LogPhaseReplacement.REPLACE_ALL);
    replacing.load(List.of(exponential("Exp")));
    replacing.selectLogPhase("Exp", 40, 100);

    replacing.applySmoothing(null, SmoothingParameters.defaults());

    LogPhaseSelection selection = replacing.logPhase("Exp").orElseThrow();
    assertFalse(selection.manual());
    assertEquals(250d, selection.end());
  }

  @Test
  void explicitDetectionReplacesManualSelection() {
    workspace.load(List.of(exponential("Exp")));
    workspace.applySmoothing(null, SmoothingParameters.defaults());
    workspace.selectLogPhase("Exp", 40, 100);

    int detected = workspace.detectLogPhases(null, LogPhaseDetectionOptions.defaults());

    assertEquals(1, detected);
    LogPhaseSelection selection = workspace.logPhase("Exp").orElseThrow();
    assertFalse(selection.manual());
    assertEquals(0d, selection.start());
    assertEquals(250d, selection.end());
  }

  @Test
  void explicitDetectionClearsManualSelectionWhenNothingIsFound() {
    workspace.load(List.of(exponential("Exp")));
    workspace.selectLogPhase("Exp", 40, 100);

    workspace.detectLogPhases(List.of("Exp"),
        new LogPhaseDetectionOptions(500, 0.98, 0.001, 0.9, 0.5, 1.05));

    assertTrue(workspace.logPhase("Exp").isEmpty());
  }

  @Test
  void automaticSelectionIsClearedWhenNothingIsDetected() {
    workspace.load(List.of(exponential("Exp")));
    workspace.applySmoothing(null, SmoothingParameters.defaults());

    int detected = workspace.detectLogPhases(null,
        new LogPhaseDetectionOptions(500, 0.98, 0.001, 0.9, 0.5, 1.05));

    assertEquals(0, detected);
    assertTrue(workspace.logPhase("Exp").isEmpty());
    assertEquals(500, workspace.detectionOptions().windowSize());
  }

  @Test
  void parametersOfRawWells() {
    workspace.load(List.of(exponential("Exp")));

    SampleParameters parameters = workspace.parameters("Exp");

    assertFalse(parameters.smoothed());
    assertEquals(2, parameters.replicatesTotal());
    assertEquals(List.of("Exp-1", "Exp-2"),
        parameters.wells().stream().map(GrowthParameters::wellId).toList());
    ParameterSpread mu = parameters.summary().get("muMax");
    assertEquals(2, mu.n());
    assertEquals(0.02, mu.mean(), 1e-9);
    assertEquals(0d, mu.sd(), 1e-12);
    assertEquals(Math.log(2) / 0.02, parameters.summary().get("td").mean(), 1e-6);
    assertEquals(Math.log(5) / 0.02, parameters.detection().get("0.05").mean(), 0.5);
    assertNull(parameters.wells().get(0).logStart());
  }

  @Test
  void parametersFollowSmoothingAndLogPhase() {
    workspace.load(List.of(exponential("Exp")));
    workspace.applySmoothing(null, SmoothingParameters.defaults());
    workspace.selectLogPhase("Exp", 40, 100);

    SampleParameters parameters = workspace.parameters("Exp");

    assertTrue(parameters.smoothed());
    GrowthParameters first = parameters.wells().get(0);
    assertEquals(40d, first.logStart());
    assertEquals(100d, first.logEnd());
    assertEquals(60d, first.tLogDuration());
    assertEquals(0.02, first.muMax(), 0.005);
  }

  @Test
  void parametersSkipWellsWithTooFewPoints() {
    workspace.load(List.of(tiny()));

    SampleParameters parameters = workspace.parameters("Tiny");

    assertEquals(1, parameters.replicatesTotal());
    assertTrue(parameters.wells().isEmpty());
    assertEquals(0, parameters.summary().get("muMax").n());
    assertThrows(NoSuchElementException.class, () -> workspace.parameters("Nope"));
  }

  @Test
  void clearingRemovesSelection() {
    workspace.load(List.of(exponential("Exp")));
    workspace.selectLogPhase("Exp", 10, 20);

    assertTrue(workspace.clearLogPhase("Exp"));
    assertFalse(workspace.clearLogPhase("Exp"));
    assertTrue(workspace.logPhase("Exp").isEmpty());
  }

  @Test
  void degenerateManualRangeIsRejected() {
    workspace.load(List.of(exponential("Exp")));

    var ex = assertThrows(InvalidParameterException.class,
        () -> workspace.selectLogPhase("Exp", 30, 30));

    assertEquals(1108, ex.errorCode());
    assertTrue(workspace.logPhase("Exp").isEmpty());
  }

  @Test
  void invalidParametersLeaveHistoryUntouched() {
    workspace.load(List.of(exponential("Exp")));

    var ex = assertThrows(InvalidParameterException.class,
        () -> workspace.applySmoothing(null, new SmoothingParameters(0d, 1, 3, 3, 1e-4)));

    assertEquals(1101, ex.errorCode());
    assertEquals(1, workspace.sample("Exp").history().size());
  }

  @Test
  void unknownSamplesAreReported() {
    workspace.load(List.of(exponential("Exp")));

    assertThrows(NoSuchElementException.class, () -> workspace.sample("Nope"));
    assertThrows(NoSuchElementException.class, () -> workspace.logPhase("Nope"));
    assertThrows(NoSuchElementException.class,
        () -> workspace.applySmoothing(List.of("Exp", "Nope"), SmoothingParameters.defaults()));
    assertEquals(1, workspace.sample("Exp").history().size());
  }

  @Test
  void progressListenerSeesEverySampleInLoadOrder() {
    workspace.load(List.of(tiny(), exponential("Exp"), linear()));
    List<String> calls = new ArrayList<>();

    workspace.applySmoothing(List.of(), SmoothingParameters.defaults(),
        (sample, done, total) -> calls.add(sample + ":" + done + "/" + total));

    assertEquals(List.of("Tiny:1/3", "Exp:2/3", "S1:3/3"), calls);
  }

  @Test
  void loadMergesWellsOfSameNameAndResetsSelections() {
    workspace.load(List.of(exponential("Exp")));
    workspace.selectLogPhase("Exp", 10, 20);

    workspace.load(List.of(
        new SampleInput("Exp", "red", List.of(exponentialWell("E1", 1))),
        new SampleInput("Exp", "blue", List.of(exponentialWell("E2", 2)))));

    assertEquals(List.of("Exp"), workspace.sampleNames());
    assertEquals("red", workspace.sample("Exp").color());
    assertEquals(2, workspace.sample("Exp").wells().size());
    assertEquals(122, workspace.sample("Exp").rawPoints().size());
    assertTrue(workspace.logPhase("Exp").isEmpty());
  }

  @Test
  void exportCarriesHistoryAndLogPhases() {
    workspace.load(List.of(exponential("Exp"), tiny()));
    workspace.applySmoothing(null, SmoothingParameters.defaults());

    SmoothedCurvesPayload payload = workspace.export();

    assertEquals(0.25, payload.smoothing().span());
    assertEquals(1, payload.smoothing().degree());
    assertEquals(2, payload.samples().size());
    assertEquals(List.of("Raw", "LOESS span 0.25, degree 1 (passes: 2, converged)"),
        payload.samples().get(0).history().stream()
            .map(SmoothedCurvesPayload.HistoryEntry::label).toList());
    assertEquals(1, payload.logPhases().size());
    assertEquals("Exp", payload.logPhases().get(0).sample());
    assertNotNull(payload.logPhases().get(0).points());
  }

  @Test
  void labelPrintsIntegralSpanWithoutFraction() {
    var refinement = new Refinement(null, 3, false, 0.5);
    assertEquals("LOESS span 5, degree 2 (passes: 3, not converged)",
        CurveWorkspace.label(new SmoothingParameters(5, 2, 1, 3, 1e-4), refinement));
  }
}
