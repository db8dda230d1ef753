package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.BandMode;
import com.ospicorp.growthcurves.curves.model.GrowthParameters;
import com.ospicorp.growthcurves.curves.model.InvalidParameterException;
import com.ospicorp.growthcurves.curves.model.LogPhaseDetectionOptions;
import com.ospicorp.growthcurves.curves.model.LogPhasePoint;
import com.ospicorp.growthcurves.curves.model.LogPhaseSelection;
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Holds the loaded samples with their smoothing histories and log-phase selections, and runs the
 * numerical components over them. Batches visit samples in load order.
 */
@Service
public class CurveWorkspace {
  private static final Logger log = LoggerFactory.getLogger(CurveWorkspace.class);

  private final LogPhaseReplacement replacement;
  private final BandSettings bandSettings;
  private final ParameterSettings parameterSettings;
  private final Clock clock;

  private volatile Map<String, SampleCurves> samples = Map.of();
  private final Map<String, LogPhaseSelection> logPhases = new ConcurrentHashMap<>();
  private volatile SmoothingParameters lastParameters = SmoothingParameters.defaults();
  private volatile LogPhaseDetectionOptions detectionOptions = LogPhaseDetectionOptions.defaults();

  @Autowired
  public CurveWorkspace(
      @Value("${curves.log-phase.replacement:keep_manual}") String replacement,
      @Value("${curves.bands.max-exact-replicates:8}") int maxExactReplicates,
      @Value("${curves.bands.monte-carlo-resamples:2000}") int monteCarloResamples,
      @Value("${curves.bands.seed:20240601}") long seed,
      @Value("${curves.parameters.alpha:0.05}") double alpha,
      @Value("${curves.parameters.bootstrap-iterations:2000}") int bootstrapIterations,
      @Value("${curves.parameters.seed:20240601}") long parameterSeed,
      @Value("${curves.parameters.detection-thresholds:0.05,0.1}") double[] thresholds) {
    this(LogPhaseReplacement.parse(replacement),
        new BandSettings(maxExactReplicates, monteCarloResamples, seed),
        new ParameterSettings(alpha, bootstrapIterations, parameterSeed,
            Arrays.stream(thresholds).boxed().toList()),
        Clock.systemUTC());
  }

  CurveWorkspace(LogPhaseReplacement replacement, BandSettings bandSettings, Clock clock) {
    this(replacement, bandSettings, ParameterSettings.defaults(), clock);
  }

  CurveWorkspace(LogPhaseReplacement replacement, BandSettings bandSettings,
      ParameterSettings parameterSettings, Clock clock) {
    this.replacement = replacement;
    this.bandSettings = bandSettings;
    this.parameterSettings = parameterSettings;
    this.clock = clock;
  }

  /** Replaces the workspace content. Wells of samples sharing a name are merged. */
  public synchronized void load(List<SampleInput> inputs) {
    Map<String, String> colors = new LinkedHashMap<>();
    Map<String, List<ReplicateWell>> wells = new LinkedHashMap<>();
    for (SampleInput input : inputs) {
      if (input == null || !StringUtils.hasText(input.name())) {
        continue;
      }
      colors.putIfAbsent(input.name(), input.color());
      List<ReplicateWell> target = wells.computeIfAbsent(input.name(), k -> new ArrayList<>());
      if (input.wells() != null) {
        target.addAll(input.wells());
      }
    }
    Map<String, SampleCurves> loaded = new LinkedHashMap<>();
    wells.forEach((name, list) -> loaded.put(name, new SampleCurves(name, colors.get(name), list)));
    samples = Collections.unmodifiableMap(loaded);
    logPhases.clear();
    lastParameters = SmoothingParameters.defaults();
    log.info("Loaded {} samples with {} wells", loaded.size(),
        loaded.values().stream().mapToInt(s -> s.wells().size()).sum());
  }

  public List<String> sampleNames() {
    return List.copyOf(samples.keySet());
  }

  public SampleCurves sample(String name) {
    SampleCurves sample = samples.get(name);
    if (sample == null) {
      throw new NoSuchElementException("Sample not found: " + name);
    }
    return sample;
  }

  public SmoothingParameters lastParameters() {
    return lastParameters;
  }

  public LogPhaseDetectionOptions detectionOptions() {
    return detectionOptions;
  }

  public SmoothingReport applySmoothing(Collection<String> names, SmoothingParameters params) {
    return applySmoothing(names, params, SmoothingProgressListener.NONE);
  }

  /**
   * Smooths the raw points of each targeted sample and appends the result to its history.
   * Samples with too few points are skipped and counted. An empty or null name list targets
   * every sample.
   */
  public SmoothingReport applySmoothing(Collection<String> names, SmoothingParameters params,
      SmoothingProgressListener listener) {
    params.validate();
    List<SampleCurves> targets = resolve(names);
    int applied = 0;
    int skipped = 0;
    int totalLoops = 0;
    Set<String> changed = new LinkedHashSet<>();
    int done = 0;
    for (SampleCurves sample : targets) {
      try {
        Refinement refinement = LoessRefiner.refine(sample.rawPoints(), params);
        sample.append(new SmoothingState(label(params, refinement),
            refinement.result().points(), refinement.result().diagnostics()));
        applied++;
        totalLoops += refinement.loops();
        changed.add(sample.name());
        log.debug("Smoothed {}: {} points, {} passes, converged={}", sample.name(),
            refinement.result().points().size(), refinement.loops(), refinement.converged());
      } catch (InsufficientDataException ex) {
        skipped++;
        log.warn("Skipping {}: {}", sample.name(), ex.getMessage());
      }
      done++;
      listener.onSampleProcessed(sample.name(), done, targets.size());
    }
    if (applied > 0) {
      lastParameters = params;
    }
    int detected = refreshLogPhases(changed, true);
    double averagePasses = applied == 0 ? 0d : (double) totalLoops / applied;
    log.info("Applied LOESS span {} to {} samples ({} skipped, avg {} passes); "
        + "auto log phase {}/{}", params.span(), applied, skipped,
        String.format(Locale.ROOT, "%.2f", averagePasses), detected, changed.size());
    return new SmoothingReport(applied, skipped, averagePasses, detected);
  }

  /** Removes the newest history entry of each targeted sample; samples at raw are skipped. */
  public SmoothingReport stepBack(Collection<String> names) {
    List<SampleCurves> targets = resolve(names);
    int applied = 0;
    int skipped = 0;
    Set<String> changed = new LinkedHashSet<>();
    for (SampleCurves sample : targets) {
      if (sample.stepBack()) {
        applied++;
        changed.add(sample.name());
      } else {
        skipped++;
      }
    }
    int detected = refreshLogPhases(changed, true);
    log.info("Stepped back {} samples ({} already at raw); auto log phase {}/{}", applied, skipped,
        detected, changed.size());
    return new SmoothingReport(applied, skipped, 0d, detected);
  }

  /**
   * Re-runs detection with new options on the targeted samples. An explicit request replaces
   * manual selections as well; samples without a detection lose their selection.
   */
  public int detectLogPhases(Collection<String> names, LogPhaseDetectionOptions options) {
    detectionOptions = options.clamped();
    List<String> targets = resolve(names).stream().map(SampleCurves::name).toList();
    return refreshLogPhases(targets, false);
  }

  public LogPhaseSelection selectLogPhase(String name, double start, double end) {
    SampleCurves sample = sample(name);
    if (!Double.isFinite(start) || !Double.isFinite(end) || start == end) {
      throw new InvalidParameterException(
          "Invalid log phase range. start and end must be finite and different.", 1108);
    }
    LogPhaseSelection selection = new LogPhaseSelection(sample.name(), Math.min(start, end),
        Math.max(start, end), Instant.now(clock), true, null);
    logPhases.put(sample.name(), selection);
    log.info("Manual log phase for {}: [{}, {}]", sample.name(), selection.start(),
        selection.end());
    return withPoints(selection);
  }

  public boolean clearLogPhase(String name) {
    SampleCurves sample = sample(name);
    return logPhases.remove(sample.name()) != null;
  }

  public Optional<LogPhaseSelection> logPhase(String name) {
    SampleCurves sample = sample(name);
    return Optional.ofNullable(logPhases.get(sample.name())).map(this::withPoints);
  }

  /**
   * Uncertainty band around the sample's curve. Span and degree default to the last applied
   * smoothing; empty when the sample has fewer than two wells or the mode is none.
   */
  public Optional<UncertaintyBand> band(String name, BandMode mode, Double span, Integer degree) {
    SampleCurves sample = sample(name);
    SmoothingParameters base = lastParameters;
    SmoothingParameters params = base.withSpanAndDegree(
        span != null ? span : base.span(),
        degree != null ? degree : base.degree());
    return BootstrapBands.band(sample.name(), sample.rawPoints(), sample.wells(), params, mode,
        bandSettings);
  }

  /**
   * Growth parameters of every replicate well of the sample and their spread. Once the sample
   * has been smoothed each well is smoothed with the last applied parameters first; a stored log
   * phase restricts the growth-rate search.
   */
  public SampleParameters parameters(String name) {
    SampleCurves sample = sample(name);
    boolean smoothed = sample.history().size() > 1;
    SmoothingParameters params = lastParameters;
    LogPhaseSelection selection = logPhases.get(sample.name());
    Double start = selection == null ? null : selection.start();
    Double end = selection == null ? null : selection.end();
    List<GrowthParameters> wells = new ArrayList<>(sample.wells().size());
    for (ReplicateWell well : sample.wells()) {
      List<Point> curve = smoothed ? smoothWell(well, params) : well.points();
      GrowthParameterCalculator.compute(well.wellId(), well.replicateIndex(), curve, start, end,
              parameterSettings.detectionThresholds())
          .ifPresentOrElse(wells::add,
              () -> log.debug("No parameters for {}/{}: too few points", sample.name(),
                  well.wellId()));
    }
    log.info("Growth parameters for {}: {}/{} wells used", sample.name(), wells.size(),
        sample.wells().size());
    return GrowthParameterCalculator.summarize(sample.name(), smoothed, sample.wells().size(),
        wells, parameterSettings);
  }

  public SmoothedCurvesPayload export() {
    Map<String, SampleCurves> current = samples;
    List<SmoothedCurvesPayload.SampleRecord> records = new ArrayList<>(current.size());
    List<LogPhaseSelection> phases = new ArrayList<>();
    for (SampleCurves sample : current.values()) {
      List<SmoothedCurvesPayload.HistoryEntry> history = sample.history().stream()
          .map(state -> new SmoothedCurvesPayload.HistoryEntry(state.label(), state.points()))
          .toList();
      records.add(new SmoothedCurvesPayload.SampleRecord(sample.name(), sample.color(),
          sample.wells(), history));
      LogPhaseSelection selection = logPhases.get(sample.name());
      if (selection != null) {
        phases.add(withPoints(selection));
      }
    }
    SmoothingParameters params = lastParameters;
    return new SmoothedCurvesPayload(
        new SmoothedCurvesPayload.Smoothing(params.span(), params.degree()), records, phases);
  }

  /**
   * Re-runs detection on the latest curve of each named sample. When {@code respectPolicy} is
   * false manual selections are overwritten too, as for an explicit re-detection request.
   */
  private int refreshLogPhases(Collection<String> names, boolean respectPolicy) {
    Instant now = Instant.now(clock);
    LogPhaseDetectionOptions options = detectionOptions;
    boolean keepManual = respectPolicy && replacement == LogPhaseReplacement.KEEP_MANUAL;
    int detected = 0;
    for (String name : names) {
      SampleCurves sample = samples.get(name);
      if (sample == null) {
        continue;
      }
      LogPhaseDetection detection = LogPhaseDetector.detect(sample.latest().points(), options);
      LogPhaseSelection found = detection.detected() && detection.startTime() < detection.endTime()
          ? new LogPhaseSelection(name, detection.startTime(), detection.endTime(), now, false,
              null)
          : null;
      // atomic against selectLogPhase on the same sample
      LogPhaseSelection stored = logPhases.compute(name,
          (key, existing) -> keepManual && existing != null && existing.manual()
              ? existing
              : found);
      if (found != null && stored == found) {
        detected++;
      }
    }
    return detected;
  }

  private static List<Point> smoothWell(ReplicateWell well, SmoothingParameters params) {
    try {
      return LoessRefiner.refine(well.points(), params).result().points();
    } catch (InsufficientDataException ex) {
      log.debug("Using raw points of well {}: {}", well.wellId(), ex.getMessage());
      return well.points();
    }
  }

  private LogPhaseSelection withPoints(LogPhaseSelection selection) {
    SampleCurves sample = samples.get(selection.sample());
    if (sample == null) {
      return selection;
    }
    List<LogPhasePoint> inside = sample.latest().points().stream()
        .filter(p -> p.x() >= selection.start() && p.x() <= selection.end())
        .map(p -> new LogPhasePoint(p.x(), p.y()))
        .toList();
    return selection.withPoints(inside);
  }

  private List<SampleCurves> resolve(Collection<String> names) {
    Map<String, SampleCurves> current = samples;
    if (names == null || names.isEmpty()) {
      return List.copyOf(current.values());
    }
    Set<String> wanted = new LinkedHashSet<>(names);
    for (String name : wanted) {
      if (!current.containsKey(name)) {
        throw new NoSuchElementException("Sample not found: " + name);
      }
    }
    return current.values().stream().filter(s -> wanted.contains(s.name())).toList();
  }

  static String label(SmoothingParameters params, Refinement refinement) {
    return String.format(Locale.ROOT, "LOESS span %s, degree %d (passes: %d, %s)",
        trimNumber(params.span()), params.degree(), refinement.loops(),
        refinement.converged() ? "converged" : "not converged");
  }

  private static String trimNumber(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return String.valueOf((long) value);
    }
    return String.valueOf(value);
  }
}
