package com.ospicorp.growthcurves.curves.model;

/**
 * Acceptance criteria for the sliding-window log-phase detector.
 *
 * <p>Values typed by users are brought into range by {@link #clamped()} rather than rejected;
 * only a window smaller than two points is refused.
 */
public record LogPhaseDetectionOptions(
    int windowSize,
    double r2Min,
    double odMin,
    double fracKMax,
    double muRelMin,
    double muRelMax
) {

  public static LogPhaseDetectionOptions defaults() {
    return new LogPhaseDetectionOptions(20, 0.98, 0.001, 0.9, 0.5, 1.05);
  }

  public LogPhaseDetectionOptions clamped() {
    if (windowSize < 2) {
      throw new InvalidParameterException(
          "Invalid windowSize. Must be greater than or equal to 2.", 1107);
    }
    LogPhaseDetectionOptions d = defaults();
    double r2 = clamp(orDefault(r2Min, d.r2Min()), 0.1, 0.9999);
    double od = Math.max(0d, orDefault(odMin, d.odMin()));
    double fracK = clamp(orDefault(fracKMax, d.fracKMax()), 0.05, 0.95);
    double relMin = Math.max(0.1, orDefault(muRelMin, d.muRelMin()));
    double relMax = Math.max(relMin + 1e-3, orDefault(muRelMax, d.muRelMax()));
    return new LogPhaseDetectionOptions(windowSize, r2, od, fracK, relMin, relMax);
  }

  private static double orDefault(double value, double fallback) {
    return Double.isFinite(value) ? value : fallback;
  }

  private static double clamp(double value, double min, double max) {
    return Math.min(max, Math.max(min, value));
  }
}
