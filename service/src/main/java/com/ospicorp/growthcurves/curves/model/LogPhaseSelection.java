package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Exponential growth window chosen for one sample, either by hand ({@code manual}) or by the
 * detector. {@code start < end} always holds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogPhaseSelection(
    String sample,
    double start,
    double end,
    Instant createdAt,
    boolean manual,
    List<LogPhasePoint> points
) {

  public LogPhaseSelection {
    if (!(start < end)) {
      throw new IllegalArgumentException("log phase start must be before end");
    }
    points = points == null ? null : List.copyOf(points);
  }

  public LogPhaseSelection withPoints(List<LogPhasePoint> newPoints) {
    return new LogPhaseSelection(sample, start, end, createdAt, manual,
        newPoints == null || newPoints.isEmpty() ? null : newPoints);
  }
}
