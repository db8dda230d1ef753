package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SmoothedCurvesPayload(
    Smoothing smoothing,
    List<SampleRecord> samples,
    List<LogPhaseSelection> logPhases
) {

  public record Smoothing(double span, int degree) {}

  public record SampleRecord(
      String sample,
      String color,
      List<ReplicateWell> wells,
      List<HistoryEntry> history
  ) {}

  public record HistoryEntry(String label, List<Point> points) {}
}
