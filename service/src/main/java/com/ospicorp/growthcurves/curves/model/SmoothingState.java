package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SmoothingState(
    String label,
    List<Point> points,
    LoessDiagnostics diagnostics
) {

  public static final String RAW_LABEL = "Raw";

  public SmoothingState {
    points = List.copyOf(points);
  }

  public static SmoothingState raw(List<Point> points) {
    return new SmoothingState(RAW_LABEL, points, null);
  }
}
