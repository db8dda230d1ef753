package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Confidence band around a sample's smoothed curve. {@code low <= high} holds at every point;
 * a {@link Method#DEGENERATE} band has zero width everywhere.
 */
public record UncertaintyBand(
    String sample,
    BandMode mode,
    Method method,
    List<BandPoint> points
) {

  public UncertaintyBand {
    points = List.copyOf(points);
  }

  public enum Method {
    BOOTSTRAP,
    MONTE_CARLO,
    WELL_SD,
    DEGENERATE;

    @JsonValue
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
