package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum BandMode {
  NONE,
  POINTWISE,
  SIMULTANEOUS;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
