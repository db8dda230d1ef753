package com.ospicorp.growthcurves.curves.model;

import java.util.List;

public record DetectionRequest(
    List<String> samples,
    Integer windowSize,
    Double r2Min,
    Double odMin,
    Double fracKMax,
    Double muRelMin,
    Double muRelMax
) {

  public LogPhaseDetectionOptions toOptions(LogPhaseDetectionOptions base) {
    return new LogPhaseDetectionOptions(
        windowSize != null ? windowSize : base.windowSize(),
        r2Min != null ? r2Min : base.r2Min(),
        odMin != null ? odMin : base.odMin(),
        fracKMax != null ? fracKMax : base.fracKMax(),
        muRelMin != null ? muRelMin : base.muRelMin(),
        muRelMax != null ? muRelMax : base.muRelMax());
  }
}
