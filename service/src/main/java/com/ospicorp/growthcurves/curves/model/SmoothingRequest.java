package com.ospicorp.growthcurves.curves.model;

import java.util.List;

// Omitted fields fall back to SmoothingParameters defaults; omitted samples target all
public record SmoothingRequest(
    List<String> samples,
    Double span,
    Integer degree,
    Integer robustIterations,
    Integer maxRefinements,
    Double convergenceTolerance
) {

  public SmoothingParameters toParameters() {
    SmoothingParameters d = SmoothingParameters.defaults();
    return new SmoothingParameters(
        span != null ? span : d.span(),
        degree != null ? degree : d.degree(),
        robustIterations != null ? robustIterations : d.robustIterations(),
        maxRefinements != null ? maxRefinements : d.maxRefinements(),
        convergenceTolerance != null ? convergenceTolerance : d.convergenceTolerance());
  }
}
