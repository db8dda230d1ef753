package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SampleParameters(
    String sample,
    boolean smoothed,
    double alpha,
    int bootstrapIterations,
    int replicatesTotal,
    GrowthParameters.LambdaMethod lambdaMethod,
    List<GrowthParameters> wells,
    Map<String, ParameterSpread> summary,
    Map<String, ParameterSpread> detection
) {

  public SampleParameters {
    wells = List.copyOf(wells);
  }
}
