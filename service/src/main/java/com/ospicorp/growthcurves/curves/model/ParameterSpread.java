package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Spread of one growth parameter across the replicate wells of a sample. {@code ciLow/ciHigh}
 * is the t-based interval of the mean; {@code bootstrapLow/bootstrapHigh} the percentile
 * interval of resampled means.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSpread(
    Double mean,
    Double median,
    Double sd,
    Double sem,
    Double ciLow,
    Double ciHigh,
    Double bootstrapLow,
    Double bootstrapHigh,
    int n
) {

  public static ParameterSpread empty() {
    return new ParameterSpread(null, null, null, null, null, null, null, null, 0);
  }
}
