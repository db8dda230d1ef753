package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Map;

/**
 * Growth parameters of one replicate well. Times are in minutes and rates per minute, like the
 * input points. Any value that cannot be derived from the curve is null.
 *
 * @param muMax             95th percentile of the sliding-window growth rates (maximum when
 *                          fewer than five), restricted to the log phase when one is selected
 * @param td                doubling time, {@code ln 2 / muMax}
 * @param lambda            lag time from the first curve time
 * @param kHat              95th percentile of the OD values, the carrying capacity estimate
 * @param tMid              time at which the curve first crosses {@code kHat / 2}
 * @param auc               trapezoidal area under the curve
 * @param detection         first time the curve reaches each detection threshold, keyed by the
 *                          threshold
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GrowthParameters(
    String wellId,
    int replicateIndex,
    Double muMax,
    Double td,
    Double lambda,
    LambdaMethod lambdaMethod,
    Double kHat,
    Double odMax,
    Double tInflection,
    Double tMid,
    Double slopeAtInflection,
    Double auc,
    Map<String, Double> detection,
    Double logStart,
    Double logEnd,
    Double tLogDuration
) {

  public enum LambdaMethod {
    THRESHOLD,
    TANGENT;

    @JsonValue
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
