package com.ospicorp.growthcurves.curves.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LogPhasePoint(
    @JsonProperty("t_min") double tMin,
    @JsonProperty("od600") double od600
) {}
