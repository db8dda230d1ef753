package com.ospicorp.growthcurves.curves.model;

import jakarta.validation.constraints.NotNull;

public record LogPhaseRangeRequest(@NotNull Double start, @NotNull Double end) {}
