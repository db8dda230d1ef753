package com.ospicorp.growthcurves.curves.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

// Validated sample as handed over by the ingestion layer
public record SampleInput(
    @NotBlank String name,
    String color,
    @Valid List<ReplicateWell> wells
) {}
