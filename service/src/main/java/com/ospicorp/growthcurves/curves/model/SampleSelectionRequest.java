package com.ospicorp.growthcurves.curves.model;

import java.util.List;

public record SampleSelectionRequest(List<String> samples) {}
