package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.LoessDiagnostics;
import com.ospicorp.growthcurves.curves.model.Point;
import java.util.List;

public record LoessResult(
    List<Point> points,
    LoessDiagnostics diagnostics
) {}
