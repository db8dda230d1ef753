package com.ospicorp.growthcurves.curves.model;

public record BandPoint(double x, double low, double high) {}
