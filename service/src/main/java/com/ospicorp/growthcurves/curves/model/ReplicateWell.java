package com.ospicorp.growthcurves.curves.model;

import java.util.List;

public record ReplicateWell(
    String wellId,
    int replicateIndex,
    List<Point> points
) {

  public ReplicateWell {
    points = Point.finiteSorted(points == null ? List.of() : points);
    if (replicateIndex < 1) {
      replicateIndex = 1;
    }
  }
}
