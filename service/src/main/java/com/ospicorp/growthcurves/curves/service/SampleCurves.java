package com.ospicorp.growthcurves.curves.service;

import com.ospicorp.growthcurves.curves.model.Point;
import com.ospicorp.growthcurves.curves.model.ReplicateWell;
import com.ospicorp.growthcurves.curves.model.SmoothingState;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One sample of the workspace: its replicate wells, the aggregated raw points and the smoothing
 * history. History entries are immutable snapshots; entry 0 is the raw state and is never
 * removed. All history access goes through this object's monitor, so one sample has at most one
 * writer at a time.
 */
public final class SampleCurves {
  private static final Comparator<ReplicateWell> WELL_ORDER =
      Comparator.comparingInt(ReplicateWell::replicateIndex).thenComparing(ReplicateWell::wellId,
          Comparator.nullsLast(Comparator.naturalOrder()));

  private final String name;
  private final String color;
  private final List<ReplicateWell> wells;
  private final List<Point> rawPoints;
  private final List<SmoothingState> history = new ArrayList<>();

  SampleCurves(String name, String color, List<ReplicateWell> wells) {
    this.name = name;
    this.color = color;
    List<ReplicateWell> sortedWells = new ArrayList<>(wells);
    sortedWells.sort(WELL_ORDER);
    this.wells = List.copyOf(sortedWells);
    List<Point> aggregated = new ArrayList<>();
    for (ReplicateWell well : this.wells) {
      aggregated.addAll(well.points());
    }
    this.rawPoints = List.copyOf(Point.finiteSorted(aggregated));
    history.add(SmoothingState.raw(rawPoints));
  }

  public String name() {
    return name;
  }

  public String color() {
    return color;
  }

  public List<ReplicateWell> wells() {
    return wells;
  }

  public List<Point> rawPoints() {
    return rawPoints;
  }

  public synchronized List<SmoothingState> history() {
    return List.copyOf(history);
  }

  public synchronized SmoothingState latest() {
    return history.get(history.size() - 1);
  }

  synchronized void append(SmoothingState state) {
    history.add(state);
  }

  /** Pops the newest entry; false when only the raw entry is left. */
  synchronized boolean stepBack() {
    if (history.size() <= 1) {
      return false;
    }
    history.remove(history.size() - 1);
    return true;
  }
}
