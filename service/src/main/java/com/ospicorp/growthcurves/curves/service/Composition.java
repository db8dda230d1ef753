package com.ospicorp.growthcurves.curves.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.commons.math3.util.FastMath;

/**
 * One bootstrap resample of {@code n} replicate wells, expressed as how many times each well was
 * drawn, together with its probability weight.
 */
public record Composition(int[] counts, double weight) {

  public Composition {
    counts = counts.clone();
  }

  @Override
  public int[] counts() {
    return counts.clone();
  }

  int count(int well) {
    return counts[well];
  }

  @Override
  public String toString() {
    return "Composition" + Arrays.toString(counts) + " w=" + weight;
  }

  /**
   * Every way of distributing {@code n} draws with replacement among {@code n} wells, weighted by
   * its multinomial probability {@code n! / prod(c_i!) / n^n}.
   */
  public static List<Composition> enumerate(int n) {
    List<Composition> out = new ArrayList<>();
    if (n <= 0) {
      return out;
    }
    double norm = FastMath.pow(n, n);
    double nFactorial = CombinatoricsUtils.factorialDouble(n);
    int[] counts = new int[n];
    fill(counts, 0, n, (c) -> {
      double denom = 1d;
      for (int v : c) {
        denom *= CombinatoricsUtils.factorialDouble(v);
      }
      out.add(new Composition(c, nFactorial / denom / norm));
    });
    return out;
  }

  /** {@code resamples} random compositions drawn with a seeded generator, each weighted equally. */
  public static List<Composition> sample(int n, int resamples, long seed) {
    List<Composition> out = new ArrayList<>(resamples);
    if (n <= 0) {
      return out;
    }
    RandomGenerator rng = new MersenneTwister(seed);
    double weight = 1d / resamples;
    for (int r = 0; r < resamples; r++) {
      int[] counts = new int[n];
      for (int draw = 0; draw < n; draw++) {
        counts[rng.nextInt(n)]++;
      }
      out.add(new Composition(counts, weight));
    }
    return out;
  }

  private static void fill(int[] counts, int idx, int remaining, Consumer<int[]> sink) {
    if (idx == counts.length - 1) {
      counts[idx] = remaining;
      sink.accept(counts);
      return;
    }
    for (int k = 0; k <= remaining; k++) {
      counts[idx] = k;
      fill(counts, idx + 1, remaining - k, sink);
    }
  }
}
