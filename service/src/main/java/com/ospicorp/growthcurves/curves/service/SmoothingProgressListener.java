package com.ospicorp.growthcurves.curves.service;

/** Called by the workspace after each sample of a smoothing batch. */
@FunctionalInterface
public interface SmoothingProgressListener {

  SmoothingProgressListener NONE = (sample, done, total) -> {
  };

  void onSampleProcessed(String sample, int done, int total);
}
