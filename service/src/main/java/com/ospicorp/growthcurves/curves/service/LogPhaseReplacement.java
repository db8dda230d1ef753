package com.ospicorp.growthcurves.curves.service;

import java.util.Locale;

/**
 * What automatic detection may do to existing log-phase selections after the history of a sample
 * changes.
 */
public enum LogPhaseReplacement {
  /** Manual selections are left alone; automatic ones are replaced, or cleared on no detection. */
  KEEP_MANUAL,
  /** Every selection is replaced by the detection result, or cleared on no detection. */
  REPLACE_ALL;

  public static LogPhaseReplacement parse(String value) {
    try {
      return LogPhaseReplacement.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException(
          "Unsupported log phase replacement policy " + value
              + "; expected keep_manual or replace_all", ex);
    }
  }
}
