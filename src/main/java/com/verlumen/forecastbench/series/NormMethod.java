package com.verlumen.forecastbench.series;

import com.google.common.base.Ascii;

/** Per-node scaling applied to model inputs before training. */
public enum NormMethod {
  Z_SCORE,
  MIN_MAX,
  NONE;

  /** Parses {@code z_score}, {@code min_max} or {@code none}, ignoring case. */
  public static NormMethod fromString(String name) {
    return NormMethod.valueOf(Ascii.toUpperCase(name.trim()));
  }
}
