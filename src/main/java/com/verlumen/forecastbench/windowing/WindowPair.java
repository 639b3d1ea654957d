package com.verlumen.forecastbench.windowing;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * An input window and the horizon that directly follows it.
 *
 * <p>{@link #index()} is the pair's position in generation order and identifies the window in
 * prediction records.
 */
@AutoValue
public abstract class WindowPair {
  public static WindowPair create(int index, Window window, HorizonTarget target) {
    checkArgument(
        window.end() == target.start(),
        "Target must start where the window ends: window ends at %s, target starts at %s",
        window.end(),
        target.start());
    return new AutoValue_WindowPair(index, window, target);
  }

  public abstract int index();

  public abstract Window window();

  public abstract HorizonTarget target();
}
