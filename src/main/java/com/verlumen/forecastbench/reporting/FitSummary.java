package com.verlumen.forecastbench.reporting;

import com.google.auto.value.AutoValue;
import com.verlumen.forecastbench.models.FitResult;
import java.time.Duration;

/** How fitting one model went. */
@AutoValue
public abstract class FitSummary {
  public static FitSummary create(
      String modelName, boolean baseline, FitResult result, Duration fitDuration) {
    return new AutoValue_FitSummary(modelName, baseline, result, fitDuration);
  }

  public abstract String modelName();

  public abstract boolean baseline();

  public abstract FitResult result();

  public abstract Duration fitDuration();
}
