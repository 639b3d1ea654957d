package com.verlumen.forecastbench.evaluation;

import com.google.auto.value.AutoValue;
import com.verlumen.forecastbench.models.Forecast;
import com.verlumen.forecastbench.windowing.HorizonTarget;

/** One model's prediction for one evaluation window, next to the ground truth. */
@AutoValue
public abstract class PredictionRecord {
  public static PredictionRecord create(
      int windowIndex, String modelName, Forecast predicted, HorizonTarget actual) {
    return new AutoValue_PredictionRecord(windowIndex, modelName, predicted, actual);
  }

  /** Index of the window pair the prediction was made for. */
  public abstract int windowIndex();

  public abstract String modelName();

  public abstract Forecast predicted();

  public abstract HorizonTarget actual();
}
