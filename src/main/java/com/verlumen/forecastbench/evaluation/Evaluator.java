package com.verlumen.forecastbench.evaluation;

import com.google.common.collect.ImmutableList;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.windowing.WindowPair;

/**
 * Scores a model's predictions against the ground truth of evaluation pairs.
 *
 * <p>Implementations are stateless and never modify the pairs, so several models may be
 * evaluated concurrently over the same list.
 */
public interface Evaluator {
  /**
   * Runs {@code model.predict} over every pair, in order.
   *
   * @throws IllegalStateException if a forecast does not match its target's shape
   */
  ImmutableList<PredictionRecord> predict(ForecastModel model, ImmutableList<WindowPair> pairs);

  /** Computes the configured metrics of {@code modelName} from its prediction records. */
  MetricReport score(String modelName, ImmutableList<PredictionRecord> records);

  default MetricReport evaluate(ForecastModel model, ImmutableList<WindowPair> pairs) {
    return score(model.name(), predict(model, pairs));
  }
}
