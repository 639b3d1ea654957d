package com.verlumen.forecastbench.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.forecastbench.models.Forecast;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.windowing.HorizonTarget;
import com.verlumen.forecastbench.windowing.WindowPair;

final class EvaluatorImpl implements Evaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableList<MetricCalculator> calculators;

  @Inject
  EvaluatorImpl(ImmutableList<MetricCalculator> calculators) {
    checkArgument(!calculators.isEmpty(), "At least one metric is required");
    this.calculators = calculators;
  }

  @Override
  public ImmutableList<PredictionRecord> predict(
      ForecastModel model, ImmutableList<WindowPair> pairs) {
    checkNotNull(model, "Model cannot be null");
    checkArgument(!pairs.isEmpty(), "Evaluation pairs cannot be empty");
    ImmutableList.Builder<PredictionRecord> records =
        ImmutableList.builderWithExpectedSize(pairs.size());
    for (WindowPair pair : pairs) {
      Forecast forecast = model.predict(pair.window());
      HorizonTarget target = pair.target();
      checkState(
          forecast.horizon() == target.length() && forecast.nodeCount() == target.nodeCount(),
          "%s predicted %s steps over %s nodes for window %s, expected %s over %s",
          model.name(),
          forecast.horizon(),
          forecast.nodeCount(),
          pair.index(),
          target.length(),
          target.nodeCount());
      records.add(PredictionRecord.create(pair.index(), model.name(), forecast, target));
    }
    logger.atFine().log("%s predicted %d windows", model.name(), pairs.size());
    return records.build();
  }

  @Override
  public MetricReport score(String modelName, ImmutableList<PredictionRecord> records) {
    checkNotNull(modelName, "Model name cannot be null");
    checkArgument(!records.isEmpty(), "Prediction records cannot be empty");
    int horizon = records.get(0).actual().length();
    int nodeCount = records.get(0).actual().nodeCount();
    int pooled = records.size() * nodeCount;

    ImmutableList.Builder<ImmutableMap<Metric, MetricValue>> steps = ImmutableList.builder();
    for (int step = 0; step < horizon; step++) {
      double[] predicted = new double[pooled];
      double[] actual = new double[pooled];
      int i = 0;
      for (PredictionRecord record : records) {
        checkArgument(
            record.modelName().equals(modelName),
            "Record of %s cannot be scored as %s",
            record.modelName(),
            modelName);
        checkArgument(
            record.actual().length() == horizon && record.actual().nodeCount() == nodeCount,
            "Records must share one shape");
        for (int node = 0; node < nodeCount; node++) {
          predicted[i] = record.predicted().value(step, node);
          actual[i] = record.actual().value(step, node);
          i++;
        }
      }
      ImmutableMap.Builder<Metric, MetricValue> values = ImmutableMap.builder();
      for (MetricCalculator calculator : calculators) {
        values.put(calculator.metric(), calculator.calculate(predicted, actual));
      }
      steps.add(values.build());
    }

    ImmutableSet<Metric> metrics =
        calculators.stream()
            .map(MetricCalculator::metric)
            .collect(ImmutableSet.toImmutableSet());
    return MetricReport.forModel(modelName, metrics, steps.build());
  }
}
