package com.verlumen.forecastbench.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

@AutoValue
public abstract class EvaluationModule extends AbstractModule {
  /** Binds an evaluator that reports {@code metrics}. */
  public static EvaluationModule create(ImmutableSet<Metric> metrics) {
    return new AutoValue_EvaluationModule(metrics);
  }

  abstract ImmutableSet<Metric> metrics();

  @Override
  protected void configure() {
    bind(Evaluator.class).to(EvaluatorImpl.class);
  }

  @Provides
  ImmutableList<MetricCalculator> provideMetricCalculators() {
    return MetricCalculators.ALL_CALCULATORS.stream()
        .filter(calculator -> metrics().contains(calculator.metric()))
        .collect(ImmutableList.toImmutableList());
  }
}
