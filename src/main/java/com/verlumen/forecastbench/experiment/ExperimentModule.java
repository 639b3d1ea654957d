package com.verlumen.forecastbench.experiment;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.verlumen.forecastbench.evaluation.EvaluationModule;
import com.verlumen.forecastbench.models.ModelsModule;
import com.verlumen.forecastbench.reporting.ReportingModule;
import com.verlumen.forecastbench.series.SeriesModule;
import com.verlumen.forecastbench.windowing.WindowingModule;
import java.util.concurrent.Executors;

/**
 * Wires a benchmark run. Settings shared by every run of an invocation, the metric set and the
 * worker pool size, come from {@code config}; each orchestrator gets its own config through
 * {@link ExperimentOrchestrator.Factory}.
 */
@AutoValue
public abstract class ExperimentModule extends AbstractModule {
  public static ExperimentModule create(ExperimentConfig config) {
    return new AutoValue_ExperimentModule(config);
  }

  abstract ExperimentConfig config();

  @Override
  protected void configure() {
    install(SeriesModule.create());
    install(WindowingModule.create());
    install(ModelsModule.create());
    install(EvaluationModule.create(config().metrics()));
    install(ReportingModule.create());
    install(
        new FactoryModuleBuilder()
            .implement(ExperimentOrchestrator.class, ExperimentOrchestratorImpl.class)
            .build(ExperimentOrchestrator.Factory.class));
  }

  /** Shut down by whoever created the injector. */
  @Provides
  @Singleton
  ListeningExecutorService provideExecutor() {
    return MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(
            config().threads(),
            new ThreadFactoryBuilder().setNameFormat("forecastbench-%d").setDaemon(true).build()));
  }
}
