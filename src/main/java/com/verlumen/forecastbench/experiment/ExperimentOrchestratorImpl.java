package com.verlumen.forecastbench.experiment;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.flogger.LogPerBucketingStrategy;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.forecastbench.evaluation.Evaluator;
import com.verlumen.forecastbench.evaluation.MetricReport;
import com.verlumen.forecastbench.evaluation.PredictionRecord;
import com.verlumen.forecastbench.models.FitResult;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.ModelFactory;
import com.verlumen.forecastbench.models.ModelRegistry;
import com.verlumen.forecastbench.reporting.FitSummary;
import com.verlumen.forecastbench.reporting.RunReport;
import com.verlumen.forecastbench.series.Series;
import com.verlumen.forecastbench.series.SeriesSource;
import com.verlumen.forecastbench.series.SeriesSourceFactory;
import com.verlumen.forecastbench.windowing.DatasetSplit;
import com.verlumen.forecastbench.windowing.WindowPair;
import com.verlumen.forecastbench.windowing.Windower;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

final class ExperimentOrchestratorImpl implements ExperimentOrchestrator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SeriesSourceFactory seriesSourceFactory;
  private final Windower windower;
  private final ModelRegistry modelRegistry;
  private final Evaluator evaluator;
  private final ListeningExecutorService executor;
  private final ExperimentConfig config;
  private final AtomicBoolean started = new AtomicBoolean(false);

  private volatile ExperimentState state = ExperimentState.CONFIGURED;
  private volatile Throwable failure;

  @Inject
  ExperimentOrchestratorImpl(
      SeriesSourceFactory seriesSourceFactory,
      Windower windower,
      ModelRegistry modelRegistry,
      Evaluator evaluator,
      ListeningExecutorService executor,
      @Assisted ExperimentConfig config) {
    this.seriesSourceFactory = seriesSourceFactory;
    this.windower = windower;
    this.modelRegistry = modelRegistry;
    this.evaluator = evaluator;
    this.executor = executor;
    this.config = config;
  }

  @Override
  public ExperimentState state() {
    return state;
  }

  @Override
  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure);
  }

  @Override
  public RunReport run() {
    checkState(started.compareAndSet(false, true), "An orchestrator runs only once");
    try {
      return execute();
    } catch (RuntimeException | Error e) {
      failure = e;
      logger.atSevere().withCause(e).log(
          "Run of %s failed while %s", config.modelName(), state);
      state = ExperimentState.FAILED;
      throw e;
    }
  }

  private RunReport execute() {
    ModelFactory primary = modelRegistry.getFactory(config.modelName());
    ImmutableList<ModelFactory> factories = modelsToRun(primary);

    checkNotInterrupted();
    SeriesSource source = seriesSourceFactory.create(config.dataset());
    Series series = source.load();
    transition(ExperimentState.DATA_LOADED, "Loaded %s", series);

    checkNotInterrupted();
    ImmutableList<WindowPair> pairs =
        windower.build(series, config.windowSize(), config.horizon(), config.stride());
    DatasetSplit split = windower.split(pairs, config.evalFraction());
    transition(
        ExperimentState.WINDOWS_BUILT,
        "Built %d pairs: %d train, %d eval, %d purged",
        pairs.size(),
        split.train().size(),
        split.eval().size(),
        split.purgedCount());

    checkNotInterrupted();
    ImmutableList<FittedModel> fitted = fitAll(factories, split.train());
    transition(ExperimentState.MODEL_FIT, "Fit %d models", fitted.size());

    checkNotInterrupted();
    Stopwatch evaluationTimer = Stopwatch.createStarted();
    ImmutableList<ImmutableList<PredictionRecord>> predictions =
        awaitAll(
            fitted.stream()
                .map(model -> executor.submit(() -> evaluator.predict(model.model(), split.eval())))
                .collect(ImmutableList.toImmutableList()));
    List<MetricReport> reports = new ArrayList<>();
    for (int i = 0; i < fitted.size(); i++) {
      reports.add(evaluator.score(fitted.get(i).model().name(), predictions.get(i)));
    }
    MetricReport metrics = MetricReport.merge(reports);
    Duration evaluationDuration = evaluationTimer.elapsed();
    transition(
        ExperimentState.EVALUATED,
        "Evaluated %d models on %d pairs in %s",
        fitted.size(),
        split.eval().size(),
        evaluationDuration);

    checkNotInterrupted();
    ImmutableMap.Builder<String, ImmutableList<PredictionRecord>> savedPredictions =
        ImmutableMap.builder();
    if (config.savePredictions()) {
      for (int i = 0; i < fitted.size(); i++) {
        savedPredictions.put(fitted.get(i).model().name(), predictions.get(i));
      }
    }
    RunReport report =
        RunReport.builder()
            .setModelName(primary.name())
            .setDatasetName(source.datasetName())
            .setWindowSize(config.windowSize())
            .setHorizon(config.horizon())
            .setSettings(config.settings())
            .setSeriesLength(series.length())
            .setNodeCount(series.nodeCount())
            .setSeriesStart(series.timestamp(0))
            .setSeriesEnd(series.timestamp(series.length() - 1))
            .setTrainPairCount(split.train().size())
            .setEvalPairCount(split.eval().size())
            .setPurgedPairCount(split.purgedCount())
            .setFitSummaries(
                fitted.stream().map(FittedModel::summary).collect(ImmutableList.toImmutableList()))
            .setMetrics(metrics)
            .setEvaluationDuration(evaluationDuration)
            .setPredictions(savedPredictions.build())
            .build();
    transition(ExperimentState.REPORTED, "Run of %s complete", report.modelName());
    return report;
  }

  /**
   * The models of the run, resolved before any data is read: the primary model first, unless only
   * baselines run, then each baseline that is not the primary model, in registry order.
   */
  private ImmutableList<ModelFactory> modelsToRun(ModelFactory primary) {
    ImmutableList.Builder<ModelFactory> factories = ImmutableList.builder();
    if (!config.baselineOnly()) {
      factories.add(primary);
    }
    if (config.baseline()) {
      for (ModelFactory baseline : modelRegistry.baselines()) {
        if (config.baselineOnly() || !baseline.name().equals(primary.name())) {
          factories.add(baseline);
        }
      }
    }
    ImmutableList<ModelFactory> resolved = factories.build();
    logger.atInfo().log(
        "Configured run of %s with models %s",
        primary.name(),
        resolved.stream().map(ModelFactory::name).collect(ImmutableList.toImmutableList()));
    return resolved;
  }

  private ImmutableList<FittedModel> fitAll(
      ImmutableList<ModelFactory> factories, ImmutableList<WindowPair> trainPairs) {
    ModelConfig modelConfig = config.modelConfig();
    ImmutableList<FittedModel> fitted =
        awaitAll(
            factories.stream()
                .map(factory -> executor.submit(() -> fit(factory, modelConfig, trainPairs)))
                .collect(ImmutableList.toImmutableList()));
    for (FittedModel model : fitted) {
      if (!model.summary().result().converged()) {
        logger.atWarning().log(
            "%s did not converge within %d epochs (final loss %.6f)",
            model.model().name(),
            model.summary().result().epochs(),
            model.summary().result().finalLoss());
      }
    }
    return fitted;
  }

  private static FittedModel fit(
      ModelFactory factory, ModelConfig modelConfig, ImmutableList<WindowPair> trainPairs) {
    ForecastModel model = factory.create(modelConfig);
    logger.atInfo().log("Fitting %s on %d pairs", model.name(), trainPairs.size());
    Stopwatch stopwatch = Stopwatch.createStarted();
    FitResult result =
        model.fit(
            trainPairs,
            (epoch, loss) ->
                logger
                    .atInfo()
                    .atMostEvery(5, TimeUnit.SECONDS)
                    .per(model.name(), LogPerBucketingStrategy.knownBounded())
                    .log("%s epoch %d: loss %.6f", model.name(), epoch, loss));
    Duration elapsed = stopwatch.elapsed();
    logger.atInfo().log(
        "Fit %s in %s (epochs=%d, converged=%s)",
        model.name(), elapsed, result.epochs(), result.converged());
    return new FittedModel(
        model, FitSummary.create(model.name(), factory.isBaseline(), result, elapsed));
  }

  /** Waits for every task, failing with the first task error unchanged. */
  private static <T> ImmutableList<T> awaitAll(ImmutableList<ListenableFuture<T>> futures) {
    try {
      return ImmutableList.copyOf(Futures.allAsList(futures).get());
    } catch (InterruptedException e) {
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      CancellationException cancellation = new CancellationException("Run interrupted");
      cancellation.initCause(e);
      throw cancellation;
    } catch (ExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException("Model task failed", e.getCause());
    }
  }

  private void checkNotInterrupted() {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Run interrupted while " + state);
    }
  }

  private void transition(ExperimentState next, String message, Object... args) {
    logger.atInfo().logVarargs(state + " -> " + next + ": " + message, args);
    state = next;
  }

  private static final class FittedModel {
    private final ForecastModel model;
    private final FitSummary summary;

    FittedModel(ForecastModel model, FitSummary summary) {
      this.model = model;
      this.summary = summary;
    }

    ForecastModel model() {
      return model;
    }

    FitSummary summary() {
      return summary;
    }
  }
}
