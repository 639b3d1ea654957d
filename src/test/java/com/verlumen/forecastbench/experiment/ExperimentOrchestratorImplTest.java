package com.verlumen.forecastbench.experiment;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;
import com.verlumen.forecastbench.evaluation.EvaluationModule;
import com.verlumen.forecastbench.evaluation.Evaluator;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.models.FitProgressListener;
import com.verlumen.forecastbench.models.FitResult;
import com.verlumen.forecastbench.models.Forecast;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.ModelFactory;
import com.verlumen.forecastbench.models.ModelRegistry;
import com.verlumen.forecastbench.models.ModelsModule;
import com.verlumen.forecastbench.models.TrainingConfig;
import com.verlumen.forecastbench.models.UnknownModelException;
import com.verlumen.forecastbench.models.baseline.PersistenceModelFactory;
import com.verlumen.forecastbench.reporting.RunReport;
import com.verlumen.forecastbench.series.DataSourceException;
import com.verlumen.forecastbench.series.DatasetSpec;
import com.verlumen.forecastbench.series.SeriesSource;
import com.verlumen.forecastbench.series.SeriesSourceFactory;
import com.verlumen.forecastbench.windowing.InsufficientDataException;
import com.verlumen.forecastbench.windowing.Window;
import com.verlumen.forecastbench.windowing.WindowPair;
import com.verlumen.forecastbench.windowing.Windower;
import com.verlumen.forecastbench.windowing.WindowingModule;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class ExperimentOrchestratorImplTest {
  private static final DatasetSpec DATASET =
      DatasetSpec.builder().setPath(Path.of("data/waves.csv")).build();

  @Rule public MockitoRule mockitoRule = MockitoJUnit.rule();

  @Bind @Mock private SeriesSourceFactory mockSeriesSourceFactory;
  @Mock private SeriesSource mockSeriesSource;
  @Mock private ModelRegistry mockModelRegistry;

  @Bind
  private ListeningExecutorService executor = MoreExecutors.newDirectExecutorService();

  @Inject private ExperimentOrchestrator.Factory orchestratorFactory;
  @Inject private Windower windower;
  @Inject private Evaluator evaluator;

  @Before
  public void setUp() {
    when(mockSeriesSourceFactory.create(any(DatasetSpec.class))).thenReturn(mockSeriesSource);
    when(mockSeriesSource.load()).thenReturn(TestSeries.waves(300));
    when(mockSeriesSource.datasetName()).thenReturn("waves");

    Guice.createInjector(
            BoundFieldModule.of(this),
            WindowingModule.create(),
            ModelsModule.create(),
            EvaluationModule.create(ImmutableSet.of(Metric.MAE, Metric.RMSE)),
            new FactoryModuleBuilder()
                .implement(ExperimentOrchestrator.class, ExperimentOrchestratorImpl.class)
                .build(ExperimentOrchestrator.Factory.class))
        .injectMembers(this);
  }

  @Test
  public void run_primaryOnly_reachesReported() {
    // Arrange
    ExperimentOrchestrator orchestrator = orchestratorFactory.create(config("GWN").build());

    // Act
    RunReport report = orchestrator.run();

    // Assert
    assertThat(orchestrator.state()).isEqualTo(ExperimentState.REPORTED);
    assertThat(orchestrator.failure()).isEmpty();
    assertThat(report.modelName()).isEqualTo("GWN");
    assertThat(report.datasetName()).isEqualTo("waves");
    assertThat(report.metrics().modelNames()).containsExactly("GWN");
    assertThat(report.metrics().horizon("GWN")).isEqualTo(3);
    assertThat(report.seriesLength()).isEqualTo(300);
    assertThat(report.nodeCount()).isEqualTo(2);
    assertThat(report.evalPairCount()).isEqualTo(57);
    assertThat(report.purgedPairCount()).isEqualTo(14);
    assertThat(report.trainPairCount()).isEqualTo(215);
    assertThat(report.predictions()).isEmpty();
  }

  @Test
  public void run_withBaseline_evaluatesPrimaryThenBaselines() {
    // Arrange
    ExperimentOrchestrator orchestrator =
        orchestratorFactory.create(config("gwn").setBaseline(true).build());

    // Act
    RunReport report = orchestrator.run();

    // Assert
    assertThat(report.metrics().modelNames())
        .containsExactly("GWN", "PERSISTENCE", "MOVING_AVERAGE")
        .inOrder();
    assertThat(report.fitSummaries().get(1).baseline()).isTrue();
    assertThat(report.fitSummaries().get(1).result().converged()).isTrue();
  }

  @Test
  public void run_baselineOnly_skipsPrimary() {
    // Arrange
    ExperimentOrchestrator orchestrator =
        orchestratorFactory.create(config("GWN").setBaseline(true).setBaselineOnly(true).build());

    // Act
    RunReport report = orchestrator.run();

    // Assert
    assertThat(report.metrics().modelNames())
        .containsExactly("PERSISTENCE", "MOVING_AVERAGE")
        .inOrder();
  }

  @Test
  public void run_primaryIsBaseline_isNotEvaluatedTwice() {
    // Arrange
    ExperimentOrchestrator orchestrator =
        orchestratorFactory.create(config("persistence").setBaseline(true).build());

    // Act
    RunReport report = orchestrator.run();

    // Assert
    assertThat(report.metrics().modelNames())
        .containsExactly("PERSISTENCE", "MOVING_AVERAGE")
        .inOrder();
  }

  @Test
  public void run_unknownModel_failsBeforeLoadingData() {
    // Arrange
    ExperimentOrchestrator orchestrator = orchestratorFactory.create(config("unknown_xyz").build());

    // Act
    UnknownModelException thrown = assertThrows(UnknownModelException.class, orchestrator::run);

    // Assert
    assertThat(thrown.kind()).isEqualTo(ErrorKind.UNKNOWN_MODEL);
    assertThat(orchestrator.state()).isEqualTo(ExperimentState.FAILED);
    assertThat(orchestrator.failure()).hasValue(thrown);
    verify(mockSeriesSourceFactory, never()).create(any(DatasetSpec.class));
  }

  @Test
  public void run_dataSourceFails_propagatesUnchanged() {
    // Arrange
    DataSourceException error = new DataSourceException("missing file");
    when(mockSeriesSource.load()).thenThrow(error);
    ExperimentOrchestrator orchestrator = orchestratorFactory.create(config("GWN").build());

    // Act
    HarnessException thrown = assertThrows(HarnessException.class, orchestrator::run);

    // Assert
    assertThat(thrown).isSameInstanceAs(error);
    assertThat(orchestrator.state()).isEqualTo(ExperimentState.FAILED);
  }

  @Test
  public void run_seriesTooShort_failsWithInsufficientData() {
    // Arrange
    when(mockSeriesSource.load()).thenReturn(TestSeries.waves(10));
    ExperimentOrchestrator orchestrator = orchestratorFactory.create(config("GWN").build());

    // Act
    InsufficientDataException thrown =
        assertThrows(InsufficientDataException.class, orchestrator::run);

    // Assert
    assertThat(thrown.available()).isEqualTo(10);
    assertThat(thrown.required()).isEqualTo(15L);
    assertThat(orchestrator.state()).isEqualTo(ExperimentState.FAILED);
  }

  @Test
  public void run_secondCall_throwsIllegalStateException() {
    // Arrange
    ExperimentOrchestrator orchestrator =
        orchestratorFactory.create(config("PERSISTENCE").build());
    orchestrator.run();

    // Act & Assert
    assertThrows(IllegalStateException.class, orchestrator::run);
    assertThat(orchestrator.state()).isEqualTo(ExperimentState.REPORTED);
  }

  @Test
  public void run_savePredictions_keepsRecordsOfEveryModel() {
    // Arrange
    ExperimentOrchestrator orchestrator =
        orchestratorFactory.create(
            config("GWN").setBaseline(true).setSavePredictions(true).build());

    // Act
    RunReport report = orchestrator.run();

    // Assert
    assertThat(report.predictions().keySet())
        .containsExactly("GWN", "PERSISTENCE", "MOVING_AVERAGE");
    assertThat(report.predictions().get("PERSISTENCE")).hasSize(report.evalPairCount());
  }

  @Test
  public void run_sameConfigTwice_givesIdenticalMetrics() {
    // Arrange
    ExperimentConfig config = config("GWN").setBaseline(true).build();

    // Act
    RunReport first = orchestratorFactory.create(config).run();
    RunReport second = orchestratorFactory.create(config).run();

    // Assert
    assertThat(second.metrics()).isEqualTo(first.metrics());
  }

  @Test
  public void run_nonConvergedFit_listedInReport() {
    // Arrange
    ExperimentOrchestrator orchestrator =
        orchestratorFactory.create(config("GWN").setBaseline(true).build());

    // Act
    RunReport report = orchestrator.run();

    // Assert
    assertThat(orchestrator.state()).isEqualTo(ExperimentState.REPORTED);
    assertThat(report.nonConvergedModels()).containsExactly("GWN");
  }

  @Test
  public void run_interruptedBeforeStart_failsWithoutLoadingData() {
    // Arrange
    ExperimentOrchestrator orchestrator = orchestratorFactory.create(config("GWN").build());
    Thread.currentThread().interrupt();

    // Act
    CancellationException thrown;
    try {
      thrown = assertThrows(CancellationException.class, orchestrator::run);
    } finally {
      Thread.interrupted();
    }

    // Assert
    assertThat(orchestrator.state()).isEqualTo(ExperimentState.FAILED);
    assertThat(orchestrator.failure()).hasValue(thrown);
    verify(mockSeriesSourceFactory, never()).create(any(DatasetSpec.class));
  }

  @Test
  public void run_twoIterativeModels_logsEpochProgressOfEach() {
    // Arrange
    when(mockModelRegistry.getFactory("FIRST")).thenReturn(reportingFactory("FIRST"));
    when(mockModelRegistry.baselines()).thenReturn(ImmutableList.of(reportingFactory("SECOND")));
    ExperimentOrchestratorImpl orchestrator =
        new ExperimentOrchestratorImpl(
            mockSeriesSourceFactory,
            windower,
            mockModelRegistry,
            evaluator,
            executor,
            config("FIRST").setBaseline(true).build());
    List<String> messages = new ArrayList<>();
    SimpleFormatter formatter = new SimpleFormatter();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            messages.add(formatter.formatMessage(record));
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    Logger logger = Logger.getLogger(ExperimentOrchestratorImpl.class.getName());
    logger.addHandler(handler);

    // Act
    try {
      orchestrator.run();
    } finally {
      logger.removeHandler(handler);
    }

    // Assert
    String log = String.join("\n", messages);
    assertThat(log).contains("FIRST epoch 1: loss 0.500000");
    assertThat(log).contains("SECOND epoch 1: loss 0.500000");
  }

  /** A model that reports one epoch of progress and forecasts by persistence. */
  private static ModelFactory reportingFactory(String name) {
    return new ModelFactory() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public boolean isBaseline() {
        return false;
      }

      @Override
      public ForecastModel create(ModelConfig modelConfig) {
        ForecastModel persistence = PersistenceModelFactory.create().create(modelConfig);
        return new ForecastModel() {
          @Override
          public String name() {
            return name;
          }

          @Override
          public FitResult fit(
              ImmutableList<WindowPair> trainPairs, FitProgressListener listener) {
            listener.onEpoch(1, 0.5);
            return FitResult.noOp();
          }

          @Override
          public Forecast predict(Window window) {
            return persistence.predict(window);
          }

          @Override
          public boolean isFitted() {
            return true;
          }
        };
      }
    };
  }

  private static ExperimentConfig.Builder config(String modelName) {
    return ExperimentConfig.builder()
        .setModelName(modelName)
        .setWindowSize(12)
        .setHorizon(3)
        .setDataset(DATASET)
        .setTraining(
            TrainingConfig.builder()
                .setEpochs(5)
                .setLearningRate(0.01)
                .setConvergenceTolerance(0.0)
                .setSeed(7L)
                .build());
  }
}
