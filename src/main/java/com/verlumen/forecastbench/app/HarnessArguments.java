package com.verlumen.forecastbench.app;

import com.google.common.collect.ImmutableSet;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.experiment.ConfigurationException;
import com.verlumen.forecastbench.experiment.ExperimentConfig;
import com.verlumen.forecastbench.experiment.HarnessDefaults;
import com.verlumen.forecastbench.models.TrainingConfig;
import com.verlumen.forecastbench.series.DatasetSpec;
import com.verlumen.forecastbench.series.NormMethod;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

/** The command-line flags of the harness and their conversion to an {@link ExperimentConfig}. */
final class HarnessArguments {
  private HarnessArguments() {}

  static ArgumentParser createParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("forecastbench")
            .build()
            .defaultHelp(true)
            .description("Benchmarks a forecasting model against baselines on a time series");

    // Run
    parser.addArgument("--model").required(true).help("Model to benchmark, e.g. GWN");
    parser.addArgument("--window_size")
        .type(Integer.class)
        .required(true)
        .help("Input window length in samples");
    parser.addArgument("--horizon")
        .type(Integer.class)
        .required(true)
        .help("Forecast horizon in samples");
    addFlag(parser, "--baseline", false, "Also evaluate the baseline models");
    addFlag(parser, "--baseline_only", false, "Evaluate only the baseline models");
    parser.addArgument("--stride")
        .type(Integer.class)
        .setDefault(HarnessDefaults.STRIDE)
        .help("Distance between consecutive window starts");
    parser.addArgument("--eval_fraction")
        .type(Double.class)
        .setDefault(HarnessDefaults.EVAL_FRACTION)
        .help("Share of window pairs held out for evaluation");
    parser.addArgument("--metrics")
        .setDefault(HarnessDefaults.METRICS)
        .help("Comma-separated metrics out of mae, rmse and mape");
    parser.addArgument("--threads")
        .type(Integer.class)
        .setDefault(Runtime.getRuntime().availableProcessors())
        .help("Worker threads fitting and evaluating models");

    // Data
    parser.addArgument("--dataset")
        .setDefault(HarnessDefaults.DATASET)
        .help("Delimited series file with a header row");
    parser.addArgument("--delimiter")
        .setDefault(String.valueOf(HarnessDefaults.DELIMITER))
        .help("Column delimiter of the series file");
    parser.addArgument("--sampling_interval")
        .help("ISO-8601 sampling interval, e.g. P1D; inferred when omitted");
    parser.addArgument("--gap_tolerance")
        .help("ISO-8601 allowed excess over the sampling interval; unchecked when omitted");

    // Training
    parser.addArgument("--epoch")
        .type(Integer.class)
        .setDefault(TrainingConfig.DEFAULT_EPOCHS)
        .help("Maximum training epochs");
    parser.addArgument("--lr")
        .type(Double.class)
        .setDefault(TrainingConfig.DEFAULT_LEARNING_RATE)
        .help("Initial learning rate");
    parser.addArgument("--batch_size")
        .type(Integer.class)
        .setDefault(TrainingConfig.DEFAULT_BATCH_SIZE)
        .help("Training mini-batch size");
    parser.addArgument("--exponential_decay_step")
        .type(Integer.class)
        .setDefault(TrainingConfig.DEFAULT_DECAY_STEP)
        .help("Epochs between learning rate decays");
    parser.addArgument("--decay_rate")
        .type(Double.class)
        .setDefault(TrainingConfig.DEFAULT_DECAY_RATE)
        .help("Learning rate multiplier applied every decay step");
    parser.addArgument("--weight_decay")
        .type(Double.class)
        .setDefault(TrainingConfig.DEFAULT_WEIGHT_DECAY)
        .help("L2 penalty on the weights");
    parser.addArgument("--norm_method")
        .choices("z_score", "min_max", "none")
        .setDefault("z_score")
        .help("Input normalisation of trainable models");
    addFlag(parser, "--early_stop", false, "Stop when the validation loss stops improving");
    parser.addArgument("--valid_fraction")
        .type(Double.class)
        .setDefault(TrainingConfig.DEFAULT_VALID_FRACTION)
        .help("Share of training pairs held out for early stopping");
    parser.addArgument("--validate_freq")
        .type(Integer.class)
        .setDefault(TrainingConfig.DEFAULT_VALIDATE_FREQUENCY)
        .help("Epochs between validations");
    parser.addArgument("--patience")
        .type(Integer.class)
        .setDefault(TrainingConfig.DEFAULT_PATIENCE)
        .help("Validations without improvement before stopping early");
    addFlag(parser, "--gcn_bool", true, "Use the adaptive graph term");
    parser.addArgument("--convergence_tolerance")
        .type(Double.class)
        .setDefault(TrainingConfig.DEFAULT_CONVERGENCE_TOLERANCE)
        .help("Relative loss spread below which a fit has converged");
    parser.addArgument("--seed").type(Long.class).setDefault(0L).help("Training seed");

    // Output
    parser.addArgument("--output_dir")
        .setDefault(HarnessDefaults.OUTPUT_DIR)
        .help("Root directory of written reports");
    addFlag(parser, "--save_predictions", false, "Also write every model's predictions");
    parser.addArgument("--experiment_config")
        .help("YAML grid file; runs every configuration of the grid instead of a single run");

    return parser;
  }

  /** A boolean flag that may be given bare ({@code --baseline}) or with a value. */
  private static void addFlag(
      ArgumentParser parser, String name, boolean defaultValue, String help) {
    parser.addArgument(name)
        .type(new BooleanArgumentType())
        .nargs("?")
        .setConst(true)
        .setDefault(defaultValue)
        .help(help);
  }

  /**
   * Builds the run config from parsed flags.
   *
   * @throws ConfigurationException if a value is invalid
   */
  static ExperimentConfig toConfig(Namespace namespace) {
    TrainingConfig training;
    try {
      training =
          TrainingConfig.builder()
              .setEpochs(namespace.getInt("epoch"))
              .setLearningRate(namespace.getDouble("lr"))
              .setBatchSize(namespace.getInt("batch_size"))
              .setDecayStep(namespace.getInt("exponential_decay_step"))
              .setDecayRate(namespace.getDouble("decay_rate"))
              .setWeightDecay(namespace.getDouble("weight_decay"))
              .setNormMethod(NormMethod.fromString(namespace.getString("norm_method")))
              .setEarlyStop(namespace.getBoolean("early_stop"))
              .setValidFraction(namespace.getDouble("valid_fraction"))
              .setValidateFrequency(namespace.getInt("validate_freq"))
              .setPatience(namespace.getInt("patience"))
              .setGraphTermEnabled(namespace.getBoolean("gcn_bool"))
              .setConvergenceTolerance(namespace.getDouble("convergence_tolerance"))
              .setSeed(namespace.getLong("seed"))
              .build();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }

    String delimiter = namespace.getString("delimiter");
    if (delimiter.length() != 1) {
      throw new ConfigurationException("delimiter must be a single character: " + delimiter);
    }
    Optional<Duration> samplingInterval = duration(namespace, "sampling_interval");
    if (samplingInterval.isPresent() && samplingInterval.get().isZero()) {
      throw new ConfigurationException("sampling_interval must be positive");
    }
    DatasetSpec dataset =
        DatasetSpec.builder()
            .setPath(Path.of(namespace.getString("dataset")))
            .setDelimiter(delimiter.charAt(0))
            .setSamplingInterval(samplingInterval)
            .setGapTolerance(duration(namespace, "gap_tolerance"))
            .build();

    ImmutableSet<Metric> metrics;
    try {
      metrics = Metric.parseList(namespace.getString("metrics"));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }

    return ExperimentConfig.builder()
        .setModelName(namespace.getString("model"))
        .setWindowSize(namespace.getInt("window_size"))
        .setHorizon(namespace.getInt("horizon"))
        .setStride(namespace.getInt("stride"))
        .setBaseline(namespace.getBoolean("baseline"))
        .setBaselineOnly(namespace.getBoolean("baseline_only"))
        .setDataset(dataset)
        .setEvalFraction(namespace.getDouble("eval_fraction"))
        .setTraining(training)
        .setMetrics(metrics)
        .setThreads(namespace.getInt("threads"))
        .setOutputDir(Path.of(namespace.getString("output_dir")))
        .setSavePredictions(namespace.getBoolean("save_predictions"))
        .build();
  }

  static Optional<Path> experimentConfig(Namespace namespace) {
    return Optional.ofNullable(namespace.getString("experiment_config")).map(Path::of);
  }

  private static Optional<Duration> duration(Namespace namespace, String flag) {
    String value = namespace.getString(flag);
    if (value == null) {
      return Optional.empty();
    }
    try {
      Duration duration = Duration.parse(value);
      if (duration.isNegative()) {
        throw new ConfigurationException(flag + " must not be negative: " + value);
      }
      return Optional.of(duration);
    } catch (DateTimeParseException e) {
      throw new ConfigurationException(flag + " is not an ISO-8601 duration: " + value, e);
    }
  }
}
