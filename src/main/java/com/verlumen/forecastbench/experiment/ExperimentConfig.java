package com.verlumen.forecastbench.experiment;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.TrainingConfig;
import com.verlumen.forecastbench.series.DatasetSpec;
import java.nio.file.Path;

/**
 * Every setting of one benchmark run, validated once when built.
 *
 * <p>Build with {@link #builder()}; {@link Builder#build()} throws {@link ConfigurationException}
 * for any invalid or inconsistent value, so a config that exists is runnable.
 */
@AutoValue
public abstract class ExperimentConfig {
  public static Builder builder() {
    return new AutoValue_ExperimentConfig.Builder()
        .setStride(HarnessDefaults.STRIDE)
        .setBaseline(false)
        .setBaselineOnly(false)
        .setEvalFraction(HarnessDefaults.EVAL_FRACTION)
        .setTraining(TrainingConfig.defaults())
        .setMetrics(Metric.parseList(HarnessDefaults.METRICS))
        .setThreads(1)
        .setOutputDir(Path.of(HarnessDefaults.OUTPUT_DIR))
        .setSavePredictions(false);
  }

  /** The primary model's name, as given. */
  public abstract String modelName();

  public abstract int windowSize();

  public abstract int horizon();

  public abstract int stride();

  /** Whether the baselines are evaluated next to the primary model. */
  public abstract boolean baseline();

  /** Whether only the baselines are evaluated. */
  public abstract boolean baselineOnly();

  public abstract DatasetSpec dataset();

  public abstract double evalFraction();

  public abstract TrainingConfig training();

  public abstract ImmutableSet<Metric> metrics();

  /** Worker threads fitting and evaluating models. */
  public abstract int threads();

  public abstract Path outputDir();

  public abstract boolean savePredictions();

  public abstract Builder toBuilder();

  public ModelConfig modelConfig() {
    return ModelConfig.create(windowSize(), horizon(), training());
  }

  /** The settings as command-line flag names and values, for reports. */
  public ImmutableMap<String, String> settings() {
    TrainingConfig training = training();
    return ImmutableMap.<String, String>builder()
        .put("model", modelName())
        .put("dataset", dataset().path().toString())
        .put("window_size", String.valueOf(windowSize()))
        .put("horizon", String.valueOf(horizon()))
        .put("stride", String.valueOf(stride()))
        .put("baseline", String.valueOf(baseline()))
        .put("baseline_only", String.valueOf(baselineOnly()))
        .put("eval_fraction", String.valueOf(evalFraction()))
        .put("epoch", String.valueOf(training.epochs()))
        .put("lr", String.valueOf(training.learningRate()))
        .put("batch_size", String.valueOf(training.batchSize()))
        .put("exponential_decay_step", String.valueOf(training.decayStep()))
        .put("decay_rate", String.valueOf(training.decayRate()))
        .put("weight_decay", String.valueOf(training.weightDecay()))
        .put("norm_method", Ascii.toLowerCase(training.normMethod().name()))
        .put("early_stop", String.valueOf(training.earlyStop()))
        .put("valid_fraction", String.valueOf(training.validFraction()))
        .put("validate_freq", String.valueOf(training.validateFrequency()))
        .put("patience", String.valueOf(training.patience()))
        .put("gcn_bool", String.valueOf(training.graphTermEnabled()))
        .put("convergence_tolerance", String.valueOf(training.convergenceTolerance()))
        .put("seed", String.valueOf(training.seed()))
        .put("metrics", Joiner.on(',').join(metrics().stream().map(Metric::label).iterator()))
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setModelName(String modelName);

    public abstract Builder setWindowSize(int windowSize);

    public abstract Builder setHorizon(int horizon);

    public abstract Builder setStride(int stride);

    public abstract Builder setBaseline(boolean baseline);

    public abstract Builder setBaselineOnly(boolean baselineOnly);

    public abstract Builder setDataset(DatasetSpec dataset);

    public abstract Builder setEvalFraction(double evalFraction);

    public abstract Builder setTraining(TrainingConfig training);

    public abstract Builder setMetrics(ImmutableSet<Metric> metrics);

    public abstract Builder setThreads(int threads);

    public abstract Builder setOutputDir(Path outputDir);

    public abstract Builder setSavePredictions(boolean savePredictions);

    abstract ExperimentConfig autoBuild();

    /**
     * Builds and validates the config.
     *
     * @throws ConfigurationException if a setting is missing or invalid
     */
    public ExperimentConfig build() {
      ExperimentConfig config;
      try {
        config = autoBuild();
      } catch (IllegalStateException e) {
        throw new ConfigurationException(e.getMessage(), e);
      }
      require(!config.modelName().isBlank(), "model must not be blank");
      require(config.windowSize() > 0, "window_size must be positive: " + config.windowSize());
      require(config.horizon() > 0, "horizon must be positive: " + config.horizon());
      require(config.stride() >= 1, "stride must be at least 1: " + config.stride());
      require(
          config.evalFraction() > 0 && config.evalFraction() < 1,
          "eval_fraction must be strictly between 0 and 1: " + config.evalFraction());
      require(
          !config.baselineOnly() || config.baseline(),
          "baseline_only requires baseline to be enabled");
      require(!config.metrics().isEmpty(), "at least one metric is required");
      require(config.threads() >= 1, "threads must be at least 1: " + config.threads());
      return config;
    }

    private static void require(boolean condition, String message) {
      if (!condition) {
        throw new ConfigurationException(message);
      }
    }
  }
}
