package com.verlumen.forecastbench.models;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.forecastbench.series.NormMethod;

/** Trainer settings for iterative models. Baselines ignore them. */
@AutoValue
public abstract class TrainingConfig {
  public static final int DEFAULT_EPOCHS = 50;
  public static final double DEFAULT_LEARNING_RATE = 1e-4;
  public static final int DEFAULT_BATCH_SIZE = 32;
  public static final int DEFAULT_DECAY_STEP = 5;
  public static final double DEFAULT_DECAY_RATE = 0.5;
  public static final double DEFAULT_WEIGHT_DECAY = 1e-4;
  public static final double DEFAULT_VALID_FRACTION = 0.25;
  public static final int DEFAULT_VALIDATE_FREQUENCY = 1;
  public static final int DEFAULT_PATIENCE = 5;
  public static final double DEFAULT_CONVERGENCE_TOLERANCE = 1e-4;

  public static Builder builder() {
    return new AutoValue_TrainingConfig.Builder()
        .setEpochs(DEFAULT_EPOCHS)
        .setLearningRate(DEFAULT_LEARNING_RATE)
        .setBatchSize(DEFAULT_BATCH_SIZE)
        .setDecayStep(DEFAULT_DECAY_STEP)
        .setDecayRate(DEFAULT_DECAY_RATE)
        .setWeightDecay(DEFAULT_WEIGHT_DECAY)
        .setNormMethod(NormMethod.Z_SCORE)
        .setEarlyStop(false)
        .setValidFraction(DEFAULT_VALID_FRACTION)
        .setValidateFrequency(DEFAULT_VALIDATE_FREQUENCY)
        .setPatience(DEFAULT_PATIENCE)
        .setGraphTermEnabled(true)
        .setConvergenceTolerance(DEFAULT_CONVERGENCE_TOLERANCE)
        .setSeed(0L);
  }

  public static TrainingConfig defaults() {
    return builder().build();
  }

  /** Maximum number of passes over the training pairs. */
  public abstract int epochs();

  public abstract double learningRate();

  public abstract int batchSize();

  /** The learning rate is multiplied by {@link #decayRate()} every this many epochs. */
  public abstract int decayStep();

  public abstract double decayRate();

  /** L2 penalty on the weights. */
  public abstract double weightDecay();

  public abstract NormMethod normMethod();

  public abstract boolean earlyStop();

  /** Share of training pairs held out for early stopping. */
  public abstract double validFraction();

  /** Validate every this many epochs. */
  public abstract int validateFrequency();

  /** Validations without improvement tolerated before stopping early. */
  public abstract int patience();

  /** Whether the adaptive-adjacency graph term is used. */
  public abstract boolean graphTermEnabled();

  /** A fit converges once the relative change of the epoch loss drops below this. */
  public abstract double convergenceTolerance();

  public abstract long seed();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setEpochs(int epochs);

    public abstract Builder setLearningRate(double learningRate);

    public abstract Builder setBatchSize(int batchSize);

    public abstract Builder setDecayStep(int decayStep);

    public abstract Builder setDecayRate(double decayRate);

    public abstract Builder setWeightDecay(double weightDecay);

    public abstract Builder setNormMethod(NormMethod normMethod);

    public abstract Builder setEarlyStop(boolean earlyStop);

    public abstract Builder setValidFraction(double validFraction);

    public abstract Builder setValidateFrequency(int validateFrequency);

    public abstract Builder setPatience(int patience);

    public abstract Builder setGraphTermEnabled(boolean graphTermEnabled);

    public abstract Builder setConvergenceTolerance(double convergenceTolerance);

    public abstract Builder setSeed(long seed);

    abstract TrainingConfig autoBuild();

    public TrainingConfig build() {
      TrainingConfig config = autoBuild();
      checkArgument(config.epochs() > 0, "epoch must be positive: %s", config.epochs());
      checkArgument(config.learningRate() > 0, "lr must be positive: %s", config.learningRate());
      checkArgument(config.batchSize() > 0, "batch_size must be positive: %s", config.batchSize());
      checkArgument(config.decayStep() > 0,
          "exponential_decay_step must be positive: %s", config.decayStep());
      checkArgument(config.decayRate() > 0 && config.decayRate() <= 1,
          "decay_rate must be in (0, 1]: %s", config.decayRate());
      checkArgument(config.weightDecay() >= 0,
          "weight_decay must not be negative: %s", config.weightDecay());
      checkArgument(config.validFraction() > 0 && config.validFraction() < 1,
          "valid_fraction must be in (0, 1): %s", config.validFraction());
      checkArgument(config.validateFrequency() > 0,
          "validate_freq must be positive: %s", config.validateFrequency());
      checkArgument(config.patience() > 0, "patience must be positive: %s", config.patience());
      checkArgument(config.convergenceTolerance() >= 0,
          "convergence_tolerance must not be negative: %s", config.convergenceTolerance());
      return config;
    }
  }
}
