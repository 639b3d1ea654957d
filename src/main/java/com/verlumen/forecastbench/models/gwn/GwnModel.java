package com.verlumen.forecastbench.models.gwn;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.forecastbench.models.FitProgressListener;
import com.verlumen.forecastbench.models.FitResult;
import com.verlumen.forecastbench.models.Forecast;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.NotFittedException;
import com.verlumen.forecastbench.models.TrainingConfig;
import com.verlumen.forecastbench.models.training.ConvergenceMonitor;
import com.verlumen.forecastbench.models.training.EarlyStopping;
import com.verlumen.forecastbench.models.training.ExponentialDecaySchedule;
import com.verlumen.forecastbench.models.training.RmsPropOptimizer;
import com.verlumen.forecastbench.series.Normalizer;
import com.verlumen.forecastbench.windowing.DatasetSplit;
import com.verlumen.forecastbench.windowing.SeriesSlice;
import com.verlumen.forecastbench.windowing.Window;
import com.verlumen.forecastbench.windowing.WindowPair;
import com.verlumen.forecastbench.windowing.Windower;
import java.util.Arrays;
import java.util.Random;

/**
 * Spatio-temporal graph forecaster registered as {@code GWN}.
 *
 * <p>Inputs are normalised per node with statistics of the training range, mapped through {@link
 * GwnParameters} and scaled back, so predictions are in series units. Training minimises the mean
 * squared error with mini-batch RMSProp, shuffling with a seeded generator: the same data and
 * configuration always give the same weights.
 *
 * <p>With early stopping enabled, the latest {@code valid_fraction} of the training pairs is held
 * out and the weights of the best validation epoch are kept.
 */
final class GwnModel implements ForecastModel {
  static final String NAME = "GWN";

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ModelConfig config;
  private final Windower windower;
  private Normalizer normalizer;
  private GwnParameters parameters;

  GwnModel(ModelConfig config, Windower windower) {
    this.config = checkNotNull(config);
    this.windower = checkNotNull(windower);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isFitted() {
    return parameters != null;
  }

  @Override
  public FitResult fit(ImmutableList<WindowPair> trainPairs, FitProgressListener listener) {
    checkNotNull(trainPairs, "Training pairs cannot be null");
    checkNotNull(listener, "Listener cannot be null");
    checkArgument(!trainPairs.isEmpty(), "Training pairs cannot be empty");
    TrainingConfig training = config.training();

    ImmutableList<WindowPair> fitPairs = trainPairs;
    ImmutableList<WindowPair> validationPairs = ImmutableList.of();
    if (training.earlyStop()) {
      DatasetSplit split = windower.split(trainPairs, training.validFraction());
      fitPairs = split.train();
      validationPairs = split.eval();
    }

    int nodeCount = trainPairs.get(0).window().nodeCount();
    for (WindowPair pair : trainPairs) {
      checkShape(pair.window(), config.windowSize(), nodeCount);
      checkShape(pair.target(), config.horizon(), nodeCount);
    }

    normalizer =
        Normalizer.fit(
            training.normMethod(),
            fitPairs.get(0).window().series(),
            fitPairs.get(0).window().start(),
            fitPairs.get(fitPairs.size() - 1).target().end());
    double[][][] inputs = normalizedInputs(fitPairs);
    double[][][] targets = normalizedTargets(fitPairs);
    double[][][] validationInputs = normalizedInputs(validationPairs);
    double[][][] validationTargets = normalizedTargets(validationPairs);

    Random random = new Random(training.seed());
    GwnParameters current =
        GwnParameters.initialize(
            config.windowSize(),
            config.horizon(),
            nodeCount,
            training.graphTermEnabled(),
            random);
    RmsPropOptimizer optimizer =
        RmsPropOptimizer.create(current.values().length, training.weightDecay());
    ExponentialDecaySchedule schedule =
        ExponentialDecaySchedule.create(
            training.learningRate(), training.decayStep(), training.decayRate());
    ConvergenceMonitor convergence = ConvergenceMonitor.create(training.convergenceTolerance());
    EarlyStopping earlyStopping = EarlyStopping.create(training.patience());
    GwnParameters best = null;

    int[] order = new int[inputs.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    double[] gradients = new double[current.values().length];
    double[][] prediction = new double[config.horizon()][nodeCount];

    double initialLoss = Double.NaN;
    double epochLoss = Double.NaN;
    boolean converged = false;
    boolean earlyStopped = false;
    int epoch = 0;
    while (epoch < training.epochs()) {
      double learningRate = schedule.rateAt(epoch);
      shuffle(order, random);
      double lossSum = 0.0;
      for (int from = 0; from < order.length; from += training.batchSize()) {
        int to = Math.min(order.length, from + training.batchSize());
        Arrays.fill(gradients, 0.0);
        for (int b = from; b < to; b++) {
          int sample = order[b];
          current.forward(inputs[sample], prediction);
          lossSum += lossGradient(prediction, targets[sample], to - from);
          current.accumulateGradient(inputs[sample], prediction, gradients);
        }
        optimizer.step(current.values(), gradients, learningRate);
      }
      epoch++;
      epochLoss = lossSum / order.length;
      if (epoch == 1) {
        initialLoss = epochLoss;
      }
      listener.onEpoch(epoch, epochLoss);
      if (!Double.isFinite(epochLoss)) {
        logger.atWarning().log("%s training loss diverged at epoch %d", NAME, epoch);
        break;
      }

      if (training.earlyStop() && epoch % training.validateFrequency() == 0) {
        double validationLoss = meanLoss(current, validationInputs, validationTargets);
        if (earlyStopping.record(validationLoss)) {
          best = current.copy();
        }
        if (earlyStopping.shouldStop()) {
          logger.atInfo().log(
              "%s stopped early at epoch %d; best validation loss %.6f",
              NAME, epoch, earlyStopping.bestLoss());
          earlyStopped = true;
          break;
        }
      }

      convergence.record(epochLoss);
      if (convergence.hasConverged()) {
        converged = true;
        break;
      }
    }

    parameters = best != null ? best : current;
    return FitResult.builder()
        .setConverged(converged || earlyStopped)
        .setEarlyStopped(earlyStopped)
        .setEpochs(epoch)
        .setInitialLoss(initialLoss)
        .setFinalLoss(epochLoss)
        .build();
  }

  @Override
  public Forecast predict(Window window) {
    checkNotNull(window, "Window cannot be null");
    if (parameters == null) {
      throw new NotFittedException(NAME);
    }
    checkShape(window, config.windowSize(), parameters.nodeCount());
    double[][] prediction = new double[config.horizon()][parameters.nodeCount()];
    parameters.forward(normalize(window), prediction);
    for (int h = 0; h < prediction.length; h++) {
      for (int n = 0; n < prediction[h].length; n++) {
        prediction[h][n] = normalizer.denormalize(prediction[h][n], n);
      }
    }
    return Forecast.of(prediction);
  }

  /**
   * Replaces {@code prediction} with the gradient of the batch-mean squared error and returns
   * this sample's mean squared error.
   */
  private static double lossGradient(double[][] prediction, double[][] target, int batchSize) {
    int cells = prediction.length * prediction[0].length;
    double squares = 0.0;
    for (int h = 0; h < prediction.length; h++) {
      for (int n = 0; n < prediction[h].length; n++) {
        double error = prediction[h][n] - target[h][n];
        squares += error * error;
        prediction[h][n] = 2.0 * error / (cells * batchSize);
      }
    }
    return squares / cells;
  }

  private double meanLoss(GwnParameters weights, double[][][] inputs, double[][][] targets) {
    double[][] prediction = new double[config.horizon()][weights.nodeCount()];
    double sum = 0.0;
    for (int i = 0; i < inputs.length; i++) {
      weights.forward(inputs[i], prediction);
      double squares = 0.0;
      for (int h = 0; h < prediction.length; h++) {
        for (int n = 0; n < prediction[h].length; n++) {
          double error = prediction[h][n] - targets[i][h][n];
          squares += error * error;
        }
      }
      sum += squares / (prediction.length * prediction[0].length);
    }
    return sum / inputs.length;
  }

  private double[][][] normalizedInputs(ImmutableList<WindowPair> pairs) {
    double[][][] inputs = new double[pairs.size()][][];
    for (int i = 0; i < inputs.length; i++) {
      inputs[i] = normalize(pairs.get(i).window());
    }
    return inputs;
  }

  private double[][][] normalizedTargets(ImmutableList<WindowPair> pairs) {
    double[][][] targets = new double[pairs.size()][][];
    for (int i = 0; i < targets.length; i++) {
      targets[i] = normalize(pairs.get(i).target());
    }
    return targets;
  }

  private double[][] normalize(SeriesSlice slice) {
    double[][] values = new double[slice.length()][slice.nodeCount()];
    for (int step = 0; step < slice.length(); step++) {
      for (int node = 0; node < slice.nodeCount(); node++) {
        values[step][node] = normalizer.normalize(slice.value(step, node), node);
      }
    }
    return values;
  }

  private static void shuffle(int[] order, Random random) {
    for (int i = order.length - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      int swap = order[i];
      order[i] = order[j];
      order[j] = swap;
    }
  }

  private static void checkShape(SeriesSlice slice, int length, int nodeCount) {
    checkArgument(
        slice.length() == length && slice.nodeCount() == nodeCount,
        "%s expects %s steps over %s nodes, got %s steps over %s nodes",
        NAME,
        length,
        nodeCount,
        slice.length(),
        slice.nodeCount());
  }
}
