package com.verlumen.forecastbench.models.training;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * RMSProp over a flat parameter vector.
 *
 * <p>Keeps a running mean of squared gradients per parameter and scales each update by its root.
 * Weight decay is added to the gradient before the update, as an L2 penalty.
 */
public final class RmsPropOptimizer {
  static final double DEFAULT_ALPHA = 0.99;
  static final double DEFAULT_EPSILON = 1e-8;

  private final double[] meanSquare;
  private final double alpha;
  private final double epsilon;
  private final double weightDecay;

  private RmsPropOptimizer(int size, double alpha, double epsilon, double weightDecay) {
    this.meanSquare = new double[size];
    this.alpha = alpha;
    this.epsilon = epsilon;
    this.weightDecay = weightDecay;
  }

  public static RmsPropOptimizer create(int parameterCount, double weightDecay) {
    checkArgument(parameterCount > 0, "parameterCount must be positive: %s", parameterCount);
    checkArgument(weightDecay >= 0, "weightDecay must not be negative: %s", weightDecay);
    return new RmsPropOptimizer(parameterCount, DEFAULT_ALPHA, DEFAULT_EPSILON, weightDecay);
  }

  /**
   * Applies one update to {@code parameters} in place.
   *
   * @param parameters the parameter vector
   * @param gradients loss gradients, same length as {@code parameters}; not modified
   * @param learningRate step size for this update
   */
  public void step(double[] parameters, double[] gradients, double learningRate) {
    checkArgument(
        parameters.length == meanSquare.length && gradients.length == meanSquare.length,
        "Expected %s parameters and gradients, got %s and %s",
        meanSquare.length,
        parameters.length,
        gradients.length);
    for (int i = 0; i < parameters.length; i++) {
      double gradient = gradients[i] + weightDecay * parameters[i];
      meanSquare[i] = alpha * meanSquare[i] + (1 - alpha) * gradient * gradient;
      parameters[i] -= learningRate * gradient / (Math.sqrt(meanSquare[i]) + epsilon);
    }
  }
}
