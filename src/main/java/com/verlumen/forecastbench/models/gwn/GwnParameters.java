package com.verlumen.forecastbench.models.gwn;

import java.util.Random;

/**
 * Weights of the graph-temporal forecaster, stored in one flat vector for the optimizer.
 *
 * <p>For a window {@code x} of {@code K} steps over {@code N} nodes the prediction for step
 * {@code h} and node {@code n} is
 *
 * <pre>
 *   y[h][n] = b[h] + sum_k W[h][k] * x[k][n] + G[h] * sum_m A[n][m] * x[K-1][m]
 * </pre>
 *
 * <p>{@code W} is a temporal filter shared by all nodes and {@code A} a learned adjacency that
 * lets each node borrow the latest values of the others. The graph term is skipped when disabled.
 */
final class GwnParameters {
  private final int windowSize;
  private final int horizon;
  private final int nodeCount;
  private final boolean graphTermEnabled;
  private final double[] values;

  private final int biasOffset;
  private final int gainOffset;
  private final int adjacencyOffset;

  private GwnParameters(
      int windowSize, int horizon, int nodeCount, boolean graphTermEnabled, double[] values) {
    this.windowSize = windowSize;
    this.horizon = horizon;
    this.nodeCount = nodeCount;
    this.graphTermEnabled = graphTermEnabled;
    this.values = values;
    this.biasOffset = horizon * windowSize;
    this.gainOffset = biasOffset + horizon;
    this.adjacencyOffset = gainOffset + horizon;
  }

  static int size(int windowSize, int horizon, int nodeCount) {
    return horizon * windowSize + 2 * horizon + nodeCount * nodeCount;
  }

  /**
   * Randomly initialised weights: {@code W ~ U(-1/sqrt(K), 1/sqrt(K))}, {@code A ~ U(-1/N, 1/N)},
   * zero bias and gain.
   */
  static GwnParameters initialize(
      int windowSize, int horizon, int nodeCount, boolean graphTermEnabled, Random random) {
    double[] values = new double[size(windowSize, horizon, nodeCount)];
    GwnParameters parameters =
        new GwnParameters(windowSize, horizon, nodeCount, graphTermEnabled, values);
    double temporalRange = 1.0 / Math.sqrt(windowSize);
    for (int i = 0; i < parameters.biasOffset; i++) {
      values[i] = (2 * random.nextDouble() - 1) * temporalRange;
    }
    double adjacencyRange = 1.0 / nodeCount;
    for (int i = parameters.adjacencyOffset; i < values.length; i++) {
      values[i] = (2 * random.nextDouble() - 1) * adjacencyRange;
    }
    return parameters;
  }

  GwnParameters copy() {
    return new GwnParameters(windowSize, horizon, nodeCount, graphTermEnabled, values.clone());
  }

  /** The flat vector; the optimizer updates it in place. */
  double[] values() {
    return values;
  }

  int nodeCount() {
    return nodeCount;
  }

  /**
   * Writes the prediction for window {@code x} ({@code K x N}) into {@code out} ({@code H x N}).
   */
  void forward(double[][] x, double[][] out) {
    double[] graph = graphTerm(x);
    for (int h = 0; h < horizon; h++) {
      double bias = values[biasOffset + h];
      double gain = values[gainOffset + h];
      int row = h * windowSize;
      for (int n = 0; n < nodeCount; n++) {
        double y = bias;
        for (int k = 0; k < windowSize; k++) {
          y += values[row + k] * x[k][n];
        }
        if (graphTermEnabled) {
          y += gain * graph[n];
        }
        out[h][n] = y;
      }
    }
  }

  /**
   * Adds the gradient of the loss with respect to every weight to {@code gradients}, given the
   * loss gradient {@code dOut} ({@code H x N}) with respect to the prediction for {@code x}.
   */
  void accumulateGradient(double[][] x, double[][] dOut, double[] gradients) {
    double[] graph = graphTerm(x);
    for (int h = 0; h < horizon; h++) {
      int row = h * windowSize;
      for (int n = 0; n < nodeCount; n++) {
        double d = dOut[h][n];
        gradients[biasOffset + h] += d;
        for (int k = 0; k < windowSize; k++) {
          gradients[row + k] += d * x[k][n];
        }
        if (graphTermEnabled) {
          gradients[gainOffset + h] += d * graph[n];
        }
      }
    }
    if (!graphTermEnabled) {
      return;
    }
    double[] latest = x[windowSize - 1];
    for (int n = 0; n < nodeCount; n++) {
      double weighted = 0.0;
      for (int h = 0; h < horizon; h++) {
        weighted += dOut[h][n] * values[gainOffset + h];
      }
      int row = adjacencyOffset + n * nodeCount;
      for (int m = 0; m < nodeCount; m++) {
        gradients[row + m] += weighted * latest[m];
      }
    }
  }

  private double[] graphTerm(double[][] x) {
    double[] graph = new double[nodeCount];
    if (!graphTermEnabled) {
      return graph;
    }
    double[] latest = x[windowSize - 1];
    for (int n = 0; n < nodeCount; n++) {
      int row = adjacencyOffset + n * nodeCount;
      double sum = 0.0;
      for (int m = 0; m < nodeCount; m++) {
        sum += values[row + m] * latest[m];
      }
      graph[n] = sum;
    }
    return graph;
  }
}
