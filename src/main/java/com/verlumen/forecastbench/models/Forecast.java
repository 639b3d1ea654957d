package com.verlumen.forecastbench.models;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;

/** An immutable {@code horizon x nodeCount} prediction. */
public final class Forecast {
  private final double[][] values;

  private Forecast(double[][] values) {
    this.values = values;
  }

  /**
   * Creates a forecast from rows of per-node predictions; the array is copied.
   *
   * @throws IllegalArgumentException if there are no steps or the rows are ragged
   */
  public static Forecast of(double[][] values) {
    checkArgument(values.length > 0, "Forecast must cover at least one step");
    int nodes = values[0].length;
    checkArgument(nodes > 0, "Forecast must cover at least one node");
    double[][] copy = new double[values.length][];
    for (int step = 0; step < values.length; step++) {
      checkArgument(values[step].length == nodes, "Row %s has %s nodes, expected %s",
          step, values[step].length, nodes);
      copy[step] = values[step].clone();
    }
    return new Forecast(copy);
  }

  /** A forecast that repeats {@code perNode} for every one of {@code horizon} steps. */
  public static Forecast repeat(int horizon, double[] perNode) {
    checkArgument(horizon > 0, "horizon must be positive: %s", horizon);
    double[][] rows = new double[horizon][];
    for (int step = 0; step < horizon; step++) {
      rows[step] = perNode.clone();
    }
    return of(rows);
  }

  public int horizon() {
    return values.length;
  }

  public int nodeCount() {
    return values[0].length;
  }

  /** Prediction for 0-based {@code step} and {@code node}. */
  public double value(int step, int node) {
    checkElementIndex(step, values.length, "step");
    checkElementIndex(node, values[step].length, "node");
    return values[step][node];
  }

  /** Predictions of one node across the horizon, in a fresh array. */
  public double[] column(int node) {
    double[] column = new double[values.length];
    for (int step = 0; step < values.length; step++) {
      column[step] = value(step, node);
    }
    return column;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Forecast && Arrays.deepEquals(values, ((Forecast) other).values);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(values);
  }

  @Override
  public String toString() {
    return "Forecast" + Arrays.deepToString(values);
  }
}
