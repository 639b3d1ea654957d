package com.verlumen.forecastbench.models.training;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Range;
import org.apache.commons.collections4.queue.CircularFifoQueue;

/**
 * Decides when the epoch loss has settled.
 *
 * <p>Keeps the last {@value #WINDOW} epoch losses. The fit has converged once the window is full
 * and its spread, relative to the latest loss, is below the tolerance.
 */
public final class ConvergenceMonitor {
  static final int WINDOW = 3;
  private static final double MIN_DENOMINATOR = 1e-12;

  private final double tolerance;
  private final CircularFifoQueue<Double> recentLosses = new CircularFifoQueue<>(WINDOW);

  private ConvergenceMonitor(double tolerance) {
    this.tolerance = tolerance;
  }

  public static ConvergenceMonitor create(double tolerance) {
    checkArgument(tolerance >= 0, "tolerance must not be negative: %s", tolerance);
    return new ConvergenceMonitor(tolerance);
  }

  /** Adds the loss of a completed epoch. The oldest loss drops out once the window is full. */
  public void record(double epochLoss) {
    recentLosses.add(epochLoss);
  }

  public boolean hasConverged() {
    if (!recentLosses.isAtFullCapacity()) {
      return false;
    }
    Range<Double> span = Range.encloseAll(recentLosses);
    double latest = recentLosses.get(recentLosses.size() - 1);
    double spread = span.upperEndpoint() - span.lowerEndpoint();
    return spread / Math.max(Math.abs(latest), MIN_DENOMINATOR) < tolerance;
  }
}
