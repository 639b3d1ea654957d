package com.verlumen.forecastbench.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import java.util.OptionalDouble;

/**
 * A metric result that may be undefined, such as a percentage error over a zero ground truth.
 * Undefined values are reported, never thrown.
 */
@AutoValue
public abstract class MetricValue {
  private static final MetricValue UNDEFINED = new AutoValue_MetricValue(OptionalDouble.empty());

  public static MetricValue of(double value) {
    checkArgument(Double.isFinite(value), "Metric value must be finite: %s", value);
    return new AutoValue_MetricValue(OptionalDouble.of(value));
  }

  /** A value, or undefined when {@code value} is NaN or infinite, e.g. after a diverged fit. */
  public static MetricValue orUndefined(double value) {
    return Double.isFinite(value) ? of(value) : UNDEFINED;
  }

  public static MetricValue undefined() {
    return UNDEFINED;
  }

  abstract OptionalDouble asOptional();

  public boolean isDefined() {
    return asOptional().isPresent();
  }

  /**
   * The numeric value.
   *
   * @throws IllegalStateException if the value is undefined
   */
  public double value() {
    checkState(isDefined(), "Metric value is undefined");
    return asOptional().getAsDouble();
  }

  @Override
  public String toString() {
    return isDefined() ? String.format("%.4f", value()) : "undefined";
  }
}
