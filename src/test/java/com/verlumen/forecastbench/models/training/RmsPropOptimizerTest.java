package com.verlumen.forecastbench.models.training;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RmsPropOptimizerTest {
  @Test
  public void step_movesAgainstGradient() {
    // Arrange
    RmsPropOptimizer optimizer = RmsPropOptimizer.create(2, 0.0);
    double[] parameters = {1.0, 1.0};

    // Act
    optimizer.step(parameters, new double[] {2.0, -2.0}, 0.01);

    // Assert
    assertThat(parameters[0]).isLessThan(1.0);
    assertThat(parameters[1]).isGreaterThan(1.0);
  }

  @Test
  public void step_firstUpdate_isScaledByRootMeanSquare() {
    // Arrange
    RmsPropOptimizer optimizer = RmsPropOptimizer.create(1, 0.0);
    double[] parameters = {0.0};
    double expected =
        -0.01 * 3.0 / (Math.sqrt((1 - RmsPropOptimizer.DEFAULT_ALPHA) * 9.0)
            + RmsPropOptimizer.DEFAULT_EPSILON);

    // Act
    optimizer.step(parameters, new double[] {3.0}, 0.01);

    // Assert
    assertThat(parameters[0]).isWithin(1e-12).of(expected);
  }

  @Test
  public void step_zeroGradientWithWeightDecay_shrinksParameters() {
    // Arrange
    RmsPropOptimizer optimizer = RmsPropOptimizer.create(1, 0.1);
    double[] parameters = {2.0};

    // Act
    optimizer.step(parameters, new double[] {0.0}, 0.01);

    // Assert
    assertThat(parameters[0]).isLessThan(2.0);
  }

  @Test
  public void step_mismatchedLengths_throwsIllegalArgumentException() {
    RmsPropOptimizer optimizer = RmsPropOptimizer.create(2, 0.0);

    assertThrows(
        IllegalArgumentException.class,
        () -> optimizer.step(new double[2], new double[3], 0.01));
  }
}
