package com.verlumen.forecastbench.models.training;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EarlyStoppingTest {
  @Test
  public void record_improvingLosses_neverStops() {
    // Arrange
    EarlyStopping stopping = EarlyStopping.create(2);

    // Act
    boolean first = stopping.record(1.0);
    boolean second = stopping.record(0.9);
    boolean third = stopping.record(0.8);

    // Assert
    assertThat(first).isTrue();
    assertThat(second).isTrue();
    assertThat(third).isTrue();
    assertThat(stopping.shouldStop()).isFalse();
    assertThat(stopping.bestLoss()).isEqualTo(0.8);
  }

  @Test
  public void shouldStop_afterPatienceValidationsWithoutImprovement_returnsTrue() {
    // Arrange
    EarlyStopping stopping = EarlyStopping.create(2);
    stopping.record(0.5);

    // Act
    stopping.record(0.6);
    boolean afterOne = stopping.shouldStop();
    stopping.record(0.5);

    // Assert
    assertThat(afterOne).isFalse();
    assertThat(stopping.shouldStop()).isTrue();
    assertThat(stopping.bestLoss()).isEqualTo(0.5);
  }

  @Test
  public void record_improvementResetsPatience() {
    // Arrange
    EarlyStopping stopping = EarlyStopping.create(2);
    stopping.record(0.5);
    stopping.record(0.6);

    // Act
    stopping.record(0.4);
    stopping.record(0.45);

    // Assert
    assertThat(stopping.shouldStop()).isFalse();
  }

  @Test
  public void create_nonPositivePatience_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> EarlyStopping.create(0));
  }
}
