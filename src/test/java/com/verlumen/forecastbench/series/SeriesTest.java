package com.verlumen.forecastbench.series;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SeriesTest {
  private static final Duration DAY = Duration.ofDays(1);
  private static final Instant START = Instant.parse("2020-01-01T00:00:00Z");

  @Test
  public void univariate_stampsRowsFromEpoch() {
    // Act
    Series series = Series.univariate(new double[] {1, 2, 3}, DAY);

    // Assert
    assertThat(series.length()).isEqualTo(3);
    assertThat(series.nodeCount()).isEqualTo(1);
    assertThat(series.timestamp(0)).isEqualTo(Instant.EPOCH);
    assertThat(series.timestamp(2)).isEqualTo(Instant.EPOCH.plus(Duration.ofDays(2)));
    assertThat(series.value(1, 0)).isEqualTo(2.0);
  }

  @Test
  public void create_copiesValues() {
    // Arrange
    double[][] values = {{1.0}, {2.0}};

    // Act
    Series series = create(ImmutableList.of(START, START.plus(DAY)), values, Optional.empty());
    values[0][0] = 99.0;

    // Assert
    assertThat(series.value(0, 0)).isEqualTo(1.0);
  }

  @Test
  public void create_emptySeries_throwsDataSourceException() {
    assertThrows(
        DataSourceException.class,
        () -> create(ImmutableList.of(), new double[0][], Optional.empty()));
  }

  @Test
  public void create_nonIncreasingTimestamps_throwsDataSourceException() {
    // Act
    DataSourceException thrown =
        assertThrows(
            DataSourceException.class,
            () ->
                create(
                    ImmutableList.of(START, START), new double[][] {{1}, {2}}, Optional.empty()));

    // Assert
    assertThat(thrown).hasMessageThat().contains("strictly increase");
  }

  @Test
  public void create_nonFiniteValue_throwsDataSourceException() {
    assertThrows(
        DataSourceException.class,
        () ->
            create(
                ImmutableList.of(START, START.plus(DAY)),
                new double[][] {{1}, {Double.NaN}},
                Optional.empty()));
  }

  @Test
  public void create_raggedRows_throwsDataSourceException() {
    assertThrows(
        DataSourceException.class,
        () ->
            Series.create(
                ImmutableList.of(START, START.plus(DAY)),
                ImmutableList.of("a", "b"),
                new double[][] {{1, 2}, {3}},
                DAY,
                Optional.empty()));
  }

  @Test
  public void create_gapBeyondTolerance_throwsDataSourceException() {
    // Arrange
    ImmutableList<Instant> timestamps =
        ImmutableList.of(START, START.plus(DAY), START.plus(Duration.ofDays(4)));

    // Act
    DataSourceException thrown =
        assertThrows(
            DataSourceException.class,
            () -> create(timestamps, new double[][] {{1}, {2}, {3}}, Optional.of(DAY)));

    // Assert
    assertThat(thrown).hasMessageThat().contains("exceeds tolerance");
  }

  @Test
  public void create_gapWithinTolerance_succeeds() {
    // Arrange
    ImmutableList<Instant> timestamps =
        ImmutableList.of(START, START.plus(DAY), START.plus(Duration.ofDays(3)));

    // Act
    Series series = create(timestamps, new double[][] {{1}, {2}, {3}}, Optional.of(DAY));

    // Assert
    assertThat(series.length()).isEqualTo(3);
  }

  @Test
  public void create_withoutTolerance_acceptsAnyGap() {
    // Arrange
    ImmutableList<Instant> timestamps =
        ImmutableList.of(START, START.plus(Duration.ofDays(30)));

    // Act
    Series series = create(timestamps, new double[][] {{1}, {2}}, Optional.empty());

    // Assert
    assertThat(series.gapTolerance()).isEmpty();
  }

  private static Series create(
      ImmutableList<Instant> timestamps, double[][] values, Optional<Duration> tolerance) {
    return Series.create(timestamps, ImmutableList.of("value"), values, DAY, tolerance);
  }
}
