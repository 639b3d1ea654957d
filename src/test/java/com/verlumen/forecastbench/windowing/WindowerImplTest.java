package com.verlumen.forecastbench.windowing;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.forecastbench.series.Series;
import java.time.Duration;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class WindowerImplTest {
  @Inject private Windower windower;

  private Series sequence;

  @Before
  public void setUp() {
    Guice.createInjector(WindowingModule.create()).injectMembers(this);
    sequence = sequence(100);
  }

  @Test
  public void build_sequenceOf100_yields51Pairs() {
    // Act
    ImmutableList<WindowPair> pairs = windower.build(sequence, 40, 10);

    // Assert
    assertThat(pairs).hasSize(51);
  }

  @Test
  public void build_firstPair_coversFirstWindowAndHorizon() {
    // Act
    WindowPair first = windower.build(sequence, 40, 10).get(0);

    // Assert
    assertThat(first.index()).isEqualTo(0);
    assertThat(first.window().column(0)).isEqualTo(range(0, 40));
    assertThat(first.target().column(0)).isEqualTo(range(40, 50));
  }

  @Test
  public void build_pairsAreContiguousDisjointAndOrdered() {
    // Act
    ImmutableList<WindowPair> pairs = windower.build(sequence, 7, 3);

    // Assert
    for (int i = 0; i < pairs.size(); i++) {
      WindowPair pair = pairs.get(i);
      assertThat(pair.index()).isEqualTo(i);
      assertThat(pair.window().start()).isEqualTo(i);
      assertThat(pair.window().length()).isEqualTo(7);
      assertThat(pair.target().start()).isEqualTo(pair.window().end());
      assertThat(pair.target().length()).isEqualTo(3);
      assertThat(pair.window().endTime()).isLessThan(pair.target().startTime());
    }
  }

  @Test
  public void build_withStride_offsetsWindowsByStride() {
    // Act
    ImmutableList<WindowPair> pairs = windower.build(sequence, 40, 10, 5);

    // Assert: floor((100 - 50) / 5) + 1
    assertThat(pairs).hasSize(11);
    assertThat(pairs.get(1).window().start()).isEqualTo(5);
    assertThat(pairs.get(10).target().end()).isEqualTo(100);
  }

  @Test
  public void build_exactlyWindowPlusHorizon_yieldsOnePair() {
    // Act
    ImmutableList<WindowPair> pairs = windower.build(sequence(50), 40, 10);

    // Assert
    assertThat(pairs).hasSize(1);
  }

  @Test
  public void build_twice_yieldsEqualPairs() {
    // Act
    ImmutableList<WindowPair> first = windower.build(sequence, 40, 10, 2);
    ImmutableList<WindowPair> second = windower.build(sequence, 40, 10, 2);

    // Assert
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void build_seriesOf45_throwsInsufficientDataException() {
    // Act
    InsufficientDataException thrown =
        assertThrows(InsufficientDataException.class, () -> windower.build(sequence(45), 40, 10));

    // Assert
    assertThat(thrown.available()).isEqualTo(45);
    assertThat(thrown.required()).isEqualTo(50L);
  }

  @Test
  public void build_windowPlusHorizonBeyondIntRange_throwsInsufficientDataException() {
    // Act
    InsufficientDataException thrown =
        assertThrows(
            InsufficientDataException.class,
            () -> windower.build(sequence(100), Integer.MAX_VALUE, 1, 1));

    // Assert
    assertThat(thrown.available()).isEqualTo(100);
    assertThat(thrown.required()).isEqualTo(Integer.MAX_VALUE + 1L);
  }

  @Test
  public void build_largeWindowAndHorizon_throwsInsufficientDataException() {
    InsufficientDataException thrown =
        assertThrows(
            InsufficientDataException.class,
            () -> windower.build(sequence(100), 1 << 30, 1 << 30, 1));

    assertThat(thrown.required()).isEqualTo(1L << 31);
  }

  @Test
  public void build_invalidArguments_throwIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> windower.build(sequence, 0, 10));
    assertThrows(IllegalArgumentException.class, () -> windower.build(sequence, 40, 0));
    assertThrows(IllegalArgumentException.class, () -> windower.build(sequence, 40, 10, 0));
  }

  @Test
  public void split_lastFractionIsEvaluatedAndOverlapIsPurged() {
    // Arrange: 151 pairs
    ImmutableList<WindowPair> pairs = windower.build(sequence(200), 40, 10);

    // Act
    DatasetSplit split = windower.split(pairs, 0.2);

    // Assert: 30 eval pairs start at index 121; train targets must end by then
    assertThat(split.eval()).hasSize(30);
    assertThat(split.eval().get(0).index()).isEqualTo(121);
    assertThat(split.train()).hasSize(72);
    assertThat(split.train().get(71).target().end()).isEqualTo(121);
    assertThat(split.purgedCount()).isEqualTo(49);
  }

  @Test
  public void split_noTrainingTargetOverlapsEvaluationWindows() {
    // Arrange
    ImmutableList<WindowPair> pairs = windower.build(sequence, 12, 6, 1);

    // Act
    DatasetSplit split = windower.split(pairs, 0.3);

    // Assert
    int firstEvalStart = split.eval().get(0).window().start();
    for (WindowPair train : split.train()) {
      assertThat(train.target().end()).isAtMost(firstEvalStart);
    }
    assertThat(split.train().size() + split.purgedCount() + split.eval().size())
        .isEqualTo(pairs.size());
  }

  @Test
  public void split_fractionOutsideUnitInterval_throwsInvalidSplitException() {
    // Arrange
    ImmutableList<WindowPair> pairs = windower.build(sequence, 40, 10);

    // Act & Assert
    assertThrows(InvalidSplitException.class, () -> windower.split(pairs, 0.0));
    assertThrows(InvalidSplitException.class, () -> windower.split(pairs, 1.0));
  }

  @Test
  public void split_fractionTooSmall_throwsInvalidSplitException() {
    // Arrange
    ImmutableList<WindowPair> pairs = windower.build(sequence, 40, 10);

    // Act
    InvalidSplitException thrown =
        assertThrows(InvalidSplitException.class, () -> windower.split(pairs, 0.01));

    // Assert
    assertThat(thrown).hasMessageThat().contains("no evaluation pairs");
  }

  @Test
  public void split_nothingLeftAfterPurge_throwsInvalidSplitException() {
    // Arrange: 11 pairs; the 5 eval windows start at 6, before any target ends
    ImmutableList<WindowPair> pairs = windower.build(sequence(60), 40, 10);

    // Act
    InvalidSplitException thrown =
        assertThrows(InvalidSplitException.class, () -> windower.split(pairs, 0.5));

    // Assert
    assertThat(thrown).hasMessageThat().contains("no training pairs");
  }

  private static Series sequence(int length) {
    double[] values = new double[length];
    for (int i = 0; i < length; i++) {
      values[i] = i;
    }
    return Series.univariate(values, Duration.ofDays(1));
  }

  private static double[] range(int fromInclusive, int toExclusive) {
    double[] values = new double[toExclusive - fromInclusive];
    for (int i = 0; i < values.length; i++) {
      values[i] = fromInclusive + i;
    }
    return values;
  }
}
