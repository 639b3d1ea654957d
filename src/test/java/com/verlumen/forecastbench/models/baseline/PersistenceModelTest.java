package com.verlumen.forecastbench.models.baseline;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.forecastbench.models.FitResult;
import com.verlumen.forecastbench.models.Forecast;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.TrainingConfig;
import com.verlumen.forecastbench.series.Series;
import com.verlumen.forecastbench.windowing.Window;
import java.time.Duration;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PersistenceModelTest {
  private static final ModelConfig CONFIG = ModelConfig.create(40, 10, TrainingConfig.defaults());

  private final ForecastModel model = PersistenceModelFactory.create().create(CONFIG);

  @Test
  public void predict_repeatsLastWindowValue() {
    // Arrange
    Window window = new Window(sequence(100), 0, 40);

    // Act
    Forecast forecast = model.predict(window);

    // Assert
    assertThat(forecast.horizon()).isEqualTo(10);
    for (int step = 0; step < 10; step++) {
      assertThat(forecast.value(step, 0)).isEqualTo(39.0);
    }
  }

  @Test
  public void predict_multivariate_repeatsEachNodesLastValue() {
    // Arrange
    Series series =
        Series.create(
            Series.indexTimestamps(3, Duration.ofDays(1)),
            ImmutableList.of("a", "b"),
            new double[][] {{1, 10}, {2, 20}, {3, 30}},
            Duration.ofDays(1),
            Optional.empty());
    ForecastModel shortModel =
        PersistenceModelFactory.create()
            .create(ModelConfig.create(3, 2, TrainingConfig.defaults()));

    // Act
    Forecast forecast = shortModel.predict(new Window(series, 0, 3));

    // Assert
    assertThat(forecast).isEqualTo(Forecast.of(new double[][] {{3, 30}, {3, 30}}));
  }

  @Test
  public void isFitted_withoutFit_isTrue() {
    assertThat(model.isFitted()).isTrue();
  }

  @Test
  public void fit_isNoOpAndConverged() {
    // Act
    FitResult result = model.fit(ImmutableList.of());

    // Assert
    assertThat(result.converged()).isTrue();
    assertThat(result.epochs()).isEqualTo(0);
  }

  @Test
  public void predict_wrongWindowLength_throwsIllegalArgumentException() {
    assertThrows(
        IllegalArgumentException.class, () -> model.predict(new Window(sequence(100), 0, 30)));
  }

  @Test
  public void name_isPersistence() {
    assertThat(model.name()).isEqualTo("PERSISTENCE");
  }

  static Series sequence(int length) {
    double[] values = new double[length];
    for (int i = 0; i < length; i++) {
      values[i] = i;
    }
    return Series.univariate(values, Duration.ofDays(1));
  }
}
