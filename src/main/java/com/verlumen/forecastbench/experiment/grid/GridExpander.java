package com.verlumen.forecastbench.experiment.grid;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.verlumen.forecastbench.experiment.ConfigurationException;
import com.verlumen.forecastbench.experiment.ExperimentConfig;
import com.verlumen.forecastbench.models.TrainingConfig;
import com.verlumen.forecastbench.series.NormMethod;
import java.util.ArrayList;
import java.util.List;

/** Expands a grid into the Cartesian product of its values, applied over a base config. */
final class GridExpander {
  private GridExpander() {}

  /**
   * Returns one point per combination, varying the last declared flag fastest.
   *
   * @throws ConfigurationException if a value does not parse or yields an invalid config
   */
  static ImmutableList<GridPoint> expand(GridSpec spec, ExperimentConfig base) {
    List<String> flags = new ArrayList<>(spec.getGrid().keySet());
    List<List<String>> dimensions = new ArrayList<>();
    for (String flag : flags) {
      dimensions.add(spec.getGrid().get(flag));
    }

    ImmutableList.Builder<GridPoint> points = ImmutableList.builder();
    for (List<String> values : Lists.cartesianProduct(dimensions)) {
      ExperimentConfig.Builder config = base.toBuilder();
      TrainingConfig.Builder training = base.training().toBuilder();
      List<String> label = new ArrayList<>();
      for (int i = 0; i < flags.size(); i++) {
        apply(flags.get(i), values.get(i), config, training);
        label.add(flags.get(i) + "=" + values.get(i));
      }
      try {
        config.setTraining(training.build());
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(e.getMessage(), e);
      }
      points.add(GridPoint.create(Joiner.on(',').join(label), config.build()));
    }
    return points.build();
  }

  private static void apply(
      String flag, String value, ExperimentConfig.Builder config, TrainingConfig.Builder training) {
    try {
      switch (flag) {
        case "window_size":
          config.setWindowSize(Integer.parseInt(value));
          break;
        case "horizon":
          config.setHorizon(Integer.parseInt(value));
          break;
        case "stride":
          config.setStride(Integer.parseInt(value));
          break;
        case "eval_fraction":
          config.setEvalFraction(Double.parseDouble(value));
          break;
        case "epoch":
          training.setEpochs(Integer.parseInt(value));
          break;
        case "lr":
          training.setLearningRate(Double.parseDouble(value));
          break;
        case "batch_size":
          training.setBatchSize(Integer.parseInt(value));
          break;
        case "norm_method":
          training.setNormMethod(NormMethod.fromString(value));
          break;
        default:
          throw new ConfigurationException("Grid flag " + flag + " is not supported");
      }
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
          String.format("Invalid value %s for grid flag %s", value, flag), e);
    }
  }
}
