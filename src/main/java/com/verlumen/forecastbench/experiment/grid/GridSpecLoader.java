package com.verlumen.forecastbench.experiment.grid;

import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.verlumen.forecastbench.experiment.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/** Loads experiment grids from YAML files. */
public final class GridSpecLoader {
  /** Flags a grid may vary. */
  static final ImmutableSet<String> SUPPORTED_FLAGS =
      ImmutableSet.of(
          "window_size",
          "horizon",
          "stride",
          "epoch",
          "lr",
          "batch_size",
          "eval_fraction",
          "norm_method");

  private static final Gson GSON = new Gson();

  private GridSpecLoader() {}

  /**
   * Loads and validates a grid file.
   *
   * @throws ConfigurationException if the file cannot be read or describes no valid grid
   */
  public static GridSpec load(Path path) {
    String content;
    try {
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read experiment config " + path, e);
    }
    return parseYaml(content);
  }

  /** Parses and validates grid YAML. */
  public static GridSpec parseYaml(String yamlContent) {
    GridSpec spec;
    try {
      Map<String, Object> yamlMap = new Yaml().load(yamlContent);
      spec = GSON.fromJson(GSON.toJson(yamlMap), GridSpec.class);
    } catch (YAMLException | JsonParseException | ClassCastException e) {
      throw new ConfigurationException("Malformed experiment config: " + e.getMessage(), e);
    }
    validate(spec);
    return spec;
  }

  private static void validate(GridSpec spec) {
    if (spec == null || spec.getGrid() == null || spec.getGrid().isEmpty()) {
      throw new ConfigurationException("Experiment config must declare a non-empty grid");
    }
    if (spec.getRuns() < 1) {
      throw new ConfigurationException("runs must be at least 1: " + spec.getRuns());
    }
    for (Map.Entry<String, List<String>> dimension : spec.getGrid().entrySet()) {
      if (!SUPPORTED_FLAGS.contains(dimension.getKey())) {
        throw new ConfigurationException(
            "Grid flag " + dimension.getKey() + " is not one of " + SUPPORTED_FLAGS);
      }
      if (dimension.getValue() == null || dimension.getValue().isEmpty()) {
        throw new ConfigurationException("Grid flag " + dimension.getKey() + " has no values");
      }
    }
  }
}
