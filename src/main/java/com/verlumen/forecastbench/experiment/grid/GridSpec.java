package com.verlumen.forecastbench.experiment.grid;

import java.util.List;
import java.util.Map;

/**
 * POJO bound from an experiment grid file.
 *
 * <pre>
 * runs: 3
 * grid:
 *   window_size: [20, 40]
 *   lr: [0.001, 0.0001]
 * </pre>
 */
public final class GridSpec {
  private Integer runs;
  private Map<String, List<String>> grid;

  public GridSpec() {}

  public GridSpec(Integer runs, Map<String, List<String>> grid) {
    this.runs = runs;
    this.grid = grid;
  }

  /** Repeats of every configuration; one when unset. */
  public int getRuns() {
    return runs == null ? 1 : runs;
  }

  public void setRuns(Integer runs) {
    this.runs = runs;
  }

  /** Flag name to the values it takes, in declaration order. */
  public Map<String, List<String>> getGrid() {
    return grid;
  }

  public void setGrid(Map<String, List<String>> grid) {
    this.grid = grid;
  }
}
