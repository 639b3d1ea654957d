package com.verlumen.forecastbench.reporting;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.forecastbench.evaluation.PredictionRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes run reports to disk.
 *
 * <p>Each run gets the directory {@code <output_dir>/<model>/<dataset>/<window_size>/<horizon>}
 * holding {@code report.txt}, {@code report.json} and, when predictions were kept, one {@code
 * predictions-<model>.json} per evaluated model. Existing files are overwritten.
 */
public final class ReportWriter {
  static final String TEXT_REPORT = "report.txt";
  static final String JSON_REPORT = "report.json";

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TextReportRenderer textRenderer;
  private final JsonReportRenderer jsonRenderer;

  @Inject
  ReportWriter(TextReportRenderer textRenderer, JsonReportRenderer jsonRenderer) {
    this.textRenderer = textRenderer;
    this.jsonRenderer = jsonRenderer;
  }

  /** The directory {@link #write} puts the report of {@code report} in. */
  public static Path runDirectory(Path outputDir, RunReport report) {
    return outputDir
        .resolve(report.modelName())
        .resolve(report.datasetName())
        .resolve(String.valueOf(report.windowSize()))
        .resolve(String.valueOf(report.horizon()));
  }

  /**
   * Writes every document of {@code report}.
   *
   * @return the run directory
   * @throws UncheckedIOException if a file cannot be written
   */
  public Path write(RunReport report, Path outputDir) {
    Path directory = runDirectory(outputDir, report);
    writeFile(directory.resolve(TEXT_REPORT), textRenderer.render(report));
    writeFile(directory.resolve(JSON_REPORT), jsonRenderer.render(report));
    for (Map.Entry<String, ImmutableList<PredictionRecord>> predictions :
        report.predictions().entrySet()) {
      writeFile(
          directory.resolve("predictions-" + predictions.getKey() + ".json"),
          jsonRenderer.renderPredictions(predictions.getValue()));
    }
    logger.atInfo().log("Wrote report to %s", directory);
    return directory;
  }

  /** Writes {@code content} as UTF-8, creating parent directories. */
  public static void writeFile(Path file, String content) {
    try {
      Files.createDirectories(file.getParent());
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + file, e);
    }
  }
}
