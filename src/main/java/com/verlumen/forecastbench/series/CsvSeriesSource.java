package com.verlumen.forecastbench.series;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads a series from a delimited text file.
 *
 * <p>The first line is a header naming the columns. If the first header is one of {@code date},
 * {@code time}, {@code datetime} or {@code timestamp}, that column holds ISO-8601 instants, local
 * date-times or local dates (taken as UTC) and every other column is a node. Otherwise all columns
 * are nodes and rows are stamped {@code EPOCH + i * samplingInterval}.
 *
 * <p>Quoted fields are not supported; cells are trimmed and must parse as doubles.
 */
public final class CsvSeriesSource implements SeriesSource {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final ImmutableSet<String> TIME_COLUMNS =
      ImmutableSet.of("date", "time", "datetime", "timestamp");
  private static final CharMatcher BYTE_ORDER_MARK = CharMatcher.is('\uFEFF');
  private static final Duration DEFAULT_SAMPLING_INTERVAL = Duration.ofDays(1);
  private static final ImmutableList<Function<String, Instant>> TIMESTAMP_PARSERS =
      ImmutableList.of(
          Instant::parse,
          cell -> LocalDateTime.parse(cell).toInstant(ZoneOffset.UTC),
          cell -> LocalDate.parse(cell).atStartOfDay(ZoneOffset.UTC).toInstant());

  private final DatasetSpec spec;

  private CsvSeriesSource(DatasetSpec spec) {
    this.spec = spec;
  }

  public static CsvSeriesSource create(DatasetSpec spec) {
    return new CsvSeriesSource(checkNotNull(spec));
  }

  @Override
  public String datasetName() {
    return spec.datasetName();
  }

  @Override
  public Series load() {
    logger.atInfo().log("Loading series from %s", spec.path());
    if (!Files.isReadable(spec.path())) {
      throw new DataSourceException("Data file is not readable: " + spec.path());
    }
    Splitter splitter = Splitter.on(spec.delimiter()).trimResults();
    try (BufferedReader reader = Files.newBufferedReader(spec.path(), StandardCharsets.UTF_8)) {
      String headerLine = reader.readLine();
      if (headerLine != null) {
        headerLine = BYTE_ORDER_MARK.trimLeadingFrom(headerLine);
      }
      if (headerLine == null || headerLine.isBlank()) {
        throw new DataSourceException("Data file has no header: " + spec.path());
      }
      List<String> header = splitter.splitToList(headerLine);
      boolean hasTimeColumn = TIME_COLUMNS.contains(Ascii.toLowerCase(header.get(0)));
      ImmutableList<String> nodeNames =
          ImmutableList.copyOf(hasTimeColumn ? header.subList(1, header.size()) : header);

      List<Instant> timestamps = new ArrayList<>();
      List<double[]> rows = new ArrayList<>();
      String line;
      int lineNumber = 1;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        List<String> cells = splitter.splitToList(line);
        if (cells.size() != header.size()) {
          throw new DataSourceException(
              String.format(
                  "%s:%d has %d cells, expected %d",
                  spec.path(), lineNumber, cells.size(), header.size()));
        }
        int offset = hasTimeColumn ? 1 : 0;
        if (hasTimeColumn) {
          timestamps.add(parseTimestamp(cells.get(0), lineNumber));
        }
        double[] row = new double[nodeNames.size()];
        for (int n = 0; n < row.length; n++) {
          row[n] = parseValue(cells.get(n + offset), lineNumber, nodeNames.get(n));
        }
        rows.add(row);
      }

      Duration interval =
          spec.samplingInterval()
              .orElseGet(
                  () -> hasTimeColumn ? inferInterval(timestamps) : DEFAULT_SAMPLING_INTERVAL);
      ImmutableList<Instant> stamps =
          hasTimeColumn
              ? ImmutableList.copyOf(timestamps)
              : Series.indexTimestamps(rows.size(), interval);
      Series series =
          Series.create(
              stamps, nodeNames, rows.toArray(new double[0][]), interval, spec.gapTolerance());
      logger.atInfo().log("Loaded %s", series);
      return series;
    } catch (IOException e) {
      throw new DataSourceException("Failed to read data file: " + spec.path(), e);
    }
  }

  private Instant parseTimestamp(String cell, int lineNumber) {
    DateTimeParseException failure = null;
    for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
      try {
        return parser.apply(cell);
      } catch (DateTimeParseException e) {
        failure = e;
      }
    }
    throw new DataSourceException(
        String.format("%s:%d has an unparseable timestamp '%s'", spec.path(), lineNumber, cell),
        failure);
  }

  private double parseValue(String cell, int lineNumber, String column) {
    try {
      return Double.parseDouble(cell);
    } catch (NumberFormatException e) {
      throw new DataSourceException(
          String.format(
              "%s:%d column '%s' is not numeric: '%s'", spec.path(), lineNumber, column, cell),
          e);
    }
  }

  private static Duration inferInterval(List<Instant> timestamps) {
    Optional<Duration> smallest = Optional.empty();
    for (int i = 1; i < timestamps.size(); i++) {
      Duration step = Duration.between(timestamps.get(i - 1), timestamps.get(i));
      if (!step.isNegative() && !step.isZero()
          && (smallest.isEmpty() || step.compareTo(smallest.get()) < 0)) {
        smallest = Optional.of(step);
      }
    }
    return smallest.orElse(DEFAULT_SAMPLING_INTERVAL);
  }
}
