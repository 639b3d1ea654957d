package com.verlumen.forecastbench.series;

import com.google.auto.value.AutoValue;
import com.google.common.io.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/** Where a series lives and how to read it. */
@AutoValue
public abstract class DatasetSpec {
  public static Builder builder() {
    return new AutoValue_DatasetSpec.Builder().setDelimiter(',');
  }

  public abstract Path path();

  public abstract char delimiter();

  /** Declared sampling interval; inferred from the data when absent. */
  public abstract Optional<Duration> samplingInterval();

  /** Allowed excess over the sampling interval between two rows; unchecked when absent. */
  public abstract Optional<Duration> gapTolerance();

  /** The file name without its extension, e.g. {@code JSE_clean_truncated}. */
  public String datasetName() {
    return Files.getNameWithoutExtension(path().getFileName().toString());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPath(Path path);

    public abstract Builder setDelimiter(char delimiter);

    public abstract Builder setSamplingInterval(Duration samplingInterval);

    public abstract Builder setSamplingInterval(Optional<Duration> samplingInterval);

    public abstract Builder setGapTolerance(Duration gapTolerance);

    public abstract Builder setGapTolerance(Optional<Duration> gapTolerance);

    public abstract DatasetSpec build();
  }
}
