package com.verlumen.forecastbench.reporting;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReportWriterTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Inject private ReportWriter writer;

  private Path outputDir;

  @Before
  public void setUp() throws IOException {
    Guice.createInjector(ReportingModule.create()).injectMembers(this);
    outputDir = temporaryFolder.newFolder("output").toPath();
  }

  @Test
  public void write_createsRunDirectoryWithBothReports() throws IOException {
    // Act
    Path directory = writer.write(TestReports.gwnWithPersistence().build(), outputDir);

    // Assert
    assertThat(directory).isEqualTo(outputDir.resolve("GWN/prices/12/2"));
    assertThat(Files.isRegularFile(directory.resolve("report.txt"))).isTrue();
    assertThat(Files.readString(directory.resolve("report.json"), StandardCharsets.UTF_8))
        .contains("\"model\": \"GWN\"");
    assertThat(Files.exists(directory.resolve("predictions-GWN.json"))).isFalse();
  }

  @Test
  public void write_withPredictions_writesOneFilePerModel() {
    // Arrange
    RunReport report =
        TestReports.gwnWithPersistence()
            .setPredictions(
                ImmutableMap.of(
                    "GWN", ImmutableList.of(TestReports.record(0, "GWN", 1.0)),
                    "PERSISTENCE", ImmutableList.of(TestReports.record(0, "PERSISTENCE", 2.0))))
            .build();

    // Act
    Path directory = writer.write(report, outputDir);

    // Assert
    assertThat(Files.isRegularFile(directory.resolve("predictions-GWN.json"))).isTrue();
    assertThat(Files.isRegularFile(directory.resolve("predictions-PERSISTENCE.json"))).isTrue();
  }

  @Test
  public void write_twice_overwritesReports() throws IOException {
    // Arrange
    writer.write(TestReports.gwnWithPersistence().build(), outputDir);
    RunReport second = TestReports.gwnWithPersistence().setTrainPairCount(61).build();

    // Act
    Path directory = writer.write(second, outputDir);

    // Assert
    assertThat(Files.readString(directory.resolve("report.txt"), StandardCharsets.UTF_8))
        .contains("train=61");
  }
}
