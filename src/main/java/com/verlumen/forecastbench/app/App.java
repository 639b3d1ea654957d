package com.verlumen.forecastbench.app;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;
import com.verlumen.forecastbench.experiment.ExperimentConfig;
import com.verlumen.forecastbench.experiment.ExperimentModule;
import com.verlumen.forecastbench.experiment.ExperimentOrchestrator;
import com.verlumen.forecastbench.experiment.grid.ExperimentSuite;
import com.verlumen.forecastbench.experiment.grid.ExperimentSuiteResult;
import com.verlumen.forecastbench.experiment.grid.GridSpec;
import com.verlumen.forecastbench.experiment.grid.GridSpecLoader;
import com.verlumen.forecastbench.experiment.grid.SuiteReportRenderer;
import com.verlumen.forecastbench.reporting.ReportRenderer;
import com.verlumen.forecastbench.reporting.ReportWriter;
import com.verlumen.forecastbench.reporting.RunReport;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command-line entry point. Runs one benchmark, or a grid of them with {@code
 * --experiment_config}, prints the report and writes it under {@code --output_dir}.
 *
 * <p>Exits with 0 on success and with the {@link ErrorKind} exit code of a failed run, after
 * printing {@code ERROR <KIND>: <message>} to stderr.
 */
public final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final int USAGE_EXIT_CODE = 2;

  private final ExperimentOrchestrator.Factory orchestratorFactory;
  private final ExperimentSuite experimentSuite;
  private final ReportRenderer reportRenderer;
  private final ReportWriter reportWriter;
  private final SuiteReportRenderer suiteReportRenderer;

  @Inject
  App(
      ExperimentOrchestrator.Factory orchestratorFactory,
      ExperimentSuite experimentSuite,
      ReportRenderer reportRenderer,
      ReportWriter reportWriter,
      SuiteReportRenderer suiteReportRenderer) {
    this.orchestratorFactory = orchestratorFactory;
    this.experimentSuite = experimentSuite;
    this.reportRenderer = reportRenderer;
    this.reportWriter = reportWriter;
    this.suiteReportRenderer = suiteReportRenderer;
  }

  RunReport runSingle(ExperimentConfig config, PrintStream out) {
    RunReport report = orchestratorFactory.create(config).run();
    out.print(reportRenderer.render(report));
    reportWriter.write(report, config.outputDir());
    return report;
  }

  ExperimentSuiteResult runGrid(ExperimentConfig base, GridSpec spec, PrintStream out) {
    ExperimentSuiteResult result = experimentSuite.run(spec, base);
    out.print(suiteReportRenderer.renderText(result));
    Path file = suiteReportRenderer.write(result, base.outputDir());
    logger.atInfo().log("Wrote suite results to %s", file);
    return result;
  }

  public static void main(String[] args) {
    System.exit(runMain(args, System.out, System.err));
  }

  /** Runs the harness and returns the process exit code. */
  @VisibleForTesting
  static int runMain(String[] args, PrintStream out, PrintStream err) {
    logger.atInfo().log("forecastbench starting with %d arguments", args.length);
    ArgumentParser parser = HarnessArguments.createParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (HelpScreenException e) {
      return 0;
    } catch (ArgumentParserException e) {
      PrintWriter writer = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8));
      parser.handleError(e, writer);
      writer.flush();
      return USAGE_EXIT_CODE;
    }

    ListeningExecutorService executor = null;
    try {
      ExperimentConfig config = HarnessArguments.toConfig(namespace);
      Optional<GridSpec> grid =
          HarnessArguments.experimentConfig(namespace).map(GridSpecLoader::load);
      Injector injector = Guice.createInjector(ExperimentModule.create(config));
      executor = injector.getInstance(ListeningExecutorService.class);
      App app = injector.getInstance(App.class);
      if (grid.isPresent()) {
        app.runGrid(config, grid.get(), out);
      } else {
        app.runSingle(config, out);
      }
      return 0;
    } catch (HarnessException e) {
      err.printf("ERROR %s: %s%n", e.kind(), e.getMessage());
      return e.kind().getExitCode();
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Unexpected failure");
      err.printf("ERROR UNEXPECTED: %s%n", e);
      return ErrorKind.UNEXPECTED_EXIT_CODE;
    } finally {
      if (executor != null) {
        executor.shutdownNow();
      }
    }
  }
}
