package com.verlumen.forecastbench.reporting;

/** Turns a run report into a document. */
public interface ReportRenderer {
  String render(RunReport report);
}
