package com.fieldprofiler.profiler.model;

/** Which rows of the dataset a run covers. */
public enum AnalysisScope {
  ALL,
  SELECTED
}
