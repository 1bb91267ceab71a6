package com.fieldprofiler.profiler.exception;

/** A run whose preconditions fail before any row is collected. */
public class AnalysisRejectedException extends RuntimeException {

  public AnalysisRejectedException(String message) {
    super(message);
  }
}
