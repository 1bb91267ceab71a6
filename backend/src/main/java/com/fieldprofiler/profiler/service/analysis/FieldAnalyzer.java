package com.fieldprofiler.profiler.service.analysis;

import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.service.collection.FieldAccumulator;

/** Computes the kind-specific statistics of one collected field. */
public interface FieldAnalyzer {

  FieldKind getKind();

  /**
   * Appends this analyzer's statistics to {@code report}. Implementations read the accumulator
   * only and keep no state between calls.
   */
  void analyze(FieldAccumulator accumulator, AnalysisOptions options, FieldReport.Builder report);
}
