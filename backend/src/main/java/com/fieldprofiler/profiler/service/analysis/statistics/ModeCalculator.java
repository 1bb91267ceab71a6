package com.fieldprofiler.profiler.service.analysis.statistics;

import java.util.List;

/** Finds the most frequent value(s) of a sample. */
public interface ModeCalculator {

  /**
   * @param values NaN-free, non-empty sample
   * @return every value tied for the highest frequency, ascending
   */
  List<Double> computeModes(double[] values);
}
