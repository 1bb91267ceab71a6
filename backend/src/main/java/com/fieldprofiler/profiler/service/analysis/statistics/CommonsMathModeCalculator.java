package com.fieldprofiler.profiler.service.analysis.statistics;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.StatUtils;

/** Mode computation backed by {@link StatUtils#mode(double[])}. */
public class CommonsMathModeCalculator implements ModeCalculator {

  @Override
  public List<Double> computeModes(double[] values) {
    // -0.0 + 0.0 is 0.0, so both zeros share one bucket
    double[] folded = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      folded[i] = values[i] + 0.0;
    }
    double[] modes = StatUtils.mode(folded);
    List<Double> result = new ArrayList<>(modes.length);
    for (double mode : modes) {
      result.add(mode);
    }
    return result;
  }
}
