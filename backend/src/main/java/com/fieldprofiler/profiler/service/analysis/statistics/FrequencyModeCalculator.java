package com.fieldprofiler.profiler.service.analysis.statistics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Counting implementation used when Commons Math is not on the classpath. */
public class FrequencyModeCalculator implements ModeCalculator {

  @Override
  public List<Double> computeModes(double[] values) {
    Map<Double, Integer> counts = new HashMap<>();
    int best = 0;
    for (double value : values) {
      // fold -0.0 into 0.0 so both count as the same value
      int count = counts.merge(value + 0.0, 1, Integer::sum);
      best = Math.max(best, count);
    }
    List<Double> modes = new ArrayList<>();
    for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
      if (entry.getValue() == best) {
        modes.add(entry.getKey());
      }
    }
    modes.sort(Double::compare);
    return modes;
  }
}
