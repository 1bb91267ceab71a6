package com.fieldprofiler.profiler.service.analysis.statistics;

import com.fieldprofiler.profiler.model.NotApplicableReason;

/** Stand-in used when Commons Math is absent or switched off. */
public class UnavailableShapeCalculator implements DistributionShapeCalculator {

  private static final DistributionShape MISSING =
      DistributionShape.notApplicable(NotApplicableReason.CAPABILITY_MISSING);

  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public DistributionShape describe(double[] values) {
    return MISSING;
  }
}
