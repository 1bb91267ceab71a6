package com.fieldprofiler.profiler.service.analysis.statistics;

import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.StatValue;

import lombok.Builder;
import lombok.Value;

/** The four distribution-shape statistics of a numeric field. */
@Value
@Builder
public class DistributionShape {

  StatValue skewness;
  StatValue kurtosis;
  StatValue normalityP;
  StatValue likelyNormal;

  public static DistributionShape allOf(StatValue value) {
    return new DistributionShape(value, value, value, value);
  }

  public static DistributionShape notApplicable(NotApplicableReason reason) {
    return allOf(StatValue.notApplicable(reason));
  }
}
