package com.fieldprofiler.profiler.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Why a statistic has no value. Rendered by {@link #getLabel()}. */
@Getter
@RequiredArgsConstructor
public enum NotApplicableReason {
  NO_DATA("N/A"),
  OPTION_DISABLED("N/A (Opt.)"),
  CAPABILITY_MISSING("N/A (Stats library missing)"),
  INSUFFICIENT_DATA("N/A (<3 valid)"),
  ALL_INVALID("N/A (all NaN)"),
  NO_UNIQUE_MODE("N/A (no unique mode)"),
  NO_TIME_DATA("N/A (No time data)"),
  NO_WORDS("N/A (No words found)"),
  COMPUTATION_ERROR("N/A (Error)");

  private final String label;
}
