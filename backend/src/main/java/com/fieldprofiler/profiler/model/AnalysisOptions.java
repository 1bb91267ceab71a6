package com.fieldprofiler.profiler.model;

import lombok.Builder;
import lombok.Value;

/** Per-run analysis toggles and presentation parameters. */
@Value
@Builder(toBuilder = true)
public class AnalysisOptions {

  public static final int MAX_TOP_VALUES_LIMIT = 100;
  public static final int MAX_DECIMAL_PLACES = 10;

  @Builder.Default boolean numericDistributionShape = true;
  @Builder.Default boolean numericAdvancedPercentiles = true;
  @Builder.Default boolean numericIntegerDecimalSplit = true;
  @Builder.Default boolean numericOutlierDetails = true;
  @Builder.Default boolean textCaseAnalysis = true;
  @Builder.Default boolean textRarityAndNonPrintable = true;
  @Builder.Default boolean temporalTimeAndWeekend = true;
  @Builder.Default int topValuesLimit = 5;
  @Builder.Default int decimalPlaces = 2;

  public static AnalysisOptions defaults() {
    return AnalysisOptions.builder().build();
  }

  /** Options with every optional block switched off. */
  public static AnalysisOptions minimal() {
    return AnalysisOptions.builder()
        .numericDistributionShape(false)
        .numericAdvancedPercentiles(false)
        .numericIntegerDecimalSplit(false)
        .numericOutlierDetails(false)
        .textCaseAnalysis(false)
        .textRarityAndNonPrintable(false)
        .temporalTimeAndWeekend(false)
        .build();
  }

  /**
   * @throws IllegalArgumentException if a parameter is out of range
   */
  public AnalysisOptions validate() {
    if (topValuesLimit < 1 || topValuesLimit > MAX_TOP_VALUES_LIMIT) {
      throw new IllegalArgumentException(
          "topValuesLimit must be between 1 and "
              + MAX_TOP_VALUES_LIMIT
              + ", was "
              + topValuesLimit);
    }
    if (decimalPlaces < 0 || decimalPlaces > MAX_DECIMAL_PLACES) {
      throw new IllegalArgumentException(
          "decimalPlaces must be between 0 and " + MAX_DECIMAL_PLACES + ", was " + decimalPlaces);
    }
    return this;
  }
}
