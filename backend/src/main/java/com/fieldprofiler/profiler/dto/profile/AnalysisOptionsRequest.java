package com.fieldprofiler.profiler.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-run overrides; a missing value falls back to the configured default. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisOptionsRequest {

  @JsonProperty("numeric_distribution_shape")
  private Boolean numericDistributionShape;

  @JsonProperty("numeric_advanced_percentiles")
  private Boolean numericAdvancedPercentiles;

  @JsonProperty("numeric_integer_decimal_split")
  private Boolean numericIntegerDecimalSplit;

  @JsonProperty("numeric_outlier_details")
  private Boolean numericOutlierDetails;

  @JsonProperty("text_case_analysis")
  private Boolean textCaseAnalysis;

  @JsonProperty("text_rarity_and_non_printable")
  private Boolean textRarityAndNonPrintable;

  @JsonProperty("temporal_time_and_weekend")
  private Boolean temporalTimeAndWeekend;

  @Min(1)
  @Max(100)
  @JsonProperty("top_values_limit")
  private Integer topValuesLimit;

  @Min(0)
  @Max(10)
  @JsonProperty("decimal_places")
  private Integer decimalPlaces;
}
