package com.fieldprofiler.profiler.dto.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A statistic as exposed over HTTP: typed value plus its rendered form. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatisticValue {

  @JsonProperty("kind")
  private String kind;

  /** Absent for non-applicable statistics; NaN is sent as the string "NaN". */
  @JsonProperty("value")
  private Object value;

  @JsonProperty("display")
  private String display;

  @JsonProperty("reason")
  private String reason;
}
