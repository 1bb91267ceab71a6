package com.fieldprofiler.profiler.dto.profile;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldProfile {

  @JsonProperty("field_name")
  private String fieldName;

  @JsonProperty("kind")
  private String kind;

  @JsonProperty("failed")
  private boolean failed;

  @JsonProperty("statistics")
  private Map<String, StatisticValue> statistics;
}
