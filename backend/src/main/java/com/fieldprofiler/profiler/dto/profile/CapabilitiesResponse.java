package com.fieldprofiler.profiler.dto.profile;

import java.util.List;
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
public class CapabilitiesResponse {

  @JsonProperty("version")
  private String version;

  @JsonProperty("statistics_library_available")
  private boolean statisticsLibraryAvailable;

  @JsonProperty("warnings")
  private List<String> warnings;

  @JsonProperty("field_kinds")
  private List<String> fieldKinds;

  @JsonProperty("default_options")
  private AnalysisOptionsRequest defaultOptions;

  @JsonProperty("row_id_cap")
  private int rowIdCap;

  @JsonProperty("statistic_descriptions")
  private Map<String, String> statisticDescriptions;
}
