package com.fieldprofiler.profiler.dto.profile;

import java.time.LocalDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisSummary {

  @JsonProperty("analysis_id")
  private String analysisId;

  @JsonProperty("dataset_name")
  private String datasetName;

  @JsonProperty("created_at")
  private LocalDateTime createdAt;

  @JsonProperty("fields")
  private List<String> fields;

  @JsonProperty("rows_scanned")
  private long rowsScanned;

  @JsonProperty("cancelled")
  private boolean cancelled;
}
