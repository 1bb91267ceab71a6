package com.fieldprofiler.profiler.dto.profile;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProfileResponse {

  @JsonProperty("analysis_id")
  private String analysisId;

  @JsonProperty("dataset_name")
  private String datasetName;

  @JsonProperty("created_at")
  private LocalDateTime createdAt;

  @JsonProperty("scope")
  private String scope;

  @JsonProperty("rows_scanned")
  private long rowsScanned;

  @JsonProperty("total_rows")
  private long totalRows;

  @JsonProperty("cancelled")
  private boolean cancelled;

  @JsonProperty("warnings")
  private List<String> warnings;

  @JsonProperty("fields")
  private List<FieldProfile> fields;

  @JsonProperty("conversion_error_ids")
  private Map<String, RowIdList> conversionErrorIds;

  @JsonProperty("non_printable_ids")
  private Map<String, RowIdList> nonPrintableIds;
}
