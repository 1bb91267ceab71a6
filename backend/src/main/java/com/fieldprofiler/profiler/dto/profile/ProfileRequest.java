package com.fieldprofiler.profiler.dto.profile;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileRequest {

  @JsonProperty("dataset_name")
  private String datasetName;

  @Valid
  @NotNull
  @NotEmpty
  @JsonProperty("fields")
  private List<FieldSpec> fields;

  /** One map per row, field name to value. Dates are ISO-8601 strings. */
  @NotNull
  @JsonProperty("rows")
  private List<Map<String, Object>> rows;

  /** Optional stable ids, aligned with {@code rows}; defaults to 1-based row numbers. */
  @JsonProperty("row_ids")
  private List<Long> rowIds;

  /** ALL (default) or SELECTED. */
  @JsonProperty("scope")
  private String scope;

  @JsonProperty("selected_row_ids")
  private List<Long> selectedRowIds;

  @Valid
  @JsonProperty("options")
  private AnalysisOptionsRequest options;
}
