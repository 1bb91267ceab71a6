package com.fieldprofiler.profiler.dto.profile;

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
public class RowIdList {

  @JsonProperty("row_ids")
  private List<Long> rowIds;

  /** True when more rows matched than were kept. */
  @JsonProperty("capped")
  private boolean capped;
}
