package com.fieldprofiler.profiler.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How to select the rows behind one statistic cell: either a filter expression over the field or
 * a list of stored row ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectionResponse {

  public enum Type {
    EXPRESSION,
    ROW_IDS
  }

  @JsonProperty("field")
  private String field;

  @JsonProperty("statistic")
  private String statistic;

  @JsonProperty("type")
  private Type type;

  @JsonProperty("expression")
  private String expression;

  @JsonProperty("row_ids")
  private List<Long> rowIds;

  @JsonProperty("capped")
  private Boolean capped;

  /** True when the run covered selected rows only and the selection must be intersected. */
  @JsonProperty("intersect_with_scope")
  private boolean intersectWithScope;
}
