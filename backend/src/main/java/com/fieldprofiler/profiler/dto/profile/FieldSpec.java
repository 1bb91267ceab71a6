package com.fieldprofiler.profiler.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldSpec {

  @NotBlank
  @JsonProperty("name")
  private String name;

  /** numeric, text, temporal or other (number, string, date and datetime also accepted). */
  @NotBlank
  @JsonProperty("kind")
  private String kind;
}
