package com.fieldprofiler.profiler.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Everything one analysis run hands back to its caller. */
@Value
@Builder
public class ProfileResult {

  /** Reports in the order the fields were requested. */
  Map<String, FieldReport> reports;

  /** Row ids of numeric conversion failures, per field with at least one failure. */
  Map<String, BoundedRowIds> conversionErrorIds;

  /** Row ids of text values with non-printable characters, per field with at least one. */
  Map<String, BoundedRowIds> nonPrintableIds;

  long rowsScanned;
  long totalRows;
  boolean cancelled;
  AnalysisScope scope;
  AnalysisOptions options;

  @Singular List<String> warnings;

  public FieldReport report(String fieldName) {
    return reports.get(fieldName);
  }
}
