package com.fieldprofiler.profiler.service.export;

import java.util.Locale;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExportFormat {
  CSV("text/csv", "csv"),
  TSV("text/tab-separated-values", "tsv");

  private final String contentType;
  private final String extension;

  public static ExportFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return CSV;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported export format: " + value, e);
    }
  }
}
