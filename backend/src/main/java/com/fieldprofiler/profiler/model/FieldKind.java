package com.fieldprofiler.profiler.model;

import java.util.Locale;

/** Closed set of field kinds the profiler knows how to analyze. */
public enum FieldKind {
  NUMERIC,
  TEXT,
  TEMPORAL,
  OTHER;

  /**
   * Parses a kind name, also accepting the common type names {@code number}, {@code string},
   * {@code date} and {@code datetime}. Returns null for a blank value.
   *
   * @throws IllegalArgumentException for an unknown name
   */
  public static FieldKind fromString(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    switch (normalized) {
      case "NUMBER":
      case "INTEGER":
      case "DOUBLE":
        return NUMERIC;
      case "STRING":
        return TEXT;
      case "DATE":
      case "DATETIME":
        return TEMPORAL;
      default:
        try {
          return FieldKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Unknown field kind: " + value, e);
        }
    }
  }
}
