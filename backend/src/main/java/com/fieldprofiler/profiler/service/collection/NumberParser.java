package com.fieldprofiler.profiler.service.collection;

import java.util.Locale;

import com.fieldprofiler.profiler.model.RawValue;

/** Lenient floating-point conversion of raw cell values. */
public final class NumberParser {

  private NumberParser() {}

  /**
   * Converts {@code value} to a double.
   *
   * @return the number, or null when the value cannot be read as one
   */
  public static Double parse(RawValue value) {
    if (value == null || value.isNull()) {
      return null;
    }
    switch (value.getType()) {
      case NUMBER:
        return ((Number) value.getValue()).doubleValue();
      case STRING:
        return parse((String) value.getValue());
      default:
        return null;
    }
  }

  public static Double parse(String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return null;
    }
    String lower = trimmed.toLowerCase(Locale.ROOT);
    switch (lower) {
      case "nan":
      case "+nan":
      case "-nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
      case "+infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        break;
    }
    // Double.parseDouble also accepts hex floats and a trailing d/f type suffix; reject those
    char last = lower.charAt(lower.length() - 1);
    if (lower.contains("x") || last == 'd' || last == 'f') {
      return null;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
