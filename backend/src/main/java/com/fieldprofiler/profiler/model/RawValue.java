package com.fieldprofiler.profiler.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A single cell value as handed over by the host. Temporal values carry a validity flag; an
 * invalid temporal value counts as null for profiling.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RawValue {

  public enum Type {
    NULL,
    NUMBER,
    STRING,
    DATE,
    DATETIME
  }

  private static final RawValue NULL = new RawValue(Type.NULL, null, true);

  private final Type type;
  private final Object value;
  private final boolean valid;

  public static RawValue nullValue() {
    return NULL;
  }

  public static RawValue number(Number number) {
    return number == null ? NULL : new RawValue(Type.NUMBER, number, true);
  }

  public static RawValue string(String text) {
    return text == null ? NULL : new RawValue(Type.STRING, text, true);
  }

  public static RawValue date(LocalDate date) {
    return date == null ? NULL : new RawValue(Type.DATE, date, true);
  }

  public static RawValue dateTime(LocalDateTime dateTime) {
    return dateTime == null ? NULL : new RawValue(Type.DATETIME, dateTime, true);
  }

  public static RawValue invalidDate() {
    return new RawValue(Type.DATE, null, false);
  }

  public static RawValue invalidDateTime() {
    return new RawValue(Type.DATETIME, null, false);
  }

  /** Wraps a plain Java object, falling back to its string form for unknown types. */
  public static RawValue of(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof RawValue) {
      return (RawValue) value;
    }
    if (value instanceof Number) {
      return number((Number) value);
    }
    if (value instanceof LocalDateTime) {
      return dateTime((LocalDateTime) value);
    }
    if (value instanceof LocalDate) {
      return date((LocalDate) value);
    }
    return string(value.toString());
  }

  public boolean isNull() {
    return type == Type.NULL || !valid;
  }

  /** String coercion used by text analysis and numeric conversion. */
  public String asText() {
    if (value == null) {
      return "";
    }
    return value.toString();
  }

  @Override
  public String toString() {
    return isNull() ? "NULL" : type + "(" + value + ")";
  }
}
