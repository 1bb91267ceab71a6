package com.fieldprofiler.profiler.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Value of one statistic in a {@link FieldReport}. A computed NaN is a {@link Kind#DECIMAL}; a
 * value that was never computed is {@link Kind#NOT_APPLICABLE} with a reason.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StatValue {

  public enum Kind {
    INTEGER,
    DECIMAL,
    PERCENT,
    BOOLEAN,
    TEXT,
    LIST,
    NOT_APPLICABLE
  }

  private final Kind kind;
  private final Object value;
  private final NotApplicableReason reason;
  private final String detail;

  public static StatValue integer(long value) {
    return new StatValue(Kind.INTEGER, value, null, null);
  }

  public static StatValue decimal(double value) {
    return new StatValue(Kind.DECIMAL, value, null, null);
  }

  public static StatValue percent(double value) {
    return new StatValue(Kind.PERCENT, value, null, null);
  }

  public static StatValue bool(boolean value) {
    return new StatValue(Kind.BOOLEAN, value, null, null);
  }

  public static StatValue text(String value) {
    return new StatValue(Kind.TEXT, Objects.requireNonNull(value), null, null);
  }

  public static StatValue list(List<StatValue> items) {
    return new StatValue(Kind.LIST, List.copyOf(items), null, null);
  }

  public static StatValue notApplicable(NotApplicableReason reason) {
    return new StatValue(Kind.NOT_APPLICABLE, null, reason, null);
  }

  public static StatValue notApplicable(NotApplicableReason reason, String detail) {
    return new StatValue(Kind.NOT_APPLICABLE, null, reason, detail);
  }

  public static StatValue na() {
    return notApplicable(NotApplicableReason.NO_DATA);
  }

  public static StatValue disabled() {
    return notApplicable(NotApplicableReason.OPTION_DISABLED);
  }

  public boolean isNotApplicable() {
    return kind == Kind.NOT_APPLICABLE;
  }

  public boolean isNumber() {
    return kind == Kind.INTEGER || kind == Kind.DECIMAL || kind == Kind.PERCENT;
  }

  public long asLong() {
    if (!isNumber()) {
      throw new IllegalStateException("Not a numeric statistic: " + kind);
    }
    return ((Number) value).longValue();
  }

  public double asDouble() {
    if (!isNumber()) {
      throw new IllegalStateException("Not a numeric statistic: " + kind);
    }
    return ((Number) value).doubleValue();
  }

  public boolean asBoolean() {
    if (kind != Kind.BOOLEAN) {
      throw new IllegalStateException("Not a boolean statistic: " + kind);
    }
    return (Boolean) value;
  }

  public String asText() {
    if (kind != Kind.TEXT) {
      throw new IllegalStateException("Not a text statistic: " + kind);
    }
    return (String) value;
  }

  @SuppressWarnings("unchecked")
  public List<StatValue> asList() {
    if (kind != Kind.LIST) {
      throw new IllegalStateException("Not a list statistic: " + kind);
    }
    return Collections.unmodifiableList((List<StatValue>) value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StatValue)) {
      return false;
    }
    StatValue other = (StatValue) o;
    // Double.equals treats NaN as equal to itself, which keeps repeated runs comparable
    return kind == other.kind
        && Objects.equals(value, other.value)
        && reason == other.reason
        && Objects.equals(detail, other.detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value, reason, detail);
  }

  @Override
  public String toString() {
    return kind == Kind.NOT_APPLICABLE ? reason.getLabel() : kind + ":" + value;
  }
}
