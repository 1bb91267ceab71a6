package com.fieldprofiler.profiler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Ordered statistics for one field. Reports are immutable once built; {@link #getTopValue()}
 * holds the untruncated most frequent value (original type) for later selection by value.
 */
@Getter
public final class FieldReport {

  private final String fieldName;
  private final FieldKind kind;
  private final Map<String, StatValue> statistics;
  private final Object topValue;
  private final boolean failed;

  private FieldReport(Builder builder) {
    this.fieldName = builder.fieldName;
    this.kind = builder.kind;
    this.statistics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.statistics));
    this.topValue = builder.topValue;
    this.failed = builder.failed;
  }

  public static Builder builder(String fieldName, FieldKind kind) {
    return new Builder(fieldName, kind);
  }

  /** A report carrying a single {@code Error} entry in place of statistics. */
  public static FieldReport error(String fieldName, FieldKind kind, String message) {
    Builder builder = new Builder(fieldName, kind);
    builder.put(StatisticKeys.ERROR, StatValue.text(message));
    builder.failed = true;
    return builder.build();
  }

  public StatValue get(String key) {
    return statistics.get(key);
  }

  public boolean has(String key) {
    return statistics.containsKey(key);
  }

  public boolean hasTopValue() {
    return topValue != null;
  }

  public static final class Builder {
    private final String fieldName;
    private final FieldKind kind;
    private final Map<String, StatValue> statistics = new LinkedHashMap<>();
    private Object topValue;
    private boolean failed;

    private Builder(String fieldName, FieldKind kind) {
      this.fieldName = fieldName;
      this.kind = kind;
    }

    public Builder put(String key, StatValue value) {
      statistics.put(key, value);
      return this;
    }

    public Builder topValue(Object value) {
      this.topValue = value;
      return this;
    }

    public StatValue get(String key) {
      return statistics.get(key);
    }

    public FieldReport build() {
      return new FieldReport(this);
    }
  }
}
