package com.fieldprofiler.profiler.model;

import java.util.Map;

import lombok.Value;

/** One row as yielded by the host: a stable row id and the raw value of each field. */
@Value
public class DatasetRow {

  long rowId;
  Map<String, RawValue> values;

  public RawValue get(String fieldName) {
    RawValue value = values.get(fieldName);
    return value == null ? RawValue.nullValue() : value;
  }
}
