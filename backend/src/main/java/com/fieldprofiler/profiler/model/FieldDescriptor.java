package com.fieldprofiler.profiler.model;

import lombok.NonNull;
import lombok.Value;

/** Name and kind of one dataset field, as supplied by the host. */
@Value
public class FieldDescriptor {

  @NonNull String name;
  @NonNull FieldKind kind;

  public static FieldDescriptor of(String name, FieldKind kind) {
    return new FieldDescriptor(name, kind);
  }
}
