package com.fieldprofiler.profiler.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Host-supplied input of one run: field descriptors, the rows in scope and the total row count
 * used as the percentage base. Rows are iterated exactly once.
 */
@Value
@Builder
public class Dataset {

  String name;

  @Singular List<FieldDescriptor> fields;

  Iterable<DatasetRow> rows;

  long totalRows;
}
