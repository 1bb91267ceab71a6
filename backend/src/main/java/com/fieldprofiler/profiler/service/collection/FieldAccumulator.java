package com.fieldprofiler.profiler.service.collection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fieldprofiler.profiler.model.BoundedRowIds;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.RawValue;

import lombok.Getter;

/**
 * Values gathered for one field during a single collection pass. Only {@link ValueCollector}
 * mutates an accumulator; after the pass it is read-only input to the analyzers.
 */
@Getter
public class FieldAccumulator {

  private final FieldDescriptor descriptor;
  private final List<RawValue> nonNullValues = new ArrayList<>();
  private final List<Double> convertedValues = new ArrayList<>();
  private final List<RawValue> temporalValues = new ArrayList<>();
  private final BoundedRowIds conversionErrorIds;
  private final BoundedRowIds nonPrintableIds;
  private long nullCount;
  private long conversionErrors;
  private String failure;

  FieldAccumulator(FieldDescriptor descriptor, int idCap) {
    this.descriptor = descriptor;
    this.conversionErrorIds = new BoundedRowIds(idCap);
    this.nonPrintableIds = new BoundedRowIds(idCap);
  }

  public FieldKind getKind() {
    return descriptor.getKind();
  }

  public String getFieldName() {
    return descriptor.getName();
  }

  public List<RawValue> getNonNullValues() {
    return Collections.unmodifiableList(nonNullValues);
  }

  public List<Double> getConvertedValues() {
    return Collections.unmodifiableList(convertedValues);
  }

  /** Original temporal values aligned with the scanned rows; null marks a missing value. */
  public List<RawValue> getTemporalValues() {
    return Collections.unmodifiableList(temporalValues);
  }

  public long getNonNullCount() {
    return nonNullValues.size();
  }

  public long getRowsScanned() {
    return nullCount + nonNullValues.size();
  }

  public boolean isFailed() {
    return failure != null;
  }

  void recordNull() {
    nullCount++;
  }

  void recordNonNull(RawValue value) {
    nonNullValues.add(value);
  }

  void recordConverted(double value) {
    convertedValues.add(value);
  }

  void recordConversionError(long rowId) {
    conversionErrors++;
    conversionErrorIds.add(rowId);
  }

  void recordNonPrintable(long rowId) {
    nonPrintableIds.add(rowId);
  }

  void recordTemporal(RawValue value) {
    temporalValues.add(value);
  }

  void markFailed(String message) {
    if (failure == null) {
      failure = message;
    }
  }
}
