package com.fieldprofiler.profiler.service.collection;

import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.DatasetRow;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.RawValue;

import lombok.extern.slf4j.Slf4j;

/**
 * Single-pass collection of field values into {@link FieldAccumulator}s. Conversion failures
 * and non-printable characters are recorded as data; a bad value never aborts the pass.
 */
@Slf4j
public class ValueCollector {

  private final int idCap;
  private final AnalysisOptions options;

  public ValueCollector(int idCap, AnalysisOptions options) {
    this.idCap = idCap;
    this.options = options;
  }

  public FieldAccumulator newAccumulator(FieldDescriptor descriptor) {
    return new FieldAccumulator(descriptor, idCap);
  }

  /** Collects every row of {@code rows} for one field. */
  public FieldAccumulator collect(FieldDescriptor descriptor, Iterable<DatasetRow> rows) {
    FieldAccumulator accumulator = newAccumulator(descriptor);
    for (DatasetRow row : rows) {
      accept(accumulator, row.getRowId(), row.get(descriptor.getName()));
    }
    return accumulator;
  }

  public void accept(FieldAccumulator accumulator, long rowId, RawValue value) {
    if (accumulator.isFailed()) {
      return;
    }
    RawValue raw = value == null ? RawValue.nullValue() : value;
    FieldKind kind = accumulator.getKind();
    try {
      if (kind == FieldKind.TEMPORAL) {
        accumulator.recordTemporal(raw.isNull() ? null : raw);
      }
      if (raw.isNull()) {
        accumulator.recordNull();
        return;
      }
      accumulator.recordNonNull(raw);

      if (kind == FieldKind.NUMERIC) {
        Double converted = NumberParser.parse(raw);
        if (converted == null) {
          accumulator.recordConversionError(rowId);
        } else {
          accumulator.recordConverted(converted);
        }
      } else if (kind == FieldKind.TEXT
          && options.isTextRarityAndNonPrintable()
          && TextCharacters.hasNonPrintable(raw.asText())) {
        accumulator.recordNonPrintable(rowId);
      }
    } catch (RuntimeException e) {
      log.warn(
          "Collection failed for field '{}' at row {}: {}",
          accumulator.getFieldName(),
          rowId,
          e.getMessage());
      accumulator.markFailed("Value collection error: " + e.getMessage());
    }
  }
}
