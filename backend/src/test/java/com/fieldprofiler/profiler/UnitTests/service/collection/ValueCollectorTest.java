package com.fieldprofiler.profiler.service.collection;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.DatasetRow;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.RawValue;

@DisplayName("ValueCollector Tests")
class ValueCollectorTest {

  private final ValueCollector collector = new ValueCollector(10, AnalysisOptions.defaults());

  private static DatasetRow row(long id, String field, RawValue value) {
    return new DatasetRow(id, Map.of(field, value));
  }

  @Nested
  @DisplayName("Numeric fields")
  class NumericFields {

    @Test
    @DisplayName("Should keep conversion failures as data with their row ids")
    void shouldRecordConversionErrors() {
      FieldAccumulator accumulator =
          collector.collect(
              FieldDescriptor.of("n", FieldKind.NUMERIC),
              List.of(
                  row(11, "n", RawValue.string("1.5")),
                  row(12, "n", RawValue.string("oops")),
                  row(13, "n", RawValue.nullValue()),
                  row(14, "n", RawValue.number(3))));

      assertThat(accumulator.getConvertedValues()).containsExactly(1.5, 3.0);
      assertThat(accumulator.getConversionErrors()).isEqualTo(1);
      assertThat(accumulator.getConversionErrorIds().getIds()).containsExactly(12L);
      assertThat(accumulator.getNullCount()).isEqualTo(1);
      assertThat(accumulator.getNonNullCount()).isEqualTo(3);
      assertThat(accumulator.getRowsScanned()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should treat a missing cell as null")
    void shouldTreatMissingCellAsNull() {
      FieldAccumulator accumulator =
          collector.collect(
              FieldDescriptor.of("n", FieldKind.NUMERIC),
              List.of(row(1, "other", RawValue.number(1))));

      assertThat(accumulator.getNullCount()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Text fields")
  class TextFields {

    @Test
    @DisplayName("Should record ids of values with non-printable characters")
    void shouldRecordNonPrintableIds() {
      FieldAccumulator accumulator =
          collector.collect(
              FieldDescriptor.of("t", FieldKind.TEXT),
              List.of(
                  row(1, "t", RawValue.string("fine")),
                  row(2, "t", RawValue.string("bell\u0007")),
                  row(3, "t", RawValue.string(""))));

      assertThat(accumulator.getNonPrintableIds().getIds()).containsExactly(2L);
      assertThat(accumulator.getNonNullCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should skip the non-printable scan when rarity is switched off")
    void shouldSkipNonPrintableScanWhenDisabled() {
      ValueCollector minimal = new ValueCollector(10, AnalysisOptions.minimal());

      FieldAccumulator accumulator =
          minimal.collect(
              FieldDescriptor.of("t", FieldKind.TEXT),
              List.of(row(1, "t", RawValue.string("bell\u0007"))));

      assertThat(accumulator.getNonPrintableIds().isEmpty()).isTrue();
    }
  }

  @Test
  @DisplayName("Should count invalid temporal values as null and keep row alignment")
  void shouldAlignTemporalValues() {
    FieldAccumulator accumulator =
        collector.collect(
            FieldDescriptor.of("d", FieldKind.TEMPORAL),
            List.of(
                row(1, "d", RawValue.date(LocalDate.of(2024, 1, 1))),
                row(2, "d", RawValue.invalidDate()),
                row(3, "d", RawValue.nullValue())));

    assertThat(accumulator.getNullCount()).isEqualTo(2);
    assertThat(accumulator.getTemporalValues()).hasSize(3);
    assertThat(accumulator.getTemporalValues().get(1)).isNull();
  }

  @Test
  @DisplayName("Should detect control and separator characters")
  void shouldDetectNonPrintableCharacters() {
    assertThat(TextCharacters.hasNonPrintable("plain text")).isFalse();
    assertThat(TextCharacters.hasNonPrintable("line\nbreak\tand tab")).isFalse();
    assertThat(TextCharacters.hasNonPrintable("zero\u200Bwidth")).isTrue();
    assertThat(TextCharacters.hasNonPrintable("no\u00A0break")).isTrue();
  }
}
