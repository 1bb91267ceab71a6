package com.fieldprofiler.profiler.service.collection;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fieldprofiler.profiler.model.RawValue;

@DisplayName("NumberParser Tests")
class NumberParserTest {

  @Test
  @DisplayName("Should read plain, signed, padded and exponent numbers")
  void shouldParseNumbers() {
    assertThat(NumberParser.parse("42")).isEqualTo(42.0);
    assertThat(NumberParser.parse(" -3.5 ")).isEqualTo(-3.5);
    assertThat(NumberParser.parse("1e3")).isEqualTo(1000.0);
    assertThat(NumberParser.parse("+.5")).isEqualTo(0.5);
  }

  @Test
  @DisplayName("Should read NaN and infinity spellings")
  void shouldParseSpecialValues() {
    assertThat(NumberParser.parse("nan")).isNaN();
    assertThat(NumberParser.parse("-Infinity")).isEqualTo(Double.NEGATIVE_INFINITY);
    assertThat(NumberParser.parse("inf")).isEqualTo(Double.POSITIVE_INFINITY);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "abc", "1,5", "0x1F", "1.5d", "2f", "12abc"})
  @DisplayName("Should reject text that is not a number")
  void shouldRejectNonNumbers(String text) {
    assertThat(NumberParser.parse(text)).isNull();
  }

  @Test
  @DisplayName("Should convert raw values by type")
  void shouldParseRawValues() {
    assertThat(NumberParser.parse(RawValue.number(7))).isEqualTo(7.0);
    assertThat(NumberParser.parse(RawValue.string("8.25"))).isEqualTo(8.25);
    assertThat(NumberParser.parse(RawValue.nullValue())).isNull();
    assertThat(NumberParser.parse(RawValue.date(LocalDate.of(2024, 1, 1)))).isNull();
  }
}
