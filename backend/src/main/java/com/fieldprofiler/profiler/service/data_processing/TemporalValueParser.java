package com.fieldprofiler.profiler.service.data_processing;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

import com.fieldprofiler.profiler.model.RawValue;

/** ISO-8601 date and datetime parsing for host input; a space may replace the 'T'. */
public final class TemporalValueParser {

  private static final DateTimeFormatter DATE_TIME =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .optionalEnd()
          .optionalStart()
          .appendLiteral(' ')
          .optionalEnd()
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .toFormatter();

  private TemporalValueParser() {}

  /** Returns a DATE or DATETIME value, or null when {@code text} is neither. */
  public static RawValue parse(String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      return RawValue.date(LocalDate.parse(trimmed));
    } catch (DateTimeParseException notADate) {
      try {
        return RawValue.dateTime(LocalDateTime.parse(trimmed, DATE_TIME));
      } catch (DateTimeParseException notADateTime) {
        return null;
      }
    }
  }

  /** Like {@link #parse(String)} but maps unparseable text to an invalid temporal value. */
  public static RawValue parseOrInvalid(String text) {
    RawValue parsed = parse(text);
    return parsed != null ? parsed : RawValue.invalidDateTime();
  }
}
