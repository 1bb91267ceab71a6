package com.fieldprofiler.profiler.service.analysis;

import static com.fieldprofiler.profiler.model.StatisticKeys.*;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.RawValue;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.service.collection.FieldAccumulator;

import lombok.RequiredArgsConstructor;

/**
 * Range, calendar-bucket and relative-to-today statistics for date and datetime fields. A date
 * orders as midnight of its day but is never printed with a time.
 */
@Component
@RequiredArgsConstructor
public class TemporalAnalyzer implements FieldAnalyzer {

  static final int TOP_BUCKETS = 3;

  private static final DateTimeFormatter DATE_TIME_SECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter ISO_SECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
  private static final DateTimeFormatter ISO_MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

  private static final Set<String> BASE_KEYS = Set.of(NON_NULL_COUNT, NULL_COUNT, PERCENT_NULL);
  private static final Set<String> ZERO_WHEN_EMPTY = Set.of(DATES_BEFORE_TODAY, DATES_AFTER_TODAY);

  private final Clock clock;

  @Override
  public FieldKind getKind() {
    return FieldKind.TEMPORAL;
  }

  @Override
  public void analyze(
      FieldAccumulator accumulator, AnalysisOptions options, FieldReport.Builder report) {
    if (accumulator.getNonNullCount() == 0) {
      putEmpty("No date data", report);
      return;
    }

    List<Object> originals = new ArrayList<>();
    for (RawValue raw : accumulator.getTemporalValues()) {
      if (raw != null && !raw.isNull() && isTemporalObject(raw.getValue())) {
        originals.add(raw.getValue());
      }
    }
    if (originals.isEmpty()) {
      putEmpty("No valid date objects parsed from non-null values", report);
      return;
    }

    List<LocalDateTime> instants = new ArrayList<>(originals.size());
    boolean hasTime = false;
    for (Object original : originals) {
      instants.add(toDateTime(original));
      hasTime |= original instanceof LocalDateTime;
    }

    LocalDateTime min = instants.stream().min(Comparator.naturalOrder()).orElseThrow();
    LocalDateTime max = instants.stream().max(Comparator.naturalOrder()).orElseThrow();
    report.put(MIN_DATE, StatValue.text(formatBound(min, hasTime)));
    report.put(MAX_DATE, StatValue.text(formatBound(max, hasTime)));

    report.put(
        COMMON_YEARS,
        StatValue.text(topBuckets(instants, LocalDateTime::getYear, String::valueOf)));
    report.put(
        COMMON_MONTHS,
        StatValue.text(topBuckets(instants, LocalDateTime::getMonthValue, String::valueOf)));
    report.put(
        COMMON_DAYS,
        StatValue.text(
            topBuckets(
                instants,
                LocalDateTime::getDayOfWeek,
                day -> day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH))));

    LocalDate today = LocalDate.now(clock);
    long before = instants.stream().filter(d -> d.toLocalDate().isBefore(today)).count();
    long after = instants.stream().filter(d -> d.toLocalDate().isAfter(today)).count();
    report.put(DATES_BEFORE_TODAY, StatValue.integer(before));
    report.put(DATES_AFTER_TODAY, StatValue.integer(after));

    putTopValues(originals, options.getTopValuesLimit(), report);

    if (options.isTemporalTimeAndWeekend()) {
      putTimeOfDay(originals, report);
      long weekend =
          instants.stream()
              .map(LocalDateTime::getDayOfWeek)
              .filter(day -> day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)
              .count();
      int total = instants.size();
      report.put(PERCENT_WEEKEND, StatValue.percent(weekend * 100.0 / total));
      report.put(PERCENT_WEEKDAY, StatValue.percent((total - weekend) * 100.0 / total));
    } else {
      report.put(COMMON_HOURS, StatValue.disabled());
      report.put(PERCENT_MIDNIGHT, StatValue.disabled());
      report.put(PERCENT_NOON, StatValue.disabled());
      report.put(PERCENT_WEEKEND, StatValue.disabled());
      report.put(PERCENT_WEEKDAY, StatValue.disabled());
    }
  }

  private static void putTimeOfDay(List<Object> originals, FieldReport.Builder report) {
    List<LocalDateTime> timed = new ArrayList<>();
    for (Object original : originals) {
      if (original instanceof LocalDateTime) {
        timed.add((LocalDateTime) original);
      }
    }
    if (timed.isEmpty()) {
      StatValue noTime = StatValue.notApplicable(NotApplicableReason.NO_TIME_DATA);
      report.put(COMMON_HOURS, noTime);
      report.put(PERCENT_MIDNIGHT, noTime);
      report.put(PERCENT_NOON, noTime);
      return;
    }
    long midnight = timed.stream().filter(t -> t.toLocalTime().equals(LocalTime.MIDNIGHT)).count();
    long noon = timed.stream().filter(t -> t.toLocalTime().equals(LocalTime.NOON)).count();
    report.put(
        COMMON_HOURS,
        StatValue.text(
            topBuckets(
                timed, LocalDateTime::getHour, hour -> String.format("%02d:00", hour), " (", ")")));
    report.put(PERCENT_MIDNIGHT, StatValue.percent(midnight * 100.0 / timed.size()));
    report.put(PERCENT_NOON, StatValue.percent(noon * 100.0 / timed.size()));
  }

  private static void putTopValues(List<Object> originals, int limit, FieldReport.Builder report) {
    Map<Object, Long> counts =
        originals.stream()
            .collect(
                Collectors.groupingBy(
                    Function.identity(), LinkedHashMap::new, Collectors.counting()));
    List<Map.Entry<Object, Long>> sorted = new ArrayList<>(counts.entrySet());
    sorted.sort(
        Map.Entry.<Object, Long>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry::getKey, TemporalAnalyzer::chronological));
    List<StatValue> top = new ArrayList<>();
    for (Map.Entry<Object, Long> entry : sorted.subList(0, Math.min(limit, sorted.size()))) {
      top.add(StatValue.text("'" + formatIso(entry.getKey()) + "': " + entry.getValue()));
    }
    report.put(TOP_VALUES, StatValue.list(top));
    report.topValue(sorted.get(0).getKey());
  }

  /** Orders by instant; a date sorts before a datetime at its midnight. */
  static int chronological(Object left, Object right) {
    int byInstant = toDateTime(left).compareTo(toDateTime(right));
    if (byInstant != 0) {
      return byInstant;
    }
    return Boolean.compare(left instanceof LocalDateTime, right instanceof LocalDateTime);
  }

  /**
   * Top buckets as {@code key:count}, most frequent first; equal counts keep first-seen order.
   */
  static <K> String topBuckets(
      List<LocalDateTime> values,
      Function<LocalDateTime, K> bucket,
      Function<K, String> label) {
    return topBuckets(values, bucket, label, ":", "");
  }

  private static <K> String topBuckets(
      List<LocalDateTime> values,
      Function<LocalDateTime, K> bucket,
      Function<K, String> label,
      String separator,
      String suffix) {
    Map<K, Long> counts = new LinkedHashMap<>();
    for (LocalDateTime value : values) {
      counts.merge(bucket.apply(value), 1L, Long::sum);
    }
    return counts.entrySet().stream()
        .sorted(Map.Entry.comparingByValue(Comparator.reverseOrder()))
        .limit(TOP_BUCKETS)
        .map(e -> label.apply(e.getKey()) + separator + e.getValue() + suffix)
        .collect(Collectors.joining(", "));
  }

  static String formatBound(LocalDateTime value, boolean hasTime) {
    if (!hasTime) {
      return value.toLocalDate().toString();
    }
    String seconds = value.format(DATE_TIME_SECONDS);
    int micros = value.getNano() / 1000;
    return micros == 0 ? seconds : seconds + String.format(".%06d", micros);
  }

  /** ISO rendering used in top-value previews; milliseconds only when present. */
  static String formatIso(Object value) {
    if (value instanceof LocalDate) {
      return value.toString();
    }
    LocalDateTime dateTime = (LocalDateTime) value;
    return dateTime.getNano() / 1_000_000 > 0
        ? dateTime.format(ISO_MILLIS)
        : dateTime.format(ISO_SECONDS);
  }

  private static boolean isTemporalObject(Object value) {
    return value instanceof LocalDate || value instanceof LocalDateTime;
  }

  private static LocalDateTime toDateTime(Object value) {
    return value instanceof LocalDate
        ? ((LocalDate) value).atStartOfDay()
        : (LocalDateTime) value;
  }

  private static void putEmpty(String status, FieldReport.Builder report) {
    report.put(STATUS, StatValue.text(status));
    for (String key : TEMPORAL) {
      if (BASE_KEYS.contains(key)) {
        continue;
      }
      if (ZERO_WHEN_EMPTY.contains(key)) {
        report.put(key, StatValue.integer(0));
      } else if (key.startsWith("%")) {
        report.put(key, StatValue.percent(0.0));
      } else {
        report.put(key, StatValue.na());
      }
    }
  }
}
