package com.fieldprofiler.profiler.service.analysis;

import static com.fieldprofiler.profiler.model.StatisticKeys.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.RawValue;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.service.collection.FieldAccumulator;
import com.fieldprofiler.profiler.service.collection.TextCharacters;

/**
 * Length, frequency, whitespace, case, word and pattern statistics for text fields. Values are
 * coerced to strings; lengths count code points.
 */
@Component
public class TextAnalyzer implements FieldAnalyzer {

  static final int PREVIEW_LENGTH = 50;
  static final int TOP_WORDS_LIMIT = 10;
  static final String EMPTY_STRING_PREVIEW = "'(Empty String)'";

  static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "that", "the", "to", "was", "were", "will", "with");

  private static final Pattern PUNCTUATION =
      Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern OUTER_WHITESPACE =
      Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern EMAIL =
      Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b");
  private static final Pattern URL = Pattern.compile("https?://[^\\s/$.?#].[^\\s]*");

  private static final Set<String> ZERO_WHEN_EMPTY =
      Set.of(
          EMPTY_STRINGS, LEADING_TRAILING_SPACES, INTERNAL_MULTIPLE_SPACES, VARIETY,
          VALUES_OCCURRING_ONCE, NON_PRINTABLE_COUNT);
  private static final Set<String> PERCENT_WHEN_EMPTY =
      Set.of(
          PERCENT_EMPTY, PERCENT_UPPERCASE, PERCENT_LOWERCASE, PERCENT_TITLECASE,
          PERCENT_MIXED_CASE);
  private static final Set<String> BASE_KEYS = Set.of(NON_NULL_COUNT, NULL_COUNT, PERCENT_NULL);

  enum CaseClass {
    UPPER,
    TITLE,
    LOWER,
    MIXED
  }

  @Override
  public FieldKind getKind() {
    return FieldKind.TEXT;
  }

  @Override
  public void analyze(
      FieldAccumulator accumulator, AnalysisOptions options, FieldReport.Builder report) {
    List<String> values = new ArrayList<>();
    for (RawValue raw : accumulator.getNonNullValues()) {
      values.add(raw.asText());
    }
    if (values.isEmpty()) {
      putEmpty(report);
      return;
    }
    int nonNullCount = values.size();

    List<String> nonEmpty = new ArrayList<>();
    for (String value : values) {
      if (!value.isEmpty()) {
        nonEmpty.add(value);
      }
    }
    int emptyCount = nonNullCount - nonEmpty.size();
    report.put(EMPTY_STRINGS, StatValue.integer(emptyCount));
    report.put(PERCENT_EMPTY, StatValue.percent(emptyCount * 100.0 / nonNullCount));
    putLengths(nonEmpty, report);

    Map<String, Long> counts = new LinkedHashMap<>();
    for (String value : values) {
      counts.merge(value, 1L, Long::sum);
    }
    report.put(VARIETY, StatValue.integer(counts.size()));
    putTopValues(counts, options.getTopValuesLimit(), report);

    if (options.isTextRarityAndNonPrintable()) {
      long once =
          counts.entrySet().stream()
              .filter(e -> e.getValue() == 1 && !e.getKey().isEmpty())
              .count();
      long nonPrintable = values.stream().filter(TextCharacters::hasNonPrintable).count();
      report.put(VALUES_OCCURRING_ONCE, StatValue.integer(once));
      report.put(NON_PRINTABLE_COUNT, StatValue.integer(nonPrintable));
    } else {
      report.put(VALUES_OCCURRING_ONCE, StatValue.disabled());
      report.put(NON_PRINTABLE_COUNT, StatValue.disabled());
    }

    if (options.isTextCaseAnalysis()) {
      putCaseAnalysis(nonEmpty, report);
    } else {
      report.put(PERCENT_UPPERCASE, StatValue.disabled());
      report.put(PERCENT_LOWERCASE, StatValue.disabled());
      report.put(PERCENT_TITLECASE, StatValue.disabled());
      report.put(PERCENT_MIXED_CASE, StatValue.disabled());
      report.put(INTERNAL_MULTIPLE_SPACES, StatValue.disabled());
    }

    long padded = nonEmpty.stream().filter(s -> !s.equals(stripWhitespace(s))).count();
    report.put(LEADING_TRAILING_SPACES, StatValue.integer(padded));
    report.put(TOP_WORDS, topWords(nonEmpty));
    report.put(PATTERN_MATCHES, StatValue.text(patternMatches(nonEmpty)));
  }

  private static void putLengths(List<String> nonEmpty, FieldReport.Builder report) {
    if (nonEmpty.isEmpty()) {
      report.put(MIN_LENGTH, StatValue.na());
      report.put(MAX_LENGTH, StatValue.na());
      report.put(AVG_LENGTH, StatValue.na());
      return;
    }
    long min = Long.MAX_VALUE;
    long max = 0;
    long total = 0;
    for (String value : nonEmpty) {
      int length = value.codePointCount(0, value.length());
      min = Math.min(min, length);
      max = Math.max(max, length);
      total += length;
    }
    report.put(MIN_LENGTH, StatValue.integer(min));
    report.put(MAX_LENGTH, StatValue.integer(max));
    report.put(AVG_LENGTH, StatValue.decimal((double) total / nonEmpty.size()));
  }

  private static void putTopValues(
      Map<String, Long> counts, int limit, FieldReport.Builder report) {
    List<Map.Entry<String, Long>> sorted = new ArrayList<>(counts.entrySet());
    sorted.sort(
        Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));
    List<StatValue> top = new ArrayList<>();
    for (Map.Entry<String, Long> entry : sorted.subList(0, Math.min(limit, sorted.size()))) {
      top.add(StatValue.text(preview(entry.getKey()) + ": " + entry.getValue()));
    }
    report.put(TOP_VALUES, StatValue.list(top));
    report.topValue(sorted.get(0).getKey());
  }

  static String preview(String value) {
    if (value.isEmpty()) {
      return EMPTY_STRING_PREVIEW;
    }
    int codePoints = value.codePointCount(0, value.length());
    if (codePoints <= PREVIEW_LENGTH) {
      return "'" + value + "'";
    }
    int end = value.offsetByCodePoints(0, PREVIEW_LENGTH);
    return "'" + value.substring(0, end) + "...'";
  }

  private static void putCaseAnalysis(List<String> nonEmpty, FieldReport.Builder report) {
    if (nonEmpty.isEmpty()) {
      report.put(PERCENT_UPPERCASE, StatValue.percent(0.0));
      report.put(PERCENT_LOWERCASE, StatValue.percent(0.0));
      report.put(PERCENT_TITLECASE, StatValue.percent(0.0));
      report.put(PERCENT_MIXED_CASE, StatValue.percent(0.0));
      report.put(INTERNAL_MULTIPLE_SPACES, StatValue.integer(0));
      return;
    }
    long[] classCounts = new long[CaseClass.values().length];
    long multipleSpaces = 0;
    for (String value : nonEmpty) {
      classCounts[classify(value).ordinal()]++;
      if (stripWhitespace(value).contains("  ")) {
        multipleSpaces++;
      }
    }
    int total = nonEmpty.size();
    report.put(PERCENT_UPPERCASE, share(classCounts, CaseClass.UPPER, total));
    report.put(PERCENT_LOWERCASE, share(classCounts, CaseClass.LOWER, total));
    report.put(PERCENT_TITLECASE, share(classCounts, CaseClass.TITLE, total));
    report.put(PERCENT_MIXED_CASE, share(classCounts, CaseClass.MIXED, total));
    report.put(INTERNAL_MULTIPLE_SPACES, StatValue.integer(multipleSpaces));
  }

  private static StatValue share(long[] classCounts, CaseClass caseClass, int total) {
    return StatValue.percent(classCounts[caseClass.ordinal()] * 100.0 / total);
  }

  /**
   * Mutually exclusive case class, checked in the order upper, title, lower. Strings without
   * cased characters are {@link CaseClass#MIXED}.
   */
  static CaseClass classify(String value) {
    boolean hasUpper = false;
    boolean hasLower = false;
    boolean titled = true;
    boolean previousCased = false;
    for (int i = 0; i < value.length(); ) {
      int cp = value.codePointAt(i);
      i += Character.charCount(cp);
      boolean upper = Character.isUpperCase(cp) || Character.isTitleCase(cp);
      boolean lower = Character.isLowerCase(cp);
      if (upper) {
        hasUpper = true;
        if (previousCased) {
          titled = false;
        }
      } else if (lower) {
        hasLower = true;
        if (!previousCased) {
          titled = false;
        }
      }
      previousCased = upper || lower;
    }
    if (hasUpper && !hasLower) {
      return CaseClass.UPPER;
    }
    if (hasUpper && titled) {
      return CaseClass.TITLE;
    }
    if (hasLower && !hasUpper) {
      return CaseClass.LOWER;
    }
    return CaseClass.MIXED;
  }

  private static StatValue topWords(List<String> nonEmpty) {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (String text : nonEmpty) {
      String cleaned = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
      for (String token : WHITESPACE.split(stripWhitespace(cleaned))) {
        String word = trimHyphens(token);
        if (!word.isEmpty() && !STOP_WORDS.contains(word) && !isDigits(word)) {
          counts.merge(word, 1L, Long::sum);
        }
      }
    }
    if (counts.isEmpty()) {
      return StatValue.notApplicable(NotApplicableReason.NO_WORDS);
    }
    // stable sort keeps first-seen order among equal counts
    List<Map.Entry<String, Long>> sorted = new ArrayList<>(counts.entrySet());
    sorted.sort(Map.Entry.comparingByValue(Comparator.reverseOrder()));
    List<StatValue> words = new ArrayList<>();
    int limit = Math.min(TOP_WORDS_LIMIT, sorted.size());
    for (Map.Entry<String, Long> entry : sorted.subList(0, limit)) {
      words.add(StatValue.text(entry.getKey() + ":" + entry.getValue()));
    }
    return StatValue.list(words);
  }

  /** Strips leading and trailing characters matched by the Unicode {@code \s} class. */
  static String stripWhitespace(String value) {
    return OUTER_WHITESPACE.matcher(value).replaceAll("");
  }

  private static String trimHyphens(String token) {
    int start = 0;
    int end = token.length();
    while (start < end && token.charAt(start) == '-') {
      start++;
    }
    while (end > start && token.charAt(end - 1) == '-') {
      end--;
    }
    return token.substring(start, end);
  }

  static boolean isDigits(String value) {
    return !value.isEmpty() && value.codePoints().allMatch(Character::isDigit);
  }

  private static String patternMatches(List<String> nonEmpty) {
    long emails = nonEmpty.stream().filter(s -> EMAIL.matcher(s).find()).count();
    long urls = nonEmpty.stream().filter(s -> URL.matcher(s).find()).count();
    return "Emails: " + emails + ", URLs: " + urls;
  }

  private static void putEmpty(FieldReport.Builder report) {
    report.put(STATUS, StatValue.text("No text data"));
    for (String key : TEXT) {
      if (BASE_KEYS.contains(key)) {
        continue;
      }
      if (ZERO_WHEN_EMPTY.contains(key)) {
        report.put(key, StatValue.integer(0));
      } else if (PERCENT_WHEN_EMPTY.contains(key)) {
        report.put(key, StatValue.percent(0.0));
      } else {
        report.put(key, StatValue.na());
      }
    }
  }
}
