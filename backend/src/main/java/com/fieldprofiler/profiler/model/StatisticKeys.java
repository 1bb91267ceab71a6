package com.fieldprofiler.profiler.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Fixed vocabulary of statistic names and their canonical presentation order. */
public final class StatisticKeys {

  public static final String NON_NULL_COUNT = "Non-Null Count";
  public static final String NULL_COUNT = "Null Count";
  public static final String PERCENT_NULL = "% Null";
  public static final String CONVERSION_ERRORS = "Conversion Errors";
  public static final String MIN = "Min";
  public static final String MAX = "Max";
  public static final String RANGE = "Range";
  public static final String SUM = "Sum";
  public static final String MEAN = "Mean";
  public static final String MEDIAN = "Median";
  public static final String STDEV = "Stdev (pop)";
  public static final String MODES = "Mode(s)";
  public static final String VARIETY = "Variety (distinct)";
  public static final String Q1 = "Q1";
  public static final String Q3 = "Q3";
  public static final String IQR = "IQR";
  public static final String OUTLIERS = "Outliers (IQR)";
  public static final String MIN_OUTLIER = "Min Outlier";
  public static final String MAX_OUTLIER = "Max Outlier";
  public static final String PERCENT_OUTLIERS = "% Outliers";
  public static final String LOW_VARIANCE = "Low Variance Flag";
  public static final String ZEROS = "Zeros";
  public static final String POSITIVES = "Positives";
  public static final String NEGATIVES = "Negatives";
  public static final String CV = "CV %";
  public static final String INTEGER_VALUES = "Integer Values";
  public static final String DECIMAL_VALUES = "Decimal Values";
  public static final String PERCENT_INTEGER = "% Integer Values";
  public static final String SKEWNESS = "Skewness";
  public static final String KURTOSIS = "Kurtosis";
  public static final String NORMALITY_P = "Normality (Shapiro-Wilk p)";
  public static final String LIKELY_NORMAL = "Normality (Likely Normal)";
  public static final String PCTL_1 = "1st Pctl";
  public static final String PCTL_5 = "5th Pctl";
  public static final String PCTL_95 = "95th Pctl";
  public static final String PCTL_99 = "99th Pctl";
  public static final String OPTIMAL_BINS = "Optimal Bins (Freedman-Diaconis)";

  public static final String EMPTY_STRINGS = "Empty Strings";
  public static final String PERCENT_EMPTY = "% Empty";
  public static final String LEADING_TRAILING_SPACES = "Leading/Trailing Spaces";
  public static final String INTERNAL_MULTIPLE_SPACES = "Internal Multiple Spaces";
  public static final String MIN_LENGTH = "Min Length";
  public static final String MAX_LENGTH = "Max Length";
  public static final String AVG_LENGTH = "Avg Length";
  public static final String TOP_VALUES = "Unique Values (Top)";
  public static final String VALUES_OCCURRING_ONCE = "Values Occurring Once";
  public static final String TOP_WORDS = "Top Words";
  public static final String PATTERN_MATCHES = "Pattern Matches";
  public static final String PERCENT_UPPERCASE = "% Uppercase";
  public static final String PERCENT_LOWERCASE = "% Lowercase";
  public static final String PERCENT_TITLECASE = "% Titlecase";
  public static final String PERCENT_MIXED_CASE = "% Mixed Case";
  public static final String NON_PRINTABLE_COUNT = "Non-Printable Chars Count";

  public static final String MIN_DATE = "Min Date";
  public static final String MAX_DATE = "Max Date";
  public static final String COMMON_YEARS = "Common Years";
  public static final String COMMON_MONTHS = "Common Months";
  public static final String COMMON_DAYS = "Common Days";
  public static final String COMMON_HOURS = "Common Hours (Top 3)";
  public static final String PERCENT_MIDNIGHT = "% Midnight Time";
  public static final String PERCENT_NOON = "% Noon Time";
  public static final String PERCENT_WEEKEND = "% Weekend Dates";
  public static final String PERCENT_WEEKDAY = "% Weekday Dates";
  public static final String DATES_BEFORE_TODAY = "Dates Before Today";
  public static final String DATES_AFTER_TODAY = "Dates After Today";

  public static final String STATUS = "Status";
  public static final String TYPE_MISMATCH_HINT = "Data Type Mismatch Hint";
  public static final String ERROR = "Error";

  public static final List<String> NUMERIC =
      List.of(
          NON_NULL_COUNT, NULL_COUNT, PERCENT_NULL, CONVERSION_ERRORS,
          MIN, MAX, RANGE, SUM, MEAN, MEDIAN, STDEV, MODES,
          VARIETY, Q1, Q3, IQR,
          OUTLIERS, MIN_OUTLIER, MAX_OUTLIER, PERCENT_OUTLIERS,
          LOW_VARIANCE,
          ZEROS, POSITIVES, NEGATIVES, CV,
          INTEGER_VALUES, DECIMAL_VALUES, PERCENT_INTEGER,
          SKEWNESS, KURTOSIS, NORMALITY_P, LIKELY_NORMAL,
          PCTL_1, PCTL_5, PCTL_95, PCTL_99,
          OPTIMAL_BINS);

  public static final List<String> TEXT =
      List.of(
          NON_NULL_COUNT, NULL_COUNT, PERCENT_NULL, EMPTY_STRINGS, PERCENT_EMPTY,
          LEADING_TRAILING_SPACES, INTERNAL_MULTIPLE_SPACES,
          VARIETY, MIN_LENGTH, MAX_LENGTH, AVG_LENGTH,
          TOP_VALUES, VALUES_OCCURRING_ONCE,
          TOP_WORDS, PATTERN_MATCHES,
          PERCENT_UPPERCASE, PERCENT_LOWERCASE, PERCENT_TITLECASE, PERCENT_MIXED_CASE,
          NON_PRINTABLE_COUNT);

  public static final List<String> TEMPORAL =
      List.of(
          NON_NULL_COUNT, NULL_COUNT, PERCENT_NULL, MIN_DATE, MAX_DATE,
          TOP_VALUES,
          COMMON_YEARS, COMMON_MONTHS, COMMON_DAYS,
          COMMON_HOURS, PERCENT_MIDNIGHT, PERCENT_NOON,
          PERCENT_WEEKEND, PERCENT_WEEKDAY,
          DATES_BEFORE_TODAY, DATES_AFTER_TODAY);

  public static final List<String> OTHER =
      List.of(NON_NULL_COUNT, NULL_COUNT, PERCENT_NULL, STATUS, TYPE_MISMATCH_HINT);

  public static final List<String> ERRORS = List.of(ERROR, STATUS);

  private static final List<String> CANONICAL_ORDER = buildCanonicalOrder();

  private static final Map<String, String> DESCRIPTIONS = buildDescriptions();

  private StatisticKeys() {}

  /** Predefined keys grouped by kind (numeric, text, temporal, other, error), no duplicates. */
  public static List<String> canonicalOrder() {
    return CANONICAL_ORDER;
  }

  /**
   * Orders the given keys canonically; keys outside the vocabulary follow, alphabetically.
   */
  public static List<String> order(Collection<String> keys) {
    Set<String> present = new LinkedHashSet<>(keys);
    List<String> ordered = new ArrayList<>();
    for (String key : CANONICAL_ORDER) {
      if (present.remove(key)) {
        ordered.add(key);
      }
    }
    ordered.addAll(new TreeSet<>(present));
    return ordered;
  }

  public static String describe(String key) {
    return DESCRIPTIONS.getOrDefault(key, "No description available.");
  }

  public static Map<String, String> descriptions() {
    return DESCRIPTIONS;
  }

  private static List<String> buildCanonicalOrder() {
    Set<String> order = new LinkedHashSet<>();
    order.addAll(NUMERIC);
    order.addAll(TEXT);
    order.addAll(TEMPORAL);
    order.addAll(OTHER);
    order.addAll(ERRORS);
    return List.copyOf(order);
  }

  private static Map<String, String> buildDescriptions() {
    Map<String, String> d = new LinkedHashMap<>();
    d.put(NON_NULL_COUNT, "Number of rows with non-missing values.");
    d.put(NULL_COUNT, "Number of rows with missing (NULL) values.");
    d.put(PERCENT_NULL, "Percentage of rows in scope with missing (NULL) values.");
    d.put(
        CONVERSION_ERRORS,
        "Number of values that could not be converted to a number (numeric fields).");
    d.put(LOW_VARIANCE, "True if standard deviation is close to zero or all values are identical.");
    d.put(OUTLIERS, "Number of values outside Q1 - 1.5*IQR and Q3 + 1.5*IQR.");
    d.put(MIN_OUTLIER, "Minimum value among those flagged as outliers by the IQR method.");
    d.put(MAX_OUTLIER, "Maximum value among those flagged as outliers by the IQR method.");
    d.put(PERCENT_OUTLIERS, "Percentage of values flagged as outliers by the IQR method.");
    d.put(MIN, "Minimum value.");
    d.put(MAX, "Maximum value.");
    d.put(RANGE, "Difference between Max and Min values.");
    d.put(SUM, "Sum of all numeric values.");
    d.put(MEAN, "Average of numeric values.");
    d.put(MEDIAN, "Median (middle) value of numeric data.");
    d.put(STDEV, "Population standard deviation.");
    d.put(MODES, "Most frequently occurring value(s).");
    d.put(VARIETY, "Number of unique distinct values.");
    d.put(Q1, "First quartile (25th percentile).");
    d.put(Q3, "Third quartile (75th percentile).");
    d.put(IQR, "Interquartile range (Q3 - Q1).");
    d.put(ZEROS, "Count of zero values.");
    d.put(POSITIVES, "Count of positive values.");
    d.put(NEGATIVES, "Count of negative values.");
    d.put(CV, "Coefficient of variation (Stdev / Mean * 100). NaN if the mean is zero.");
    d.put(INTEGER_VALUES, "Count of numeric values that are whole numbers.");
    d.put(DECIMAL_VALUES, "Count of numeric values with a fractional part.");
    d.put(PERCENT_INTEGER, "Percentage of numeric values that are whole numbers.");
    d.put(SKEWNESS, "Measure of asymmetry. Positive: tail on right. Negative: tail on left.");
    d.put(KURTOSIS, "Measure of tailedness (Fisher's, normal=0).");
    d.put(
        NORMALITY_P,
        "P-value from the Shapiro-Wilk normality test. Low p (<0.05) suggests non-normal data.");
    d.put(LIKELY_NORMAL, "True if the Shapiro-Wilk p-value is above 0.05.");
    d.put(PCTL_1, "1st percentile.");
    d.put(PCTL_5, "5th percentile.");
    d.put(PCTL_95, "95th percentile.");
    d.put(PCTL_99, "99th percentile.");
    d.put(OPTIMAL_BINS, "Suggested histogram bin count using the Freedman-Diaconis rule.");
    d.put(EMPTY_STRINGS, "Number of non-null strings that are empty ('').");
    d.put(PERCENT_EMPTY, "Percentage of non-null strings that are empty.");
    d.put(
        LEADING_TRAILING_SPACES,
        "Number of non-empty strings with leading or trailing whitespace.");
    d.put(
        INTERNAL_MULTIPLE_SPACES,
        "Number of non-empty strings with consecutive internal spaces (e.g. 'word  word').");
    d.put(MIN_LENGTH, "Minimum length of non-empty strings.");
    d.put(MAX_LENGTH, "Maximum length of non-empty strings.");
    d.put(AVG_LENGTH, "Average length of non-empty strings.");
    d.put(TOP_VALUES, "Most frequent distinct values and their counts.");
    d.put(VALUES_OCCURRING_ONCE, "Count of distinct values that appear only once.");
    d.put(TOP_WORDS, "Most frequent words after removing stop words and punctuation.");
    d.put(PATTERN_MATCHES, "Counts of values containing e-mail addresses or URLs.");
    d.put(PERCENT_UPPERCASE, "Percentage of non-empty strings that are entirely uppercase.");
    d.put(PERCENT_LOWERCASE, "Percentage of non-empty strings that are entirely lowercase.");
    d.put(PERCENT_TITLECASE, "Percentage of non-empty strings in title case.");
    d.put(PERCENT_MIXED_CASE, "Percentage of non-empty strings that are none of the above.");
    d.put(
        NON_PRINTABLE_COUNT,
        "Number of strings containing non-printable characters (tab, newline and CR excluded).");
    d.put(MIN_DATE, "Earliest date/datetime found.");
    d.put(MAX_DATE, "Latest date/datetime found.");
    d.put(COMMON_YEARS, "Most frequent years.");
    d.put(COMMON_MONTHS, "Most frequent months.");
    d.put(COMMON_DAYS, "Most frequent days of the week.");
    d.put(COMMON_HOURS, "Most frequent hours for datetime values.");
    d.put(PERCENT_MIDNIGHT, "Percentage of datetime values at exactly 00:00:00.");
    d.put(PERCENT_NOON, "Percentage of datetime values at exactly 12:00:00.");
    d.put(PERCENT_WEEKEND, "Percentage of dates falling on a Saturday or Sunday.");
    d.put(PERCENT_WEEKDAY, "Percentage of dates falling on a weekday (Mon-Fri).");
    d.put(DATES_BEFORE_TODAY, "Count of dates before today.");
    d.put(DATES_AFTER_TODAY, "Count of dates after today.");
    d.put(STATUS, "General status or summary of the field analysis.");
    d.put(ERROR, "An error occurred during analysis of this field.");
    d.put(
        TYPE_MISMATCH_HINT,
        "A suggestion if the field's content statistically resembles a different data type.");
    return Collections.unmodifiableMap(d);
  }
}
