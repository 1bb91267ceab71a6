package com.fieldprofiler.profiler.service.export;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.stream.Collectors;

import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.model.StatisticKeys;

/**
 * Deterministic string rendering of statistic values. Decimals use a fixed number of places, the
 * Shapiro-Wilk p-value four significant digits; NaN prints as {@code NaN} so it stays distinct
 * from the N/A labels.
 */
public class StatValueFormatter {

  static final int P_VALUE_SIGNIFICANT_DIGITS = 4;

  private final int decimalPlaces;

  public StatValueFormatter(int decimalPlaces) {
    this.decimalPlaces = decimalPlaces;
  }

  public String format(String key, StatValue value) {
    if (value == null) {
      return "";
    }
    switch (value.getKind()) {
      case INTEGER:
        return Long.toString(value.asLong());
      case DECIMAL:
        return StatisticKeys.NORMALITY_P.equals(key)
            ? formatSignificant(value.asDouble(), P_VALUE_SIGNIFICANT_DIGITS)
            : formatFixed(value.asDouble());
      case PERCENT:
        return formatFixed(value.asDouble()) + "%";
      case BOOLEAN:
        return Boolean.toString(value.asBoolean());
      case TEXT:
        return value.asText();
      case LIST:
        String delimiter = StatisticKeys.MODES.equals(key) ? ", " : "; ";
        return value.asList().stream()
            .map(item -> format(key, item))
            .collect(Collectors.joining(delimiter));
      case NOT_APPLICABLE:
        return formatNotApplicable(value);
      default:
        throw new IllegalStateException("Unhandled statistic kind: " + value.getKind());
    }
  }

  String formatFixed(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    return String.format(Locale.ROOT, "%." + decimalPlaces + "f", value);
  }

  /** Mirrors printf's {@code %g} with trailing zeros removed. */
  static String formatSignificant(double value, int digits) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    if (value == 0) {
      return "0";
    }
    BigDecimal rounded =
        new BigDecimal(value).round(new MathContext(digits, RoundingMode.HALF_EVEN));
    int exponent = rounded.precision() - rounded.scale() - 1;
    if (exponent < -4 || exponent >= digits) {
      BigDecimal mantissa = rounded.movePointLeft(exponent).stripTrailingZeros();
      String sign = exponent < 0 ? "-" : "+";
      int magnitude = Math.abs(exponent);
      return mantissa.toPlainString() + "e" + sign + (magnitude < 10 ? "0" : "") + magnitude;
    }
    return rounded.stripTrailingZeros().toPlainString();
  }

  private static String formatNotApplicable(StatValue value) {
    if (value.getReason() == NotApplicableReason.COMPUTATION_ERROR && value.getDetail() != null) {
      return "N/A (Error: " + value.getDetail() + ")";
    }
    return value.getReason().getLabel();
  }

  /** Plain decimal form of a number for use inside filter expressions. */
  public static String plainNumber(double value) {
    BigDecimal decimal = new BigDecimal(Double.toString(value));
    String plain = decimal.toPlainString();
    return plain.contains(".") ? plain : plain + ".0";
  }
}
