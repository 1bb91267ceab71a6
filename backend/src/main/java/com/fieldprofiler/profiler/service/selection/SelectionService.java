package com.fieldprofiler.profiler.service.selection;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import org.springframework.stereotype.Service;

import com.fieldprofiler.profiler.dto.profile.SelectionResponse;
import com.fieldprofiler.profiler.exception.ResourceNotFoundException;
import com.fieldprofiler.profiler.model.AnalysisScope;
import com.fieldprofiler.profiler.model.BoundedRowIds;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.model.StatisticKeys;
import com.fieldprofiler.profiler.service.export.StatValueFormatter;
import com.fieldprofiler.profiler.service.storage.StoredAnalysis;

import lombok.extern.slf4j.Slf4j;

/**
 * Derives, for one statistic of one field, how to select the rows behind it: a filter expression
 * (null, empty, padded, outlier and top-value statistics) or the stored row ids (conversion
 * errors, non-printable text).
 */
@Slf4j
@Service
public class SelectionService {

  private static final DateTimeFormatter ISO_DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

  public SelectionResponse derive(StoredAnalysis analysis, String fieldName, String statistic) {
    ProfileResult result = analysis.getResult();
    FieldReport report = result.report(fieldName);
    if (report == null) {
      throw new ResourceNotFoundException(
          "Field '" + fieldName + "' is not part of analysis " + analysis.getId());
    }
    FieldKind kind = report.getKind();
    String field = quote(fieldName);

    SelectionResponse.SelectionResponseBuilder selection =
        SelectionResponse.builder()
            .field(fieldName)
            .statistic(statistic)
            .intersectWithScope(result.getScope() == AnalysisScope.SELECTED);

    switch (statistic) {
      case StatisticKeys.NULL_COUNT:
        return expression(selection, field + " IS NULL");
      case StatisticKeys.EMPTY_STRINGS:
        requireKind(kind, FieldKind.TEXT, statistic);
        return expression(selection, field + " = ''");
      case StatisticKeys.LEADING_TRAILING_SPACES:
        requireKind(kind, FieldKind.TEXT, statistic);
        return expression(
            selection,
            field + " != trim(" + field + ") AND length(trim(" + field + ")) > 0");
      case StatisticKeys.OUTLIERS:
        requireKind(kind, FieldKind.NUMERIC, statistic);
        return expression(selection, outlierExpression(report, field));
      case StatisticKeys.TOP_VALUES:
        return expression(selection, topValueExpression(report, field));
      case StatisticKeys.CONVERSION_ERRORS:
        requireKind(kind, FieldKind.NUMERIC, statistic);
        return rowIds(
            selection,
            result.getConversionErrorIds().get(fieldName),
            "No features with conversion errors recorded.");
      case StatisticKeys.NON_PRINTABLE_COUNT:
        requireKind(kind, FieldKind.TEXT, statistic);
        return rowIds(
            selection,
            result.getNonPrintableIds().get(fieldName),
            "No features with non-printable characters recorded.");
      default:
        throw new IllegalArgumentException(
            "Statistic '" + statistic + "' does not support row selection");
    }
  }

  private static String outlierExpression(FieldReport report, String field) {
    double q1 = finiteDecimal(report.get(StatisticKeys.Q1));
    double q3 = finiteDecimal(report.get(StatisticKeys.Q3));
    double iqr = finiteDecimal(report.get(StatisticKeys.IQR));
    if (Double.isNaN(q1) || Double.isNaN(q3) || Double.isNaN(iqr)) {
      throw new IllegalArgumentException("Q1, Q3, or IQR is N/A for outlier selection.");
    }
    double lower = q1 - 1.5 * iqr;
    double upper = q3 + 1.5 * iqr;
    return "("
        + field
        + " < "
        + StatValueFormatter.plainNumber(lower)
        + " OR "
        + field
        + " > "
        + StatValueFormatter.plainNumber(upper)
        + ") AND "
        + field
        + " IS NOT NULL";
  }

  private static String topValueExpression(FieldReport report, String field) {
    if (!report.hasTopValue()) {
      throw new IllegalArgumentException("No specific unique value cached for selection.");
    }
    Object value = report.getTopValue();
    if (value instanceof String) {
      return field + " = '" + ((String) value).replace("'", "''") + "'";
    }
    if (value instanceof Number) {
      double number = ((Number) value).doubleValue();
      if (Double.isNaN(number)) {
        throw new IllegalArgumentException(
            "Cannot select NaN unique value directly by expression.");
      }
      return field + " = " + StatValueFormatter.plainNumber(number);
    }
    if (value instanceof LocalDateTime) {
      return field + " = datetime('" + ((LocalDateTime) value).format(ISO_DATE_TIME) + "')";
    }
    if (value instanceof LocalDate) {
      return field + " = date('" + value + "')";
    }
    throw new IllegalArgumentException(
        "Cannot select unique value of type: " + value.getClass().getSimpleName());
  }

  private static SelectionResponse expression(
      SelectionResponse.SelectionResponseBuilder selection, String expression) {
    log.debug("Selection expression: {}", expression);
    return selection.type(SelectionResponse.Type.EXPRESSION).expression(expression).build();
  }

  private static SelectionResponse rowIds(
      SelectionResponse.SelectionResponseBuilder selection,
      BoundedRowIds ids,
      String emptyMessage) {
    if (ids == null || ids.isEmpty()) {
      throw new IllegalArgumentException(emptyMessage);
    }
    return selection
        .type(SelectionResponse.Type.ROW_IDS)
        .rowIds(ids.getIds())
        .capped(ids.isCapped())
        .build();
  }

  private static void requireKind(FieldKind actual, FieldKind expected, String statistic) {
    if (actual != expected) {
      throw new IllegalArgumentException(
          "Statistic '" + statistic + "' is only selectable on " + expected + " fields");
    }
  }

  private static double finiteDecimal(StatValue value) {
    if (value == null || !value.isNumber()) {
      return Double.NaN;
    }
    double number = value.asDouble();
    return Double.isInfinite(number) ? Double.NaN : number;
  }

  static String quote(String fieldName) {
    return "\"" + fieldName.replace("\"", "\"\"") + "\"";
  }
}
