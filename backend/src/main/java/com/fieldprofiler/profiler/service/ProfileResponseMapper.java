package com.fieldprofiler.profiler.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.fieldprofiler.profiler.dto.profile.AnalysisOptionsRequest;
import com.fieldprofiler.profiler.dto.profile.AnalysisSummary;
import com.fieldprofiler.profiler.dto.profile.FieldProfile;
import com.fieldprofiler.profiler.dto.profile.ProfileResponse;
import com.fieldprofiler.profiler.dto.profile.RowIdList;
import com.fieldprofiler.profiler.dto.profile.StatisticValue;
import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.BoundedRowIds;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.model.StatisticKeys;
import com.fieldprofiler.profiler.service.export.StatValueFormatter;
import com.fieldprofiler.profiler.service.storage.StoredAnalysis;

/** Converts stored runs into their HTTP representation. */
@Component
public class ProfileResponseMapper {

  public ProfileResponse toResponse(StoredAnalysis analysis) {
    ProfileResult result = analysis.getResult();
    StatValueFormatter formatter = new StatValueFormatter(result.getOptions().getDecimalPlaces());

    List<FieldProfile> fields = new ArrayList<>();
    for (FieldReport report : result.getReports().values()) {
      Map<String, StatisticValue> statistics = new LinkedHashMap<>();
      for (String key : StatisticKeys.order(report.getStatistics().keySet())) {
        statistics.put(key, toStatistic(key, report.get(key), formatter));
      }
      fields.add(
          FieldProfile.builder()
              .fieldName(report.getFieldName())
              .kind(report.getKind().name())
              .failed(report.isFailed())
              .statistics(statistics)
              .build());
    }

    return ProfileResponse.builder()
        .analysisId(analysis.getId())
        .datasetName(analysis.getDatasetName())
        .createdAt(analysis.getCreatedAt())
        .scope(result.getScope().name())
        .rowsScanned(result.getRowsScanned())
        .totalRows(result.getTotalRows())
        .cancelled(result.isCancelled())
        .warnings(result.getWarnings())
        .fields(fields)
        .conversionErrorIds(toRowIdLists(result.getConversionErrorIds()))
        .nonPrintableIds(toRowIdLists(result.getNonPrintableIds()))
        .build();
  }

  public AnalysisSummary toSummary(StoredAnalysis analysis) {
    return AnalysisSummary.builder()
        .analysisId(analysis.getId())
        .datasetName(analysis.getDatasetName())
        .createdAt(analysis.getCreatedAt())
        .fields(
            analysis.getFields().stream()
                .map(FieldDescriptor::getName)
                .collect(Collectors.toList()))
        .rowsScanned(analysis.getResult().getRowsScanned())
        .cancelled(analysis.getResult().isCancelled())
        .build();
  }

  public AnalysisOptionsRequest toRequest(AnalysisOptions options) {
    return AnalysisOptionsRequest.builder()
        .numericDistributionShape(options.isNumericDistributionShape())
        .numericAdvancedPercentiles(options.isNumericAdvancedPercentiles())
        .numericIntegerDecimalSplit(options.isNumericIntegerDecimalSplit())
        .numericOutlierDetails(options.isNumericOutlierDetails())
        .textCaseAnalysis(options.isTextCaseAnalysis())
        .textRarityAndNonPrintable(options.isTextRarityAndNonPrintable())
        .temporalTimeAndWeekend(options.isTemporalTimeAndWeekend())
        .topValuesLimit(options.getTopValuesLimit())
        .decimalPlaces(options.getDecimalPlaces())
        .build();
  }

  StatisticValue toStatistic(String key, StatValue value, StatValueFormatter formatter) {
    StatisticValue.StatisticValueBuilder statistic =
        StatisticValue.builder()
            .kind(value.getKind().name())
            .display(formatter.format(key, value));
    if (value.isNotApplicable()) {
      return statistic.reason(value.getReason().name()).build();
    }
    return statistic.value(rawValue(value)).build();
  }

  /** JSON-safe value; NaN becomes the string "NaN". */
  private static Object rawValue(StatValue value) {
    switch (value.getKind()) {
      case DECIMAL:
      case PERCENT:
        double number = value.asDouble();
        return Double.isNaN(number) || Double.isInfinite(number) ? Double.toString(number) : number;
      case LIST:
        return value.asList().stream()
            .map(item -> item.isNotApplicable() ? null : rawValue(item))
            .collect(Collectors.toList());
      default:
        return value.getValue();
    }
  }

  private static Map<String, RowIdList> toRowIdLists(Map<String, BoundedRowIds> ids) {
    Map<String, RowIdList> lists = new LinkedHashMap<>();
    ids.forEach(
        (field, rowIds) ->
            lists.put(
                field,
                RowIdList.builder().rowIds(rowIds.getIds()).capped(rowIds.isCapped()).build()));
    return lists;
  }
}
