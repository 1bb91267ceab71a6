package com.fieldprofiler.profiler.service.selection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fieldprofiler.profiler.dto.profile.SelectionResponse;
import com.fieldprofiler.profiler.exception.ResourceNotFoundException;
import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.AnalysisScope;
import com.fieldprofiler.profiler.model.BoundedRowIds;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.model.StatisticKeys;
import com.fieldprofiler.profiler.service.storage.StoredAnalysis;

@DisplayName("SelectionService Tests")
class SelectionServiceTest {

  private SelectionService selectionService;

  @BeforeEach
  void setUp() {
    selectionService = new SelectionService();
  }

  private static StoredAnalysis analysisOf(AnalysisScope scope, FieldReport... reports) {
    return analysisOf(scope, Map.of(), Map.of(), reports);
  }

  private static StoredAnalysis analysisOf(
      AnalysisScope scope,
      Map<String, BoundedRowIds> conversionErrors,
      Map<String, BoundedRowIds> nonPrintable,
      FieldReport... reports) {
    Map<String, FieldReport> byName = new LinkedHashMap<>();
    for (FieldReport report : reports) {
      byName.put(report.getFieldName(), report);
    }
    ProfileResult result =
        ProfileResult.builder()
            .reports(byName)
            .conversionErrorIds(conversionErrors)
            .nonPrintableIds(nonPrintable)
            .scope(scope)
            .options(AnalysisOptions.defaults())
            .build();
    return StoredAnalysis.builder()
        .id("run-1")
        .datasetName("parcels")
        .createdAt(LocalDateTime.of(2024, 1, 1, 0, 0))
        .fields(List.of(FieldDescriptor.of("name", FieldKind.TEXT)))
        .result(result)
        .build();
  }

  private static FieldReport text(String name) {
    return FieldReport.builder(name, FieldKind.TEXT).build();
  }

  private static FieldReport numeric(StatValue q1, StatValue q3, StatValue iqr) {
    return FieldReport.builder("amount", FieldKind.NUMERIC)
        .put(StatisticKeys.Q1, q1)
        .put(StatisticKeys.Q3, q3)
        .put(StatisticKeys.IQR, iqr)
        .build();
  }

  @Nested
  @DisplayName("Expression selections")
  class Expressions {

    @Test
    @DisplayName("Should quote field names and select nulls")
    void shouldSelectNulls() {
      SelectionResponse response =
          selectionService.derive(
              analysisOf(AnalysisScope.ALL, text("na\"me")), "na\"me", StatisticKeys.NULL_COUNT);

      assertThat(response.getType()).isEqualTo(SelectionResponse.Type.EXPRESSION);
      assertThat(response.getExpression()).isEqualTo("\"na\"\"me\" IS NULL");
      assertThat(response.isIntersectWithScope()).isFalse();
    }

    @Test
    @DisplayName("Should select empty and padded strings")
    void shouldSelectEmptyAndPadded() {
      StoredAnalysis analysis = analysisOf(AnalysisScope.SELECTED, text("name"));

      assertThat(
              selectionService
                  .derive(analysis, "name", StatisticKeys.EMPTY_STRINGS)
                  .getExpression())
          .isEqualTo("\"name\" = ''");
      SelectionResponse padded =
          selectionService.derive(analysis, "name", StatisticKeys.LEADING_TRAILING_SPACES);
      assertThat(padded.getExpression())
          .isEqualTo("\"name\" != trim(\"name\") AND length(trim(\"name\")) > 0");
      assertThat(padded.isIntersectWithScope()).isTrue();
    }

    @Test
    @DisplayName("Should select outliers from the IQR fences")
    void shouldSelectOutliers() {
      FieldReport report =
          numeric(StatValue.decimal(2.0), StatValue.decimal(4.0), StatValue.decimal(2.0));

      SelectionResponse response =
          selectionService.derive(
              analysisOf(AnalysisScope.ALL, report), "amount", StatisticKeys.OUTLIERS);

      assertThat(response.getExpression())
          .isEqualTo("(\"amount\" < -1.0 OR \"amount\" > 7.0) AND \"amount\" IS NOT NULL");
    }

    @Test
    @DisplayName("Should refuse outlier selection when the quartiles are unavailable")
    void shouldRejectOutliersWithoutQuartiles() {
      FieldReport report =
          numeric(
              StatValue.notApplicable(NotApplicableReason.INSUFFICIENT_DATA),
              StatValue.decimal(4.0),
              StatValue.decimal(Double.NaN));

      assertThatThrownBy(
              () ->
                  selectionService.derive(
                      analysisOf(AnalysisScope.ALL, report), "amount", StatisticKeys.OUTLIERS))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Q1, Q3, or IQR is N/A for outlier selection.");
    }

    @Test
    @DisplayName("Should select the most frequent value by its type")
    void shouldSelectTopValues() {
      FieldReport quoted = FieldReport.builder("name", FieldKind.TEXT).topValue("O'Brien").build();
      FieldReport number = FieldReport.builder("n", FieldKind.NUMERIC).topValue(3L).build();
      FieldReport date =
          FieldReport.builder("d", FieldKind.TEMPORAL).topValue(LocalDate.of(2024, 1, 2)).build();
      FieldReport dateTime =
          FieldReport.builder("t", FieldKind.TEMPORAL)
              .topValue(LocalDateTime.of(2024, 1, 2, 10, 30))
              .build();
      StoredAnalysis analysis =
          analysisOf(AnalysisScope.ALL, quoted, number, date, dateTime);

      assertThat(topValueExpression(analysis, "name")).isEqualTo("\"name\" = 'O''Brien'");
      assertThat(topValueExpression(analysis, "n")).isEqualTo("\"n\" = 3.0");
      assertThat(topValueExpression(analysis, "d")).isEqualTo("\"d\" = date('2024-01-02')");
      assertThat(topValueExpression(analysis, "t"))
          .isEqualTo("\"t\" = datetime('2024-01-02T10:30:00')");
    }

    private String topValueExpression(StoredAnalysis analysis, String field) {
      return selectionService.derive(analysis, field, StatisticKeys.TOP_VALUES).getExpression();
    }

    @Test
    @DisplayName("Should refuse top-value selection without a cached value or for NaN")
    void shouldRejectMissingTopValue() {
      FieldReport nan =
          FieldReport.builder("n", FieldKind.NUMERIC).topValue(Double.NaN).build();
      StoredAnalysis analysis = analysisOf(AnalysisScope.ALL, text("name"), nan);

      assertThatThrownBy(() -> selectionService.derive(analysis, "name", StatisticKeys.TOP_VALUES))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("No specific unique value cached for selection.");
      assertThatThrownBy(() -> selectionService.derive(analysis, "n", StatisticKeys.TOP_VALUES))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Cannot select NaN unique value directly by expression.");
    }
  }

  @Nested
  @DisplayName("Row id selections")
  class RowIds {

    @Test
    @DisplayName("Should return stored conversion error ids with the capped flag")
    void shouldReturnConversionErrorIds() {
      BoundedRowIds ids = new BoundedRowIds(2);
      ids.add(4);
      ids.add(9);
      ids.add(12);
      StoredAnalysis analysis =
          analysisOf(
              AnalysisScope.ALL,
              Map.of("amount", ids),
              Map.of(),
              FieldReport.builder("amount", FieldKind.NUMERIC).build());

      SelectionResponse response =
          selectionService.derive(analysis, "amount", StatisticKeys.CONVERSION_ERRORS);

      assertThat(response.getType()).isEqualTo(SelectionResponse.Type.ROW_IDS);
      assertThat(response.getRowIds()).containsExactly(4L, 9L);
      assertThat(response.getCapped()).isTrue();
    }

    @Test
    @DisplayName("Should return stored non-printable ids")
    void shouldReturnNonPrintableIds() {
      BoundedRowIds ids = new BoundedRowIds(10);
      ids.add(7);
      StoredAnalysis analysis =
          analysisOf(AnalysisScope.ALL, Map.of(), Map.of("name", ids), text("name"));

      SelectionResponse response =
          selectionService.derive(analysis, "name", StatisticKeys.NON_PRINTABLE_COUNT);

      assertThat(response.getRowIds()).containsExactly(7L);
      assertThat(response.getCapped()).isFalse();
    }

    @Test
    @DisplayName("Should refuse when no ids were recorded")
    void shouldRejectWhenNothingRecorded() {
      StoredAnalysis analysis = analysisOf(AnalysisScope.ALL, text("name"));

      assertThatThrownBy(
              () -> selectionService.derive(analysis, "name", StatisticKeys.NON_PRINTABLE_COUNT))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("No features with non-printable characters recorded.");
    }
  }

  @Test
  @DisplayName("Should reject unknown fields, unsupported statistics and kind mismatches")
  void shouldRejectInvalidRequests() {
    StoredAnalysis analysis = analysisOf(AnalysisScope.ALL, text("name"));

    assertThatThrownBy(() -> selectionService.derive(analysis, "other", StatisticKeys.NULL_COUNT))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessageContaining("run-1");
    assertThatThrownBy(() -> selectionService.derive(analysis, "name", StatisticKeys.MEAN))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Statistic 'Mean' does not support row selection");
    assertThatThrownBy(() -> selectionService.derive(analysis, "name", StatisticKeys.OUTLIERS))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("NUMERIC");
  }

  @Test
  @DisplayName("Should double embedded quotes in field names")
  void shouldQuoteFieldNames() {
    assertThat(SelectionService.quote("plain")).isEqualTo("\"plain\"");
    assertThat(SelectionService.quote("a\"b")).isEqualTo("\"a\"\"b\"");
  }
}
