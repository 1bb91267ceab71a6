package com.fieldprofiler.profiler.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.fieldprofiler.profiler.config.ProfilerProperties;
import com.fieldprofiler.profiler.config.StatisticsCapability;
import com.fieldprofiler.profiler.dto.profile.AnalysisOptionsRequest;
import com.fieldprofiler.profiler.dto.profile.AnalysisSummary;
import com.fieldprofiler.profiler.dto.profile.ProfileResponse;
import com.fieldprofiler.profiler.dto.profile.SelectionResponse;
import com.fieldprofiler.profiler.exception.ResourceNotFoundException;
import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.AnalysisScope;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.model.StatisticKeys;
import com.fieldprofiler.profiler.service.ProfileResponseMapper;
import com.fieldprofiler.profiler.service.export.ExportFormat;
import com.fieldprofiler.profiler.service.export.ReportExportService;
import com.fieldprofiler.profiler.service.selection.SelectionService;
import com.fieldprofiler.profiler.service.storage.AnalysisStorageService;
import com.fieldprofiler.profiler.service.storage.StoredAnalysis;

@WebMvcTest(AnalysisController.class)
@DisplayName("Analysis Controller Tests")
public class AnalysisControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AnalysisStorageService storageService;

  @MockitoBean private ReportExportService exportService;

  @MockitoBean private SelectionService selectionService;

  @MockitoBean private ProfileResponseMapper responseMapper;

  @MockitoBean private ProfilerProperties properties;

  @MockitoBean private StatisticsCapability statisticsCapability;

  private static StoredAnalysis stored() {
    ProfileResult result =
        ProfileResult.builder()
            .reports(Map.of())
            .conversionErrorIds(Map.of())
            .nonPrintableIds(Map.of())
            .scope(AnalysisScope.ALL)
            .options(AnalysisOptions.defaults())
            .build();
    return StoredAnalysis.builder()
        .id("run-1")
        .datasetName("parcels")
        .createdAt(LocalDateTime.of(2024, 1, 1, 0, 0))
        .fields(List.of())
        .result(result)
        .build();
  }

  @Test
  @DisplayName("Should report health")
  public void shouldReportHealth() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status", is("UP")));
  }

  @Test
  @DisplayName("Should report capabilities and the missing statistics library")
  public void shouldReportCapabilities() throws Exception {
    when(properties.getVersion()).thenReturn("1.0.0");
    when(properties.getRowIdCap()).thenReturn(10_000);
    when(properties.getDefaults()).thenReturn(new ProfilerProperties.Defaults());
    when(statisticsCapability.isAvailable()).thenReturn(false);
    when(statisticsCapability.warningMessage())
        .thenReturn(Optional.of(StatisticsCapability.MISSING_WARNING));
    when(responseMapper.toRequest(any()))
        .thenReturn(AnalysisOptionsRequest.builder().topValuesLimit(5).build());

    mockMvc
        .perform(get("/api/capabilities"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version", is("1.0.0")))
        .andExpect(jsonPath("$.statistics_library_available", is(false)))
        .andExpect(jsonPath("$.warnings[0]", is(StatisticsCapability.MISSING_WARNING)))
        .andExpect(jsonPath("$.field_kinds", hasSize(4)))
        .andExpect(jsonPath("$.default_options.top_values_limit", is(5)))
        .andExpect(jsonPath("$.row_id_cap", is(10000)))
        .andExpect(jsonPath("$.statistic_descriptions['Mean']").exists());
  }

  @Nested
  @DisplayName("Stored analyses")
  class StoredAnalysisTests {

    @Test
    @DisplayName("Should list stored analyses")
    public void shouldListAnalyses() throws Exception {
      StoredAnalysis analysis = stored();
      when(storageService.list()).thenReturn(List.of(analysis));
      when(responseMapper.toSummary(analysis))
          .thenReturn(AnalysisSummary.builder().analysisId("run-1").build());

      mockMvc
          .perform(get("/api/analyses"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$", hasSize(1)))
          .andExpect(jsonPath("$[0].analysis_id", is("run-1")));
    }

    @Test
    @DisplayName("Should return a stored analysis")
    public void shouldGetAnalysis() throws Exception {
      StoredAnalysis analysis = stored();
      when(storageService.get("run-1")).thenReturn(analysis);
      when(responseMapper.toResponse(analysis))
          .thenReturn(ProfileResponse.builder().analysisId("run-1").build());

      mockMvc
          .perform(get("/api/analyses/run-1"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.analysis_id", is("run-1")));
    }

    @Test
    @DisplayName("Should return 404 for unknown analyses")
    public void shouldReturnNotFound() throws Exception {
      when(storageService.get("missing"))
          .thenThrow(new ResourceNotFoundException("Analysis not found: missing"));

      mockMvc
          .perform(get("/api/analyses/missing"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.message", is("Analysis not found: missing")))
          .andExpect(jsonPath("$.path", is("/api/analyses/missing")));
    }

    @Test
    @DisplayName("Should delete one or all analyses")
    public void shouldDeleteAnalyses() throws Exception {
      mockMvc.perform(delete("/api/analyses/run-1")).andExpect(status().isNoContent());
      mockMvc.perform(delete("/api/analyses")).andExpect(status().isNoContent());

      verify(storageService).delete("run-1");
      verify(storageService).clear();
    }

    @Test
    @DisplayName("Should return 404 when deleting an unknown analysis")
    public void shouldNotDeleteUnknownAnalysis() throws Exception {
      doThrow(new ResourceNotFoundException("Analysis not found: gone"))
          .when(storageService)
          .delete("gone");

      mockMvc.perform(delete("/api/analyses/gone")).andExpect(status().isNotFound());
    }
  }

  @Nested
  @DisplayName("GET /api/analyses/{id}/export")
  class ExportTests {

    @Test
    @DisplayName("Should download a CSV export by default")
    public void shouldExportCsv() throws Exception {
      StoredAnalysis analysis = stored();
      when(storageService.get("run-1")).thenReturn(analysis);
      when(exportService.export(analysis.getResult(), ExportFormat.CSV))
          .thenReturn("Statistic,amount\nMean,2.50\n");

      mockMvc
          .perform(get("/api/analyses/run-1/export"))
          .andExpect(status().isOk())
          .andExpect(content().contentType("text/csv;charset=UTF-8"))
          .andExpect(header().string("Content-Disposition", containsString("attachment")))
          .andExpect(
              header().string("Content-Disposition", containsString("parcels_profile.csv")))
          .andExpect(content().string("Statistic,amount\nMean,2.50\n"));
    }

    @Test
    @DisplayName("Should export TSV on request")
    public void shouldExportTsv() throws Exception {
      StoredAnalysis analysis = stored();
      when(storageService.get("run-1")).thenReturn(analysis);
      when(exportService.export(analysis.getResult(), ExportFormat.TSV))
          .thenReturn("Statistic\tamount\n");

      mockMvc
          .perform(get("/api/analyses/run-1/export").param("format", "tsv"))
          .andExpect(status().isOk())
          .andExpect(content().contentType("text/tab-separated-values;charset=UTF-8"))
          .andExpect(
              header().string("Content-Disposition", containsString("parcels_profile.tsv")));
    }

    @Test
    @DisplayName("Should reject unknown export formats")
    public void shouldRejectUnknownFormat() throws Exception {
      mockMvc
          .perform(get("/api/analyses/run-1/export").param("format", "xlsx"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message", is("Unsupported export format: xlsx")));

      verifyNoInteractions(exportService);
    }
  }

  @Nested
  @DisplayName("GET /api/analyses/{id}/selection")
  class SelectionTests {

    @Test
    @DisplayName("Should return the selection for a statistic")
    public void shouldSelectRows() throws Exception {
      StoredAnalysis analysis = stored();
      when(storageService.get("run-1")).thenReturn(analysis);
      when(selectionService.derive(analysis, "amount", StatisticKeys.NULL_COUNT))
          .thenReturn(
              SelectionResponse.builder()
                  .field("amount")
                  .statistic(StatisticKeys.NULL_COUNT)
                  .type(SelectionResponse.Type.EXPRESSION)
                  .expression("\"amount\" IS NULL")
                  .build());

      mockMvc
          .perform(
              get("/api/analyses/run-1/selection")
                  .param("field", "amount")
                  .param("statistic", StatisticKeys.NULL_COUNT))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.type", is("EXPRESSION")))
          .andExpect(jsonPath("$.expression", is("\"amount\" IS NULL")))
          .andExpect(jsonPath("$.row_ids").doesNotExist());
    }

    @Test
    @DisplayName("Should reject statistics without a selection")
    public void shouldRejectUnsupportedStatistic() throws Exception {
      StoredAnalysis analysis = stored();
      when(storageService.get("run-1")).thenReturn(analysis);
      when(selectionService.derive(analysis, "amount", StatisticKeys.MEAN))
          .thenThrow(
              new IllegalArgumentException("Statistic 'Mean' does not support row selection"));

      mockMvc
          .perform(
              get("/api/analyses/run-1/selection")
                  .param("field", "amount")
                  .param("statistic", StatisticKeys.MEAN))
          .andExpect(status().isBadRequest())
          .andExpect(
              jsonPath("$.message", is("Statistic 'Mean' does not support row selection")));
    }

    @Test
    @DisplayName("Should require field and statistic parameters")
    public void shouldRequireParameters() throws Exception {
      mockMvc
          .perform(get("/api/analyses/run-1/selection").param("field", "amount"))
          .andExpect(status().isBadRequest());
    }
  }
}
