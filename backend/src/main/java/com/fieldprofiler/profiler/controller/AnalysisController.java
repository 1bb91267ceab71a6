package com.fieldprofiler.profiler.controller;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fieldprofiler.profiler.config.ProfilerProperties;
import com.fieldprofiler.profiler.config.StatisticsCapability;
import com.fieldprofiler.profiler.dto.profile.AnalysisSummary;
import com.fieldprofiler.profiler.dto.profile.CapabilitiesResponse;
import com.fieldprofiler.profiler.dto.profile.ProfileResponse;
import com.fieldprofiler.profiler.dto.profile.SelectionResponse;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.StatisticKeys;
import com.fieldprofiler.profiler.service.ProfileResponseMapper;
import com.fieldprofiler.profiler.service.export.ExportFormat;
import com.fieldprofiler.profiler.service.export.ReportExportService;
import com.fieldprofiler.profiler.service.selection.SelectionService;
import com.fieldprofiler.profiler.service.storage.AnalysisStorageService;
import com.fieldprofiler.profiler.service.storage.StoredAnalysis;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Analyses", description = "Stored analyses, export and row selection")
public class AnalysisController {

  private final AnalysisStorageService storageService;
  private final ReportExportService exportService;
  private final SelectionService selectionService;
  private final ProfileResponseMapper responseMapper;
  private final ProfilerProperties properties;
  private final StatisticsCapability statisticsCapability;

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the profiling service is healthy")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }

  @GetMapping("/capabilities")
  @Operation(
      summary = "Engine capabilities",
      description =
          "Reports whether distribution shape statistics are available, the default options"
              + " and the description of every statistic")
  public ResponseEntity<CapabilitiesResponse> capabilities() {
    CapabilitiesResponse response =
        CapabilitiesResponse.builder()
            .version(properties.getVersion())
            .statisticsLibraryAvailable(statisticsCapability.isAvailable())
            .warnings(statisticsCapability.warningMessage().stream().collect(Collectors.toList()))
            .fieldKinds(
                Arrays.stream(FieldKind.values()).map(Enum::name).collect(Collectors.toList()))
            .defaultOptions(responseMapper.toRequest(properties.getDefaults().toOptions()))
            .rowIdCap(properties.getRowIdCap())
            .statisticDescriptions(StatisticKeys.descriptions())
            .build();
    return ResponseEntity.ok(response);
  }

  @GetMapping("/analyses")
  @Operation(summary = "List stored analyses", description = "Newest analyses first")
  public ResponseEntity<List<AnalysisSummary>> listAnalyses() {
    List<AnalysisSummary> summaries =
        storageService.list().stream()
            .map(responseMapper::toSummary)
            .collect(Collectors.toList());
    log.debug("Retrieved {} stored analyses", summaries.size());
    return ResponseEntity.ok(summaries);
  }

  @DeleteMapping("/analyses")
  @Operation(summary = "Delete all stored analyses")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Successfully deleted all analyses")
      })
  public ResponseEntity<Void> deleteAllAnalyses() {
    long removed = storageService.clear();
    log.info("Deleted {} stored analyses", removed);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/analyses/{analysisId}")
  @Operation(summary = "Get a stored analysis")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Analysis found"),
        @ApiResponse(responseCode = "404", description = "Analysis not found")
      })
  public ResponseEntity<ProfileResponse> getAnalysis(@PathVariable String analysisId) {
    return ResponseEntity.ok(responseMapper.toResponse(storageService.get(analysisId)));
  }

  @DeleteMapping("/analyses/{analysisId}")
  @Operation(summary = "Delete a stored analysis")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Successfully deleted the analysis"),
        @ApiResponse(responseCode = "404", description = "Analysis not found")
      })
  public ResponseEntity<Void> deleteAnalysis(@PathVariable String analysisId) {
    storageService.delete(analysisId);
    log.info("Deleted analysis: {}", analysisId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/analyses/{analysisId}/export")
  @Operation(
      summary = "Export an analysis",
      description = "Statistics as rows, fields as columns, in CSV or TSV")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Exported table"),
        @ApiResponse(responseCode = "400", description = "Unsupported format"),
        @ApiResponse(responseCode = "404", description = "Analysis not found")
      })
  public ResponseEntity<byte[]> exportAnalysis(
      @PathVariable String analysisId,
      @Parameter(description = "csv (default) or tsv")
          @RequestParam(value = "format", required = false)
          String format) {
    ExportFormat exportFormat = ExportFormat.fromString(format);
    StoredAnalysis analysis = storageService.get(analysisId);
    byte[] body =
        exportService.export(analysis.getResult(), exportFormat).getBytes(StandardCharsets.UTF_8);

    String fileName = analysis.getDatasetName() + "_profile." + exportFormat.getExtension();
    HttpHeaders headers = new HttpHeaders();
    MediaType contentType = MediaType.parseMediaType(exportFormat.getContentType());
    headers.setContentType(new MediaType(contentType, StandardCharsets.UTF_8));
    headers.setContentDisposition(
        ContentDisposition.attachment().filename(fileName, StandardCharsets.UTF_8).build());
    log.info("Exported analysis {} as {}", analysisId, exportFormat);
    return ResponseEntity.ok().headers(headers).body(body);
  }

  @GetMapping("/analyses/{analysisId}/selection")
  @Operation(
      summary = "Rows behind a statistic",
      description =
          "Filter expression or stored row ids selecting the rows that produced one statistic")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Selection derived"),
        @ApiResponse(responseCode = "400", description = "Statistic does not support selection"),
        @ApiResponse(responseCode = "404", description = "Analysis or field not found")
      })
  public ResponseEntity<SelectionResponse> selectRows(
      @PathVariable String analysisId,
      @RequestParam("field") String field,
      @RequestParam("statistic") String statistic) {
    StoredAnalysis analysis = storageService.get(analysisId);
    return ResponseEntity.ok(selectionService.derive(analysis, field, statistic));
  }
}
