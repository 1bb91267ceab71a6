package com.fieldprofiler.profiler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fieldprofiler.profiler.config.ProfilerProperties;
import com.fieldprofiler.profiler.dto.profile.AnalysisOptionsRequest;
import com.fieldprofiler.profiler.dto.profile.ProfileRequest;
import com.fieldprofiler.profiler.dto.profile.ProfileResponse;
import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.AnalysisScope;
import com.fieldprofiler.profiler.model.Dataset;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.service.analysis.FieldProfilingService;
import com.fieldprofiler.profiler.service.data_processing.CsvParsingService;
import com.fieldprofiler.profiler.service.data_processing.JsonDatasetMapper;
import com.fieldprofiler.profiler.service.storage.AnalysisStorageService;
import com.fieldprofiler.profiler.service.storage.StoredAnalysis;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProfileRunService Tests")
class ProfileRunServiceTest {

  @Mock private FieldProfilingService profilingService;
  @Mock private JsonDatasetMapper datasetMapper;
  @Mock private CsvParsingService csvParsingService;
  @Mock private AnalysisStorageService storageService;
  @Mock private ProfileResponseMapper responseMapper;

  private ProfilerProperties properties;
  private ProfileRunService profileRunService;

  private final Dataset dataset =
      Dataset.builder().name("parcels").rows(List.of()).totalRows(0).build();

  @BeforeEach
  void setUp() {
    properties = new ProfilerProperties();
    properties.getDefaults().setTopValuesLimit(7);
    profileRunService =
        new ProfileRunService(
            profilingService,
            datasetMapper,
            csvParsingService,
            storageService,
            responseMapper,
            properties);
  }

  private ProfileResult stubRun() {
    ProfileResult result =
        ProfileResult.builder()
            .reports(Map.of())
            .conversionErrorIds(Map.of())
            .nonPrintableIds(Map.of())
            .scope(AnalysisScope.ALL)
            .options(AnalysisOptions.defaults())
            .build();
    StoredAnalysis stored =
        StoredAnalysis.builder()
            .id("run-1")
            .datasetName("parcels")
            .createdAt(LocalDateTime.of(2024, 1, 1, 0, 0))
            .fields(List.of())
            .result(result)
            .build();
    when(profilingService.analyze(any(), any(), any(), any(), any())).thenReturn(result);
    when(storageService.save(anyString(), anyList(), eq(result))).thenReturn(stored);
    when(responseMapper.toResponse(stored))
        .thenReturn(ProfileResponse.builder().analysisId("run-1").build());
    return result;
  }

  @Test
  @DisplayName("Should fall back to configured defaults without overrides")
  void shouldUseConfiguredDefaults() {
    AnalysisOptions options = profileRunService.resolveOptions(null);

    assertThat(options.getTopValuesLimit()).isEqualTo(7);
    assertThat(options.isNumericDistributionShape()).isTrue();
  }

  @Test
  @DisplayName("Should apply only the overrides that are set")
  void shouldApplyOverrides() {
    // Given
    AnalysisOptionsRequest overrides =
        AnalysisOptionsRequest.builder().textCaseAnalysis(false).decimalPlaces(4).build();

    // When
    AnalysisOptions options = profileRunService.resolveOptions(overrides);

    // Then
    assertThat(options.isTextCaseAnalysis()).isFalse();
    assertThat(options.getDecimalPlaces()).isEqualTo(4);
    assertThat(options.getTopValuesLimit()).isEqualTo(7);
    assertThat(options.isTemporalTimeAndWeekend()).isTrue();
  }

  @Test
  @DisplayName("Should reject out-of-range overrides before any work is done")
  void shouldRejectInvalidOverrides() {
    ProfileRequest request =
        ProfileRequest.builder()
            .options(AnalysisOptionsRequest.builder().topValuesLimit(0).build())
            .build();

    assertThatThrownBy(() -> profileRunService.profile(request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("topValuesLimit");
    verify(profilingService, never()).analyze(any(), any(), any(), any(), any());
  }

  @Test
  @DisplayName("Should analyze, store and map a JSON request")
  void shouldProfileJsonRequest() {
    // Given
    ProfileRequest request = ProfileRequest.builder().scope("selected").build();
    when(datasetMapper.toDataset(request)).thenReturn(dataset);
    stubRun();

    // When
    ProfileResponse response = profileRunService.profile(request);

    // Then
    assertThat(response.getAnalysisId()).isEqualTo("run-1");
    ArgumentCaptor<AnalysisScope> scope = ArgumentCaptor.forClass(AnalysisScope.class);
    verify(profilingService).analyze(eq(dataset), any(), scope.capture(), any(), any());
    assertThat(scope.getValue()).isEqualTo(AnalysisScope.SELECTED);
  }

  @Test
  @DisplayName("Should profile an uploaded CSV over all rows")
  void shouldProfileCsv() throws Exception {
    // Given
    InputStream csv = new ByteArrayInputStream("a\n1\n".getBytes());
    when(csvParsingService.parse(csv, "parcels.csv", Map.of(), List.of())).thenReturn(dataset);
    stubRun();

    // When
    ProfileResponse response =
        profileRunService.profileCsv(csv, "parcels.csv", Map.of(), List.of(), null);

    // Then
    assertThat(response.getAnalysisId()).isEqualTo("run-1");
    verify(profilingService).analyze(eq(dataset), any(), eq(AnalysisScope.ALL), any(), any());
  }
}
