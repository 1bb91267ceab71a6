package com.fieldprofiler.profiler.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fieldprofiler.profiler.config.ProfilerProperties;
import com.fieldprofiler.profiler.dto.profile.AnalysisOptionsRequest;
import com.fieldprofiler.profiler.dto.profile.ProfileRequest;
import com.fieldprofiler.profiler.dto.profile.ProfileResponse;
import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.AnalysisScope;
import com.fieldprofiler.profiler.model.CancellationToken;
import com.fieldprofiler.profiler.model.Dataset;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.model.ProgressListener;
import com.fieldprofiler.profiler.service.analysis.FieldProfilingService;
import com.fieldprofiler.profiler.service.data_processing.CsvParsingService;
import com.fieldprofiler.profiler.service.data_processing.JsonDatasetMapper;
import com.fieldprofiler.profiler.service.storage.AnalysisStorageService;
import com.fieldprofiler.profiler.service.storage.StoredAnalysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Runs a profile for an HTTP request and keeps the result in the analysis store. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileRunService {

  private final FieldProfilingService profilingService;
  private final JsonDatasetMapper datasetMapper;
  private final CsvParsingService csvParsingService;
  private final AnalysisStorageService storageService;
  private final ProfileResponseMapper responseMapper;
  private final ProfilerProperties properties;

  public ProfileResponse profile(ProfileRequest request) {
    AnalysisOptions options = resolveOptions(request.getOptions());
    Dataset dataset = datasetMapper.toDataset(request);
    return run(dataset, options, JsonDatasetMapper.scopeOf(request));
  }

  public ProfileResponse profileCsv(
      InputStream csv,
      String fileName,
      Map<String, FieldKind> kinds,
      List<String> fields,
      AnalysisOptionsRequest overrides)
      throws IOException {
    AnalysisOptions options = resolveOptions(overrides);
    Dataset dataset = csvParsingService.parse(csv, fileName, kinds, fields);
    return run(dataset, options, AnalysisScope.ALL);
  }

  /** Configured defaults with the non-null request values applied on top. */
  public AnalysisOptions resolveOptions(AnalysisOptionsRequest overrides) {
    AnalysisOptions defaults = properties.getDefaults().toOptions();
    if (overrides == null) {
      return defaults.validate();
    }
    AnalysisOptions.AnalysisOptionsBuilder options = defaults.toBuilder();
    if (overrides.getNumericDistributionShape() != null) {
      options.numericDistributionShape(overrides.getNumericDistributionShape());
    }
    if (overrides.getNumericAdvancedPercentiles() != null) {
      options.numericAdvancedPercentiles(overrides.getNumericAdvancedPercentiles());
    }
    if (overrides.getNumericIntegerDecimalSplit() != null) {
      options.numericIntegerDecimalSplit(overrides.getNumericIntegerDecimalSplit());
    }
    if (overrides.getNumericOutlierDetails() != null) {
      options.numericOutlierDetails(overrides.getNumericOutlierDetails());
    }
    if (overrides.getTextCaseAnalysis() != null) {
      options.textCaseAnalysis(overrides.getTextCaseAnalysis());
    }
    if (overrides.getTextRarityAndNonPrintable() != null) {
      options.textRarityAndNonPrintable(overrides.getTextRarityAndNonPrintable());
    }
    if (overrides.getTemporalTimeAndWeekend() != null) {
      options.temporalTimeAndWeekend(overrides.getTemporalTimeAndWeekend());
    }
    if (overrides.getTopValuesLimit() != null) {
      options.topValuesLimit(overrides.getTopValuesLimit());
    }
    if (overrides.getDecimalPlaces() != null) {
      options.decimalPlaces(overrides.getDecimalPlaces());
    }
    return options.build().validate();
  }

  private ProfileResponse run(Dataset dataset, AnalysisOptions options, AnalysisScope scope) {
    long startTime = System.currentTimeMillis();
    ProgressListener progress =
        (processed, total) -> log.debug("Collected {} of {} row(s)", processed, total);
    ProfileResult result =
        profilingService.analyze(dataset, options, scope, progress, CancellationToken.none());
    StoredAnalysis stored = storageService.save(dataset.getName(), dataset.getFields(), result);
    log.info(
        "Analysis {} finished in {} ms ({} field(s), {} row(s))",
        stored.getId(),
        System.currentTimeMillis() - startTime,
        dataset.getFields().size(),
        result.getRowsScanned());
    return responseMapper.toResponse(stored);
  }
}
