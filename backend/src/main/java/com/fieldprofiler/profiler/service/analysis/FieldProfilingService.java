package com.fieldprofiler.profiler.service.analysis;

import static com.fieldprofiler.profiler.model.StatisticKeys.*;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.fieldprofiler.profiler.config.ProfilerProperties;
import com.fieldprofiler.profiler.config.StatisticsCapability;
import com.fieldprofiler.profiler.exception.AnalysisRejectedException;
import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.AnalysisScope;
import com.fieldprofiler.profiler.model.BoundedRowIds;
import com.fieldprofiler.profiler.model.CancellationToken;
import com.fieldprofiler.profiler.model.Dataset;
import com.fieldprofiler.profiler.model.DatasetRow;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.model.ProgressListener;
import com.fieldprofiler.profiler.model.RawValue;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.service.collection.FieldAccumulator;
import com.fieldprofiler.profiler.service.collection.ValueCollector;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the profiling engine. One call is one run: rows are collected in a single pass,
 * then each field is analyzed on its own so that a fault in one field never affects another.
 * No state is kept between runs.
 */
@Slf4j
@Service
public class FieldProfilingService {

  static final double NUMERIC_LIKE_THRESHOLD = 0.9;
  static final int CATEGORICAL_VARIETY_LIMIT = 15;
  static final int CATEGORICAL_MIN_VALUES = 20;

  static final String NUMERIC_LIKE_HINT =
      "High % of numeric-like strings. Consider if this field should be numeric.";
  static final String CATEGORICAL_HINT =
      "Low variety for a numeric field. Consider if this is categorical or a code.";

  private final Map<FieldKind, FieldAnalyzer> analyzers = new EnumMap<>(FieldKind.class);
  private final ProfilerProperties properties;
  private final StatisticsCapability capability;

  public FieldProfilingService(
      List<FieldAnalyzer> analyzers,
      ProfilerProperties properties,
      StatisticsCapability capability) {
    for (FieldAnalyzer analyzer : analyzers) {
      this.analyzers.put(analyzer.getKind(), analyzer);
    }
    this.properties = properties;
    this.capability = capability;
  }

  public ProfileResult analyze(Dataset dataset, AnalysisOptions options) {
    return analyze(
        dataset, options, AnalysisScope.ALL, ProgressListener.NONE, CancellationToken.none());
  }

  /**
   * Profiles every field of {@code dataset}.
   *
   * @throws AnalysisRejectedException if there is no dataset, no field or no row in scope
   * @throws IllegalArgumentException if {@code options} are out of range
   */
  public ProfileResult analyze(
      Dataset dataset,
      AnalysisOptions options,
      AnalysisScope scope,
      ProgressListener progress,
      CancellationToken cancellation) {
    validate(dataset, scope);
    options.validate();

    long totalRows = dataset.getTotalRows();
    log.info(
        "Profiling {} field(s) of '{}' over {} row(s), scope {}",
        dataset.getFields().size(),
        dataset.getName(),
        totalRows,
        scope);

    ValueCollector collector = new ValueCollector(properties.getRowIdCap(), options);
    Map<String, FieldAccumulator> accumulators = new LinkedHashMap<>();
    for (FieldDescriptor field : dataset.getFields()) {
      accumulators.put(field.getName(), collector.newAccumulator(field));
    }

    long processed = 0;
    boolean cancelled = false;
    String iterationFailure = null;
    long interval = Math.max(1, totalRows / 100);
    try {
      Iterator<DatasetRow> rows = dataset.getRows().iterator();
      while (rows.hasNext()) {
        if (cancellation.isCancelled()) {
          cancelled = true;
          break;
        }
        DatasetRow row = rows.next();
        for (FieldAccumulator accumulator : accumulators.values()) {
          collector.accept(accumulator, row.getRowId(), row.get(accumulator.getFieldName()));
        }
        processed++;
        if (processed % interval == 0) {
          progress.onProgress(processed, totalRows);
        }
      }
    } catch (RuntimeException e) {
      log.error("Row iteration failed after {} row(s)", processed, e);
      iterationFailure = "Feature iteration error: " + e.getMessage();
    }
    if (processed % interval != 0 || processed == 0) {
      progress.onProgress(processed, totalRows);
    }
    if (cancelled) {
      log.info("Run cancelled after {} of {} row(s)", processed, totalRows);
    }

    ProfileResult.ProfileResultBuilder result =
        ProfileResult.builder()
            .rowsScanned(processed)
            .totalRows(totalRows)
            .cancelled(cancelled)
            .scope(scope)
            .options(options);
    capability.warningMessage().ifPresent(result::warning);

    Map<String, FieldReport> reports = new LinkedHashMap<>();
    Map<String, BoundedRowIds> conversionErrorIds = new LinkedHashMap<>();
    Map<String, BoundedRowIds> nonPrintableIds = new LinkedHashMap<>();
    for (FieldAccumulator accumulator : accumulators.values()) {
      String name = accumulator.getFieldName();
      if (iterationFailure != null) {
        reports.put(name, FieldReport.error(name, accumulator.getKind(), iterationFailure));
        continue;
      }
      reports.put(name, profileField(accumulator, totalRows, options));
      if (!accumulator.getConversionErrorIds().isEmpty()) {
        conversionErrorIds.put(name, accumulator.getConversionErrorIds());
      }
      if (!accumulator.getNonPrintableIds().isEmpty()) {
        nonPrintableIds.put(name, accumulator.getNonPrintableIds());
      }
    }

    return result
        .reports(reports)
        .conversionErrorIds(conversionErrorIds)
        .nonPrintableIds(nonPrintableIds)
        .build();
  }

  private FieldReport profileField(
      FieldAccumulator accumulator, long totalRows, AnalysisOptions options) {
    String name = accumulator.getFieldName();
    FieldKind kind = accumulator.getKind();
    if (accumulator.isFailed()) {
      return FieldReport.error(name, kind, accumulator.getFailure());
    }
    try {
      FieldReport.Builder report = FieldReport.builder(name, kind);
      long nonNull = accumulator.getNonNullCount();
      long nulls = accumulator.getNullCount();
      report.put(NULL_COUNT, StatValue.integer(nulls));
      report.put(PERCENT_NULL, StatValue.percent(totalRows > 0 ? nulls * 100.0 / totalRows : 0.0));
      report.put(NON_NULL_COUNT, StatValue.integer(nonNull));

      if (nonNull == 0) {
        long errors = accumulator.getConversionErrors();
        report.put(
            STATUS,
            StatValue.text(
                kind == FieldKind.NUMERIC && errors > 0
                    ? "All values Null or conversion errors (" + errors + ")"
                    : "All Null or Empty"));
      } else {
        FieldAnalyzer analyzer = analyzers.get(kind);
        if (analyzer == null) {
          report.put(STATUS, StatValue.text("Analysis not implemented for this type"));
        } else {
          analyzer.analyze(accumulator, options, report);
        }
      }

      report.put(TYPE_MISMATCH_HINT, mismatchHint(accumulator, report));
      return report.build();
    } catch (RuntimeException e) {
      log.error("Analysis failed for field '{}'", name, e);
      return FieldReport.error(name, kind, "Analysis function error: " + e.getMessage());
    }
  }

  private static StatValue mismatchHint(FieldAccumulator accumulator, FieldReport.Builder report) {
    long nonNull = accumulator.getNonNullCount();
    if (nonNull == 0) {
      return StatValue.na();
    }
    if (accumulator.getKind() == FieldKind.TEXT) {
      long numericLike =
          accumulator.getNonNullValues().stream()
              .map(RawValue::asText)
              .filter(FieldProfilingService::looksNumeric)
              .count();
      if ((double) numericLike / nonNull > NUMERIC_LIKE_THRESHOLD) {
        return StatValue.text(NUMERIC_LIKE_HINT);
      }
    } else if (accumulator.getKind() == FieldKind.NUMERIC) {
      StatValue variety = report.get(VARIETY);
      if (variety != null
          && variety.isNumber()
          && variety.asLong() < CATEGORICAL_VARIETY_LIMIT
          && nonNull > CATEGORICAL_MIN_VALUES) {
        return StatValue.text(CATEGORICAL_HINT);
      }
    }
    return StatValue.na();
  }

  /** Digits only once the first '.' is removed and surrounding whitespace trimmed. */
  static boolean looksNumeric(String value) {
    String candidate = value.replaceFirst("\\.", "").strip();
    return !candidate.isEmpty() && candidate.codePoints().allMatch(Character::isDigit);
  }

  private static void validate(Dataset dataset, AnalysisScope scope) {
    if (dataset == null || dataset.getRows() == null) {
      throw new AnalysisRejectedException("No dataset selected");
    }
    if (dataset.getFields() == null || dataset.getFields().isEmpty()) {
      throw new AnalysisRejectedException("Please select one or more fields to analyze");
    }
    Set<String> names = new HashSet<>();
    for (FieldDescriptor field : dataset.getFields()) {
      if (!names.add(field.getName())) {
        throw new AnalysisRejectedException("Field selected more than once: " + field.getName());
      }
    }
    if (dataset.getTotalRows() <= 0) {
      throw new AnalysisRejectedException(
          scope == AnalysisScope.SELECTED
              ? "No features selected for analysis"
              : "No features to analyze");
    }
  }
}
