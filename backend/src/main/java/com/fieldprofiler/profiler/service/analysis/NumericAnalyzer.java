package com.fieldprofiler.profiler.service.analysis;

import static com.fieldprofiler.profiler.model.StatisticKeys.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fieldprofiler.profiler.model.AnalysisOptions;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.StatValue;
import com.fieldprofiler.profiler.service.analysis.statistics.DistributionShape;
import com.fieldprofiler.profiler.service.analysis.statistics.DistributionShapeCalculator;
import com.fieldprofiler.profiler.service.analysis.statistics.ModeCalculator;
import com.fieldprofiler.profiler.service.analysis.statistics.Percentiles;
import com.fieldprofiler.profiler.service.collection.FieldAccumulator;

import lombok.RequiredArgsConstructor;

/**
 * Location, spread, shape and outlier statistics for numeric fields.
 *
 * <p>Infinite values are discarded up front. NaN values still count towards the sample size but
 * every location and spread statistic is computed over the NaN-free values only.
 */
@Component
@RequiredArgsConstructor
public class NumericAnalyzer implements FieldAnalyzer {

  static final double LOW_VARIANCE_EPSILON = 1e-8;
  static final double OUTLIER_FENCE = 1.5;

  private static final Set<String> ZERO_WHEN_EMPTY =
      Set.of(
          VARIETY, ZEROS, POSITIVES, NEGATIVES, OUTLIERS, INTEGER_VALUES, DECIMAL_VALUES,
          PERCENT_OUTLIERS, MIN_OUTLIER, MAX_OUTLIER);
  private static final Set<String> FALSE_WHEN_EMPTY = Set.of(LOW_VARIANCE, LIKELY_NORMAL);
  private static final Set<String> BASE_KEYS =
      Set.of(NON_NULL_COUNT, NULL_COUNT, PERCENT_NULL, CONVERSION_ERRORS);

  private final ModeCalculator modeCalculator;
  private final DistributionShapeCalculator shapeCalculator;

  @Override
  public FieldKind getKind() {
    return FieldKind.NUMERIC;
  }

  @Override
  public void analyze(
      FieldAccumulator accumulator, AnalysisOptions options, FieldReport.Builder report) {
    long conversionErrors = accumulator.getConversionErrors();
    report.put(CONVERSION_ERRORS, StatValue.integer(conversionErrors));

    double[] data = finiteValues(accumulator.getConvertedValues());
    if (data.length == 0) {
      putEmpty(conversionErrors, report);
      return;
    }

    int count = data.length;
    double[] valid = Arrays.stream(data).filter(v -> !Double.isNaN(v)).sorted().toArray();
    int validCount = valid.length;

    double min = validCount > 0 ? valid[0] : Double.NaN;
    double max = validCount > 0 ? valid[validCount - 1] : Double.NaN;
    double range = max - min;
    double sum = validCount > 0 ? sum(valid) : Double.NaN;
    double mean = validCount > 0 ? sum / validCount : Double.NaN;
    double median = Percentiles.linear(valid, 50);
    double stdev = populationStdev(valid, mean);
    long variety = Arrays.stream(valid).map(v -> v + 0.0).distinct().count();

    report.put(MIN, StatValue.decimal(min));
    report.put(MAX, StatValue.decimal(max));
    report.put(RANGE, StatValue.decimal(range));
    report.put(SUM, StatValue.decimal(sum));
    report.put(MEAN, StatValue.decimal(mean));
    report.put(MEDIAN, StatValue.decimal(median));
    report.put(STDEV, StatValue.decimal(stdev));
    report.put(MODES, modes(valid, variety));
    report.put(VARIETY, StatValue.integer(variety));

    double q1 = Percentiles.linear(valid, 25);
    double q3 = Percentiles.linear(valid, 75);
    double iqr = q3 - q1;
    report.put(Q1, StatValue.decimal(q1));
    report.put(Q3, StatValue.decimal(q3));
    report.put(IQR, StatValue.decimal(iqr));
    putOutliers(valid, count, q1, q3, iqr, options, report);

    boolean lowVariance =
        count == 1
            || (!Double.isNaN(stdev) && Math.abs(stdev) <= LOW_VARIANCE_EPSILON)
            || (variety == 1 && count > 1);
    report.put(LOW_VARIANCE, StatValue.bool(lowVariance));

    report.put(ZEROS, StatValue.integer(Arrays.stream(valid).filter(v -> v == 0).count()));
    report.put(POSITIVES, StatValue.integer(Arrays.stream(valid).filter(v -> v > 0).count()));
    report.put(NEGATIVES, StatValue.integer(Arrays.stream(valid).filter(v -> v < 0).count()));

    double cv = Double.NaN;
    if (!Double.isNaN(mean) && mean != 0 && !Double.isNaN(stdev)) {
      cv = stdev / mean * 100.0;
    }
    report.put(CV, StatValue.decimal(cv));

    if (options.isNumericIntegerDecimalSplit()) {
      putIntegerSplit(valid, range, iqr, variety, report);
    } else {
      report.put(INTEGER_VALUES, StatValue.disabled());
      report.put(DECIMAL_VALUES, StatValue.disabled());
      report.put(PERCENT_INTEGER, StatValue.disabled());
      report.put(OPTIMAL_BINS, StatValue.disabled());
    }

    DistributionShape shape =
        options.isNumericDistributionShape()
            ? shapeCalculator.describe(valid)
            : DistributionShape.notApplicable(NotApplicableReason.OPTION_DISABLED);
    report.put(SKEWNESS, shape.getSkewness());
    report.put(KURTOSIS, shape.getKurtosis());
    report.put(NORMALITY_P, shape.getNormalityP());
    report.put(LIKELY_NORMAL, shape.getLikelyNormal());

    if (options.isNumericAdvancedPercentiles()) {
      report.put(PCTL_1, StatValue.decimal(Percentiles.linear(valid, 1)));
      report.put(PCTL_5, StatValue.decimal(Percentiles.linear(valid, 5)));
      report.put(PCTL_95, StatValue.decimal(Percentiles.linear(valid, 95)));
      report.put(PCTL_99, StatValue.decimal(Percentiles.linear(valid, 99)));
    } else {
      report.put(PCTL_1, StatValue.disabled());
      report.put(PCTL_5, StatValue.disabled());
      report.put(PCTL_95, StatValue.disabled());
      report.put(PCTL_99, StatValue.disabled());
    }
  }

  private StatValue modes(double[] valid, long variety) {
    if (valid.length == 0) {
      return StatValue.na();
    }
    if (valid.length > 1 && variety == valid.length) {
      return StatValue.notApplicable(NotApplicableReason.NO_UNIQUE_MODE);
    }
    List<StatValue> modes = new ArrayList<>();
    for (Double mode : modeCalculator.computeModes(valid)) {
      modes.add(StatValue.decimal(mode));
    }
    return StatValue.list(modes);
  }

  private static void putOutliers(
      double[] valid,
      int count,
      double q1,
      double q3,
      double iqr,
      AnalysisOptions options,
      FieldReport.Builder report) {
    long outlierCount = 0;
    double minOutlier = Double.NaN;
    double maxOutlier = Double.NaN;
    if (!Double.isNaN(q1) && !Double.isNaN(q3)) {
      double lower = q1 - OUTLIER_FENCE * iqr;
      double upper = q3 + OUTLIER_FENCE * iqr;
      for (double value : valid) {
        if (value < lower || value > upper) {
          outlierCount++;
          minOutlier = Double.isNaN(minOutlier) ? value : Math.min(minOutlier, value);
          maxOutlier = Double.isNaN(maxOutlier) ? value : Math.max(maxOutlier, value);
        }
      }
    }
    report.put(OUTLIERS, StatValue.integer(outlierCount));
    if (options.isNumericOutlierDetails()) {
      report.put(MIN_OUTLIER, StatValue.decimal(minOutlier));
      report.put(MAX_OUTLIER, StatValue.decimal(maxOutlier));
      report.put(PERCENT_OUTLIERS, StatValue.percent(outlierCount * 100.0 / count));
    } else {
      report.put(MIN_OUTLIER, StatValue.disabled());
      report.put(MAX_OUTLIER, StatValue.disabled());
      report.put(PERCENT_OUTLIERS, StatValue.disabled());
    }
  }

  private static void putIntegerSplit(
      double[] valid, double range, double iqr, long variety, FieldReport.Builder report) {
    long integers = Arrays.stream(valid).filter(v -> v == Math.floor(v)).count();
    report.put(INTEGER_VALUES, StatValue.integer(integers));
    report.put(DECIMAL_VALUES, StatValue.integer(valid.length - integers));
    report.put(
        PERCENT_INTEGER,
        StatValue.percent(valid.length > 0 ? integers * 100.0 / valid.length : 0.0));
    report.put(OPTIMAL_BINS, StatValue.integer(optimalBins(valid.length, range, iqr, variety)));
  }

  /** Freedman-Diaconis bin count with fallbacks for degenerate samples. */
  static long optimalBins(int n, double range, double iqr, long variety) {
    if (range == 0) {
      return 1;
    }
    if (Double.isNaN(iqr) || iqr <= 0 || Double.isNaN(range)) {
      return variety > 0 ? variety : 1;
    }
    double binWidth = 2.0 * iqr / Math.cbrt(n);
    return (long) Math.ceil(range / binWidth);
  }

  private static void putEmpty(long conversionErrors, FieldReport.Builder report) {
    report.put(
        STATUS,
        StatValue.text(
            conversionErrors == 0
                ? "No valid numeric data"
                : "No valid data (" + conversionErrors + " conversion errors)"));
    for (String key : NUMERIC) {
      if (BASE_KEYS.contains(key)) {
        continue;
      }
      if (ZERO_WHEN_EMPTY.contains(key)) {
        report.put(key, StatValue.integer(0));
      } else if (FALSE_WHEN_EMPTY.contains(key)) {
        report.put(key, StatValue.bool(false));
      } else if (PERCENT_INTEGER.equals(key)) {
        report.put(key, StatValue.percent(0.0));
      } else {
        report.put(key, StatValue.na());
      }
    }
  }

  private static double[] finiteValues(List<Double> converted) {
    return converted.stream()
        .mapToDouble(Double::doubleValue)
        .filter(v -> !Double.isInfinite(v))
        .toArray();
  }

  private static double sum(double[] values) {
    double total = 0;
    for (double value : values) {
      total += value;
    }
    return total;
  }

  private static double populationStdev(double[] values, double mean) {
    if (values.length == 0) {
      return Double.NaN;
    }
    double squares = 0;
    for (double value : values) {
      double d = value - mean;
      squares += d * d;
    }
    return Math.sqrt(squares / values.length);
  }
}
