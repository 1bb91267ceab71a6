package com.fieldprofiler.profiler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.fieldprofiler.profiler.model.AnalysisOptions;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "profiler")
public class ProfilerProperties {

  private String version;

  /** Maximum row ids kept per field for conversion errors and non-printable text. */
  private int rowIdCap = 10_000;

  private Defaults defaults = new Defaults();
  private Statistics statistics = new Statistics();
  private Upload upload = new Upload();
  private Cache cache = new Cache();

  @Data
  public static class Defaults {
    private boolean numericDistributionShape = true;
    private boolean numericAdvancedPercentiles = true;
    private boolean numericIntegerDecimalSplit = true;
    private boolean numericOutlierDetails = true;
    private boolean textCaseAnalysis = true;
    private boolean textRarityAndNonPrintable = true;
    private boolean temporalTimeAndWeekend = true;
    private int topValuesLimit = 5;
    private int decimalPlaces = 2;

    public AnalysisOptions toOptions() {
      return AnalysisOptions.builder()
          .numericDistributionShape(numericDistributionShape)
          .numericAdvancedPercentiles(numericAdvancedPercentiles)
          .numericIntegerDecimalSplit(numericIntegerDecimalSplit)
          .numericOutlierDetails(numericOutlierDetails)
          .textCaseAnalysis(textCaseAnalysis)
          .textRarityAndNonPrintable(textRarityAndNonPrintable)
          .temporalTimeAndWeekend(temporalTimeAndWeekend)
          .topValuesLimit(topValuesLimit)
          .decimalPlaces(decimalPlaces)
          .build();
    }
  }

  @Data
  public static class Statistics {
    /** Set to false to run without the optional statistics library even when present. */
    private boolean advancedEnabled = true;
  }

  @Data
  public static class Upload {
    private long maxRows = 1_000_000;
    private char separator = ',';
  }

  @Data
  public static class Cache {
    private long maxSize = 50;
    private long expireAfterWriteMinutes = 60;
  }
}
