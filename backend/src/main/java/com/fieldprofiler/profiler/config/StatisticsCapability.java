package com.fieldprofiler.profiler.config;

import java.util.Optional;

import org.springframework.util.ClassUtils;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Whether the optional statistics library (Apache Commons Math) can be used for this process.
 * Decided once at startup.
 */
@Slf4j
@Getter
public class StatisticsCapability {

  static final String PROBE_CLASS = "org.apache.commons.math3.distribution.NormalDistribution";

  public static final String MISSING_WARNING =
      "Statistics library (Apache Commons Math) not available: skewness, kurtosis and "
          + "normality statistics will be reported as N/A.";
  public static final String DISABLED_WARNING =
      "Advanced statistics disabled by configuration: skewness, kurtosis and normality "
          + "statistics will be reported as N/A.";

  private final boolean available;
  private final String warning;

  StatisticsCapability(boolean available, String warning) {
    this.available = available;
    this.warning = warning;
  }

  public static StatisticsCapability detect(boolean enabled, ClassLoader classLoader) {
    if (!enabled) {
      log.warn(DISABLED_WARNING);
      return new StatisticsCapability(false, DISABLED_WARNING);
    }
    if (!ClassUtils.isPresent(PROBE_CLASS, classLoader)) {
      log.warn(MISSING_WARNING);
      return new StatisticsCapability(false, MISSING_WARNING);
    }
    log.info("Statistics library detected, distribution shape statistics enabled");
    return new StatisticsCapability(true, null);
  }

  public static StatisticsCapability available() {
    return new StatisticsCapability(true, null);
  }

  public static StatisticsCapability unavailable(String warning) {
    return new StatisticsCapability(false, warning);
  }

  public Optional<String> warningMessage() {
    return Optional.ofNullable(warning);
  }
}
