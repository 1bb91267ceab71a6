package com.fieldprofiler.profiler.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fieldprofiler.profiler.service.analysis.statistics.CommonsMathModeCalculator;
import com.fieldprofiler.profiler.service.analysis.statistics.CommonsMathShapeCalculator;
import com.fieldprofiler.profiler.service.analysis.statistics.DistributionShapeCalculator;
import com.fieldprofiler.profiler.service.analysis.statistics.FrequencyModeCalculator;
import com.fieldprofiler.profiler.service.analysis.statistics.ModeCalculator;
import com.fieldprofiler.profiler.service.analysis.statistics.UnavailableShapeCalculator;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public StatisticsCapability statisticsCapability(ProfilerProperties properties) {
    return StatisticsCapability.detect(
        properties.getStatistics().isAdvancedEnabled(), CoreConfig.class.getClassLoader());
  }

  @Bean
  public ModeCalculator modeCalculator(StatisticsCapability capability) {
    return capability.isAvailable()
        ? new CommonsMathModeCalculator()
        : new FrequencyModeCalculator();
  }

  @Bean
  public DistributionShapeCalculator distributionShapeCalculator(
      StatisticsCapability capability) {
    return capability.isAvailable()
        ? new CommonsMathShapeCalculator()
        : new UnavailableShapeCalculator();
  }
}
