package com.fieldprofiler.profiler.service.storage;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Service;

import com.fieldprofiler.profiler.config.ProfilerProperties;
import com.fieldprofiler.profiler.exception.ResourceNotFoundException;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded, expiring in-memory store of finished runs. Each run is one entry under its own id;
 * runs are never merged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisStorageService {

  private final ProfilerProperties properties;
  private final Clock clock;

  private Cache<String, StoredAnalysis> analyses;

  @PostConstruct
  public void init() {
    ProfilerProperties.Cache cache = properties.getCache();
    analyses =
        CacheBuilder.newBuilder()
            .maximumSize(cache.getMaxSize())
            .expireAfterWrite(cache.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
            .build();
    log.info(
        "Analysis store initialized (max {} runs, expiry {} min)",
        cache.getMaxSize(),
        cache.getExpireAfterWriteMinutes());
  }

  public StoredAnalysis save(
      String datasetName, List<FieldDescriptor> fields, ProfileResult result) {
    StoredAnalysis stored =
        StoredAnalysis.builder()
            .id(UUID.randomUUID().toString())
            .datasetName(datasetName)
            .createdAt(LocalDateTime.now(clock))
            .fields(List.copyOf(fields))
            .result(result)
            .build();
    analyses.put(stored.getId(), stored);
    log.debug("Stored analysis {} for '{}'", stored.getId(), datasetName);
    return stored;
  }

  public Optional<StoredAnalysis> find(String id) {
    return Optional.ofNullable(analyses.getIfPresent(id));
  }

  public StoredAnalysis get(String id) {
    return find(id).orElseThrow(() -> new ResourceNotFoundException("Analysis not found: " + id));
  }

  /** Stored runs, newest first. */
  public List<StoredAnalysis> list() {
    return analyses.asMap().values().stream()
        .sorted(Comparator.comparing(StoredAnalysis::getCreatedAt).reversed())
        .collect(Collectors.toList());
  }

  public void delete(String id) {
    get(id);
    analyses.invalidate(id);
    log.info("Deleted analysis {}", id);
  }

  public long clear() {
    long removed = analyses.size();
    analyses.invalidateAll();
    log.info("Cleared {} stored analyses", removed);
    return removed;
  }
}
