package com.fieldprofiler.profiler.service.storage;

import java.time.LocalDateTime;
import java.util.List;

import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.ProfileResult;

import lombok.Builder;
import lombok.Value;

/** A finished run as kept by {@link AnalysisStorageService}. */
@Value
@Builder
public class StoredAnalysis {
  String id;
  String datasetName;
  LocalDateTime createdAt;
  List<FieldDescriptor> fields;
  ProfileResult result;
}
