package com.fieldprofiler.profiler.model;

/** Receives throttled progress notifications during the collection pass. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (processed, total) -> {};

  void onProgress(long processedRows, long totalRows);
}
