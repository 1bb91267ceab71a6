package com.fieldprofiler.profiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Row identifiers recorded for one statistic, limited to {@code cap} entries. Once the cap is
 * reached further ids are dropped and {@link #isCapped()} reports it; counts are tracked
 * separately by the caller and are never truncated.
 */
public final class BoundedRowIds {

  @Getter private final int cap;
  private final List<Long> ids = new ArrayList<>();
  @Getter private boolean capped;

  public BoundedRowIds(int cap) {
    if (cap < 0) {
      throw new IllegalArgumentException("cap must be >= 0, was " + cap);
    }
    this.cap = cap;
  }

  /** Records {@code rowId}; returns false when the cap was already reached. */
  public boolean add(long rowId) {
    if (ids.size() >= cap) {
      capped = true;
      return false;
    }
    ids.add(rowId);
    return true;
  }

  public List<Long> getIds() {
    return Collections.unmodifiableList(ids);
  }

  public int size() {
    return ids.size();
  }

  public boolean isEmpty() {
    return ids.isEmpty();
  }
}
