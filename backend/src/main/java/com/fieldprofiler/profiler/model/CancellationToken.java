package com.fieldprofiler.profiler.model;

import java.util.concurrent.atomic.AtomicBoolean;

/** Lets the host stop a running collection pass between two rows. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
