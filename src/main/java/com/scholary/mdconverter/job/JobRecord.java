package com.scholary.mdconverter.job;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable state of one job at one instant.
 *
 * <p>The store replaces records wholesale on every transition, so a reader holding a record never
 * sees a status paired with a message from another transition.
 */
public record JobRecord(JobStatus status, String message, Instant timestamp) {

  public JobRecord {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
