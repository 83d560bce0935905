package com.scholary.mdconverter.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a conversion job.
 *
 * <p>{@code QUEUED -> PROCESSING -> COMPLETED | ERROR}. Terminal states are only left through a
 * fresh registration or a store clear.
 */
public enum JobStatus {
  QUEUED("Queued"),
  PROCESSING("Processing"),
  COMPLETED("Completed"),
  ERROR("Error");

  private final String label;

  JobStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }
}
