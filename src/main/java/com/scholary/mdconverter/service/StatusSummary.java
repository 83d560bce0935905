package com.scholary.mdconverter.service;

/** Job counts per status, taken from a single snapshot. */
public record StatusSummary(int queued, int processing, int completed, int error, int total) {

  public static StatusSummary of(int queued, int processing, int completed, int error) {
    return new StatusSummary(
        queued, processing, completed, error, queued + processing + completed + error);
  }
}
