package com.scholary.mdconverter.service;

import java.util.List;

/**
 * Outcome of a batch submission.
 *
 * @param queuedFiles paths newly queued by this submission, in expansion order
 * @param unmatchedPatterns patterns that resolved to no supported file
 */
public record BatchResult(List<String> queuedFiles, List<String> unmatchedPatterns) {

  public int queuedCount() {
    return queuedFiles.size();
  }
}
