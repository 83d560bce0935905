package com.scholary.mdconverter.logging;

import com.scholary.mdconverter.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log job and batch events with structured fields that can be queried in
 * Kibana.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log batch submission event. */
  public void logBatchSubmitted(int patterns, int resolved, int queued, int unmatched) {
    try {
      MDC.put("event_type", "batch_submitted");
      MDC.put("patterns", String.valueOf(patterns));
      MDC.put("resolved", String.valueOf(resolved));
      MDC.put("queued", String.valueOf(queued));
      MDC.put("unmatched", String.valueOf(unmatched));

      logger.info(
          "Batch submitted: patterns={}, resolved={}, queued={}, unmatched={}",
          patterns,
          resolved,
          queued,
          unmatched);
    } finally {
      clearEventFields();
    }
  }

  /** Log job status transition event. */
  public void logJobTransition(String path, JobStatus status, String message) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("status", status.label());

      if (status == JobStatus.ERROR) {
        logger.warn("Job {}: path={}, message={}", status.label(), path, message);
      } else {
        logger.info("Job {}: path={}", status.label(), path);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log conversion finished event. */
  public void logConversionFinished(String path, JobStatus status, long durationMs) {
    try {
      MDC.put("event_type", "conversion_finished");
      MDC.put("status", status.label());
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Conversion finished: path={}, status={}, duration={}ms",
          path,
          status.label(),
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log conversion timeout event. */
  public void logConversionTimeout(String path, long timeoutMs) {
    try {
      MDC.put("event_type", "conversion_timeout");
      MDC.put("timeoutMs", String.valueOf(timeoutMs));

      logger.warn(
          "Conversion timed out: path={}, timeout={}ms, abandoning call", path, timeoutMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a unit of work dropped because its job is no longer claimable. */
  public void logJobDropped(String path, String reason) {
    try {
      MDC.put("event_type", "job_dropped");
      MDC.put("reason", reason);

      logger.warn("Job dropped: path={}, reason={}", path, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String path) {
    MDC.put("path", path);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("path");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("patterns");
    MDC.remove("resolved");
    MDC.remove("queued");
    MDC.remove("unmatched");
    MDC.remove("status");
    MDC.remove("durationMs");
    MDC.remove("timeoutMs");
    MDC.remove("reason");
  }
}
