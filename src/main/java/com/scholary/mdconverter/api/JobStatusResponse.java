package com.scholary.mdconverter.api;

import com.scholary.mdconverter.job.JobRecord;
import com.scholary.mdconverter.job.JobStatus;

/** Status of one file as shown to polling clients. */
public record JobStatusResponse(JobStatus status, String message, String timestamp) {

  public static JobStatusResponse from(JobRecord record) {
    return new JobStatusResponse(
        record.status(),
        record.message() == null ? "" : record.message(),
        record.timestamp().toString());
  }
}
