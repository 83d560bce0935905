package com.scholary.mdconverter.service;

import com.scholary.mdconverter.job.JobRecord;
import com.scholary.mdconverter.job.JobStatus;
import com.scholary.mdconverter.job.JobStatusStore;
import java.util.Map;
import org.springframework.stereotype.Service;

/** Read-only view of job status for polling clients. */
@Service
public class StatusPoller {

  private final JobStatusStore store;

  public StatusPoller(JobStatusStore store) {
    this.store = store;
  }

  public Map<String, JobRecord> poll() {
    return store.snapshot();
  }

  public StatusSummary summary() {
    int queued = 0;
    int processing = 0;
    int completed = 0;
    int error = 0;
    for (JobRecord record : store.snapshot().values()) {
      if (record.status() == JobStatus.QUEUED) {
        queued++;
      } else if (record.status() == JobStatus.PROCESSING) {
        processing++;
      } else if (record.status() == JobStatus.COMPLETED) {
        completed++;
      } else {
        error++;
      }
    }
    return StatusSummary.of(queued, processing, completed, error);
  }
}
