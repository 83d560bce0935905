package com.scholary.mdconverter.job;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of conversion job status, keyed by absolute source path.
 *
 * <p>Every operation runs under a single monitor that is held only for the map access itself,
 * never while a conversion runs. Records are immutable and replaced on each transition, so
 * {@link #snapshot()} can hand out a shallow copy that is consistent at one instant.
 *
 * <p>Iteration order is registration order. Re-registering a finished path keeps its original
 * position.
 */
@Repository
public class JobStatusStore {

  static final String QUEUED_MESSAGE = "Waiting to be processed";

  private final Map<String, JobRecord> jobs = new LinkedHashMap<>();
  private final Clock clock;

  @Autowired
  public JobStatusStore() {
    this(Clock.systemUTC());
  }

  public JobStatusStore(Clock clock) {
    this.clock = clock;
  }

  /**
   * Register a path as queued.
   *
   * @return true if a fresh queued record was written, false if the path is already queued or
   *     processing
   */
  public synchronized boolean register(String path) {
    JobRecord current = jobs.get(path);
    if (current != null && !current.status().isTerminal()) {
      return false;
    }
    jobs.put(path, new JobRecord(JobStatus.QUEUED, QUEUED_MESSAGE, clock.instant()));
    return true;
  }

  /**
   * Overwrite the record of a registered path.
   *
   * @throws UnknownJobException if the path is not registered
   */
  public synchronized void transition(String path, JobStatus status, String message) {
    if (!jobs.containsKey(path)) {
      throw new UnknownJobException(path);
    }
    jobs.put(path, new JobRecord(status, message, clock.instant()));
  }

  /**
   * Overwrite the record of a registered path only if it is currently in {@code expected}.
   *
   * @return true if the transition was applied
   * @throws UnknownJobException if the path is not registered
   */
  public synchronized boolean transitionIf(
      String path, JobStatus expected, JobStatus status, String message) {
    JobRecord current = jobs.get(path);
    if (current == null) {
      throw new UnknownJobException(path);
    }
    if (current.status() != expected) {
      return false;
    }
    jobs.put(path, new JobRecord(status, message, clock.instant()));
    return true;
  }

  public synchronized Optional<JobRecord> get(String path) {
    return Optional.ofNullable(jobs.get(path));
  }

  /** Point-in-time copy of all records, in registration order. */
  public synchronized Map<String, JobRecord> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
  }

  public synchronized void clear() {
    jobs.clear();
  }
}
