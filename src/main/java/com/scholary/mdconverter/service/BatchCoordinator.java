package com.scholary.mdconverter.service;

import com.scholary.mdconverter.expansion.ExpansionResult;
import com.scholary.mdconverter.expansion.PatternExpander;
import com.scholary.mdconverter.job.JobStatusStore;
import com.scholary.mdconverter.logging.StructuredLogger;
import com.scholary.mdconverter.worker.ConversionWorkerPool;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for batch submissions.
 *
 * <p>Expands the patterns, registers each file as Queued and hands newly registered files to the
 * worker pool. Files that are already queued or processing are skipped, so submitting the same
 * pattern twice never runs a file twice at once.
 *
 * <p>Submission never waits for a conversion; progress is only visible through {@link
 * StatusPoller}.
 */
@Service
public class BatchCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchCoordinator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PatternExpander expander;
  private final JobStatusStore store;
  private final ConversionWorkerPool pool;

  public BatchCoordinator(PatternExpander expander, JobStatusStore store, ConversionWorkerPool pool) {
    this.expander = expander;
    this.store = store;
    this.pool = pool;
  }

  /**
   * Submit a batch of patterns.
   *
   * @param patterns file paths or glob expressions
   * @return files queued by this call and patterns that matched nothing
   * @throws IllegalArgumentException if no non-blank pattern is given
   */
  public BatchResult submit(List<String> patterns) {
    if (patterns == null || patterns.stream().allMatch(p -> p == null || p.isBlank())) {
      throw new IllegalArgumentException("At least one file path or pattern is required");
    }

    ExpansionResult expansion = expander.expand(patterns);

    List<String> queued = new ArrayList<>();
    for (String file : expansion.files()) {
      if (store.register(file)) {
        queued.add(file);
        pool.submit(file);
      } else {
        LOGGER.debug("Skipping file already in flight: {}", file);
      }
    }

    structuredLogger.logBatchSubmitted(
        patterns.size(), expansion.files().size(), queued.size(), expansion.unmatched().size());

    return new BatchResult(List.copyOf(queued), expansion.unmatched());
  }

  /**
   * Forget every job.
   *
   * <p>Queued work is dropped when a worker picks it up; running conversions finish but their
   * results are discarded.
   */
  public void clear() {
    store.clear();
    LOGGER.info("Cleared conversion status");
  }
}
