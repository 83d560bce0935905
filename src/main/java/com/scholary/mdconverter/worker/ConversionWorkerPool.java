package com.scholary.mdconverter.worker;

import com.scholary.mdconverter.config.ConversionProperties;
import com.scholary.mdconverter.converter.ConversionException;
import com.scholary.mdconverter.converter.ConversionResult;
import com.scholary.mdconverter.converter.ConversionTimeoutException;
import com.scholary.mdconverter.converter.DocumentConverter;
import com.scholary.mdconverter.job.JobStatus;
import com.scholary.mdconverter.job.JobStatusStore;
import com.scholary.mdconverter.job.UnknownJobException;
import com.scholary.mdconverter.logging.StructuredLogger;
import jakarta.annotation.PreDestroy;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Runs conversion jobs on a bounded pool of worker threads.
 *
 * <p>Each unit of work owns one worker for its whole lifetime:
 *
 * <ol>
 *   <li>claim the job by moving it from Queued to Processing
 *   <li>call the converter on a separate call thread and wait at most the configured timeout
 *   <li>record Completed or Error
 * </ol>
 *
 * <p>A call that overruns the timeout is interrupted and abandoned. It may keep running until the
 * converter notices, but its result is never read. All terminal writes are conditional on the job
 * still being Processing, so a job that was cleared or re-registered meanwhile is left alone.
 *
 * <p>Failures never escape a unit of work: whatever happens, the worker thread goes back to the
 * queue.
 */
@Component
public class ConversionWorkerPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionWorkerPool.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String STILL_RUNNING_MESSAGE =
      "A previous conversion of this file is still running";

  private final JobStatusStore store;
  private final DocumentConverter converter;
  private final Executor workers;
  private final Duration timeout;
  private final ExecutorService calls;

  // Paths with a converter call in flight, including abandoned ones
  private final Set<String> runningCalls = ConcurrentHashMap.newKeySet();

  @Autowired
  public ConversionWorkerPool(
      JobStatusStore store,
      DocumentConverter converter,
      @Qualifier("conversionExecutor") Executor workers,
      ConversionProperties properties) {
    this(store, converter, workers, properties.timeout());
  }

  public ConversionWorkerPool(
      JobStatusStore store,
      DocumentConverter converter,
      Executor workers,
      Duration timeout) {
    this(store, converter, workers, timeout, newCallExecutor());
  }

  ConversionWorkerPool(
      JobStatusStore store,
      DocumentConverter converter,
      Executor workers,
      Duration timeout,
      ExecutorService calls) {
    this.store = store;
    this.converter = converter;
    this.workers = workers;
    this.timeout = timeout;
    this.calls = calls;
  }

  private static ExecutorService newCallExecutor() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("conversion-call-");
    threadFactory.setDaemon(true);
    return Executors.newCachedThreadPool(threadFactory);
  }

  /** Enqueue a registered job. Returns immediately. */
  public void submit(String path) {
    workers.execute(() -> run(path));
  }

  @PreDestroy
  public void shutdown() {
    LOGGER.info("Shutting down conversion calls ({} in flight)", runningCalls.size());
    calls.shutdownNow();
  }

  private void run(String path) {
    StructuredLogger.setJobContext(path);
    try {
      process(path);
    } catch (UnknownJobException e) {
      structuredLogger.logJobDropped(path, "job was cleared");
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure while processing job: {}", path, e);
      finishQuietly(path, "Error: " + describe(e));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void process(String path) {
    if (!store.transitionIf(path, JobStatus.QUEUED, JobStatus.PROCESSING, "")) {
      structuredLogger.logJobDropped(path, "job is no longer queued");
      return;
    }
    structuredLogger.logJobTransition(path, JobStatus.PROCESSING, "");

    if (!runningCalls.add(path)) {
      finish(path, JobStatus.ERROR, STILL_RUNNING_MESSAGE);
      return;
    }

    long startNanos = System.nanoTime();
    AtomicBoolean callStarted = new AtomicBoolean();
    Future<ConversionResult> call;
    try {
      call =
          calls.submit(
              () -> {
                if (!callStarted.compareAndSet(false, true)) {
                  return null;
                }
                try {
                  return converter.convert(Paths.get(path), timeout);
                } finally {
                  runningCalls.remove(path);
                }
              });
    } catch (RuntimeException e) {
      runningCalls.remove(path);
      throw e;
    }

    JobStatus outcome = JobStatus.ERROR;
    try {
      ConversionResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (finish(path, JobStatus.COMPLETED, "Successfully converted to: " + result.outputPath())) {
        outcome = JobStatus.COMPLETED;
      }
    } catch (TimeoutException e) {
      abandon(path, call, callStarted);
      structuredLogger.logConversionTimeout(path, timeout.toMillis());
      finish(path, JobStatus.ERROR, ConversionTimeoutException.timeoutMessage(timeout));
    } catch (ExecutionException e) {
      finish(path, JobStatus.ERROR, failureMessage(path, e.getCause()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      abandon(path, call, callStarted);
      finish(path, JobStatus.ERROR, "Conversion interrupted");
    }

    structuredLogger.logConversionFinished(
        path, outcome, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
  }

  /**
   * Cancel a call that is no longer awaited.
   *
   * <p>Whichever side flips {@code started} first owns the runningCalls entry: a call that never
   * got to run is released here, one that did releases it when the converter returns.
   */
  private void abandon(String path, Future<ConversionResult> call, AtomicBoolean started) {
    if (started.compareAndSet(false, true)) {
      runningCalls.remove(path);
    }
    call.cancel(true);
  }

  private String failureMessage(String path, Throwable cause) {
    if (cause instanceof ConversionException) {
      return cause.getMessage();
    }
    if (cause instanceof InterruptedException) {
      return "Conversion interrupted";
    }
    LOGGER.error("Converter failed unexpectedly for job: {}", path, cause);
    return "Error: " + describe(cause);
  }

  /**
   * Write a terminal status if the job is still ours.
   *
   * @return true if the status was recorded
   */
  private boolean finish(String path, JobStatus status, String message) {
    if (store.transitionIf(path, JobStatus.PROCESSING, status, message)) {
      structuredLogger.logJobTransition(path, status, message);
      return true;
    }
    structuredLogger.logJobDropped(path, "result discarded, job is no longer processing");
    return false;
  }

  private void finishQuietly(String path, String message) {
    try {
      finish(path, JobStatus.ERROR, message);
    } catch (UnknownJobException e) {
      structuredLogger.logJobDropped(path, "job was cleared");
    }
  }

  private static String describe(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
  }
}
