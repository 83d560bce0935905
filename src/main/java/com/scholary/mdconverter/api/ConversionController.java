package com.scholary.mdconverter.api;

import com.scholary.mdconverter.service.BatchCoordinator;
import com.scholary.mdconverter.service.BatchResult;
import com.scholary.mdconverter.service.StatusPoller;
import com.scholary.mdconverter.service.StatusSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for batch Markdown conversion.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting file paths and glob patterns (returns immediately)
 *   <li>Polling the status of every known file
 *   <li>Clearing the status history
 * </ul>
 */
@RestController
@Tag(name = "Conversion", description = "Batch document to Markdown conversion API")
public class ConversionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionController.class);

  private final BatchCoordinator batchCoordinator;
  private final StatusPoller statusPoller;

  public ConversionController(BatchCoordinator batchCoordinator, StatusPoller statusPoller) {
    this.batchCoordinator = batchCoordinator;
    this.statusPoller = statusPoller;
  }

  @PostMapping("/convert")
  @Operation(
      summary = "Start conversion",
      description = "Expand paths and patterns, queue the files and return without waiting")
  public ResponseEntity<ConvertResponse> convert(@Valid @RequestBody ConvertRequest request) {
    try {
      LOGGER.info("Conversion request: {} path(s)", request.paths().size());
      BatchResult result = batchCoordinator.submit(request.paths());
      return ResponseEntity.ok(ConvertResponse.accepted(result));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(ConvertResponse.rejected(e.getMessage()));
    } catch (Exception e) {
      LOGGER.error("Failed to start conversion", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(ConvertResponse.rejected(e.getMessage()));
    }
  }

  /**
   * Get the status of every known file.
   *
   * <p>Safe to call on a fixed interval; reading never waits for a conversion.
   */
  @GetMapping("/status")
  @Operation(summary = "Get job status", description = "Status of every submitted file")
  public Map<String, JobStatusResponse> status() {
    Map<String, JobStatusResponse> response = new LinkedHashMap<>();
    statusPoller.poll().forEach((path, record) -> response.put(path, JobStatusResponse.from(record)));
    return response;
  }

  @GetMapping("/status/summary")
  @Operation(summary = "Get status counts", description = "Number of files in each status")
  public StatusSummary summary() {
    return statusPoller.summary();
  }

  @PostMapping("/clear")
  @Operation(summary = "Clear history", description = "Forget every submitted file")
  public ClearResponse clear() {
    batchCoordinator.clear();
    return new ClearResponse(true);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ConvertResponse> handleMalformedRequest(Exception e) {
    LOGGER.warn("Rejected malformed conversion request: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(ConvertResponse.rejected("Request must contain a non-empty 'paths' list"));
  }
}
