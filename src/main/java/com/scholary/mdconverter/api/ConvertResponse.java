package com.scholary.mdconverter.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.mdconverter.service.BatchResult;
import java.util.List;

/**
 * Response for a batch submission.
 *
 * <p>{@code files} lists only the files queued by this request; files that were already queued or
 * processing are left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConvertResponse(
    boolean success, int queued, List<String> files, List<String> unmatched, String error) {

  public static ConvertResponse accepted(BatchResult result) {
    return new ConvertResponse(
        true, result.queuedCount(), result.queuedFiles(), result.unmatchedPatterns(), null);
  }

  public static ConvertResponse rejected(String error) {
    return new ConvertResponse(false, 0, List.of(), List.of(), error);
  }
}
