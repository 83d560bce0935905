package com.scholary.mdconverter.api;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request for converting a batch of files.
 *
 * <p>Each entry is a file path, a directory, or a glob such as {@code docs/*.pdf} or {@code
 * docs/**}{@code /*.docx}. Conversion is asynchronous: the response lists what was queued and the
 * client polls {@code /status} for progress.
 */
public record ConvertRequest(@NotEmpty List<String> paths) {}
