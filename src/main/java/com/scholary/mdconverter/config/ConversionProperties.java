package com.scholary.mdconverter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch conversion.
 *
 * <p>Controls the worker pool size, the per-job time limit, which files are picked up by pattern
 * expansion and how the external converter is invoked.
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public record ConversionProperties(
    @PositiveOrZero int workers,
    @DefaultValue("120") @Positive int timeoutSeconds,
    @DefaultValue({"pdf", "docx", "pptx", "txt", "md"}) @NotEmpty List<String> supportedExtensions,
    @DefaultValue("md") @NotBlank String outputExtension,
    @DefaultValue @Valid ConverterProperties converter) {

  public ConversionProperties {
    if (supportedExtensions == null || supportedExtensions.isEmpty()) {
      supportedExtensions = List.of("pdf", "docx", "pptx", "txt", "md");
    }
    if (outputExtension == null) {
      outputExtension = "md";
    }
    if (converter == null) {
      converter = new ConverterProperties(null, true);
    }
  }

  /**
   * External converter invocation.
   *
   * @param command executable and leading arguments; the source path is appended last
   * @param cleanOutput whether to run the Markdown cleanup pass on the converter's output
   */
  public record ConverterProperties(
      @DefaultValue("markitdown") @NotEmpty List<String> command,
      @DefaultValue("true") boolean cleanOutput) {

    public ConverterProperties {
      if (command == null || command.isEmpty()) {
        command = List.of("markitdown");
      }
    }
  }

  /** Number of worker threads: the configured value, or one less than the CPU count. */
  public int effectiveWorkers() {
    if (workers > 0) {
      return workers;
    }
    return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
  }

  public Duration timeout() {
    return Duration.ofSeconds(timeoutSeconds);
  }

  /** Supported extensions, lower-cased and without a leading dot. */
  public Set<String> normalizedExtensions() {
    return supportedExtensions.stream()
        .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
        .map(ext -> ext.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
