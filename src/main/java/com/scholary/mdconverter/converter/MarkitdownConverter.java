package com.scholary.mdconverter.converter;

import com.scholary.mdconverter.config.ConversionProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts documents by running the markitdown command line tool.
 *
 * <p>The configured command is run with the absolute source path appended as its last argument.
 * Whatever the tool prints on stdout is taken as the Markdown body. A small header naming the
 * source is prepended, the result is optionally cleaned and written next to the source.
 *
 * <p>stdout and stderr go to temp files, never to pipes.
 */
@Component
public class MarkitdownConverter implements DocumentConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(MarkitdownConverter.class);

  private static final int MAX_ERROR_CHARS = 500;

  private final List<String> command;
  private final boolean cleanOutput;
  private final String outputExtension;
  private final MarkdownCleaner cleaner;

  public MarkitdownConverter(ConversionProperties properties, MarkdownCleaner cleaner) {
    this.command = List.copyOf(properties.converter().command());
    this.cleanOutput = properties.converter().cleanOutput();
    this.outputExtension = properties.outputExtension();
    this.cleaner = cleaner;
  }

  @Override
  public ConversionResult convert(Path source, Duration timeout) throws InterruptedException {
    if (!Files.isRegularFile(source)) {
      throw new ConversionException("File does not exist: " + source);
    }

    Path resolved = source.toAbsolutePath().normalize();
    Path output = OutputPaths.derive(resolved, outputExtension);

    Path stdout = null;
    Path stderr = null;
    try {
      stdout = Files.createTempFile("md-converter-", ".out");
      stderr = Files.createTempFile("md-converter-", ".err");

      List<String> args = new ArrayList<>(command);
      args.add(resolved.toString());
      LOGGER.debug("Executing: {}", args);

      Process process =
          new ProcessBuilder(args)
              .redirectOutput(stdout.toFile())
              .redirectError(stderr.toFile())
              .start();

      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        process.destroyForcibly();
        throw e;
      }
      if (!finished) {
        process.destroyForcibly();
        throw new ConversionTimeoutException(timeout);
      }

      if (process.exitValue() != 0) {
        String error = Files.readString(stderr, StandardCharsets.UTF_8).strip();
        throw new ConversionException(
            "markitdown conversion failed (exit code "
                + process.exitValue()
                + "): "
                + abbreviate(error));
      }

      String body = Files.readString(stdout, StandardCharsets.UTF_8);
      String header = "# File: " + resolved.getFileName() + "\n# Path: " + resolved + "\n\n";
      String content = cleanOutput ? cleaner.clean(header + body) : header + body;

      Files.writeString(output, content, StandardCharsets.UTF_8);
      LOGGER.debug("Wrote {} chars to {}", content.length(), output);

      return new ConversionResult(resolved, output);

    } catch (IOException e) {
      throw new ConversionException("Error during conversion: " + e.getMessage(), e);
    } finally {
      deleteQuietly(stdout);
      deleteQuietly(stderr);
    }
  }

  private static String abbreviate(String text) {
    if (text.isEmpty()) {
      return "no error output";
    }
    return text.length() <= MAX_ERROR_CHARS ? text : text.substring(0, MAX_ERROR_CHARS) + "...";
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", file, e);
    }
  }
}
