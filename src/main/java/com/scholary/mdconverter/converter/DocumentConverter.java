package com.scholary.mdconverter.converter;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Converts one source document into a derived Markdown file.
 *
 * <p>Implementations should honour thread interruption: the worker pool interrupts a call that
 * overran its time limit, but cannot force it to stop.
 */
public interface DocumentConverter {

  /**
   * Convert a document.
   *
   * @param source the source file
   * @param timeout wall-clock limit for this conversion
   * @return the location of the derived file
   * @throws ConversionException if the document cannot be converted
   * @throws InterruptedException if the calling thread is interrupted
   */
  ConversionResult convert(Path source, Duration timeout) throws InterruptedException;
}
