package com.scholary.mdconverter.converter;

/**
 * Exception thrown when a document cannot be converted.
 *
 * <p>The message is shown to the user as the job's status message, so it should say what went
 * wrong in plain terms (unreadable file, unsupported content, converter exit code).
 */
public class ConversionException extends RuntimeException {

  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
