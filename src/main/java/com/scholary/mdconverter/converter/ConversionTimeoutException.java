package com.scholary.mdconverter.converter;

import java.time.Duration;

/** The converter gave up on a document because it ran past its time limit. */
public class ConversionTimeoutException extends ConversionException {

  public ConversionTimeoutException(Duration timeout) {
    super(timeoutMessage(timeout));
  }

  public static String timeoutMessage(Duration timeout) {
    long millis = timeout.toMillis();
    String limit = millis % 1000 == 0 ? (millis / 1000) + " seconds" : millis + " ms";
    return "Conversion timed out after " + limit;
  }
}
