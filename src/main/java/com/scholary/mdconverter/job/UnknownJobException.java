package com.scholary.mdconverter.job;

/**
 * Thrown when a transition targets a path that is not registered in the store.
 *
 * <p>In normal flow this only happens when the store was cleared while a unit of work for the
 * path was still queued or running.
 */
public class UnknownJobException extends RuntimeException {

  private final String path;

  public UnknownJobException(String path) {
    super("No job registered for path: " + path);
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
