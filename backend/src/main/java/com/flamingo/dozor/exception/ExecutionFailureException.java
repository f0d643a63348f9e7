package com.flamingo.dozor.exception;

import java.nio.file.Path;

/** Exception thrown when the dozor executable or a service around it fails for a batch. */
public class ExecutionFailureException extends RuntimeException {

  private final Path workingDirectory;

  public ExecutionFailureException(Path workingDirectory, String message) {
    super(message);
    this.workingDirectory = workingDirectory;
  }

  public ExecutionFailureException(Path workingDirectory, String message, Throwable cause) {
    super(message, cause);
    this.workingDirectory = workingDirectory;
  }

  public Path getWorkingDirectory() {
    return workingDirectory;
  }
}
