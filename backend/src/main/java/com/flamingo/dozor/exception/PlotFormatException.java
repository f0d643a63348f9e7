package com.flamingo.dozor.exception;

/** Exception thrown when a plot description file does not follow the block/subplot grammar. */
public class PlotFormatException extends RuntimeException {

  private final int lineNumber;
  private final String userMessage;

  public PlotFormatException(int lineNumber, String message) {
    super("Line " + lineNumber + ": " + message);
    this.lineNumber = lineNumber;
    this.userMessage = "Plot file could not be parsed";
  }

  public PlotFormatException(int lineNumber, String message, Throwable cause) {
    super("Line " + lineNumber + ": " + message, cause);
    this.lineNumber = lineNumber;
    this.userMessage = "Plot file could not be parsed";
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
