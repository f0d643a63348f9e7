package com.flamingo.dozor.exception;

/**
 * Exception thrown when a run cannot be configured: missing or contradictory image-source
 * descriptor, unknown detector, or unresolvable library. Raised before any execution attempt.
 */
public class ConfigurationException extends RuntimeException {

  private final String userMessage;

  public ConfigurationException(String message) {
    super(message);
    this.userMessage = message;
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
