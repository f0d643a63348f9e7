package com.flamingo.dozor.exception;

/** Exception thrown when the header, catalog or artifact-store service fails. */
public class ExternalServiceException extends RuntimeException {

  private final String serviceName;
  private final String userMessage;

  public ExternalServiceException(String serviceName, String message) {
    super(message);
    this.serviceName = serviceName;
    this.userMessage = "The " + serviceName + " service is temporarily unavailable.";
  }

  public ExternalServiceException(String serviceName, String message, Throwable cause) {
    super(message, cause);
    this.serviceName = serviceName;
    this.userMessage = "The " + serviceName + " service is temporarily unavailable.";
  }

  public String getServiceName() {
    return serviceName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
