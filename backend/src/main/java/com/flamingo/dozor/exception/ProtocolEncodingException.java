package com.flamingo.dozor.exception;

/** Exception thrown when run parameters violate the encoder contract. */
public class ProtocolEncodingException extends RuntimeException {

  public ProtocolEncodingException(String message) {
    super(message);
  }
}
