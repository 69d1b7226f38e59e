package com.legacyrules.engine.detection;

public class ProfileConfigurationException extends RuntimeException {

  public ProfileConfigurationException(String message) {
    super(message);
  }

  public ProfileConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
