package com.acme.achnotify.core;

/**
 * Raised when the job cannot start: a required parameter is missing or the eligible-payments
 * search cannot be opened. Always fatal for the run.
 */
public class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable e) {
    super(message, e);
  }
}
