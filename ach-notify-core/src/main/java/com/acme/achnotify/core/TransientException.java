package com.acme.achnotify.core;

/** A failure that may clear on its own, such as a lost connection or an unreachable mail server. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable cause) {
    super(message, cause);
  }
}
