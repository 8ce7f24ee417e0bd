package com.acme.achnotify.core;

/** A failure that repeats on retry, such as a missing row or a constraint violation. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
