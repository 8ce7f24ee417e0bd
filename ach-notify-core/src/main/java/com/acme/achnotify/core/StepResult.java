package com.acme.achnotify.core;

import java.util.function.Supplier;

/**
 * Outcome of a single collaborator call. Callers branch on {@link #isSuccess()} and decide the
 * routing themselves instead of burying it in a catch block.
 */
public record StepResult<T>(T value, ErrorKind errorKind, String error, Throwable cause) {

  public static <T> StepResult<T> success(T value) {
    return new StepResult<>(value, null, null, null);
  }

  public static <T> StepResult<T> failure(ErrorKind kind, Throwable cause) {
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    return new StepResult<>(null, kind, message, cause);
  }

  /** Runs the call, capturing any runtime failure under the given kind. */
  public static <T> StepResult<T> attempt(ErrorKind kind, Supplier<T> call) {
    try {
      return success(call.get());
    } catch (RuntimeException e) {
      return failure(kind, e);
    }
  }

  /** Variant of {@link #attempt} for calls without a return value. */
  public static StepResult<Void> attemptRun(ErrorKind kind, Runnable call) {
    return attempt(
        kind,
        () -> {
          call.run();
          return null;
        });
  }

  public boolean isSuccess() {
    return errorKind == null;
  }

  public boolean isFailure() {
    return errorKind != null;
  }
}
