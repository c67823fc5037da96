package org.apache.arrow.ballista;

/**
 * Base exception class for Ballista errors.
 *
 * <p>This is the parent class for all exceptions thrown while writing, reading, resolving or
 * describing query stages. None of them are retried inside the library; retry policy belongs to the
 * scheduler that re-runs whole stages.
 */
public class BallistaException extends RuntimeException {
  public BallistaException(String message) {
    super(message);
  }

  public BallistaException(String message, Throwable cause) {
    super(message, cause);
  }
}
