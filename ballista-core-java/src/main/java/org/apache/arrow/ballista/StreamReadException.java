package org.apache.arrow.ballista;

/** Thrown when a record batch stream fails while being read. */
public class StreamReadException extends BallistaException {
  public StreamReadException(String message) {
    super(message);
  }

  public StreamReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
