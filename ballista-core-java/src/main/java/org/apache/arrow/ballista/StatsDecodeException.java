package org.apache.arrow.ballista;

/**
 * Thrown when a partition statistics record does not match the expected schema.
 *
 * <p>Decoding never substitutes default values: a missing field, a field of the wrong type, a null
 * value or a record with other than one row all end up here.
 */
public class StatsDecodeException extends BallistaException {
  public StatsDecodeException(String message) {
    super("Partition stats schema mismatch: " + message);
  }
}
