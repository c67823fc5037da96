package org.apache.arrow.ballista;

import java.nio.file.Path;

/**
 * Thrown when a shuffle write is aborted after the file was created.
 *
 * <p>The in-progress file has been removed by the time this exception reaches the caller, so
 * nothing is left at the destination that a reader could mistake for a finalized partition.
 */
public class ShuffleWriteException extends BallistaException {
  private final Path destination;
  private final long batchIndex;

  /**
   * Creates a new ShuffleWriteException.
   *
   * @param destination the partition file that was being written
   * @param batchIndex index of the batch being processed when the write failed, or -1 if the
   *     failure happened outside batch processing (header or footer)
   * @param message what went wrong
   * @param cause the underlying failure, may be null
   */
  public ShuffleWriteException(Path destination, long batchIndex, String message, Throwable cause) {
    super(formatMessage(destination, batchIndex, message), cause);
    this.destination = destination;
    this.batchIndex = batchIndex;
  }

  public Path getDestination() {
    return destination;
  }

  public long getBatchIndex() {
    return batchIndex;
  }

  private static String formatMessage(Path destination, long batchIndex, String message) {
    if (batchIndex >= 0) {
      return "Failed to write partition file " + destination + " at batch " + batchIndex + ": "
          + message;
    }
    return "Failed to write partition file " + destination + ": " + message;
  }
}
