package org.apache.arrow.ballista;

import java.nio.file.Path;

/** Thrown when a shuffle file cannot be opened for exclusive creation. */
public class ShuffleCreateException extends BallistaException {
  private final Path destination;

  public ShuffleCreateException(Path destination, String reason, Throwable cause) {
    super("Failed to create partition file at " + destination + ": " + reason, cause);
    this.destination = destination;
  }

  /**
   * Gets the path that could not be created.
   *
   * @return the requested destination
   */
  public Path getDestination() {
    return destination;
  }
}
