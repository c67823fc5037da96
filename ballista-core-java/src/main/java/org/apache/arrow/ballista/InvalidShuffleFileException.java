package org.apache.arrow.ballista;

import java.nio.file.Path;

/**
 * Thrown when a file offered as shuffle input is not a finalized partition file.
 *
 * <p>This covers in-progress files left behind by a crashed or cancelled writer as well as files
 * whose Arrow IPC footer is missing or corrupt.
 */
public class InvalidShuffleFileException extends StreamReadException {
  private final Path path;

  public InvalidShuffleFileException(Path path, String reason, Throwable cause) {
    super("Not a finalized shuffle file: " + path + " (" + reason + ")", cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
