package org.apache.arrow.ballista;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.InvalidArrowFileException;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a finalized shuffle partition file.
 *
 * <p>A file is accepted only if it is not an in-progress file and its Arrow IPC footer is present
 * and valid. The footer is written last, so a file cut short by a crash is rejected rather than
 * read as a shorter partition.
 */
public final class ShuffleFileReader implements RecordBatchReader {
  private static final Logger logger = LoggerFactory.getLogger(ShuffleFileReader.class);

  private final Path path;
  private final ArrowFileReader reader;
  private final VectorSchemaRoot root;
  private final int batchCount;
  private boolean closed = false;

  private ShuffleFileReader(
      Path path, ArrowFileReader reader, VectorSchemaRoot root, int batchCount) {
    this.path = path;
    this.reader = reader;
    this.root = root;
    this.batchCount = batchCount;
  }

  /**
   * Opens a partition file written by {@link ShuffleWriter}.
   *
   * @param path the partition file
   * @param allocator allocator for the batches read from the file
   * @return a reader positioned before the first batch
   * @throws InvalidShuffleFileException if the file is in progress, truncated or corrupt
   * @throws StreamReadException if the file cannot be opened
   */
  public static ShuffleFileReader open(Path path, BufferAllocator allocator) {
    String name = path.getFileName().toString();
    if (name.endsWith(ShuffleWriter.IN_PROGRESS_SUFFIX)) {
      throw new InvalidShuffleFileException(path, "file is still being written", null);
    }

    FileChannel channel;
    try {
      channel = FileChannel.open(path, StandardOpenOption.READ);
    } catch (IOException e) {
      throw new StreamReadException("Failed to open shuffle file " + path + ": " + e, e);
    }

    ArrowFileReader reader = new ArrowFileReader(channel, allocator);
    try {
      VectorSchemaRoot root = reader.getVectorSchemaRoot();
      int batchCount = reader.getRecordBlocks().size();
      logger.debug("Opened shuffle file {} with {} batches", path, batchCount);
      return new ShuffleFileReader(path, reader, root, batchCount);
    } catch (InvalidArrowFileException | IOException e) {
      closeAfterFailure(reader, e);
      throw new InvalidShuffleFileException(path, e.getMessage(), e);
    } catch (RuntimeException e) {
      closeAfterFailure(reader, e);
      throw new InvalidShuffleFileException(path, e.toString(), e);
    }
  }

  /**
   * Returns the path this reader was opened on.
   *
   * @return the partition file path
   */
  public Path getPath() {
    return path;
  }

  /**
   * Returns the number of batches recorded in the file footer.
   *
   * @return batch count
   */
  public int getBatchCount() {
    return batchCount;
  }

  @Override
  public Schema schema() {
    return root.getSchema();
  }

  @Override
  public VectorSchemaRoot getVectorSchemaRoot() {
    return root;
  }

  @Override
  public boolean loadNextBatch() {
    if (closed) {
      throw new IllegalStateException("ShuffleFileReader has been closed");
    }
    try {
      return reader.loadNextBatch();
    } catch (IOException e) {
      throw new StreamReadException("Failed to read batch from " + path + ": " + e, e);
    }
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      try {
        reader.close();
        logger.debug("Closed shuffle file {}", path);
      } catch (IOException e) {
        logger.error("Error closing shuffle file {}", path, e);
      }
    }
  }

  private static void closeAfterFailure(ArrowFileReader reader, Exception failure) {
    try {
      reader.close();
    } catch (IOException | RuntimeException e) {
      failure.addSuppressed(e);
    }
  }
}
