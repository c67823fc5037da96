package org.apache.arrow.ballista;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.UUID;
import org.apache.arrow.ballista.config.ShuffleOptions;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists one partition of a stage's output as an Arrow IPC file.
 *
 * <p>Data is first written to a hidden in-progress file next to the destination. Only after the
 * whole stream has been consumed and the IPC footer written is that file renamed onto the
 * destination with an atomic move. Any failure, including an interrupt between batches, deletes
 * the in-progress file, so a reader never finds a truncated file at the destination path.
 *
 * <p>A writer holds no per-write state and may be shared by tasks writing different partitions.
 */
public final class ShuffleWriter {
  private static final Logger logger = LoggerFactory.getLogger(ShuffleWriter.class);

  /** Suffix of files that are still being written. Readers reject these. */
  public static final String IN_PROGRESS_SUFFIX = ".inprogress";

  private final ShuffleOptions options;
  private final BufferAllocator allocator;

  public ShuffleWriter(ShuffleOptions options, BufferAllocator allocator) {
    this.options = Objects.requireNonNull(options, "options");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
  }

  /**
   * Streams every batch of {@code stream} into a partition file at {@code destination}.
   *
   * <p>The schema header is taken from {@link RecordBatchReader#schema()}; every batch must carry
   * exactly that schema. The caller keeps ownership of the stream.
   *
   * @param stream the stage output for one partition
   * @param destination where the finalized file should appear
   * @return statistics of everything written
   * @throws ShuffleCreateException if the destination exists or its directory cannot be written
   * @throws ShuffleWriteException if the stream fails, a batch has the wrong schema, the thread is
   *     interrupted, or an I/O error occurs while writing
   */
  public PartitionStats writeStreamToDisk(RecordBatchReader stream, Path destination) {
    Path target = destination.toAbsolutePath();
    if (!options.overwriteExisting() && Files.exists(target)) {
      throw new ShuffleCreateException(target, "file already exists", null);
    }

    Path inProgress = inProgressPath(target);
    FileChannel channel = openExclusive(target, inProgress);
    logger.debug("Writing partition file {} via {}", target, inProgress.getFileName());

    boolean committed = false;
    long batchIndex = -1;
    try {
      Schema schema = stream.schema();
      PartitionStatsAccumulator stats = new PartitionStatsAccumulator();

      try (VectorSchemaRoot sink = VectorSchemaRoot.create(schema, allocator)) {
        ArrowFileWriter writer =
            new ArrowFileWriter(sink, new DictionaryProvider.MapDictionaryProvider(), channel);
        writer.start();

        while (true) {
          batchIndex++;
          if (Thread.currentThread().isInterrupted()) {
            throw new ShuffleWriteException(target, batchIndex, "interrupted", null);
          }
          if (!nextBatch(stream, target, batchIndex)) {
            break;
          }
          VectorSchemaRoot batch = stream.getVectorSchemaRoot();
          if (!schema.equals(batch.getSchema())) {
            throw new ShuffleWriteException(
                target,
                batchIndex,
                "batch schema " + batch.getSchema() + " does not match stream schema " + schema,
                null);
          }
          stats.accumulate(batch);
          BatchStreams.transfer(batch, sink);
          writer.writeBatch();
          logger.debug(
              "Appended batch {} with {} rows to {}", batchIndex, batch.getRowCount(), target);
        }
        batchIndex = -1;
        writer.end();
        if (options.syncOnFinish()) {
          channel.force(true);
        }
      }
      channel.close();
      commit(inProgress, target);
      committed = true;

      PartitionStats result = stats.snapshot();
      logger.debug(
          "Finalized partition file {}: {} rows in {} batches",
          target,
          result.numRows(),
          result.numBatches());
      return result;
    } catch (IOException e) {
      throw new ShuffleWriteException(target, batchIndex, e.toString(), e);
    } catch (ShuffleWriteException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ShuffleWriteException(target, batchIndex, e.toString(), e);
    } finally {
      if (!committed) {
        abandon(channel, inProgress);
      }
    }
  }

  /**
   * Returns the in-progress sibling used while writing {@code destination}.
   *
   * @param destination the final partition file path
   * @return a hidden, unique path in the same directory
   */
  static Path inProgressPath(Path destination) {
    String name = "." + destination.getFileName() + "." + UUID.randomUUID() + IN_PROGRESS_SUFFIX;
    return destination.resolveSibling(name);
  }

  private FileChannel openExclusive(Path target, Path inProgress) {
    try {
      return FileChannel.open(inProgress, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    } catch (NoSuchFileException e) {
      throw new ShuffleCreateException(target, "directory does not exist", e);
    } catch (FileAlreadyExistsException e) {
      throw new ShuffleCreateException(target, "in-progress file already exists", e);
    } catch (IOException | SecurityException e) {
      throw new ShuffleCreateException(target, e.toString(), e);
    }
  }

  private static boolean nextBatch(RecordBatchReader stream, Path target, long batchIndex) {
    try {
      return stream.loadNextBatch();
    } catch (RuntimeException e) {
      throw new ShuffleWriteException(target, batchIndex, "stream failed: " + e.getMessage(), e);
    }
  }

  private void commit(Path inProgress, Path target) throws IOException {
    if (!options.overwriteExisting() && Files.exists(target)) {
      throw new ShuffleWriteException(target, -1, "destination was created concurrently", null);
    }
    try {
      Files.move(inProgress, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      throw new ShuffleWriteException(
          target, -1, "file system does not support atomic rename", e);
    }
  }

  private static void abandon(FileChannel channel, Path inProgress) {
    try {
      channel.close();
    } catch (IOException e) {
      logger.warn("Failed to close abandoned partition file {}", inProgress, e);
    }
    try {
      Files.deleteIfExists(inProgress);
      logger.debug("Deleted abandoned partition file {}", inProgress);
    } catch (IOException e) {
      logger.warn("Failed to delete abandoned partition file {}", inProgress, e);
    }
  }
}
