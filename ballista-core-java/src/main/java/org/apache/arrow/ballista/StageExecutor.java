package org.apache.arrow.ballista;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.arrow.ballista.config.ShuffleOptions;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes the output partitions of a running {@link QueryStage}.
 *
 * <p>Executing the stage's operators is the caller's job; this class takes the resulting batch
 * stream for one partition, writes it under the configured work directory and records the
 * finalized partition on the stage.
 */
public final class StageExecutor {
  private static final Logger logger = LoggerFactory.getLogger(StageExecutor.class);

  private final ShuffleOptions options;
  private final ShuffleWriter writer;

  public StageExecutor(ShuffleOptions options, BufferAllocator allocator) {
    this.options = Objects.requireNonNull(options, "options");
    this.writer = new ShuffleWriter(options, allocator);
  }

  /**
   * Writes one output partition of {@code stage}.
   *
   * @param stage a running stage
   * @param partition the output partition index
   * @param output the stage's batch stream for that partition; the caller keeps ownership
   * @return the location of the finalized partition file
   * @throws IllegalStateException if the stage is not running
   * @throws ShuffleCreateException if the partition directory or file cannot be created
   * @throws ShuffleWriteException if writing fails
   */
  public PartitionLocation executePartition(
      QueryStage stage, int partition, RecordBatchReader output) {
    if (stage.state() != StageState.RUNNING) {
      throw new IllegalStateException(stage + " is not running");
    }
    if (partition < 0 || partition >= stage.partitionCount()) {
      throw new IllegalArgumentException(
          "Partition " + partition + " out of range for " + stage);
    }

    Path path = options.partitionFile(stage.jobId(), stage.stageId(), partition);
    try {
      Files.createDirectories(path.getParent());
    } catch (IOException e) {
      throw new ShuffleCreateException(path, "cannot create partition directory: " + e, e);
    }

    logger.debug("Executing partition {} of {} into {}", partition, stage, path);
    PartitionStats stats = writer.writeStreamToDisk(output, path);
    PartitionLocation location =
        new PartitionLocation(stage.jobId(), stage.stageId(), partition, path, stats);
    stage.recordPartition(location);
    return location;
  }
}
