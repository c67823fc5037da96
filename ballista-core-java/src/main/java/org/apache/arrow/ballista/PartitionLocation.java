package org.apache.arrow.ballista;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Location and statistics of one finalized shuffle partition.
 *
 * @param jobId the job that produced the partition
 * @param stageId the stage that produced the partition
 * @param partitionId the output partition index
 * @param path the finalized partition file
 * @param stats statistics recorded while writing the file
 */
public record PartitionLocation(
    String jobId, int stageId, int partitionId, Path path, PartitionStats stats) {
  public PartitionLocation {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(stats, "stats");
  }
}
