package org.apache.arrow.ballista;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.arrow.ballista.plan.PhysicalPlan;
import org.apache.arrow.ballista.plan.PhysicalPlan.QueryStageExec;
import org.apache.arrow.ballista.plan.StageResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One stage of a distributed query and the partitions it has written.
 *
 * <p>A stage moves from {@link StageState#PENDING} to {@link StageState#RUNNING} once its plan has
 * no unresolved shuffle inputs left, and to {@link StageState#COMPLETED} once every output
 * partition has been recorded. A completed stage never changes; re-executing it means creating a
 * new stage with {@link #withResolvedInputs(Map)} or from scratch.
 *
 * <p>Partition results may be recorded from several worker threads, so the mutators are
 * synchronized.
 */
public final class QueryStage {
  private static final Logger logger = LoggerFactory.getLogger(QueryStage.class);

  private final QueryStageExec plan;
  private final int partitionCount;
  private final PartitionLocation[] partitions;
  private int recordedPartitions = 0;
  private StageState state = StageState.PENDING;

  /**
   * Creates a pending stage.
   *
   * @param plan the stage root
   * @param partitionCount number of output partitions the stage will write
   */
  public QueryStage(QueryStageExec plan, int partitionCount) {
    this.plan = Objects.requireNonNull(plan, "plan");
    if (partitionCount <= 0) {
      throw new IllegalArgumentException("partitionCount must be positive: " + partitionCount);
    }
    this.partitionCount = partitionCount;
    this.partitions = new PartitionLocation[partitionCount];
  }

  public String jobId() {
    return plan.jobId();
  }

  public int stageId() {
    return plan.stageId();
  }

  public QueryStageExec plan() {
    return plan;
  }

  public int partitionCount() {
    return partitionCount;
  }

  public synchronized StageState state() {
    return state;
  }

  /**
   * Returns the upstream stages this stage still waits for.
   *
   * @return ordered, de-duplicated stage ids; empty once all inputs are resolved
   */
  public List<Integer> pendingInputs() {
    return StageResolver.unresolvedStageIds(plan);
  }

  /**
   * Marks the stage as running.
   *
   * @throws IllegalStateException if the stage is not pending or still has unresolved inputs
   */
  public synchronized void start() {
    if (state != StageState.PENDING) {
      throw new IllegalStateException(describe() + " cannot start from state " + state);
    }
    List<Integer> pending = pendingInputs();
    if (!pending.isEmpty()) {
      throw new IllegalStateException(
          describe() + " still depends on unresolved stages " + pending);
    }
    state = StageState.RUNNING;
    logger.debug("{} is running", describe());
  }

  /**
   * Records a finalized output partition.
   *
   * @param location the partition written by the stage
   * @throws IllegalStateException if the stage is not running or the partition was already recorded
   * @throws IllegalArgumentException if the location belongs to another stage or is out of range
   */
  public synchronized void recordPartition(PartitionLocation location) {
    if (state != StageState.RUNNING) {
      throw new IllegalStateException(
          describe() + " cannot record partitions in state " + state);
    }
    if (!location.jobId().equals(jobId()) || location.stageId() != stageId()) {
      throw new IllegalArgumentException(
          "Partition of job " + location.jobId() + " stage " + location.stageId()
              + " recorded on " + describe());
    }
    int partition = location.partitionId();
    if (partition < 0 || partition >= partitionCount) {
      throw new IllegalArgumentException(
          "Partition " + partition + " out of range for " + describe());
    }
    if (partitions[partition] != null) {
      throw new IllegalStateException(
          "Partition " + partition + " of " + describe() + " was already recorded");
    }
    partitions[partition] = location;
    recordedPartitions++;
    if (recordedPartitions == partitionCount) {
      state = StageState.COMPLETED;
      logger.debug("{} completed with {} partitions", describe(), partitionCount);
    }
  }

  /**
   * Returns the recorded partitions in partition order.
   *
   * @return an unmodifiable list; only complete once the stage is completed
   */
  public synchronized List<PartitionLocation> partitionLocations() {
    List<PartitionLocation> locations = new ArrayList<>(recordedPartitions);
    Arrays.stream(partitions).filter(Objects::nonNull).forEach(locations::add);
    return Collections.unmodifiableList(locations);
  }

  /**
   * Returns the sum of the statistics of all recorded partitions.
   *
   * @return the stage statistics
   */
  public synchronized PartitionStats totalStats() {
    PartitionStats total = PartitionStats.EMPTY;
    for (PartitionLocation location : partitions) {
      if (location != null) {
        total = total.plus(location.stats());
      }
    }
    return total;
  }

  /**
   * Creates a new pending stage whose unresolved shuffle inputs are replaced by the given
   * partitions.
   *
   * @param upstream completed partitions by upstream stage id
   * @return a new stage; this stage is not modified
   */
  public QueryStage withResolvedInputs(Map<Integer, List<PartitionLocation>> upstream) {
    PhysicalPlan resolved = StageResolver.resolve(plan, upstream);
    return new QueryStage((QueryStageExec) resolved, partitionCount);
  }

  private String describe() {
    return "Stage " + plan.jobId() + "/" + plan.stageId();
  }

  @Override
  public String toString() {
    return describe() + " [" + state() + "]";
  }
}
