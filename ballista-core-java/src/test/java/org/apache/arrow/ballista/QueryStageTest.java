package org.apache.arrow.ballista;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.arrow.ballista.plan.FileFormat;
import org.apache.arrow.ballista.plan.Operator;
import org.apache.arrow.ballista.plan.PhysicalExpr;
import org.apache.arrow.ballista.plan.PhysicalPlan;
import org.apache.arrow.ballista.plan.PhysicalPlan.QueryStageExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.ShuffleReaderExec;
import org.apache.arrow.ballista.plan.StageResolver;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.Test;

public class QueryStageTest {

  static QueryStageExec scanStage(String jobId, int stageId) {
    PhysicalExpr predicate =
        new PhysicalExpr.BinaryExpr(
            new PhysicalExpr.ColumnExpr("id", 0),
            Operator.GT,
            new PhysicalExpr.LiteralExpr(10, new ArrowType.Int(32, true)));
    return new QueryStageExec(
        jobId,
        stageId,
        new PhysicalPlan.FilterExec(
            predicate, new PhysicalPlan.ScanExec(FileFormat.CSV, "/data/t.csv", 2, 2)));
  }

  static QueryStageExec mergeStage(String jobId, int stageId, int upstream) {
    return new QueryStageExec(
        jobId,
        stageId,
        new PhysicalPlan.MergeExec(
            new PhysicalPlan.UnresolvedShuffleExec(List.of(upstream), TestBatches.schema(), 2)));
  }

  private static PartitionLocation location(String jobId, int stageId, int partition, long rows) {
    return new PartitionLocation(
        jobId,
        stageId,
        partition,
        Path.of("/work", jobId, Integer.toString(stageId), Integer.toString(partition)),
        new PartitionStats(rows, 1, rows * 8, 0));
  }

  @Test
  void testLifecycle() {
    QueryStage stage = new QueryStage(scanStage("job-1", 0), 2);
    assertEquals(StageState.PENDING, stage.state());
    assertEquals(List.of(), stage.pendingInputs());

    stage.start();
    assertEquals(StageState.RUNNING, stage.state());

    // Partitions may complete out of order
    stage.recordPartition(location("job-1", 0, 1, 5));
    assertEquals(StageState.RUNNING, stage.state());
    stage.recordPartition(location("job-1", 0, 0, 3));
    assertEquals(StageState.COMPLETED, stage.state());

    assertEquals(
        List.of(location("job-1", 0, 0, 3), location("job-1", 0, 1, 5)),
        stage.partitionLocations());
    assertEquals(new PartitionStats(8, 2, 64, 0), stage.totalStats());
    assertEquals("Stage job-1/0 [COMPLETED]", stage.toString());
  }

  @Test
  void testCannotRecordBeforeStart() {
    QueryStage stage = new QueryStage(scanStage("job-1", 0), 1);
    assertThrows(
        IllegalStateException.class, () -> stage.recordPartition(location("job-1", 0, 0, 1)));
  }

  @Test
  void testCompletedStageRejectsMorePartitions() {
    QueryStage stage = new QueryStage(scanStage("job-1", 0), 1);
    stage.start();
    stage.recordPartition(location("job-1", 0, 0, 1));
    assertThrows(
        IllegalStateException.class, () -> stage.recordPartition(location("job-1", 0, 0, 1)));
    assertThrows(IllegalStateException.class, stage::start);
  }

  @Test
  void testInvalidPartitions() {
    QueryStage stage = new QueryStage(scanStage("job-1", 0), 2);
    stage.start();
    stage.recordPartition(location("job-1", 0, 0, 1));

    assertThrows(
        IllegalStateException.class, () -> stage.recordPartition(location("job-1", 0, 0, 1)));
    assertThrows(
        IllegalArgumentException.class, () -> stage.recordPartition(location("job-1", 0, 2, 1)));
    assertThrows(
        IllegalArgumentException.class, () -> stage.recordPartition(location("job-1", 1, 1, 1)));
    assertThrows(
        IllegalArgumentException.class, () -> stage.recordPartition(location("job-2", 0, 1, 1)));
    assertEquals(StageState.RUNNING, stage.state());
  }

  @Test
  void testPartitionCountMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new QueryStage(scanStage("job-1", 0), 0));
  }

  @Test
  void testPendingInputsBlockStart() {
    QueryStage stage = new QueryStage(mergeStage("job-1", 1, 0), 1);
    assertEquals(List.of(0), stage.pendingInputs());

    IllegalStateException e = assertThrows(IllegalStateException.class, stage::start);
    assertTrue(e.getMessage().contains("[0]"), "Got: " + e.getMessage());
    assertEquals(StageState.PENDING, stage.state());
  }

  @Test
  void testResolvedStageCanStart() {
    QueryStage stage = new QueryStage(mergeStage("job-1", 1, 0), 1);
    List<PartitionLocation> upstream =
        List.of(location("job-1", 0, 0, 3), location("job-1", 0, 1, 5));

    QueryStage resolved = stage.withResolvedInputs(Map.of(0, upstream));

    assertEquals(List.of(0), stage.pendingInputs(), "The source stage is unchanged");
    assertEquals(List.of(), resolved.pendingInputs());
    assertTrue(StageResolver.isExecutable(resolved.plan()));
    PhysicalPlan reader = resolved.plan().child().children().get(0);
    assertEquals(new ShuffleReaderExec(upstream, TestBatches.schema()), reader);

    resolved.start();
    assertEquals(StageState.RUNNING, resolved.state());
  }
}
