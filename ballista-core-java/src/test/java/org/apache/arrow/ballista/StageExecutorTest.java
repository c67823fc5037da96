package org.apache.arrow.ballista;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.arrow.ballista.config.ShuffleOptions;
import org.apache.arrow.ballista.plan.PhysicalPlan.ShuffleReaderExec;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs a two-stage job through the executor: a scan stage feeding a merge stage. */
public class StageExecutorTest {

  @TempDir Path workDir;

  private ShuffleOptions options() {
    return ShuffleOptions.builder().workDir(workDir).syncOnFinish(false).build();
  }

  @Test
  void testTwoStageJob() {
    try (BufferAllocator allocator = new RootAllocator()) {
      StageExecutor executor = new StageExecutor(options(), allocator);

      QueryStage scan = new QueryStage(QueryStageTest.scanStage("job-1", 0), 2);
      scan.start();
      List<PartitionLocation> written = new ArrayList<>();
      int[][] rowsPerPartition = {{3, 5}, {7}};
      int firstId = 0;
      for (int partition = 0; partition < 2; partition++) {
        List<VectorSchemaRoot> batches = new ArrayList<>();
        for (int rows : rowsPerPartition[partition]) {
          batches.add(TestBatches.batch(allocator, firstId, rows, 0));
          firstId += rows;
        }
        try (MemoryStream output = new MemoryStream(TestBatches.schema(), batches, allocator)) {
          written.add(executor.executePartition(scan, partition, output));
        }
      }

      assertEquals(StageState.COMPLETED, scan.state());
      assertEquals(written, scan.partitionLocations());
      assertEquals(options().partitionFile("job-1", 0, 1), written.get(1).path());
      assertTrue(Files.exists(written.get(0).path()));
      assertEquals(8, written.get(0).stats().numRows());
      assertEquals(15, scan.totalStats().numRows());
      assertEquals(3, scan.totalStats().numBatches());

      // Hand the results to the downstream stage through a summary batch
      List<PartitionLocation> reported;
      try (VectorSchemaRoot summary = ShuffleSummary.encode(scan.partitionLocations(), allocator)) {
        reported = ShuffleSummary.decode("job-1", 0, summary);
      }
      QueryStage merge =
          new QueryStage(QueryStageTest.mergeStage("job-1", 1, 0), 1)
              .withResolvedInputs(Map.of(0, reported));
      merge.start();

      ShuffleReaderExec reader = (ShuffleReaderExec) merge.plan().child().children().get(0);
      List<Integer> ids = new ArrayList<>();
      for (PartitionLocation location : reader.partitionLocations()) {
        try (ShuffleFileReader file = ShuffleFileReader.open(location.path(), allocator)) {
          while (file.loadNextBatch()) {
            ids.addAll(TestBatches.ids(file.getVectorSchemaRoot()));
          }
        }
      }
      List<Integer> expected = new ArrayList<>();
      for (int i = 0; i < 15; i++) {
        expected.add(i);
      }
      assertEquals(expected, ids);
    }
  }

  @Test
  void testStageMustBeRunning() {
    try (BufferAllocator allocator = new RootAllocator();
        MemoryStream output = new MemoryStream(TestBatches.schema(), List.of(), allocator)) {
      StageExecutor executor = new StageExecutor(options(), allocator);
      QueryStage stage = new QueryStage(QueryStageTest.scanStage("job-1", 0), 1);

      assertThrows(IllegalStateException.class, () -> executor.executePartition(stage, 0, output));
      assertFalse(Files.exists(workDir.resolve("job-1")));
    }
  }

  @Test
  void testFailedPartitionIsNotRecorded() {
    try (BufferAllocator allocator = new RootAllocator()) {
      StageExecutor executor = new StageExecutor(options(), allocator);
      QueryStage stage = new QueryStage(QueryStageTest.scanStage("job-1", 0), 1);
      stage.start();

      try (ScriptedStream output =
          new ScriptedStream(
              new MemoryStream(TestBatches.schema(), List.of(), allocator),
              load -> {
                throw new BallistaException("scan failed");
              })) {
        assertThrows(
            ShuffleWriteException.class, () -> executor.executePartition(stage, 0, output));
      }

      assertEquals(StageState.RUNNING, stage.state());
      assertEquals(List.of(), stage.partitionLocations());
      assertFalse(Files.exists(options().partitionFile("job-1", 0, 0)));
    }
  }
}
