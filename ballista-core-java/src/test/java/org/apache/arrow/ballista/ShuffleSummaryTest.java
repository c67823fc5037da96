package org.apache.arrow.ballista;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

public class ShuffleSummaryTest {

  private static final List<PartitionLocation> LOCATIONS =
      List.of(
          new PartitionLocation(
              "job-7",
              3,
              0,
              Path.of("/work/job-7/3/0/data.arrow"),
              new PartitionStats(15, 4, 960, 3)),
          new PartitionLocation(
              "job-7", 3, 1, Path.of("/work/job-7/3/1/data.arrow"), PartitionStats.EMPTY));

  @Test
  void testEncodeDecode() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot summary = ShuffleSummary.encode(LOCATIONS, allocator)) {
      assertEquals(ShuffleSummary.schema(), summary.getSchema());
      assertEquals(2, summary.getRowCount());
      assertEquals(LOCATIONS, ShuffleSummary.decode("job-7", 3, summary));
    }
  }

  @Test
  void testMissingColumn() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot batch = VectorSchemaRoot.create(TestBatches.schema(), allocator)) {
      StatsDecodeException e =
          assertThrows(StatsDecodeException.class, () -> ShuffleSummary.decode("j", 0, batch));
      assertTrue(e.getMessage().contains(ShuffleSummary.PARTITION_ID), "Got: " + e.getMessage());
    }
  }

  @Test
  void testWrongColumnType() {
    Schema schema =
        new Schema(
            List.of(
                new Field(
                    ShuffleSummary.PARTITION_ID,
                    FieldType.notNullable(new ArrowType.Int(64, true)),
                    null),
                new Field(
                    ShuffleSummary.PATH, FieldType.notNullable(ArrowType.Utf8.INSTANCE), null),
                PartitionStats.arrowStructField(ShuffleSummary.STATS)));
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot batch = VectorSchemaRoot.create(schema, allocator)) {
      StatsDecodeException e =
          assertThrows(StatsDecodeException.class, () -> ShuffleSummary.decode("j", 0, batch));
      assertTrue(e.getMessage().contains("unexpected type"), "Got: " + e.getMessage());
    }
  }
}
