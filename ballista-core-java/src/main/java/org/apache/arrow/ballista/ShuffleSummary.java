package org.apache.arrow.ballista;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Encodes the partitions written by a stage as one record batch.
 *
 * <p>This is the batch an executor hands back to the scheduler once a stage's partitions are on
 * disk: one row per partition with columns {@code partition_id}, {@code path} and {@code stats},
 * the latter being the {@link PartitionStats} struct.
 */
public final class ShuffleSummary {

  public static final String PARTITION_ID = "partition_id";
  public static final String PATH = "path";
  public static final String STATS = "stats";

  private ShuffleSummary() {}

  /** Returns the schema of summary batches. */
  public static Schema schema() {
    return new Schema(
        List.of(
            new Field(PARTITION_ID, FieldType.notNullable(new ArrowType.Int(32, true)), null),
            new Field(PATH, FieldType.notNullable(ArrowType.Utf8.INSTANCE), null),
            PartitionStats.arrowStructField(STATS)));
  }

  /**
   * Encodes partition locations as a summary batch.
   *
   * <p>The caller owns the returned root and must close it.
   *
   * @param locations the partitions, in output order
   * @param allocator allocator for the batch
   * @return a batch with one row per location
   */
  public static VectorSchemaRoot encode(
      List<PartitionLocation> locations, BufferAllocator allocator) {
    VectorSchemaRoot root = VectorSchemaRoot.create(schema(), allocator);
    try {
      root.allocateNew();
      IntVector partitionIds = (IntVector) root.getVector(PARTITION_ID);
      VarCharVector paths = (VarCharVector) root.getVector(PATH);
      StructVector stats = (StructVector) root.getVector(STATS);
      for (int i = 0; i < locations.size(); i++) {
        PartitionLocation location = locations.get(i);
        partitionIds.setSafe(i, location.partitionId());
        paths.setSafe(i, location.path().toString().getBytes(StandardCharsets.UTF_8));
        location.stats().writeTo(stats, i);
      }
      root.setRowCount(locations.size());
      return root;
    } catch (RuntimeException e) {
      root.close();
      throw e;
    }
  }

  /**
   * Decodes a summary batch produced by {@link #encode(List, BufferAllocator)}.
   *
   * @param jobId the job the partitions belong to
   * @param stageId the stage that produced them
   * @param batch the summary batch
   * @return the partition locations, in row order
   * @throws StatsDecodeException if a column is missing or has the wrong type
   */
  public static List<PartitionLocation> decode(String jobId, int stageId, VectorSchemaRoot batch) {
    IntVector partitionIds = column(batch, PARTITION_ID, IntVector.class);
    VarCharVector paths = column(batch, PATH, VarCharVector.class);
    StructVector stats = column(batch, STATS, StructVector.class);

    List<PartitionLocation> locations = new ArrayList<>(batch.getRowCount());
    for (int i = 0; i < batch.getRowCount(); i++) {
      if (partitionIds.isNull(i) || paths.isNull(i)) {
        throw new StatsDecodeException("summary row " + i + " has a null partition id or path");
      }
      Path path = Path.of(new String(paths.get(i), StandardCharsets.UTF_8));
      locations.add(
          new PartitionLocation(
              jobId, stageId, partitionIds.get(i), path, PartitionStats.fromArrowStruct(stats, i)));
    }
    return locations;
  }

  private static <T extends FieldVector> T column(
      VectorSchemaRoot batch, String name, Class<T> type) {
    FieldVector vector = batch.getVector(name);
    if (vector == null) {
      throw new StatsDecodeException("summary batch has no column " + name);
    }
    if (!type.isInstance(vector)) {
      throw new StatsDecodeException(
          "summary column " + name + " has unexpected type " + vector.getField().getType());
    }
    return type.cast(vector);
  }
}
