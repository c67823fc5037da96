package org.apache.arrow.ballista;

import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * Summary of one executed partition.
 *
 * <p>The same values can be encoded as a single-row Arrow struct so they can travel next to query
 * data, e.g. in the summary batch an executor returns for a stage. The struct has four non-nullable
 * unsigned 64-bit children named {@code num_rows}, {@code num_batches}, {@code num_bytes} and
 * {@code null_count}.
 *
 * @param numRows total number of rows written
 * @param numBatches number of record batches written
 * @param numBytes summed in-memory buffer size of every column of every batch
 * @param nullCount summed null count of every column of every batch
 */
public record PartitionStats(long numRows, long numBatches, long numBytes, long nullCount) {

  /** Statistics of a partition with no batches. */
  public static final PartitionStats EMPTY = new PartitionStats(0, 0, 0, 0);

  public static final String STRUCT_FIELD_NAME = "partition_stats";
  public static final String NUM_ROWS = "num_rows";
  public static final String NUM_BATCHES = "num_batches";
  public static final String NUM_BYTES = "num_bytes";
  public static final String NULL_COUNT = "null_count";

  private static final ArrowType UINT64 = new ArrowType.Int(64, false);

  private static final List<String> FIELD_NAMES =
      List.of(NUM_ROWS, NUM_BATCHES, NUM_BYTES, NULL_COUNT);

  public PartitionStats {
    requireNonNegative(NUM_ROWS, numRows);
    requireNonNegative(NUM_BATCHES, numBatches);
    requireNonNegative(NUM_BYTES, numBytes);
    requireNonNegative(NULL_COUNT, nullCount);
  }

  /**
   * Returns the Arrow field describing the encoded statistics.
   *
   * @return a non-nullable struct field named {@value #STRUCT_FIELD_NAME}
   */
  public static Field arrowStructField() {
    return arrowStructField(STRUCT_FIELD_NAME);
  }

  /**
   * Returns the Arrow field describing the encoded statistics under a custom name.
   *
   * @param name the field name
   * @return a non-nullable struct field with the four statistics children
   */
  public static Field arrowStructField(String name) {
    List<Field> children =
        FIELD_NAMES.stream().map(n -> new Field(n, FieldType.notNullable(UINT64), null)).toList();
    return new Field(name, FieldType.notNullable(ArrowType.Struct.INSTANCE), children);
  }

  /**
   * Adds two statistics together.
   *
   * @param other the statistics to add
   * @return the element-wise sum
   */
  public PartitionStats plus(PartitionStats other) {
    return new PartitionStats(
        Math.addExact(numRows, other.numRows),
        Math.addExact(numBatches, other.numBatches),
        Math.addExact(numBytes, other.numBytes),
        Math.addExact(nullCount, other.nullCount));
  }

  /**
   * Encodes these statistics as a single-row struct vector.
   *
   * <p>The caller owns the returned vector and must close it.
   *
   * @param allocator the allocator for the vector buffers
   * @return a struct vector with exactly one defined row
   */
  public StructVector toArrowStruct(BufferAllocator allocator) {
    StructVector vector = (StructVector) arrowStructField().createVector(allocator);
    try {
      vector.allocateNew();
      writeTo(vector, 0);
      vector.setValueCount(1);
      return vector;
    } catch (RuntimeException e) {
      vector.close();
      throw e;
    }
  }

  /**
   * Writes these statistics into one row of an existing struct vector.
   *
   * <p>The vector must have been created from {@link #arrowStructField()} (or a field with the same
   * children). The caller is responsible for setting the value count.
   *
   * @param vector the target struct vector
   * @param index the row to write
   */
  public void writeTo(StructVector vector, int index) {
    vector.getChild(NUM_ROWS, UInt8Vector.class).setSafe(index, numRows);
    vector.getChild(NUM_BATCHES, UInt8Vector.class).setSafe(index, numBatches);
    vector.getChild(NUM_BYTES, UInt8Vector.class).setSafe(index, numBytes);
    vector.getChild(NULL_COUNT, UInt8Vector.class).setSafe(index, nullCount);
    vector.setIndexDefined(index);
  }

  /**
   * Decodes statistics from a single-row struct vector.
   *
   * @param vector a struct vector produced by {@link #toArrowStruct(BufferAllocator)}
   * @return the decoded statistics
   * @throws StatsDecodeException if the vector does not hold exactly one row or a field is missing,
   *     not an unsigned 64-bit column, or null
   */
  public static PartitionStats fromArrowStruct(StructVector vector) {
    if (vector.getValueCount() != 1) {
      throw new StatsDecodeException(
          "expected exactly one row but found " + vector.getValueCount());
    }
    return fromArrowStruct(vector, 0);
  }

  /**
   * Decodes statistics from one row of a struct vector.
   *
   * @param vector a struct vector with the statistics children
   * @param index the row to decode
   * @return the decoded statistics
   * @throws StatsDecodeException if the row is out of range or null, or a field is missing, not an
   *     unsigned 64-bit column, or null
   */
  public static PartitionStats fromArrowStruct(StructVector vector, int index) {
    if (index < 0 || index >= vector.getValueCount()) {
      throw new StatsDecodeException(
          "row " + index + " out of range for " + vector.getValueCount() + " rows");
    }
    if (vector.isNull(index)) {
      throw new StatsDecodeException("row " + index + " is null");
    }
    return new PartitionStats(
        readUInt64(vector, NUM_ROWS, index),
        readUInt64(vector, NUM_BATCHES, index),
        readUInt64(vector, NUM_BYTES, index),
        readUInt64(vector, NULL_COUNT, index));
  }

  private static long readUInt64(StructVector vector, String name, int index) {
    FieldVector child = vector.getChild(name);
    if (child == null) {
      throw new StatsDecodeException("expected a field " + name);
    }
    if (!(child instanceof UInt8Vector values)) {
      throw new StatsDecodeException(
          "expected " + name + " to be UInt64 but was " + child.getField().getType());
    }
    if (values.isNull(index)) {
      throw new StatsDecodeException("field " + name + " is null");
    }
    long value = values.get(index);
    if (value < 0) {
      throw new StatsDecodeException(
          "field " + name + " value " + Long.toUnsignedString(value) + " is out of range");
    }
    return value;
  }

  private static void requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must be non-negative, got " + value);
    }
  }
}
