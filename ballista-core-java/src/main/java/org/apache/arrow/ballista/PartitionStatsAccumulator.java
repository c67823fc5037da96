package org.apache.arrow.ballista;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Accumulates {@link PartitionStats} while a partition is being written.
 *
 * <p>Counters only ever grow. {@link #snapshot()} can be called any number of times; it does not
 * reset the accumulator.
 */
public final class PartitionStatsAccumulator {
  private long numRows;
  private long numBatches;
  private long numBytes;
  private long nullCount;

  /**
   * Adds one batch to the statistics.
   *
   * @param batch the batch that was written
   */
  public void accumulate(VectorSchemaRoot batch) {
    long batchBytes = 0;
    long batchNulls = 0;
    for (FieldVector vector : batch.getFieldVectors()) {
      batchBytes += vector.getBufferSize();
      batchNulls += vector.getNullCount();
    }
    numBatches++;
    numRows += batch.getRowCount();
    numBytes += batchBytes;
    nullCount += batchNulls;
  }

  /**
   * Returns the statistics accumulated so far.
   *
   * @return the current statistics
   */
  public PartitionStats snapshot() {
    return new PartitionStats(numRows, numBatches, numBytes, nullCount);
  }
}
