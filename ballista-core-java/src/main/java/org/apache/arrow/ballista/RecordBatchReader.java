package org.apache.arrow.ballista;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Common interface for reading record batches.
 *
 * <p>This interface is the batch stream consumed by the shuffle writer and produced by shuffle file
 * readers. It is a lazy, finite, non-restartable sequence: call {@link #loadNextBatch()} until it
 * returns false, inspecting {@link #getVectorSchemaRoot()} after each successful call.
 *
 * <p>Most implementations reuse a single VectorSchemaRoot for every batch, following Arrow's
 * ArrowReader pattern. Implementations that hand out a different root per batch must return the
 * current one from {@link #getVectorSchemaRoot()}. Either way the root is owned by the reader and
 * is only valid until the next call to {@link #loadNextBatch()} or {@link #close()}.
 */
public interface RecordBatchReader extends AutoCloseable {
  /**
   * Returns the schema this stream declares for all of its batches.
   *
   * <p>Default implementation returns the schema of the current VectorSchemaRoot.
   *
   * @return The declared Arrow schema
   */
  default Schema schema() {
    return getVectorSchemaRoot().getSchema();
  }

  /**
   * Gets the VectorSchemaRoot holding the most recently loaded batch.
   *
   * @return The VectorSchemaRoot containing the current batch data
   */
  VectorSchemaRoot getVectorSchemaRoot();

  /**
   * Loads the next batch of data into the VectorSchemaRoot.
   *
   * @return true if a batch was loaded, false if no more batches are available
   * @throws BallistaException if producing the batch fails
   */
  boolean loadNextBatch();

  /**
   * Releases resources held by this reader.
   *
   * <p>After calling close, the reader should not be used.
   */
  @Override
  void close();
}
