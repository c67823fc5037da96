package org.apache.arrow.ballista;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * A {@link RecordBatchReader} over batches that are already in memory.
 *
 * <p>The stream takes ownership of the batches passed to it and closes them when it is closed. Each
 * batch is handed out as-is, so {@link #getVectorSchemaRoot()} returns a different root after
 * each call to {@link #loadNextBatch()}. Before the first batch is loaded an empty root with the
 * declared schema is returned.
 */
public final class MemoryStream implements RecordBatchReader {
  private final Schema schema;
  private final List<VectorSchemaRoot> batches;
  private final VectorSchemaRoot empty;
  private VectorSchemaRoot current;
  private int nextBatch = 0;
  private boolean closed = false;

  /**
   * Creates a MemoryStream.
   *
   * @param schema the declared schema of the stream
   * @param batches the batches to replay, in order; ownership passes to the stream
   * @param allocator allocator for the empty root returned before the first batch
   */
  public MemoryStream(Schema schema, List<VectorSchemaRoot> batches, BufferAllocator allocator) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.batches = new ArrayList<>(Objects.requireNonNull(batches, "batches"));
    this.empty = VectorSchemaRoot.create(schema, allocator);
    this.current = empty;
  }

  @Override
  public Schema schema() {
    return schema;
  }

  @Override
  public VectorSchemaRoot getVectorSchemaRoot() {
    return current;
  }

  @Override
  public boolean loadNextBatch() {
    if (closed) {
      throw new IllegalStateException("MemoryStream has been closed");
    }
    if (nextBatch >= batches.size()) {
      return false;
    }
    current = batches.get(nextBatch++);
    return true;
  }

  /**
   * Returns the number of batches not yet loaded.
   *
   * @return remaining batch count
   */
  public int remaining() {
    return batches.size() - nextBatch;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      List<AutoCloseable> resources = new ArrayList<>(batches);
      resources.add(empty);
      try {
        AutoCloseables.close(resources);
      } catch (Exception e) {
        throw new BallistaException("Failed to close MemoryStream", e);
      }
    }
  }
}
