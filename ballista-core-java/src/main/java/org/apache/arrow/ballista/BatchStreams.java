package org.apache.arrow.ballista;

import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorLoader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;

/** Utility methods for consuming {@link RecordBatchReader} streams. */
public final class BatchStreams {

  private BatchStreams() {}

  /**
   * Reads an entire stream into memory, preserving arrival order.
   *
   * <p>Each batch is moved into its own VectorSchemaRoot allocated from {@code allocator}, so the
   * result stays valid after the stream is closed, also when the stream's batches live under a
   * different root allocator. The caller owns the returned roots. If any batch
   * fails, everything collected so far is released and no partial result is returned. The stream is
   * not closed by this method.
   *
   * @param stream the stream to drain
   * @param allocator the allocator owning the collected batches
   * @return the batches in the order they were produced
   * @throws StreamReadException if the stream fails to produce a batch
   */
  public static List<VectorSchemaRoot> collect(
      RecordBatchReader stream, BufferAllocator allocator) {
    List<VectorSchemaRoot> batches = new ArrayList<>();
    try {
      while (stream.loadNextBatch()) {
        VectorSchemaRoot batch = stream.getVectorSchemaRoot();
        VectorSchemaRoot copy = VectorSchemaRoot.create(batch.getSchema(), allocator);
        batches.add(copy);
        transfer(batch, copy);
      }
      return batches;
    } catch (RuntimeException e) {
      try {
        AutoCloseables.close(batches);
      } catch (Exception closeError) {
        e.addSuppressed(closeError);
      }
      if (e instanceof StreamReadException) {
        throw e;
      }
      throw new StreamReadException(
          "Failed to collect stream after " + batches.size() + " batches: " + e.getMessage(), e);
    }
  }

  /**
   * Loads the contents of one root into another root with the same schema.
   *
   * <p>When both roots are allocated under the same root allocator the buffers are shared by
   * reference count rather than copied. Arrow cannot hand a buffer across root allocators, so
   * otherwise the values are copied into buffers owned by {@code to}.
   */
  static void transfer(VectorSchemaRoot from, VectorSchemaRoot to) {
    if (shareRootAllocator(from, to)) {
      try (ArrowRecordBatch recordBatch = new VectorUnloader(from).getRecordBatch()) {
        new VectorLoader(to).load(recordBatch);
      }
    } else {
      copy(from, to);
    }
  }

  private static boolean shareRootAllocator(VectorSchemaRoot from, VectorSchemaRoot to) {
    List<FieldVector> source = from.getFieldVectors();
    List<FieldVector> target = to.getFieldVectors();
    for (int i = 0; i < source.size(); i++) {
      BufferAllocator sourceRoot = source.get(i).getAllocator().getRoot();
      if (sourceRoot != target.get(i).getAllocator().getRoot()) {
        return false;
      }
    }
    return true;
  }

  private static void copy(VectorSchemaRoot from, VectorSchemaRoot to) {
    int rowCount = from.getRowCount();
    to.clear();
    List<FieldVector> source = from.getFieldVectors();
    List<FieldVector> target = to.getFieldVectors();
    for (int i = 0; i < source.size(); i++) {
      FieldVector fromVector = source.get(i);
      FieldVector toVector = target.get(i);
      toVector.allocateNew();
      for (int row = 0; row < rowCount; row++) {
        toVector.copyFromSafe(row, row, fromVector);
      }
      toVector.setValueCount(rowCount);
    }
    to.setRowCount(rowCount);
  }
}
