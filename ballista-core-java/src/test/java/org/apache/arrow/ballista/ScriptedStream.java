package org.apache.arrow.ballista;

import java.util.function.IntConsumer;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * A stream over in-memory batches that runs a hook before each load.
 *
 * <p>The hook receives the 1-based number of the load call and can throw to simulate a failing
 * upstream operator.
 */
final class ScriptedStream implements RecordBatchReader {
  private final MemoryStream delegate;
  private final IntConsumer beforeLoad;
  private int loads = 0;

  ScriptedStream(MemoryStream delegate, IntConsumer beforeLoad) {
    this.delegate = delegate;
    this.beforeLoad = beforeLoad;
  }

  int loads() {
    return loads;
  }

  int remaining() {
    return delegate.remaining();
  }

  @Override
  public Schema schema() {
    return delegate.schema();
  }

  @Override
  public VectorSchemaRoot getVectorSchemaRoot() {
    return delegate.getVectorSchemaRoot();
  }

  @Override
  public boolean loadNextBatch() {
    loads++;
    beforeLoad.accept(loads);
    return delegate.loadNextBatch();
  }

  @Override
  public void close() {
    delegate.close();
  }
}
