package org.apache.arrow.ballista;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.jupiter.api.Test;

public class BatchStreamsTest {

  @Test
  void testCollectPreservesOrder() throws Exception {
    try (BufferAllocator allocator = new RootAllocator()) {
      List<VectorSchemaRoot> batches =
          TestBatches.batches(allocator, new int[] {2, 0, 3}, new int[] {0, 0, 1});
      List<VectorSchemaRoot> collected;
      try (MemoryStream stream = new MemoryStream(TestBatches.schema(), batches, allocator)) {
        collected = BatchStreams.collect(stream, allocator);
      }

      // The copies stay valid after the source stream is closed
      try {
        assertEquals(3, collected.size());
        assertEquals(List.of(0, 1), TestBatches.ids(collected.get(0)));
        assertEquals(0, collected.get(1).getRowCount());
        assertEquals(List.of(2, 3, 4), TestBatches.ids(collected.get(2)));
        assertTrue(collected.get(2).getVector("name").isNull(0));
      } finally {
        AutoCloseables.close(collected);
      }
    }
  }

  @Test
  void testCollectIntoAnotherRootAllocator() throws Exception {
    try (BufferAllocator producer = new RootAllocator();
        BufferAllocator consumer = new RootAllocator()) {
      List<VectorSchemaRoot> batches =
          TestBatches.batches(producer, new int[] {3, 2}, new int[] {2, 0});
      List<VectorSchemaRoot> collected;
      try (MemoryStream stream = new MemoryStream(TestBatches.schema(), batches, producer)) {
        collected = BatchStreams.collect(stream, consumer);
      }

      try {
        assertEquals(0, producer.getAllocatedMemory());
        assertEquals(2, collected.size());
        assertEquals(List.of(0, 1, 2), TestBatches.ids(collected.get(0)));
        assertEquals(List.of(3, 4), TestBatches.ids(collected.get(1)));
        assertTrue(collected.get(0).getVector("name").isNull(1));
        assertFalse(collected.get(0).getVector("name").isNull(2));
        assertEquals(2, collected.get(0).getVector("name").getNullCount());
      } finally {
        AutoCloseables.close(collected);
      }
    }
  }

  @Test
  void testStreamErrorReleasesCollectedBatches() {
    try (BufferAllocator allocator = new RootAllocator()) {
      List<VectorSchemaRoot> batches =
          TestBatches.batches(allocator, new int[] {4, 4, 4}, new int[] {0, 0, 0});
      try (ScriptedStream stream =
          new ScriptedStream(
              new MemoryStream(TestBatches.schema(), batches, allocator),
              load -> {
                if (load == 3) {
                  throw new IllegalStateException("upstream exploded");
                }
              })) {
        StreamReadException e =
            assertThrows(StreamReadException.class, () -> BatchStreams.collect(stream, allocator));
        assertTrue(e.getMessage().contains("after 2 batches"), "Got: " + e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
      }
      // Closing the allocator fails if the partial copies leaked
    }
  }

  @Test
  void testReadErrorIsNotWrapped() {
    StreamReadException failure = new StreamReadException("disk gone");
    try (BufferAllocator allocator = new RootAllocator();
        ScriptedStream stream =
            new ScriptedStream(
                new MemoryStream(TestBatches.schema(), List.of(), allocator),
                load -> {
                  throw failure;
                })) {
      StreamReadException e =
          assertThrows(StreamReadException.class, () -> BatchStreams.collect(stream, allocator));
      assertSame(failure, e);
    }
  }
}
