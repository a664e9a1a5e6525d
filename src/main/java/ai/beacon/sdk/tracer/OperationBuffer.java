package ai.beacon.sdk.tracer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of deferred operations recorded before the backend is ready.
 *
 * <p>Not thread-safe; the owning service guards it with its own lock.
 */
class OperationBuffer {
  private final int capacity;
  private final Deque<Runnable> operations = new ArrayDeque<>();
  private long dropped;

  OperationBuffer(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative: " + capacity);
    }
    this.capacity = capacity;
  }

  /** Queue an operation; returns false and drops it when the buffer is full */
  boolean offer(Runnable operation) {
    if (operations.size() >= capacity) {
      dropped++;
      return false;
    }
    operations.addLast(operation);
    return true;
  }

  /** Remove and return up to {@code max} operations from the head */
  List<Runnable> takeChunk(int max) {
    List<Runnable> chunk = new ArrayList<>(Math.min(max, operations.size()));
    while (chunk.size() < max && !operations.isEmpty()) {
      chunk.add(operations.pollFirst());
    }
    return chunk;
  }

  /** Discard everything; returns how many operations were discarded */
  int clear() {
    int discarded = operations.size();
    operations.clear();
    return discarded;
  }

  boolean isEmpty() {
    return operations.isEmpty();
  }

  int size() {
    return operations.size();
  }

  int capacity() {
    return capacity;
  }

  long droppedCount() {
    return dropped;
  }
}
