package ca.gc.cra.relay.application.bus;

import ca.gc.cra.relay.domain.event.Event;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO between a subscriber's read loop and its consumers. When full, admitting a new event drops the
 * oldest one. {@link #close()} wakes every waiting consumer with an empty result.
 */
final class ReceiveBuffer {
  private final int capacity;
  private final ArrayDeque<Event> events;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private boolean closed;

  ReceiveBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.events = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  /**
   * Admits an event.
   *
   * @return {@code true} when the oldest buffered event was dropped to make room
   */
  boolean offer(Event event) {
    Objects.requireNonNull(event, "event");
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      boolean dropped = false;
      if (events.size() >= capacity) {
        events.pollFirst();
        dropped = true;
      }
      events.addLast(event);
      notEmpty.signal();
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  /** Waits until an event is available or the buffer is closed. */
  Optional<Event> take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (events.isEmpty() && !closed) {
        notEmpty.await();
      }
      return closed ? Optional.empty() : Optional.of(events.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /** Waits up to {@code timeout}; empty on timeout or close. */
  Optional<Event> poll(Duration timeout) throws InterruptedException {
    long remaining = Objects.requireNonNull(timeout, "timeout").toNanos();
    lock.lockInterruptibly();
    try {
      while (events.isEmpty() && !closed) {
        if (remaining <= 0L) {
          return Optional.empty();
        }
        remaining = notEmpty.awaitNanos(remaining);
      }
      return closed ? Optional.empty() : Optional.of(events.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  Optional<Event> poll() {
    lock.lock();
    try {
      return closed ? Optional.empty() : Optional.ofNullable(events.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return events.size();
    } finally {
      lock.unlock();
    }
  }

  int capacity() {
    return capacity;
  }

  /** Discards buffered events and releases all waiters. Idempotent. */
  void close() {
    lock.lock();
    try {
      closed = true;
      events.clear();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }
}
