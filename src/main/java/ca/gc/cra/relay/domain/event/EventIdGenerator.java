package ca.gc.cra.relay.domain.event;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Mints event ids as {@code (timestampMillis << 20) | (sequence & 0xFFFFF)}.
 *
 * <p>Ids are unique within the generator that minted them as long as fewer than 2^20 ids are requested in the
 * same millisecond. Processes that need process-wide uniqueness share one instance.</p>
 * <p>Thread-safe; the sequence is a single atomic counter.</p>
 *
 * @since 0.1.0
 */
public final class EventIdGenerator {
  /** Number of low bits reserved for the sequence. */
  public static final int SEQUENCE_BITS = 20;
  /** Mask applied to the sequence counter. */
  public static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

  private final AtomicLong sequence = new AtomicLong();

  /**
   * Returns the next id for an event created at {@code timestampMillis}.
   *
   * @param timestampMillis event creation time in epoch milliseconds
   * @return packed id
   */
  public long nextId(long timestampMillis) {
    long seq = sequence.getAndIncrement() & SEQUENCE_MASK;
    return (timestampMillis << SEQUENCE_BITS) | seq;
  }

  /**
   * Extracts the millisecond part of an id.
   *
   * @param id packed id
   * @return epoch milliseconds encoded in the id
   */
  public static long timestampOf(long id) {
    return id >>> SEQUENCE_BITS;
  }

  /**
   * Extracts the sequence part of an id.
   *
   * @param id packed id
   * @return low {@value #SEQUENCE_BITS} bits
   */
  public static long sequenceOf(long id) {
    return id & SEQUENCE_MASK;
  }
}
