package ca.gc.cra.relay.domain.event;

import ca.gc.cra.relay.domain.bus.BusException;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable routed message envelope carried by the bus.
 * <p><strong>Why:</strong> Every field is validated at construction so no event with an illegal topic or an
 * oversized payload can reach the wire.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the payload is defensively copied on the way in and out.</p>
 *
 * @since 0.1.0
 * @see TopicMatcher
 */
public final class Event {
  /** Maximum topic length in characters. */
  public static final int MAX_TOPIC_LENGTH = 256;
  /** Maximum payload size in bytes (1 MiB). */
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024;

  private final String topic;
  private final long id;
  private final long timestamp;
  private final String source;
  private final byte[] payload;

  private Event(String topic, long id, long timestamp, String source, byte[] payload) {
    this.topic = topic;
    this.id = id;
    this.timestamp = timestamp;
    this.source = source;
    this.payload = payload;
  }

  /**
   * Builds an event from already-minted identity fields, validating topic and payload.
   *
   * <p>Producers normally go through {@code EventFactory}; this entry point exists for decoders that rebuild
   * events received from the wire.</p>
   *
   * @param topic dot-separated routing key
   * @param id event id minted by the sending process
   * @param timestamp epoch milliseconds captured by the sending process
   * @param source free-form sender identifier, not validated; {@code null} is treated as empty. It travels in
   *     the same frame as the payload, so a source that pushes the encoded event past the frame limit is only
   *     rejected when the event is encoded for the wire
   * @param payload opaque payload; {@code null} is treated as empty
   * @return validated event
   * @throws BusException {@code INVALID_TOPIC} for illegal topics, {@code SERIALIZATION} for oversized payloads
   */
  public static Event of(String topic, long id, long timestamp, String source, byte[] payload)
      throws BusException {
    requireValidTopic(topic);
    byte[] body = payload == null ? new byte[0] : payload;
    if (body.length > MAX_PAYLOAD_BYTES) {
      throw BusException.serialization("payload exceeds " + MAX_PAYLOAD_BYTES + " bytes");
    }
    return new Event(topic, id, timestamp, source == null ? "" : source, body.clone());
  }

  /**
   * Validates a topic: 1 to {@value #MAX_TOPIC_LENGTH} characters drawn from {@code [A-Za-z0-9._-]}.
   *
   * @param topic candidate topic
   * @return the topic unchanged
   * @throws BusException {@code INVALID_TOPIC} when the topic is null, empty, too long, or uses other characters
   */
  public static String requireValidTopic(String topic) throws BusException {
    if (topic == null || topic.isEmpty()) {
      throw BusException.invalidTopic("topic cannot be empty");
    }
    if (topic.length() > MAX_TOPIC_LENGTH) {
      throw BusException.invalidTopic("topic exceeds " + MAX_TOPIC_LENGTH + " chars");
    }
    if (!TopicMatcher.isTopicText(topic)) {
      throw BusException.invalidTopic(
          "topic must contain only alphanumeric, dot, underscore, or hyphen");
    }
    return topic;
  }

  public String topic() {
    return topic;
  }

  /**
   * Returns the id, to be read as an unsigned 64-bit value.
   *
   * @return {@code (timestamp << 20) | sequence}
   */
  public long id() {
    return id;
  }

  /**
   * Returns the creation time.
   *
   * @return epoch milliseconds
   */
  public long timestamp() {
    return timestamp;
  }

  public String source() {
    return source;
  }

  /**
   * Returns a copy of the payload.
   *
   * @return payload bytes; never {@code null}
   */
  public byte[] payload() {
    return payload.clone();
  }

  /**
   * Returns the payload length without copying.
   *
   * @return payload size in bytes
   */
  public int payloadSize() {
    return payload.length;
  }

  /**
   * Tests this event's topic against a pattern.
   *
   * @param pattern {@code "*"}, {@code "prefix.*"}, or an exact topic
   * @return {@code true} when the topic matches
   */
  public boolean matchesTopic(String pattern) {
    return TopicMatcher.matches(topic, pattern);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Event that)) {
      return false;
    }
    return id == that.id
        && timestamp == that.timestamp
        && topic.equals(that.topic)
        && source.equals(that.source)
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(topic, id, timestamp, source);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "Event[topic=" + topic
        + ", id=" + Long.toUnsignedString(id)
        + ", timestamp=" + timestamp
        + ", source=" + source
        + ", payloadBytes=" + payload.length + ']';
  }
}
