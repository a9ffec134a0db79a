package ca.gc.cra.relay.application.bus;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.PayloadCodec;
import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.event.Event;
import ca.gc.cra.relay.domain.event.EventIdGenerator;
import ca.gc.cra.relay.infrastructure.codec.MessagePackPayloadCodec;
import java.util.Objects;

/**
 * <strong>What:</strong> Creates events, stamping each with a timestamp and a generator-unique id.
 * <p><strong>Why:</strong> The id generator is owned here rather than held in a static, so its scope is whoever
 * holds the factory. Share one factory to get process-wide unique ids.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when the supplied clock and codec are.</p>
 *
 * @since 0.1.0
 */
public final class EventFactory {
  private final ClockPort clock;
  private final EventIdGenerator ids;
  private final PayloadCodec payloads;

  /** Creates a factory using the system clock and MessagePack payloads. */
  public EventFactory() {
    this(ClockPort.SYSTEM, new EventIdGenerator(), new MessagePackPayloadCodec());
  }

  /**
   * Creates a factory from explicit collaborators.
   *
   * @param clock timestamp source
   * @param ids id generator; not shared unless the caller shares it
   * @param payloads codec for {@link #withData} and {@link #data}
   */
  public EventFactory(ClockPort clock, EventIdGenerator ids, PayloadCodec payloads) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.payloads = Objects.requireNonNull(payloads, "payloads");
  }

  /**
   * Creates an event with raw payload bytes.
   *
   * <p>The source is not validated, but topic, source, and payload share one wire frame of at most 8 MiB
   * ({@code FrameCodec.DEFAULT_MAX_FRAME_BYTES}). A source large enough to overflow it makes
   * {@link Publisher#publish(Event)} fail with {@code SERIALIZATION}.</p>
   *
   * @param topic routing key
   * @param source sender identifier; {@code null} is treated as empty
   * @param payload payload bytes; {@code null} is treated as empty
   * @return new event
   * @throws BusException {@code INVALID_TOPIC} for an illegal topic, {@code SERIALIZATION} when the payload
   *     exceeds {@value Event#MAX_PAYLOAD_BYTES} bytes
   */
  public Event create(String topic, String source, byte[] payload) throws BusException {
    Event.requireValidTopic(topic);
    long now = clock.nowMillis();
    return Event.of(topic, ids.nextId(now), now, source, payload);
  }

  /**
   * Creates an event whose payload is {@code value} serialized with the factory's payload codec.
   *
   * @param topic routing key
   * @param source sender identifier
   * @param value typed value to serialize
   * @return new event
   * @throws BusException {@code INVALID_TOPIC}, or {@code SERIALIZATION} if the value cannot be encoded or is
   *     too large
   */
  public Event withData(String topic, String source, Object value) throws BusException {
    Event.requireValidTopic(topic);
    return create(topic, source, payloads.encode(value));
  }

  /**
   * Decodes an event payload produced by {@link #withData}.
   *
   * @param event event to read
   * @param type target type
   * @param <T> target type
   * @return decoded value
   * @throws BusException {@code DESERIALIZATION} if the payload does not decode as {@code type}
   */
  public <T> T data(Event event, Class<T> type) throws BusException {
    Objects.requireNonNull(event, "event");
    return payloads.decode(event.payload(), type);
  }
}
