package ca.gc.cra.relay.application.bus;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.ConnectionEventEmitter;
import ca.gc.cra.relay.application.port.EventCodec;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.TransportConnector;
import ca.gc.cra.relay.config.SubscriberConfig;
import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.bus.ConnectionEventType;
import ca.gc.cra.relay.domain.bus.SubscriberState;
import ca.gc.cra.relay.domain.event.Event;
import ca.gc.cra.relay.domain.event.TopicMatcher;
import ca.gc.cra.relay.domain.net.Endpoint;
import ca.gc.cra.relay.infrastructure.codec.MessagePackEventCodec;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.relay.infrastructure.net.FrameCodec;
import ca.gc.cra.relay.infrastructure.net.TcpConnector;
import ca.gc.cra.relay.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Connects to a {@link Publisher}, decodes its frames, filters them by topic, and buffers
 * matching events for {@link #recv()}.
 * <p><strong>Reconnects:</strong> with auto-reconnect on, a lost or failed connection is retried after the
 * configured delay until {@link #stop()}. With it off, the subscriber settles in {@code DISCONNECTED} and
 * {@link #start()} may be called again.</p>
 * <p><strong>Buffering:</strong> the receive buffer is bounded; when a consumer falls behind the oldest buffered
 * event is dropped to admit the newest.</p>
 * <p><strong>Thread-safety:</strong> all public methods may be called from any thread. One supervisor thread
 * per started subscriber owns the socket and the read loop.</p>
 * <p><strong>Observability:</strong> Metrics {@code subscriber.events.received},
 * {@code subscriber.events.filtered}, {@code subscriber.buffer.dropped}, {@code subscriber.connect.failed},
 * {@code subscriber.reconnect.scheduled}, and {@code subscriber.frames.invalid}.</p>
 *
 * @since 0.1.0
 */
public final class Subscriber implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Subscriber.class);

  static final String ROLE = "subscriber";
  static final String METRIC_RECEIVED = "subscriber.events.received";
  static final String METRIC_FILTERED = "subscriber.events.filtered";
  static final String METRIC_DROPPED = "subscriber.buffer.dropped";
  static final String METRIC_CONNECT_FAILED = "subscriber.connect.failed";
  static final String METRIC_RECONNECT = "subscriber.reconnect.scheduled";
  static final String METRIC_FRAMES_INVALID = "subscriber.frames.invalid";

  private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(2);

  private final SubscriberConfig config;
  private final Endpoint endpoint;
  private final TransportConnector connector;
  private final EventCodec codec;
  private final FrameCodec frames;
  private final MetricsPort metrics;
  private final ConnectionEventEmitter events;
  private final LifecycleNotifier notifier;
  private final SubscriberStateMachine machine;
  private final ReceiveBuffer buffer;
  private final AtomicLong eventsReceived = new AtomicLong();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final ReentrantLock lifecycleLock = new ReentrantLock();

  private TransportConnector.Connection connection;
  private Thread supervisor;
  private boolean supervising;

  /**
   * Creates a TCP subscriber with MessagePack decoding and no metrics or lifecycle collaborator.
   *
   * @param config validated settings
   */
  public Subscriber(SubscriberConfig config) {
    this(config, new TcpConnector(), new MessagePackEventCodec(), MetricsPort.NO_OP,
        ConnectionEventEmitter.NO_OP);
  }

  /**
   * Creates a subscriber from explicit collaborators.
   *
   * @param config validated settings
   * @param connector transport used for every connection attempt
   * @param codec event decoder
   * @param metrics metrics sink; {@code null} disables metrics
   * @param events lifecycle collaborator; {@code null} disables notifications
   */
  public Subscriber(
      SubscriberConfig config,
      TransportConnector connector,
      EventCodec codec,
      MetricsPort metrics,
      ConnectionEventEmitter events) {
    this.config = Objects.requireNonNull(config, "config");
    this.endpoint = config.publisherEndpoint();
    this.connector = Objects.requireNonNull(connector, "connector");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.frames = new FrameCodec();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.events = events == null ? ConnectionEventEmitter.NO_OP : events;
    this.notifier = new LifecycleNotifier(this.events, ClockPort.SYSTEM, ROLE);
    this.machine = new SubscriberStateMachine(config.autoReconnect());
    this.buffer = new ReceiveBuffer(config.bufferCapacity());
  }

  /**
   * Creates an unstarted subscriber with default settings targeting {@code address}.
   *
   * @param address publisher {@code host:port}, optionally prefixed with {@code tcp://}
   * @return new subscriber
   * @throws BusException {@code INVALID_ADDRESS} if the address is malformed
   */
  public static Subscriber connectTo(String address) throws BusException {
    try {
      return new Subscriber(SubscriberConfig.forAddress(address));
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw BusException.invalidAddress(address + " (" + ex.getMessage() + ")", ex);
    }
  }

  /**
   * Returns a new, unstarted subscriber with the same collaborators and one more topic pattern.
   *
   * @param pattern {@code *}, {@code prefix.*}, or an exact topic
   * @return new subscriber
   * @throws BusException {@code INVALID_TOPIC} if the pattern is malformed
   */
  public Subscriber withTopic(String pattern) throws BusException {
    SubscriberConfig next;
    try {
      next = config.withTopic(pattern);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw BusException.invalidTopic("invalid topic pattern '" + pattern + "'");
    }
    return new Subscriber(next, connector, codec, metrics, events);
  }

  /**
   * Connects to the publisher and starts the read loop on a supervisor thread.
   *
   * <p>Blocks until the first connection attempt completes; no timeout is applied.</p>
   *
   * @throws BusException {@code CONNECTION_FAILED} if the first attempt fails and auto-reconnect is off,
   *     {@code ALREADY_RUNNING} if a supervisor is active, {@code NOT_RUNNING} if already stopped
   */
  public void start() throws BusException {
    awaitExitingSupervisor();
    FirstAttempt first = new FirstAttempt();
    Thread worker;
    lifecycleLock.lock();
    try {
      if (machine.isStopped()) {
        throw BusException.notRunning("subscriber was stopped; create a new instance");
      }
      if (supervising || !machine.start()) {
        throw BusException.alreadyRunning();
      }
      supervising = true;
      worker = ExecutorFactories.newDaemonThread(
          "relay-sub-" + endpoint.port() + "-" + Integer.toHexString(System.identityHashCode(this)),
          () -> supervise(first),
          (thread, ex) -> log.error("Subscriber thread {} crashed", thread.getName(), ex));
      supervisor = worker;
      worker.start();
    } finally {
      lifecycleLock.unlock();
    }

    IOException failure;
    try {
      failure = first.await();
    } catch (InterruptedException ex) {
      // the supervisor keeps trying in the background; stop() cancels it
      Thread.currentThread().interrupt();
      return;
    }
    if (failure != null && !config.autoReconnect()) {
      joinQuietly(worker);
      throw BusException.connectionFailed("cannot reach publisher at " + endpoint, failure);
    }
  }

  /**
   * Waits for the next event.
   *
   * @return the next event, or empty once the subscriber is stopped
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public Optional<Event> recv() throws InterruptedException {
    return buffer.take();
  }

  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @param timeout maximum wait
   * @return the next event, or empty on timeout or stop
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public Optional<Event> recv(Duration timeout) throws InterruptedException {
    return buffer.poll(timeout);
  }

  /**
   * Returns a buffered event without waiting.
   *
   * @return the next event, or empty if none is buffered
   */
  public Optional<Event> tryRecv() {
    return buffer.poll();
  }

  /**
   * Stops the subscriber: closes the connection, cancels any pending reconnect, and releases every waiting
   * {@link #recv()} with an empty result. Idempotent and terminal.
   */
  public void stop() {
    TransportConnector.Connection open;
    Thread worker;
    lifecycleLock.lock();
    try {
      if (!machine.stop()) {
        return;
      }
      open = connection;
      connection = null;
      worker = supervisor;
    } finally {
      lifecycleLock.unlock();
    }
    stopSignal.countDown();
    buffer.close();
    closeQuietly(open);
    if (worker != null && worker != Thread.currentThread()) {
      joinQuietly(worker);
    }
    notifier.notify(ConnectionEventType.STOPPED, 0L, endpoint.toString(), null);
    log.info("Subscriber for {} stopped after {} event(s)", endpoint, eventsReceived.get());
  }

  /** Same as {@link #stop()}. */
  @Override
  public void close() {
    stop();
  }

  public SubscriberState state() {
    return machine.state();
  }

  /**
   * Returns the number of events that passed the topic filter.
   *
   * @return received event count
   */
  public long eventsReceived() {
    return eventsReceived.get();
  }

  public SubscriberConfig config() {
    return config;
  }

  private void supervise(FirstAttempt first) {
    try (MDC.MDCCloseable ignored = Logs.withRole(ROLE)) {
      while (true) {
        TransportConnector.Connection open;
        try {
          open = connector.connect(endpoint);
        } catch (IOException ex) {
          first.fail(ex);
          if (!machine.connectFailed()) {
            break;
          }
          metrics.increment(METRIC_CONNECT_FAILED);
          notifier.notify(ConnectionEventType.CONNECT_FAILED, 0L, endpoint.toString(), ex.getMessage());
          log.warn("Failed to connect to publisher at {}: {}", endpoint, ex.getMessage());
          if (!awaitReconnect()) {
            break;
          }
          continue;
        }

        if (!adopt(open)) {
          closeQuietly(open);
          break;
        }
        first.succeed();
        notifier.notify(ConnectionEventType.CONNECTED, 0L, open.peer(), null);
        log.info("Connected to publisher at {}", open.peer());

        String reason = readLoop(open);
        release(open);
        if (!machine.ioError()) {
          break;
        }
        notifier.notify(ConnectionEventType.CONNECTION_LOST, 0L, open.peer(), reason);
        log.warn("Connection to publisher at {} lost: {}", open.peer(), reason);
        if (!awaitReconnect()) {
          break;
        }
      }
    } finally {
      first.succeed();
      lifecycleLock.lock();
      try {
        supervising = false;
      } finally {
        lifecycleLock.unlock();
      }
    }
  }

  /**
   * Without auto-reconnect, a supervisor that has moved the machine to {@code DISCONNECTED} is about to exit;
   * wait for it so a restart does not race its last notification.
   */
  private void awaitExitingSupervisor() {
    Thread previous;
    lifecycleLock.lock();
    try {
      if (!supervising || config.autoReconnect() || machine.state() != SubscriberState.DISCONNECTED) {
        return;
      }
      previous = supervisor;
    } finally {
      lifecycleLock.unlock();
    }
    if (previous != null && previous != Thread.currentThread()) {
      joinQuietly(previous);
    }
  }

  private boolean adopt(TransportConnector.Connection open) {
    lifecycleLock.lock();
    try {
      if (!machine.connected()) {
        return false;
      }
      connection = open;
      return true;
    } finally {
      lifecycleLock.unlock();
    }
  }

  private void release(TransportConnector.Connection open) {
    lifecycleLock.lock();
    try {
      if (connection == open) {
        connection = null;
      }
    } finally {
      lifecycleLock.unlock();
    }
    closeQuietly(open);
  }

  private String readLoop(TransportConnector.Connection open) {
    InputStream in = open.input();
    while (!machine.isStopped()) {
      byte[] body;
      Event event;
      try {
        body = frames.readFrame(in);
        if (body == null) {
          return "publisher closed the connection";
        }
        event = codec.decode(body);
      } catch (IOException ex) {
        return "read failed: " + ex.getMessage();
      } catch (BusException ex) {
        metrics.increment(METRIC_FRAMES_INVALID);
        return "protocol violation: " + ex.getMessage();
      }
      deliver(event);
    }
    return "stopped";
  }

  private void deliver(Event event) {
    if (!TopicMatcher.matchesAny(event.topic(), config.topics())) {
      metrics.increment(METRIC_FILTERED);
      return;
    }
    eventsReceived.incrementAndGet();
    metrics.increment(METRIC_RECEIVED);
    if (buffer.offer(event)) {
      metrics.increment(METRIC_DROPPED);
      log.debug("Receive buffer full ({}); dropped oldest event", buffer.capacity());
    }
    if (log.isDebugEnabled()) {
      log.debug("Received event {} on {} from {}", Long.toUnsignedString(event.id()), event.topic(),
          Logs.truncate(event.source()));
    }
  }

  private boolean awaitReconnect() {
    if (!machine.shouldReconnect()) {
      return false;
    }
    metrics.increment(METRIC_RECONNECT);
    log.info("Reconnecting to {} in {} ms", endpoint, config.reconnectDelayMillis());
    try {
      if (stopSignal.await(config.reconnectDelayMillis(), TimeUnit.MILLISECONDS)) {
        return false;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
    return machine.timerFired();
  }

  private static void joinQuietly(Thread worker) {
    try {
      worker.join(STOP_JOIN_TIMEOUT.toMillis());
      if (worker.isAlive()) {
        log.warn("Subscriber thread {} still running after {}", worker.getName(), STOP_JOIN_TIMEOUT);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static void closeQuietly(TransportConnector.Connection open) {
    if (open == null) {
      return;
    }
    try {
      open.close();
    } catch (IOException ex) {
      log.debug("Error closing connection to {}", open.peer(), ex);
    }
  }

  /** Outcome of the first connection attempt, handed from the supervisor to {@code start()}. */
  private static final class FirstAttempt {
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile IOException failure;

    void succeed() {
      done.countDown();
    }

    void fail(IOException ex) {
      if (done.getCount() > 0) {
        failure = ex;
        done.countDown();
      }
    }

    IOException await() throws InterruptedException {
      done.await();
      return failure;
    }
  }
}
