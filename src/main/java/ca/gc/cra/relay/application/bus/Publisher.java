package ca.gc.cra.relay.application.bus;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.ConnectionEventEmitter;
import ca.gc.cra.relay.application.port.EventCodec;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.config.PublisherConfig;
import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.bus.ConnectionEventType;
import ca.gc.cra.relay.domain.event.Event;
import ca.gc.cra.relay.domain.net.Endpoint;
import ca.gc.cra.relay.infrastructure.codec.MessagePackEventCodec;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.relay.infrastructure.net.FrameCodec;
import ca.gc.cra.relay.logging.Logs;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> TCP publisher that fans every published event out to all connected subscribers.
 * <p><strong>Why:</strong> Each subscriber gets its own bounded queue and writer thread, so one slow or dead
 * subscriber never delays {@link #publish(Event)} or the other subscribers.</p>
 * <p><strong>Slow consumers:</strong> when a subscriber's queue is full at publish time, that subscriber is
 * evicted (its socket is closed and an {@code EVICTED} lifecycle event is emitted). A subscriber observes every
 * event enqueued for it, in publish order, up to the point of eviction.</p>
 * <p><strong>Lifecycle:</strong> {@code NEW -> RUNNING -> STOPPED}. An instance is single-use: after
 * {@link #stop()} or a failed bind, construct a new publisher.</p>
 * <p><strong>Thread-safety:</strong> {@link #publish}, the accessors, and {@link #stop()} may be called from any
 * thread.</p>
 * <p><strong>Observability:</strong> Metrics {@code publisher.events.published},
 * {@code publisher.connections.accepted}, {@code publisher.connections.rejected},
 * {@code publisher.subscriber.evicted}, {@code publisher.subscriber.disconnected}, and
 * {@code publisher.queue.depth}.</p>
 *
 * @since 0.1.0
 */
public final class Publisher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Publisher.class);

  static final String ROLE = "publisher";
  static final String METRIC_PUBLISHED = "publisher.events.published";
  static final String METRIC_ACCEPTED = "publisher.connections.accepted";
  static final String METRIC_REJECTED = "publisher.connections.rejected";
  static final String METRIC_EVICTED = "publisher.subscriber.evicted";
  static final String METRIC_DISCONNECTED = "publisher.subscriber.disconnected";
  static final String METRIC_QUEUE_DEPTH = "publisher.queue.depth";

  private static final int ACCEPT_BACKLOG = 128;
  private static final long WRITER_IDLE_POLL_MILLIS = 250L;
  private static final long ACCEPT_BACKOFF_MILLIS = 50L;
  private static final int WRITER_POOL_SLACK = 16;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

  private enum Lifecycle { NEW, RUNNING, STOPPED }

  private final PublisherConfig config;
  private final EventCodec codec;
  private final FrameCodec frames;
  private final MetricsPort metrics;
  private final LifecycleNotifier notifier;
  private final ConnectionRegistry registry = new ConnectionRegistry();
  private final AtomicLong eventsPublished = new AtomicLong();
  private final AtomicLong connectionIds = new AtomicLong();
  private final ReentrantLock lifecycleLock = new ReentrantLock();

  private volatile Lifecycle lifecycle = Lifecycle.NEW;
  private volatile Endpoint boundEndpoint;
  private ServerSocket serverSocket;
  private Thread acceptThread;
  private ExecutorService writers;

  /**
   * Creates a publisher with MessagePack encoding and no metrics or lifecycle collaborator.
   *
   * @param config validated settings
   */
  public Publisher(PublisherConfig config) {
    this(config, new MessagePackEventCodec(), MetricsPort.NO_OP, ConnectionEventEmitter.NO_OP);
  }

  /**
   * Creates a publisher from explicit collaborators.
   *
   * @param config validated settings
   * @param codec event encoder shared by every connection
   * @param metrics metrics sink; {@code null} disables metrics
   * @param events lifecycle collaborator; {@code null} disables notifications
   */
  public Publisher(
      PublisherConfig config, EventCodec codec, MetricsPort metrics, ConnectionEventEmitter events) {
    this.config = Objects.requireNonNull(config, "config");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.frames = new FrameCodec();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.notifier = new LifecycleNotifier(events, ClockPort.SYSTEM, ROLE);
  }

  /**
   * Creates an unstarted publisher on {@code 127.0.0.1:0} with default limits.
   *
   * @return new publisher
   */
  public static Publisher withDefaults() {
    return new Publisher(PublisherConfig.defaults());
  }

  /**
   * Binds the listening socket and starts accepting subscribers.
   *
   * @throws BusException {@code ALREADY_RUNNING} if started, {@code NOT_RUNNING} if already stopped, or
   *     {@code IO} if the bind fails (the instance is then unusable)
   */
  public void start() throws BusException {
    lifecycleLock.lock();
    try {
      if (lifecycle == Lifecycle.RUNNING) {
        throw BusException.alreadyRunning();
      }
      if (lifecycle == Lifecycle.STOPPED) {
        throw BusException.notRunning("publisher was stopped; create a new instance");
      }
      Endpoint bind = config.bindEndpoint();
      ServerSocket server = null;
      try {
        server = new ServerSocket();
        server.setReuseAddress(true);
        server.bind(bind.toSocketAddress(), ACCEPT_BACKLOG);
      } catch (IOException | RuntimeException ex) {
        lifecycle = Lifecycle.STOPPED;
        closeQuietly(server);
        throw BusException.io("failed to bind " + bind, ex);
      }
      ServerSocket listening = server;
      serverSocket = listening;
      boundEndpoint = Endpoint.of((InetSocketAddress) listening.getLocalSocketAddress());
      writers = ExecutorFactories.newConnectionPool(
          config.maxConnections() + WRITER_POOL_SLACK,
          "relay-pub-" + boundEndpoint.port() + "-writer",
          (thread, ex) -> log.error("Writer thread {} crashed", thread.getName(), ex));
      acceptThread = ExecutorFactories.newDaemonThread(
          "relay-pub-" + boundEndpoint.port() + "-accept",
          () -> acceptLoop(listening),
          (thread, ex) -> log.error("Accept thread {} crashed", thread.getName(), ex));
      lifecycle = Lifecycle.RUNNING;
      acceptThread.start();
    } finally {
      lifecycleLock.unlock();
    }
    log.info("Publisher listening on {} (channelCapacity={}, maxConnections={})",
        boundEndpoint, config.channelCapacity(), config.maxConnections());
  }

  /**
   * Enqueues {@code event} for every connected subscriber without blocking.
   *
   * <p>The event is encoded and framed once. Subscribers whose queue is full are evicted. Subscribers that
   * connect later never see this event. The published counter advances even when nobody is connected.</p>
   *
   * @param event event to broadcast
   * @throws BusException {@code NOT_RUNNING} unless started, or {@code SERIALIZATION} if encoding fails
   */
  public void publish(Event event) throws BusException {
    Objects.requireNonNull(event, "event");
    if (lifecycle != Lifecycle.RUNNING) {
      throw BusException.notRunning("publisher is not running");
    }
    byte[] frame = frames.encode(codec.encode(event));
    List<SubscriberLink> links = registry.snapshot();
    for (SubscriberLink link : links) {
      if (link.offer(frame)) {
        metrics.observe(METRIC_QUEUE_DEPTH, link.depth());
      } else if (!link.isClosed()) {
        evict(link);
      }
    }
    eventsPublished.incrementAndGet();
    metrics.increment(METRIC_PUBLISHED);
    if (log.isDebugEnabled()) {
      log.debug("Published event {} on {} to {} subscriber(s)",
          Long.toUnsignedString(event.id()), event.topic(), links.size());
    }
  }

  /**
   * Closes the listening socket and every subscriber connection. Idempotent; calling it before
   * {@link #start()} has no effect.
   */
  public void stop() {
    ServerSocket server;
    Thread accept;
    ExecutorService pool;
    lifecycleLock.lock();
    try {
      if (lifecycle != Lifecycle.RUNNING) {
        return;
      }
      lifecycle = Lifecycle.STOPPED;
      server = serverSocket;
      accept = acceptThread;
      pool = writers;
    } finally {
      lifecycleLock.unlock();
    }

    closeQuietly(server);
    List<SubscriberLink> links = registry.closeAll();
    for (SubscriberLink link : links) {
      link.close();
    }
    pool.shutdownNow();
    awaitQuietly(accept, pool);
    notifier.notify(ConnectionEventType.STOPPED, 0L, String.valueOf(boundEndpoint),
        "closed " + links.size() + " connection(s)");
    log.info("Publisher on {} stopped after {} event(s); closed {} connection(s)",
        boundEndpoint, eventsPublished.get(), links.size());
  }

  /** Same as {@link #stop()}. */
  @Override
  public void close() {
    stop();
  }

  /**
   * Returns the address actually bound, with the OS-assigned port when the config asked for port 0.
   *
   * @return bound endpoint
   * @throws BusException {@code NOT_RUNNING} unless the publisher is running
   */
  public Endpoint boundAddress() throws BusException {
    Endpoint endpoint = boundEndpoint;
    if (lifecycle != Lifecycle.RUNNING || endpoint == null) {
      throw BusException.notRunning("publisher has no bound address");
    }
    return endpoint;
  }

  /**
   * Returns the number of live subscriber connections.
   *
   * @return connection count
   */
  public int connectionCount() {
    return registry.size();
  }

  /**
   * Returns the number of successful {@link #publish} calls.
   *
   * @return published event count
   */
  public long eventsPublished() {
    return eventsPublished.get();
  }

  public boolean isRunning() {
    return lifecycle == Lifecycle.RUNNING;
  }

  public PublisherConfig config() {
    return config;
  }

  private void acceptLoop(ServerSocket server) {
    try (MDC.MDCCloseable ignored = Logs.withRole(ROLE)) {
      while (lifecycle == Lifecycle.RUNNING) {
        Socket socket;
        try {
          socket = server.accept();
        } catch (IOException ex) {
          if (lifecycle != Lifecycle.RUNNING || server.isClosed()) {
            break;
          }
          log.warn("Accept failed on {}: {}", boundEndpoint, ex.getMessage());
          if (!backOff()) {
            break;
          }
          continue;
        }
        admit(socket);
      }
    }
    log.debug("Accept loop on {} exited", boundEndpoint);
  }

  private void admit(Socket socket) {
    long id = connectionIds.incrementAndGet();
    String peer = describe(socket.getRemoteSocketAddress());
    SubscriberLink link;
    try {
      socket.setTcpNoDelay(true);
      link = new SubscriberLink(id, socket, peer, config.channelCapacity());
    } catch (IOException ex) {
      log.warn("Failed to set up connection {} from {}: {}", id, peer, ex.getMessage());
      closeQuietly(socket);
      return;
    }

    ConnectionRegistry.Admission admission = registry.tryRegister(link, config.maxConnections());
    if (admission == ConnectionRegistry.Admission.CLOSED) {
      link.close();
      return;
    }
    if (admission == ConnectionRegistry.Admission.FULL) {
      link.close();
      reject(link, "max connections (" + config.maxConnections() + ") reached");
      return;
    }
    try {
      writers.execute(() -> writeLoop(link));
    } catch (RejectedExecutionException ex) {
      registry.remove(link);
      link.close();
      if (lifecycle == Lifecycle.RUNNING) {
        reject(link, "no writer thread available");
      }
      return;
    }
    metrics.increment(METRIC_ACCEPTED);
    notifier.notify(ConnectionEventType.ACCEPTED, id, peer, null);
    log.info("Subscriber {} connected from {} ({} live)", id, peer, registry.size());
  }

  private void reject(SubscriberLink link, String reason) {
    metrics.increment(METRIC_REJECTED);
    notifier.notify(ConnectionEventType.REJECTED, link.id(), link.peer(), reason);
    log.warn("Rejected subscriber {} from {}: {}", link.id(), link.peer(), reason);
  }

  private void writeLoop(SubscriberLink link) {
    try (MDC.MDCCloseable ignored = Logs.withRole(ROLE)) {
      while (!link.isClosed()) {
        byte[] frame = link.poll(WRITER_IDLE_POLL_MILLIS);
        if (frame == null) {
          continue;
        }
        link.write(frame);
        while ((frame = link.pollNow()) != null) {
          link.write(frame);
        }
        link.flush();
      }
    } catch (IOException ex) {
      if (!link.isClosed()) {
        drop(link, ex.getMessage());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      link.close();
    }
  }

  private void evict(SubscriberLink link) {
    if (!registry.remove(link)) {
      return;
    }
    link.close();
    String reason = "outbound queue full (capacity " + link.capacity() + ")";
    metrics.increment(METRIC_EVICTED);
    notifier.notify(ConnectionEventType.EVICTED, link.id(), link.peer(), reason);
    log.warn("Evicted slow subscriber {} ({}): {}", link.id(), link.peer(), reason);
  }

  private void drop(SubscriberLink link, String reason) {
    if (!registry.remove(link)) {
      return;
    }
    link.close();
    metrics.increment(METRIC_DISCONNECTED);
    notifier.notify(ConnectionEventType.DISCONNECTED, link.id(), link.peer(), reason);
    log.info("Subscriber {} ({}) disconnected: {}", link.id(), link.peer(), reason);
  }

  private boolean backOff() {
    try {
      Thread.sleep(ACCEPT_BACKOFF_MILLIS);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static void awaitQuietly(Thread accept, ExecutorService pool) {
    try {
      if (accept != null && accept != Thread.currentThread()) {
        accept.join(SHUTDOWN_TIMEOUT.toMillis());
      }
      if (!pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Publisher writer threads did not terminate within {}", SHUTDOWN_TIMEOUT);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static String describe(SocketAddress address) {
    if (address instanceof InetSocketAddress inet) {
      return Endpoint.of(inet).toString();
    }
    return String.valueOf(address);
  }

  private static void closeQuietly(AutoCloseable closeable) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception ex) {
      log.debug("Error while closing {}", closeable, ex);
    }
  }
}
