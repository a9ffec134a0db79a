package ca.gc.cra.relay.infrastructure.events;

import ca.gc.cra.relay.application.port.ConnectionEventEmitter;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.bus.ConnectionEvent;
import ca.gc.cra.relay.domain.bus.ConnectionEventType;
import ca.gc.cra.relay.logging.Logs;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits connection lifecycle events as structured logs and counts them per type.
 *
 * <p>Losses ({@code EVICTED}, {@code CONNECTION_LOST}, {@code CONNECT_FAILED}, {@code REJECTED}) log at WARN;
 * everything else at INFO.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConnectionEventEmitter implements ConnectionEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(LoggingConnectionEventEmitter.class);
  private static final String DEFAULT_PREFIX = "connectionEvents";

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a logging emitter using the supplied metrics port and prefix.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code connectionEvents})
   */
  public LoggingConnectionEventEmitter(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? DEFAULT_PREFIX : metricPrefix.trim();
  }

  /**
   * Creates a logging emitter using {@code connectionEvents} as the metric prefix.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingConnectionEventEmitter(MetricsPort metrics) {
    this(metrics, DEFAULT_PREFIX);
  }

  @Override
  public void emit(ConnectionEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + "." + event.type().name().toLowerCase(Locale.ROOT));

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("timestamp=" + event.timestamp());
    joiner.add("type=" + event.type());
    joiner.add("role=" + event.role());
    joiner.add("connection=" + event.connectionId());
    joiner.add("peer=" + Logs.truncate(event.peer()));
    if (event.detail() != null && !event.detail().isBlank()) {
      joiner.add("detail=" + Logs.truncate(event.detail(), 256));
    }

    if (isLoss(event.type())) {
      log.warn("bus.connection {}", joiner);
    } else {
      log.info("bus.connection {}", joiner);
    }
  }

  private static boolean isLoss(ConnectionEventType type) {
    return switch (type) {
      case EVICTED, CONNECTION_LOST, CONNECT_FAILED, REJECTED -> true;
      default -> false;
    };
  }
}
