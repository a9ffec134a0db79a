package ca.gc.cra.relay.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.bus.ConnectionEvent;
import ca.gc.cra.relay.domain.bus.ConnectionEventType;
import ca.gc.cra.relay.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConnectionEventEmitterTest {
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private boolean originalAdditive;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(LoggingConnectionEventEmitter.class);
    appender = new ListAppender<>();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    logger.setAdditive(originalAdditive);
    appender.stop();
  }

  @Test
  void acceptedConnectionLogsInfoAndCounts() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingConnectionEventEmitter emitter = new LoggingConnectionEventEmitter(metrics, "testBus");

    emitter.emit(new ConnectionEvent(Instant.parse("2024-01-01T00:00:00Z"), ConnectionEventType.ACCEPTED,
        "publisher", 3L, "127.0.0.1:50000", null));

    assertEquals(1, metrics.count("testBus.accepted"));
    List<ILoggingEvent> events = appender.list;
    assertEquals(1, events.size());
    ILoggingEvent logged = events.get(0);
    assertEquals(Level.INFO, logged.getLevel());
    String message = logged.getFormattedMessage();
    assertTrue(message.startsWith("bus.connection timestamp=2024-01-01T00:00:00Z"));
    assertTrue(message.contains("type=ACCEPTED"));
    assertTrue(message.contains("role=publisher"));
    assertTrue(message.contains("connection=3"));
    assertTrue(message.contains("peer=127.0.0.1:50000"));
    assertFalse(message.contains("detail="));
  }

  @Test
  void evictionLogsWarningWithDetail() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingConnectionEventEmitter emitter = new LoggingConnectionEventEmitter(metrics);

    emitter.emit(new ConnectionEvent(Instant.EPOCH, ConnectionEventType.EVICTED, "publisher", 9L,
        "10.0.0.2:41000", "queue full (1024)"));

    assertEquals(1, metrics.count("connectionEvents.evicted"));
    ILoggingEvent logged = appender.list.get(0);
    assertEquals(Level.WARN, logged.getLevel());
    assertTrue(logged.getFormattedMessage().contains("detail=queue full (1024)"));
  }

  @Test
  void emitRejectsNullEvent() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingConnectionEventEmitter emitter = new LoggingConnectionEventEmitter(metrics);

    assertThrows(NullPointerException.class, () -> emitter.emit(null));
    assertFalse(metrics.hasCounter("connectionEvents.accepted"));
  }
}
