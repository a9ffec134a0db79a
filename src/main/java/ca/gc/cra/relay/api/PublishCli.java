package ca.gc.cra.relay.api;

import ca.gc.cra.relay.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.relay.application.bus.EventFactory;
import ca.gc.cra.relay.application.bus.Publisher;
import ca.gc.cra.relay.application.port.ConnectionEventEmitter;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.config.PublisherConfig;
import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.event.Event;
import ca.gc.cra.relay.domain.event.EventIdGenerator;
import ca.gc.cra.relay.infrastructure.codec.MessagePackEventCodec;
import ca.gc.cra.relay.infrastructure.codec.MessagePackPayloadCodec;
import ca.gc.cra.relay.infrastructure.events.LoggingConnectionEventEmitter;
import ca.gc.cra.relay.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.relay.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.relay.logging.Logs;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import ca.gc.cra.relay.validation.Numbers;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Starts a {@link Publisher} and publishes each stdin line as one event until EOF.
 *
 * @since 0.1.0
 */
public final class PublishCli {
  private static final Logger log = LoggerFactory.getLogger(PublishCli.class);
  static final String MODE = "publish";
  private static final long AWAIT_POLL_MILLIS = 50L;
  private static final int MAX_AWAIT_SUBSCRIBERS = 65_536;
  private static final String SUMMARY_USAGE =
      "usage: relay publish [bind=HOST:PORT] [topic=NAME] [source=ID] [channelCapacity=N] "
          + "[maxConnections=N] [awaitSubscribers=N] [config=FILE] [logLevel=LEVEL] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...] [--dry-run]";
  private static final String HELP_TEXT = """
      RELAY publisher

      Usage:
        relay publish [options] < lines.txt

      Each stdin line (UTF-8) becomes one event payload. The publisher stops at EOF.

      Options:
        bind=HOST:PORT            Listen address (default 127.0.0.1:0, port 0 picks a free port)
        topic=NAME                Topic for every event (default relay.lines)
        source=ID                 Source identifier stamped on events (default relay-cli)
        channelCapacity=N         Per-subscriber queue depth before eviction (default 1024)
        maxConnections=N          Concurrent subscriber limit (default 100)
        awaitSubscribers=N        Wait for N subscribers before reading stdin (default 0)
        config=FILE               YAML file with common/publish sections; CLI wins on conflicts
        logLevel=LEVEL            Root log level (TRACE|DEBUG|INFO|WARN|ERROR|OFF)
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OpenTelemetry resource attributes
        --dry-run                 Print the effective plan and exit
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private PublishCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, System.in);
  }

  static ExitCode run(String[] args, InputStream stdin) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for publish CLI");
    }

    Plan plan;
    try {
      plan = plan(input);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    if (input.dryRun()) {
      printDryRunPlan(plan);
      return ExitCode.SUCCESS;
    }
    return execute(plan, stdin);
  }

  private static Plan plan(CliInput input) throws CliAbort {
    if (!input.unknownFlags(null).isEmpty()) {
      log.error("Unknown flag(s): {}", input.unknownFlags(null));
      CliPrinter.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    Map<String, String> cliOptions;
    try {
      cliOptions = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    Map<String, String> effective =
        ConfigCliUtils.effectiveOptions(MODE, cliOptions, log, SUMMARY_USAGE);
    try {
      TelemetrySettings telemetry = TelemetryConfigurator.resolve(effective);
      PublisherConfig config = PublisherConfig.fromMap(effective);
      String topic = effective.get("topic").trim();
      String source = effective.get("source").trim();
      int awaitSubscribers = (int) Numbers.parseRange(
          "awaitSubscribers", effective.get("awaitSubscribers"), 0, MAX_AWAIT_SUBSCRIBERS);
      Event.requireValidTopic(topic);
      return new Plan(config, topic, source, awaitSubscribers, telemetry);
    } catch (IllegalArgumentException | BusException ex) {
      log.error("Invalid publish configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static ExitCode execute(Plan plan, InputStream stdin) {
    MetricsPort metrics = TelemetryConfigurator.openMetrics(plan.telemetry());
    ConnectionEventEmitter events = new LoggingConnectionEventEmitter(metrics);
    Publisher publisher =
        new Publisher(plan.config(), new MessagePackEventCodec(), metrics, events);
    EventFactory factory = new EventFactory(
        new SystemClockAdapter(), new EventIdGenerator(), new MessagePackPayloadCodec());
    try (MDC.MDCCloseable ignored = Logs.withRole("publisher-cli")) {
      publisher.start();
      log.info("Publishing topic {} on {}", plan.topic(), publisher.boundAddress());
      awaitSubscribers(publisher, plan.awaitSubscribers());
      long published = pump(publisher, factory, plan, stdin);
      log.info("Reached end of input after {} event(s)", published);
      return ExitCode.SUCCESS;
    } catch (BusException ex) {
      log.error("Publisher failed: {}", ex.getMessage(), ex);
      return ExitCode.forBusError(ex.kind());
    } catch (IOException ex) {
      log.error("Failed to read standard input", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Publisher interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in publisher", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      publisher.stop();
      closeMetrics(metrics);
    }
  }

  private static void awaitSubscribers(Publisher publisher, int wanted) throws InterruptedException {
    if (wanted <= 0) {
      return;
    }
    log.info("Waiting for {} subscriber(s)", wanted);
    while (publisher.connectionCount() < wanted) {
      Thread.sleep(AWAIT_POLL_MILLIS);
    }
  }

  private static long pump(Publisher publisher, EventFactory factory, Plan plan, InputStream stdin)
      throws IOException, BusException {
    long published = 0;
    BufferedReader reader =
        new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    String line;
    while ((line = reader.readLine()) != null) {
      Event event = factory.create(plan.topic(), plan.source(), line.getBytes(StandardCharsets.UTF_8));
      publisher.publish(event);
      published++;
      if (log.isDebugEnabled()) {
        log.debug("Published {} to {} subscriber(s): {}", event.id(), publisher.connectionCount(),
            Logs.preview(event.payload(), Logs.DEFAULT_MAX_BYTES));
      }
    }
    return published;
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }

  private static void printDryRunPlan(Plan plan) {
    PublisherConfig config = plan.config();
    CliPrinter.printLines(
        "Publish dry-run: no listener will be opened.",
        " Bind address     : " + config.bindEndpoint(),
        " Topic            : " + plan.topic(),
        " Source           : " + Logs.truncate(plan.source(), 96),
        " Channel capacity : " + config.channelCapacity(),
        " Max connections  : " + config.maxConnections(),
        " Await subscribers: " + plan.awaitSubscribers(),
        " Metrics exporter : " + plan.telemetry().exporter(),
        " Re-run without --dry-run to start publishing.");
  }

  private record Plan(
      PublisherConfig config,
      String topic,
      String source,
      int awaitSubscribers,
      TelemetrySettings telemetry) {}
}
