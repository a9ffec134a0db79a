package ca.gc.cra.relay.api;

import ca.gc.cra.relay.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.relay.application.bus.Subscriber;
import ca.gc.cra.relay.application.port.ConnectionEventEmitter;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.config.SubscriberConfig;
import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.bus.SubscriberState;
import ca.gc.cra.relay.domain.event.Event;
import ca.gc.cra.relay.infrastructure.codec.MessagePackEventCodec;
import ca.gc.cra.relay.infrastructure.events.LoggingConnectionEventEmitter;
import ca.gc.cra.relay.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.relay.infrastructure.net.TcpConnector;
import ca.gc.cra.relay.logging.Logs;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import ca.gc.cra.relay.validation.Numbers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Connects a {@link Subscriber} and prints each received event as
 * {@code topic id timestamp source payload} on stdout.
 *
 * @since 0.1.0
 */
public final class SubscribeCli {
  private static final Logger log = LoggerFactory.getLogger(SubscribeCli.class);
  static final String MODE = "subscribe";
  private static final Duration RECV_POLL = Duration.ofMillis(250);
  private static final String SUMMARY_USAGE =
      "usage: relay subscribe [connect=HOST:PORT] [topics=PATTERN,...] [autoReconnect=true|false] "
          + "[reconnectDelayMs=N] [bufferCapacity=N] [max=N] [config=FILE] [logLevel=LEVEL] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...] [--dry-run]";
  private static final String HELP_TEXT = """
      RELAY subscriber

      Usage:
        relay subscribe connect=HOST:PORT [options]

      Prints one line per event: topic id timestamp source payload (payload decoded as UTF-8).

      Options:
        connect=HOST:PORT         Publisher address (default 127.0.0.1:9999)
        topics=PATTERN,...        Topic filters; '*' matches everything, 'a.*' matches a prefix
        autoReconnect=true|false  Retry after connection loss (default true)
        reconnectDelayMs=N        Delay between attempts, 0-3600000 (default 1000)
        bufferCapacity=N          Receive buffer; the oldest event is dropped when full (default 256)
        max=N                     Exit after N events (default 0, unlimited)
        config=FILE               YAML file with common/subscribe sections; CLI wins on conflicts
        logLevel=LEVEL            Root log level (TRACE|DEBUG|INFO|WARN|ERROR|OFF)
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OpenTelemetry resource attributes
        --dry-run                 Print the effective plan and exit
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private SubscribeCli() {}

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
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for subscribe CLI");
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
    return execute(plan);
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
      SubscriberConfig config = SubscriberConfig.fromMap(effective);
      long max = Numbers.parseRange("max", effective.get("max"), 0, Long.MAX_VALUE);
      return new Plan(config, max, telemetry);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid subscribe configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static ExitCode execute(Plan plan) {
    MetricsPort metrics = TelemetryConfigurator.openMetrics(plan.telemetry());
    ConnectionEventEmitter events = new LoggingConnectionEventEmitter(metrics);
    Subscriber subscriber = new Subscriber(
        plan.config(), new TcpConnector(), new MessagePackEventCodec(), metrics, events);
    Thread hook = new Thread(subscriber::stop, "relay-subscribe-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try (MDC.MDCCloseable ignored = Logs.withRole("subscriber-cli")) {
      subscriber.start();
      if (subscriber.state() == SubscriberState.CONNECTED) {
        log.info("Subscribed to {} with filters {}", plan.config().publisherEndpoint(),
            plan.config().topics().isEmpty() ? "<all>" : plan.config().topics());
      }
      return consume(subscriber, plan);
    } catch (BusException ex) {
      log.error("Subscriber failed: {}", ex.getMessage());
      return ExitCode.forBusError(ex.kind());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Subscriber interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in subscriber", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      subscriber.stop();
      removeHook(hook);
      closeMetrics(metrics);
    }
  }

  private static ExitCode consume(Subscriber subscriber, Plan plan) throws InterruptedException {
    long printed = 0;
    while (plan.max() == 0 || printed < plan.max()) {
      Optional<Event> next = subscriber.recv(RECV_POLL);
      if (next.isPresent()) {
        CliPrinter.println(format(next.get()));
        printed++;
        continue;
      }
      SubscriberState state = subscriber.state();
      if (state == SubscriberState.STOPPED) {
        break;
      }
      if (state == SubscriberState.DISCONNECTED && !plan.config().autoReconnect()) {
        log.error("Connection to {} lost and autoReconnect is disabled",
            plan.config().publisherEndpoint());
        return ExitCode.IO_ERROR;
      }
    }
    log.info("Printed {} event(s)", printed);
    return ExitCode.SUCCESS;
  }

  static String format(Event event) {
    return event.topic() + ' ' + Long.toUnsignedString(event.id()) + ' ' + event.timestamp() + ' '
        + event.source() + ' ' + new String(event.payload(), StandardCharsets.UTF_8);
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; leaving shutdown hook registered");
    }
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
    SubscriberConfig config = plan.config();
    CliPrinter.printLines(
        "Subscribe dry-run: no connection will be opened.",
        " Publisher        : " + config.publisherEndpoint(),
        " Topics           : " + (config.topics().isEmpty() ? "<all>" : String.join(",", config.topics())),
        " Auto reconnect   : " + config.autoReconnect(),
        " Reconnect delay  : " + config.reconnectDelayMillis() + " ms",
        " Buffer capacity  : " + config.bufferCapacity(),
        " Max events       : " + (plan.max() == 0 ? "unlimited" : Long.toString(plan.max())),
        " Metrics exporter : " + plan.telemetry().exporter(),
        " Re-run without --dry-run to start receiving.");
  }

  private record Plan(SubscriberConfig config, long max, TelemetrySettings telemetry) {}
}
