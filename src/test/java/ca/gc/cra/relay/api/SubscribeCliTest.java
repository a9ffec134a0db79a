package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.bus.EventFactory;
import ca.gc.cra.relay.application.bus.Publisher;
import ca.gc.cra.relay.config.PublisherConfig;
import ca.gc.cra.relay.domain.event.Event;
import ca.gc.cra.relay.testutil.Await;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SubscribeCliTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsEffectivePlan() {
    ExitCode code = SubscribeCli.run(new String[] {
        "connect=localhost:7100", "topics=orders.*, billing.paid", "autoReconnect=off", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Publisher        : localhost:7100"), out);
    assertTrue(out.contains("Topics           : orders.*,billing.paid"), out);
    assertTrue(out.contains("Auto reconnect   : false"), out);
    assertTrue(out.contains("Max events       : unlimited"), out);
  }

  @Test
  void malformedTopicPatternIsInvalidArgs() {
    ExitCode code = SubscribeCli.run(new String[] {"topics=orders.*.x", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: relay subscribe"));
  }

  @Test
  void unreachablePublisherWithoutReconnectIsIoError() throws Exception {
    int port;
    try (ServerSocket reserved = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = reserved.getLocalPort();
    }

    ExitCode code = SubscribeCli.run(new String[] {
        "connect=127.0.0.1:" + port, "autoReconnect=false"});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void printsReceivedEventsUntilMax() throws Exception {
    Publisher publisher = new Publisher(PublisherConfig.defaults());
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      publisher.start();
      String address = publisher.boundAddress().toString();
      Future<ExitCode> run = pool.submit(() -> SubscribeCli.run(new String[] {
          "connect=" + address, "topics=orders.*", "max=2", "autoReconnect=false"}));
      Await.until("subscriber connected", () -> publisher.connectionCount() == 1);

      EventFactory factory = new EventFactory();
      Event first = factory.create("orders.created", "checkout", "A-1".getBytes(StandardCharsets.UTF_8));
      publisher.publish(first);
      publisher.publish(factory.create("billing.paid", "ledger", null));
      publisher.publish(factory.create("orders.shipped", "warehouse", "A-1".getBytes(StandardCharsets.UTF_8)));

      assertEquals(ExitCode.SUCCESS, run.get(10, TimeUnit.SECONDS));
      String[] lines = buffer.toString().split("\\R");
      assertEquals(2, lines.length);
      assertEquals(SubscribeCli.format(first), lines[0]);
      assertTrue(lines[1].startsWith("orders.shipped "), lines[1]);
      assertTrue(lines[1].endsWith(" warehouse A-1"), lines[1]);
    } finally {
      pool.shutdownNow();
      publisher.stop();
    }
  }

  @Test
  void formatUsesSpaceSeparatedFields() throws Exception {
    Event event = Event.of("orders.created", 42L, 1_700_000_000_000L, "checkout",
        "hello world".getBytes(StandardCharsets.UTF_8));

    assertEquals("orders.created 42 1700000000000 checkout hello world", SubscribeCli.format(event));
  }

  @Test
  void formatPrintsIdAsUnsigned() throws Exception {
    Event event = Event.of("orders.created", -1L, 1_700_000_000_000L, "checkout", null);

    assertEquals("orders.created 18446744073709551615 1700000000000 checkout ", SubscribeCli.format(event));
  }
}
