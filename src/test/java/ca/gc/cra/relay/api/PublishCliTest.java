package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class PublishCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(PublishCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsEffectivePlan() {
    ExitCode code = PublishCli.run(new String[] {
        "bind=tcp://127.0.0.1:7100", "topic=orders.created", "channelCapacity=8", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Bind address     : 127.0.0.1:7100"), out);
    assertTrue(out.contains("Topic            : orders.created"), out);
    assertTrue(out.contains("Channel capacity : 8"), out);
    assertTrue(out.contains("Max connections  : 100"), out);
  }

  @Test
  void yamlSectionFillsGapsAndCliWins() throws Exception {
    Path yaml = tempDir.resolve("relay.yaml");
    Files.writeString(yaml, String.join("\n",
        "publish:",
        "  topic: from.yaml",
        "  maxConnections: 7",
        ""));

    ExitCode code = PublishCli.run(new String[] {
        "config=" + yaml, "maxConnections=3", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Topic            : from.yaml"), out);
    assertTrue(out.contains("Max connections  : 3"), out);
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = PublishCli.run(new String[] {
        "config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void invalidValuesAreRejectedWithUsage() {
    ExitCode code = PublishCli.run(new String[] {"channelCapacity=0", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: relay publish"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Invalid publish configuration")));
  }

  @Test
  void invalidTopicIsRejectedBeforeBinding() {
    ExitCode code = PublishCli.run(new String[] {"topic=has space", "bind=127.0.0.1:0"},
        new ByteArrayInputStream("line\n".getBytes(StandardCharsets.UTF_8)));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void unknownFlagIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, PublishCli.run(new String[] {"--loud"}));
  }

  @Test
  void publishesStdinUntilEof() {
    ByteArrayInputStream stdin =
        new ByteArrayInputStream("first\nsecond\n".getBytes(StandardCharsets.UTF_8));

    ExitCode code = PublishCli.run(new String[] {"bind=127.0.0.1:0", "topic=lines"}, stdin);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("after 2 event(s)")));
  }
}
