package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandPrintsOverview() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: relay"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"broadcast"}));
  }

  @Test
  void leadingHelpIsForwardedToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help", "subscribe"}));
    assertTrue(buffer.toString().contains("RELAY subscriber"));
  }

  @Test
  void dispatchesCaseInsensitively() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"PUBLISH", "--dry-run"}));
    assertTrue(buffer.toString().contains("Publish dry-run"));
  }
}
