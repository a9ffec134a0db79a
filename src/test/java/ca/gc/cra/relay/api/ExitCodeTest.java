package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.relay.domain.bus.BusErrorKind;
import org.junit.jupiter.api.Test;

class ExitCodeTest {
  @Test
  void mapsBusErrorsToExitCodes() {
    assertEquals(ExitCode.IO_ERROR, ExitCode.forBusError(BusErrorKind.CONNECTION_FAILED));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forBusError(BusErrorKind.IO));
    assertEquals(ExitCode.INVALID_ARGS, ExitCode.forBusError(BusErrorKind.INVALID_ADDRESS));
    assertEquals(ExitCode.INVALID_ARGS, ExitCode.forBusError(BusErrorKind.INVALID_TOPIC));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forBusError(BusErrorKind.SERIALIZATION));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forBusError(null));
  }

  @Test
  void codesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
