package ca.gc.cra.relay.domain.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.bus.BusErrorKind;
import ca.gc.cra.relay.domain.bus.BusException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import org.junit.jupiter.api.Test;

class EndpointTest {

  @Test
  void parsesHostPort() throws BusException {
    Endpoint endpoint = Endpoint.parse("127.0.0.1:9999", false);

    assertEquals("127.0.0.1", endpoint.host());
    assertEquals(9999, endpoint.port());
    assertEquals("127.0.0.1:9999", endpoint.toString());
  }

  @Test
  void stripsTcpScheme() throws BusException {
    assertEquals(new Endpoint("localhost", 7000), Endpoint.parse("tcp://localhost:7000", false));
    assertEquals(new Endpoint("localhost", 7000), Endpoint.parse("TCP://localhost:7000", false));
  }

  @Test
  void bracketedIpv6RoundTripsThroughToString() throws BusException {
    Endpoint endpoint = Endpoint.parse("[::1]:7000", false);

    assertTrue(endpoint.isIpv6());
    assertEquals("::1", endpoint.host());
    assertEquals("[::1]:7000", endpoint.toString());
  }

  @Test
  void malformedAddressIsInvalidAddress() {
    for (String raw : new String[] {"not-an-address", "localhost:", ":80", "host:99999", ""}) {
      BusException ex = assertThrows(BusException.class, () -> Endpoint.parse(raw, false), raw);
      assertEquals(BusErrorKind.INVALID_ADDRESS, ex.kind());
    }
  }

  @Test
  void nullAddressIsInvalidAddress() {
    BusException ex = assertThrows(BusException.class, () -> Endpoint.parse(null, true));
    assertEquals(BusErrorKind.INVALID_ADDRESS, ex.kind());
  }

  @Test
  void portZeroNeedsEphemeralPermission() throws BusException {
    assertThrows(BusException.class, () -> Endpoint.parse("127.0.0.1:0", false));
    assertEquals(0, Endpoint.parse("127.0.0.1:0", true).port());
  }

  @Test
  void fromSocketAddressUsesLiteralHost() throws Exception {
    Endpoint endpoint = Endpoint.of(new InetSocketAddress(InetAddress.getByName("127.0.0.1"), 4242));

    assertEquals("127.0.0.1:4242", endpoint.toString());
    assertFalse(endpoint.isIpv6());
    assertEquals(4242, endpoint.toSocketAddress().getPort());
  }
}
