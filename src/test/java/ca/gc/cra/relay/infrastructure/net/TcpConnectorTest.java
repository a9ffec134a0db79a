package ca.gc.cra.relay.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.relay.application.port.TransportConnector;
import ca.gc.cra.relay.domain.net.Endpoint;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import org.junit.jupiter.api.Test;

class TcpConnectorTest {

  @Test
  void connectsAndStreamsBytes() throws Exception {
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Endpoint endpoint = new Endpoint("127.0.0.1", server.getLocalPort());
      try (TransportConnector.Connection connection = new TcpConnector().connect(endpoint);
          Socket accepted = server.accept()) {
        OutputStream out = accepted.getOutputStream();
        out.write(new byte[] {4, 5, 6});
        out.flush();

        byte[] received = connection.input().readNBytes(3);

        assertArrayEquals(new byte[] {4, 5, 6}, received);
        assertEquals(endpoint.toString(), connection.peer());
      }
    }
  }

  @Test
  void refusedConnectionSurfacesIoException() throws IOException {
    int port;
    try (ServerSocket reserved = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = reserved.getLocalPort();
    }

    assertThrows(IOException.class, () -> new TcpConnector().connect(new Endpoint("127.0.0.1", port)));
  }
}
