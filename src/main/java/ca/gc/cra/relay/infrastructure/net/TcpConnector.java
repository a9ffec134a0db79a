package ca.gc.cra.relay.infrastructure.net;

import ca.gc.cra.relay.application.port.TransportConnector;
import ca.gc.cra.relay.domain.net.Endpoint;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;

/**
 * Socket-backed {@link TransportConnector}. Connects without a timeout; Nagle is disabled so small frames are
 * not delayed.
 *
 * @since 0.1.0
 */
public final class TcpConnector implements TransportConnector {
  private static final int READ_BUFFER_BYTES = 64 * 1024;

  @Override
  public Connection connect(Endpoint endpoint) throws IOException {
    Socket socket = new Socket();
    try {
      socket.connect(endpoint.toSocketAddress());
      socket.setTcpNoDelay(true);
      socket.setKeepAlive(true);
      return new SocketConnection(socket, endpoint.toString());
    } catch (IOException ex) {
      closeQuietly(socket, ex);
      throw ex;
    }
  }

  private static void closeQuietly(Socket socket, IOException primary) {
    try {
      socket.close();
    } catch (IOException closeEx) {
      primary.addSuppressed(closeEx);
    }
  }

  private static final class SocketConnection implements Connection {
    private final Socket socket;
    private final InputStream input;
    private final String peer;

    SocketConnection(Socket socket, String peer) throws IOException {
      this.socket = socket;
      this.input = new BufferedInputStream(socket.getInputStream(), READ_BUFFER_BYTES);
      this.peer = peer;
    }

    @Override
    public InputStream input() {
      return input;
    }

    @Override
    public String peer() {
      return peer;
    }

    @Override
    public void close() throws IOException {
      socket.close();
    }
  }
}
