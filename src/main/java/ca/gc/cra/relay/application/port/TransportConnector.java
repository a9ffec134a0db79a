package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.net.Endpoint;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * <strong>What:</strong> Outbound transport used by subscribers to reach a publisher.
 * <p><strong>Why:</strong> Lets the reconnect state machine run against in-memory streams in tests and against
 * TCP sockets in production.</p>
 * <p><strong>Thread-safety:</strong> {@link #connect(Endpoint)} may be called from the subscriber supervisor
 * thread; {@link Connection#close()} may be called concurrently from {@code stop()}.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.relay.infrastructure.net.TcpConnector
 */
public interface TransportConnector {
  /**
   * Opens a connection. Blocks until connected or failed; no timeout is imposed here.
   *
   * @param endpoint target endpoint
   * @return open connection
   * @throws IOException if the connection cannot be established
   */
  Connection connect(Endpoint endpoint) throws IOException;

  /** One open inbound byte stream. Closing it must unblock a reader parked in {@link #input()}. */
  interface Connection extends Closeable {
    /**
     * Returns the inbound stream carrying frames from the publisher.
     *
     * @return input stream; owned by this connection
     */
    InputStream input();

    /**
     * Describes the remote peer for logs.
     *
     * @return printable peer description
     */
    String peer();
  }
}
