package ca.gc.cra.relay.application.bus;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One accepted subscriber connection on the publisher side: its socket and its bounded outbound queue of
 * pre-framed events.
 *
 * <p>{@link #offer} is called from publishing threads; everything else runs on the link's writer thread, except
 * {@link #close()}, which any thread may call.</p>
 */
final class SubscriberLink {
  private static final Logger log = LoggerFactory.getLogger(SubscriberLink.class);
  private static final int WRITE_BUFFER_BYTES = 64 * 1024;

  private final long id;
  private final String peer;
  private final Socket socket;
  private final OutputStream out;
  private final BlockingQueue<byte[]> queue;
  private final int capacity;
  private final AtomicBoolean closed = new AtomicBoolean();

  SubscriberLink(long id, Socket socket, String peer, int capacity) throws IOException {
    this.id = id;
    this.peer = peer;
    this.socket = socket;
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.out = new BufferedOutputStream(socket.getOutputStream(), WRITE_BUFFER_BYTES);
  }

  long id() {
    return id;
  }

  String peer() {
    return peer;
  }

  int capacity() {
    return capacity;
  }

  int depth() {
    return queue.size();
  }

  boolean isClosed() {
    return closed.get();
  }

  /** Non-blocking enqueue; {@code false} when the queue is full or the link is closed. */
  boolean offer(byte[] frame) {
    return !closed.get() && queue.offer(frame);
  }

  byte[] poll(long timeoutMillis) throws InterruptedException {
    return queue.poll(timeoutMillis, TimeUnit.MILLISECONDS);
  }

  byte[] pollNow() {
    return queue.poll();
  }

  void write(byte[] frame) throws IOException {
    out.write(frame);
  }

  void flush() throws IOException {
    out.flush();
  }

  /** Idempotent; closing the socket unblocks an in-flight write. */
  void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    queue.clear();
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing subscriber connection {} ({})", id, peer, ex);
    }
  }
}
