package ca.gc.cra.relay.infrastructure.net;

import ca.gc.cra.relay.domain.bus.BusException;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * <strong>What:</strong> Delimits encoded events on a byte stream with a 4-byte big-endian length header.
 * <p><strong>Why:</strong> TCP has no message boundaries; the header lets the reader pull exactly one event at a
 * time. The codec knows nothing about topics or event fields.</p>
 * <p><strong>Thread-safety:</strong> Immutable; callers serialize access to each stream.</p>
 *
 * @since 0.1.0
 */
public final class FrameCodec {
  /** Size of the length header in bytes. */
  public static final int HEADER_BYTES = 4;
  /** Default upper bound on a frame body (8 MiB). */
  public static final int DEFAULT_MAX_FRAME_BYTES = 8 * 1024 * 1024;

  private final int maxFrameBytes;

  /** Creates a codec with {@link #DEFAULT_MAX_FRAME_BYTES}. */
  public FrameCodec() {
    this(DEFAULT_MAX_FRAME_BYTES);
  }

  /**
   * Creates a codec with a custom body limit.
   *
   * @param maxFrameBytes largest accepted body length; must be positive
   */
  public FrameCodec(int maxFrameBytes) {
    if (maxFrameBytes <= 0) {
      throw new IllegalArgumentException("maxFrameBytes must be positive");
    }
    this.maxFrameBytes = maxFrameBytes;
  }

  /**
   * Returns the largest accepted body length.
   *
   * @return byte limit
   */
  public int maxFrameBytes() {
    return maxFrameBytes;
  }

  /**
   * Builds a complete frame (header plus body) so a publisher can encode once and write the same bytes to every
   * connection.
   *
   * @param body encoded event bytes
   * @return framed bytes
   * @throws BusException {@code SERIALIZATION} when the body is empty or larger than the limit
   */
  public byte[] encode(byte[] body) throws BusException {
    checkBodyLength(body == null ? 0 : body.length);
    byte[] frame = new byte[HEADER_BYTES + body.length];
    int len = body.length;
    frame[0] = (byte) (len >>> 24);
    frame[1] = (byte) (len >>> 16);
    frame[2] = (byte) (len >>> 8);
    frame[3] = (byte) len;
    System.arraycopy(body, 0, frame, HEADER_BYTES, len);
    return frame;
  }

  /**
   * Writes one frame to {@code out}. Does not flush.
   *
   * @param out destination stream
   * @param body encoded event bytes
   * @throws IOException if the write fails
   * @throws BusException {@code SERIALIZATION} when the body length is out of range
   */
  public void writeFrame(OutputStream out, byte[] body) throws IOException, BusException {
    checkBodyLength(body == null ? 0 : body.length);
    DataOutputStream data = new DataOutputStream(out);
    data.writeInt(body.length);
    data.write(body);
  }

  /**
   * Reads one frame body.
   *
   * @param in source stream, ideally buffered
   * @return body bytes, or {@code null} when the stream ended cleanly on a frame boundary
   * @throws EOFException if the stream ends inside a frame
   * @throws IOException if the read fails
   * @throws BusException {@code DESERIALIZATION} when the header announces an invalid length
   */
  public byte[] readFrame(InputStream in) throws IOException, BusException {
    int b0 = in.read();
    if (b0 < 0) {
      return null;
    }
    DataInputStream data = new DataInputStream(in);
    int rest = (data.readUnsignedByte() << 16) | (data.readUnsignedByte() << 8) | data.readUnsignedByte();
    long length = ((long) b0 << 24) | rest;
    if (length <= 0 || length > maxFrameBytes) {
      throw BusException.deserialization("invalid frame length " + length + " (max " + maxFrameBytes + ")");
    }
    byte[] body = new byte[(int) length];
    data.readFully(body);
    return body;
  }

  private void checkBodyLength(int length) throws BusException {
    if (length <= 0) {
      throw BusException.serialization("frame body must not be empty");
    }
    if (length > maxFrameBytes) {
      throw BusException.serialization("frame body of " + length + " bytes exceeds " + maxFrameBytes);
    }
  }
}
