package ca.gc.cra.relay.domain.net;

import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.validation.Net;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated TCP endpoint ({@code host:port}) used for publisher binds and subscriber
 * connects.
 * <p><strong>Why:</strong> Parses address text once so sockets never see malformed hosts or ports.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param host hostname, IPv4 literal, or IPv6 literal without brackets
 * @param port TCP port; {@code 0} only for bind endpoints
 * @since 0.1.0
 */
public record Endpoint(String host, int port) {
  /** Optional scheme prefix accepted on address strings. */
  public static final String TCP_SCHEME = "tcp://";

  public Endpoint {
    Objects.requireNonNull(host, "host");
    if (host.isEmpty()) {
      throw new IllegalArgumentException("host must not be empty");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 0 and 65535 (was " + port + ")");
    }
  }

  /**
   * Parses an address string, stripping an optional {@code tcp://} prefix.
   *
   * @param raw address text such as {@code 127.0.0.1:9999}, {@code tcp://host:80}, or {@code [::1]:0}
   * @param allowEphemeralPort whether port {@code 0} is accepted (bind addresses only)
   * @return parsed endpoint
   * @throws BusException {@code INVALID_ADDRESS} when the text is not a valid {@code host:port}
   */
  public static Endpoint parse(String raw, boolean allowEphemeralPort) throws BusException {
    try {
      return of(raw, allowEphemeralPort);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw BusException.invalidAddress(raw + " (" + ex.getMessage() + ")", ex);
    }
  }

  /**
   * Unchecked variant of {@link #parse(String, boolean)} for configuration validation.
   *
   * @param raw address text
   * @param allowEphemeralPort whether port {@code 0} is accepted
   * @return parsed endpoint
   * @throws IllegalArgumentException when the text is not a valid {@code host:port}
   * @throws NullPointerException when {@code raw} is {@code null}
   */
  public static Endpoint of(String raw, boolean allowEphemeralPort) {
    Objects.requireNonNull(raw, "address");
    String normalized = Net.validateHostPort(stripScheme(raw.trim()), allowEphemeralPort);
    int colon = normalized.lastIndexOf(':');
    String host = normalized.substring(0, colon);
    if (host.startsWith("[")) {
      host = host.substring(1, host.length() - 1);
    }
    return new Endpoint(host, Integer.parseInt(normalized.substring(colon + 1)));
  }

  /**
   * Builds an endpoint from a socket address, such as the one a server socket actually bound.
   *
   * @param address resolved or unresolved socket address
   * @return endpoint carrying the literal host when resolved
   */
  public static Endpoint of(InetSocketAddress address) {
    Objects.requireNonNull(address, "address");
    String host = address.getAddress() != null
        ? address.getAddress().getHostAddress()
        : address.getHostString();
    int zone = host.indexOf('%');
    if (zone >= 0) {
      host = host.substring(0, zone);
    }
    return new Endpoint(host, address.getPort());
  }

  /**
   * Strips a leading {@code tcp://} scheme when present.
   *
   * @param raw address text
   * @return text without the scheme
   */
  public static String stripScheme(String raw) {
    if (raw != null && raw.regionMatches(true, 0, TCP_SCHEME, 0, TCP_SCHEME.length())) {
      return raw.substring(TCP_SCHEME.length());
    }
    return raw;
  }

  /**
   * Returns an unresolved-if-needed socket address for bind or connect calls.
   *
   * @return socket address; name resolution happens here for hostnames
   */
  public InetSocketAddress toSocketAddress() {
    return new InetSocketAddress(host, port);
  }

  /**
   * Indicates whether the host is an IPv6 literal.
   *
   * @return {@code true} when the host contains a colon
   */
  public boolean isIpv6() {
    return host.indexOf(':') >= 0;
  }

  @Override
  public String toString() {
    return (isIpv6() ? '[' + host + ']' : host) + ':' + port;
  }
}
