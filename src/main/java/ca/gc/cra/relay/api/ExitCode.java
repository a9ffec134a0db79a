package ca.gc.cra.relay.api;

import ca.gc.cra.relay.domain.bus.BusErrorKind;

/**
 * <strong>What:</strong> Process exit codes shared by the {@code relay} subcommands.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Socket or stream failure. */
  IO_ERROR(3),
  /** Configuration file was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps a bus failure category to the exit code a CLI should report for it.
   *
   * @param kind failure category; {@code null} maps to {@link #RUNTIME_FAILURE}
   * @return exit code
   */
  public static ExitCode forBusError(BusErrorKind kind) {
    if (kind == null) {
      return RUNTIME_FAILURE;
    }
    return switch (kind) {
      case IO, CONNECTION_FAILED, CHANNEL_CLOSED, TIMEOUT -> IO_ERROR;
      case INVALID_ADDRESS, INVALID_TOPIC -> INVALID_ARGS;
      default -> RUNTIME_FAILURE;
    };
  }
}
