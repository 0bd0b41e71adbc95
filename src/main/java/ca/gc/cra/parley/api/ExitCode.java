package ca.gc.cra.parley.api;

/**
 * <strong>What:</strong> Process exit codes shared by PARLEY command-line tools.
 * <p><strong>Why:</strong> CI jobs key off the status: {@link #GATE_FAILED} means the replayed
 * conversation breached a latency target or quality threshold, the other failures mean the gate
 * could not be evaluated at all.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since PARLEY 0.1.0
 */
public enum ExitCode {
  /** Successful execution; any gate evaluated passed. */
  SUCCESS(0),
  /** A latency target or quality threshold failed. */
  GATE_FAILED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration or rule files were missing or malformed. */
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
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
