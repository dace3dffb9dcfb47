package ca.gc.cra.prism.api;

/**
 * <strong>What:</strong> Process exit codes returned by PRISM commands.
 * <p><strong>Why:</strong> Lets schedulers and scripts tell bad input from an unreachable or rejecting endpoint.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every batch was delivered. */
  SUCCESS(0),
  /** Command-line arguments, configuration values, or input records were invalid. */
  INVALID_ARGS(2),
  /** A configuration or input file could not be read. */
  IO_ERROR(3),
  /** TLS material or the endpoint URL was unusable at connect time. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, including payload encoding failures. */
  RUNTIME_FAILURE(5),
  /** The endpoint could not be resolved or reached, or it rejected a batch. */
  DELIVERY_FAILED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
