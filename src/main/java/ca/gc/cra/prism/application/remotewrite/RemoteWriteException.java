package ca.gc.cra.prism.application.remotewrite;

import java.util.Objects;

/**
 * <strong>What:</strong> Base checked exception for every failure of a remote-write delivery call.
 * <p><strong>Why:</strong> Callers own retry policy, so each failure carries an {@link ErrorKind} they can branch on.</p>
 * <p><strong>Role:</strong> Root of the shipper's error taxonomy.</p>
 *
 * @since 0.1.0
 */
public abstract class RemoteWriteException extends Exception {
  private final ErrorKind kind;

  protected RemoteWriteException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected RemoteWriteException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return error kind; never {@code null}
   */
  public ErrorKind kind() {
    return kind;
  }
}
