package org.example.taskprobe.error;

/**
 * A call to a remote collaborator failed.
 *
 * <p>Distinct from a clean "not found" answer, which collaborators report as an empty result.
 * Always fatal.
 */
public class TransportException extends ProbeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
