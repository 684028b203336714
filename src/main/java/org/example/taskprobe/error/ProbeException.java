package org.example.taskprobe.error;

/**
 * Base type of every failure the probe reports to the monitoring collector.
 *
 * <p>All subclasses are unchecked. They propagate unchanged to {@code ProbeRunner}, which is the
 * only place that catches them and turns them into an error document.
 */
public abstract class ProbeException extends RuntimeException {

  protected ProbeException(String message) {
    super(message);
  }

  protected ProbeException(String message, Throwable cause) {
    super(message, cause);
  }
}
