package org.example.taskprobe.error;

/** A required value is missing, blank or outside the accepted set. Never retried. */
public class InputValidationException extends ProbeException {

  public InputValidationException(String message) {
    super(message);
  }

  public InputValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
