package org.example.taskprobe.error;

/** Log content does not parse as the expected event XML format. */
public class MalformedLogException extends ProbeException {

  public MalformedLogException(String message) {
    super(message);
  }

  public MalformedLogException(String message, Throwable cause) {
    super(message, cause);
  }
}
