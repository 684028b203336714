package org.example.taskprobe.error;

/** The scheduled task identity resolved to more than one scheduler entry. */
public class MultipleMatchException extends ProbeException {

  public MultipleMatchException(String identity, int matches) {
    super("Task identity '" + identity + "' matches " + matches + " scheduled tasks, expected 1");
  }
}
