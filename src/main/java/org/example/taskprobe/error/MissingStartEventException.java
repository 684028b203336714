package org.example.taskprobe.error;

/** The primary event log holds no start event for the job, so there is no run to correlate. */
public class MissingStartEventException extends ProbeException {

  public MissingStartEventException(String source, int startEventId) {
    super("No start event (id " + startEventId + ") from source '" + source + "' in event log");
  }
}
