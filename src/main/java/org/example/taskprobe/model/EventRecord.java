package org.example.taskprobe.model;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * A single entry of a job event log.
 *
 * <p>Records are produced once by {@link org.example.taskprobe.service.EventLogParser} and are
 * never mutated afterwards. Within one log, {@link #recordId} grows monotonically, so the most
 * recent record among a set of matches is the one with the highest id.
 *
 * <h2>Field semantics</h2>
 *
 * <ul>
 *   <li>{@link #eventId} — kind of event; {@code 200} marks a job start, {@code 201} a job end.
 *   <li>{@link #source} — writer of the event; start events carry the job's leaf name.
 *   <li>{@link #correlationId} — links the start, end and exception events of one run.
 *   <li>{@link #errorCode}, {@link #message}, {@link #dataObject} — optional payload; {@code null}
 *       when the log entry omits them.
 * </ul>
 */
public final class EventRecord {
  /** Position of the record in its log; higher is newer. */
  public final long recordId;

  /** Event kind identifier. */
  public final int eventId;

  /** Name of the component that wrote the event. */
  public final String source;

  /** Run correlation token; empty string when absent. */
  public final String correlationId;

  /** Time the event was written, or {@code null}. */
  public final LocalDateTime timeCreated;

  /** Error code payload, or {@code null}. */
  public final Integer errorCode;

  /** Message payload, or {@code null}. */
  public final String message;

  /** Serialized data object payload (typically a stack trace), or {@code null}. */
  public final String dataObject;

  public EventRecord(
      long recordId,
      int eventId,
      String source,
      String correlationId,
      LocalDateTime timeCreated,
      Integer errorCode,
      String message,
      String dataObject) {
    this.recordId = recordId;
    this.eventId = eventId;
    this.source = source == null ? "" : source;
    this.correlationId = correlationId == null ? "" : correlationId;
    this.timeCreated = timeCreated;
    this.errorCode = errorCode;
    this.message = message;
    this.dataObject = dataObject;
  }

  public Optional<Integer> errorCode() {
    return Optional.ofNullable(errorCode);
  }

  public Optional<String> message() {
    return Optional.ofNullable(message);
  }

  public Optional<String> dataObject() {
    return Optional.ofNullable(dataObject);
  }

  @Override
  public String toString() {
    return "EventRecord{recordId="
        + recordId
        + ", eventId="
        + eventId
        + ", source="
        + source
        + ", correlationId="
        + correlationId
        + "}";
  }
}
