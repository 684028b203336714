package org.example.taskprobe.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import org.example.taskprobe.error.InputValidationException;
import org.example.taskprobe.error.MalformedLogException;
import org.example.taskprobe.error.MandatoryEvidenceMissingException;
import org.example.taskprobe.error.MissingStartEventException;
import org.example.taskprobe.model.EventRecord;
import org.example.taskprobe.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the result of the most recent job run from its event logs.
 *
 * <p>The correlator reads the primary event log once, at construction. The last run is the start
 * event ({@value #START_EVENT_ID}) with the highest record id among events whose source is the
 * namespace leaf; its correlation id is then looked up among end events ({@value #END_EVENT_ID}).
 * That yields a <em>preliminary</em> verdict. Confirming or refuting it takes a second step:
 *
 * <ul>
 *   <li>after a preliminary success the caller may confirm it ({@link #confirmLastRunResult()})
 *       when no inner exception log exists, or import that log when it does;
 *   <li>after a preliminary failure the inner exception log must be imported ({@link
 *       #importInnerException(List)}); there is no way to confirm a failure without it.
 * </ul>
 *
 * <p>The name of the inner exception log is derived from the namespace and the timestamp embedded
 * in the last correlation id ({@link #getInnerExceptionLogFilename()}).
 *
 * <p>Result codes returned by {@link #getLastRunResult()}: {@value #SUCCESS} for a confirmed
 * success, {@value #PRELIMINARY_SUCCESS} and {@value #PRELIMINARY_FAILURE} for unresolved
 * preliminary verdicts, {@value #NEVER_EVALUATED} when nothing was evaluated, and the error code
 * from the inner exception log for a failure.
 *
 * <p><b>Thread-safety:</b> not thread-safe; one instance serves one probe invocation.
 */
public class LogCorrelator {
  public static final int START_EVENT_ID = 200;
  public static final int END_EVENT_ID = 201;

  public static final int SUCCESS = 0;
  public static final int NEVER_EVALUATED = -1;
  public static final int PRELIMINARY_SUCCESS = -2;
  public static final int PRELIMINARY_FAILURE = -3;

  /** Failure code used when the decisive inner exception record carries no error code. */
  public static final int UNSPECIFIED_ERROR_CODE = 1;

  /** Separator between data object and message in the inferred stack trace. */
  public static final String STACK_TRACE_SEPARATOR = " -- ";

  private static final Logger log = LoggerFactory.getLogger(LogCorrelator.class);

  private final String namespace;
  private final String leaf;
  private final String parent;
  private final List<EventRecord> primaryEvents;

  /** {@code null} until an inner exception log is imported. */
  private List<EventRecord> secondaryEvents;

  private Verdict verdict = Verdict.UNINITIALIZED;
  private String lastCorrelationId;

  private int failureCode;
  private String inferredMessage;
  private String inferredStackTrace;
  private String secondaryFilename;

  /**
   * Creates a correlator for the job identified by {@code namespace}.
   *
   * @param namespace dotted job identifier, e.g. {@code com.example.job}; its last segment is the
   *     source name of start events
   * @param primaryLog full text of the primary event log
   * @throws InputValidationException if the namespace is blank or the log holds no events
   * @throws MalformedLogException if the log is not an event log
   */
  public LogCorrelator(String namespace, String primaryLog) {
    if (namespace == null || namespace.isBlank()) {
      throw new InputValidationException("Job namespace must not be empty");
    }
    this.namespace = namespace.trim();
    int dot = this.namespace.lastIndexOf('.');
    this.leaf = (dot < 0) ? this.namespace : this.namespace.substring(dot + 1);
    this.parent = (dot < 0) ? "" : this.namespace.substring(0, dot);
    if (leaf.isEmpty()) {
      throw new InputValidationException("Job namespace '" + namespace + "' ends with a dot");
    }

    List<EventRecord> parsed = EventLogParser.parse(primaryLog);
    if (parsed.isEmpty()) {
      throw new InputValidationException("Primary event log for '" + namespace + "' has no events");
    }
    this.primaryEvents = List.copyOf(parsed);
  }

  // ---------- State machine ----------

  /**
   * Runs one transition of the verdict state machine.
   *
   * <p>Idempotent as long as no new inner exception evidence arrives. Once the verdict is terminal
   * ({@link Verdict#CONFIRMED_SUCCESS} or {@link Verdict#FAILURE}) further calls do nothing.
   *
   * @return the verdict after the transition
   * @throws MissingStartEventException if the primary log has no start event for the job
   * @throws MandatoryEvidenceMissingException if a preliminary failure meets an imported inner
   *     exception log without records
   */
  public Verdict evaluate() {
    if (verdict.isTerminal()) {
      return verdict;
    }
    if (lastCorrelationId == null) {
      lastCorrelationId = locateLastStart().correlationId;
      log.debug("Last run of '{}' has correlation id {}", namespace, lastCorrelationId);
    }

    boolean ended =
        primaryEvents.stream()
            .anyMatch(e -> e.eventId == END_EVENT_ID && lastCorrelationId.equals(e.correlationId));

    // Gated on UNINITIALIZED: once failure handling has begun an end event must not win again.
    if (ended && verdict == Verdict.UNINITIALIZED) {
      transition(Verdict.PRELIMINARY_SUCCESS);
    } else if (secondaryEvents == null) {
      if (verdict == Verdict.UNINITIALIZED) {
        transition(Verdict.PRELIMINARY_FAILURE);
      }
    } else {
      resolveFromInnerException();
    }
    return verdict;
  }

  private EventRecord locateLastStart() {
    EventRecord start =
        primaryEvents.stream()
            .filter(e -> e.eventId == START_EVENT_ID && leaf.equals(e.source))
            .max(Comparator.comparingLong((EventRecord e) -> e.recordId))
            .orElseThrow(() -> new MissingStartEventException(leaf, START_EVENT_ID));
    if (start.correlationId.isBlank()) {
      throw new MalformedLogException(
          "Start event " + start.recordId + " of '" + namespace + "' has no correlation id");
    }
    return start;
  }

  private void resolveFromInnerException() {
    List<EventRecord> newestFirst = new ArrayList<>(secondaryEvents);
    newestFirst.sort(Comparator.comparingLong((EventRecord e) -> e.recordId).reversed());

    if (newestFirst.isEmpty()) {
      if (verdict == Verdict.PRELIMINARY_SUCCESS) {
        transition(Verdict.CONFIRMED_SUCCESS);
        return;
      }
      throw new MandatoryEvidenceMissingException(
          "Inner exception log "
              + getInnerExceptionLogFilename()
              + " holds no events; the failure of '"
              + namespace
              + "' cannot be diagnosed");
    }

    EventRecord decisive;
    String stackTrace;
    if (newestFirst.size() == 1) {
      decisive = newestFirst.get(0);
      stackTrace = null;
    } else {
      // newest entry is the trace of the exception reported by the one before it
      decisive = newestFirst.get(1);
      stackTrace = stackTraceOf(newestFirst.get(0));
    }

    failureCode = decisive.errorCode().orElse(UNSPECIFIED_ERROR_CODE);
    inferredMessage = decisive.message;
    inferredStackTrace = stackTrace;
    secondaryFilename = getInnerExceptionLogFilename();
    transition(Verdict.FAILURE);
    log.info(
        "Last run of '{}' failed with code {}: {}",
        namespace,
        failureCode,
        inferredMessage == null ? "(no message)" : inferredMessage);
  }

  private static String stackTraceOf(EventRecord record) {
    StringJoiner joiner = new StringJoiner(STACK_TRACE_SEPARATOR);
    record.dataObject().filter(s -> !s.isBlank()).ifPresent(joiner::add);
    record.message().filter(s -> !s.isBlank()).ifPresent(joiner::add);
    return joiner.length() == 0 ? null : joiner.toString();
  }

  private void transition(Verdict next) {
    log.debug("Verdict for '{}': {} -> {}", namespace, verdict, next);
    verdict = next;
  }

  // ---------- Operations ----------

  /**
   * Imports the inner exception log of the last run and re-evaluates.
   *
   * <p>The raw lines are repaired by {@link ExceptionContentImporter} first. If the correlator has
   * not been evaluated yet, the preliminary verdict is established before the evidence is used.
   *
   * @param rawLines physical lines of the inner exception log
   * @return the verdict after re-evaluation
   * @throws IllegalStateException if an inner exception log was already imported
   * @throws InputValidationException if {@code rawLines} is empty
   * @throws MalformedLogException if the repaired text is not an event log
   */
  public Verdict importInnerException(List<String> rawLines) {
    if (secondaryEvents != null) {
      throw new IllegalStateException("Inner exception log already imported for '" + namespace + "'");
    }
    List<EventRecord> parsed = EventLogParser.parse(ExceptionContentImporter.repair(rawLines));
    if (verdict == Verdict.UNINITIALIZED) {
      evaluate();
    }
    secondaryEvents = List.copyOf(parsed);
    log.debug("Imported {} inner exception record(s) for '{}'", parsed.size(), namespace);
    return evaluate();
  }

  /**
   * Tells whether the inner exception log should be fetched before the result is final.
   *
   * <p>True for both preliminary verdicts: a sub-process may have logged an exception without
   * disturbing the start/end pair of a seemingly successful run.
   *
   * @return {@code true} if the verdict is preliminary and no inner exception log was imported
   */
  public boolean isInnerExceptionRequired() {
    return verdict.isPreliminary() && secondaryEvents == null;
  }

  /** Turns a preliminary success into a confirmed one. Does nothing in any other state. */
  public void confirmLastRunResult() {
    if (verdict == Verdict.PRELIMINARY_SUCCESS) {
      transition(Verdict.CONFIRMED_SUCCESS);
    }
  }

  /**
   * Returns the result code of the last run, evaluating lazily on first use.
   *
   * @return {@value #SUCCESS}, a negative sentinel, or the failure code
   */
  public int getLastRunResult() {
    if (verdict == Verdict.UNINITIALIZED) {
      evaluate();
    }
    switch (verdict) {
      case PRELIMINARY_SUCCESS:
        return PRELIMINARY_SUCCESS;
      case PRELIMINARY_FAILURE:
        return PRELIMINARY_FAILURE;
      case CONFIRMED_SUCCESS:
        return SUCCESS;
      case FAILURE:
        return failureCode;
      default:
        return NEVER_EVALUATED;
    }
  }

  /**
   * Derives the inner exception log name of the last run.
   *
   * <p>The correlation id has the form {@code <prefix>-<yyyyMMddHHmm>-<suffix>}; the file name is
   * {@code <namespace>.<yyyyMMdd>_<HHmm>.xml}.
   *
   * @return file name relative to the job's log directory
   * @throws IllegalStateException if no start event has been located yet
   * @throws MalformedLogException if the correlation id carries no timestamp token
   */
  public String getInnerExceptionLogFilename() {
    if (lastCorrelationId == null) {
      throw new IllegalStateException("Last run of '" + namespace + "' has not been located yet");
    }
    String[] fields = lastCorrelationId.split("-");
    if (fields.length < 2 || fields[1].length() < 12) {
      throw new MalformedLogException(
          "Correlation id '" + lastCorrelationId + "' has no 12-character timestamp field");
    }
    String token = fields[1];
    return namespace + "." + token.substring(0, 8) + "_" + token.substring(8, 12) + ".xml";
  }

  // ---------- Accessors ----------

  /**
   * Tells whether the last run counts as successful.
   *
   * @return {@code true} if {@link #getLastRunResult()} is {@value #SUCCESS}
   */
  public boolean isSuccess() {
    return getLastRunResult() == SUCCESS;
  }

  public Verdict getVerdict() {
    return verdict;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getLeaf() {
    return leaf;
  }

  public String getParent() {
    return parent;
  }

  public Optional<String> getLastCorrelationId() {
    return Optional.ofNullable(lastCorrelationId);
  }

  public List<EventRecord> getPrimaryEvents() {
    return primaryEvents;
  }

  public boolean hasInnerException() {
    return secondaryEvents != null;
  }

  /** Error code taken from the inner exception log; meaningful only after a failure. */
  public int getInnerExceptionCode() {
    return failureCode;
  }

  public Optional<String> getInnerExceptionMessage() {
    return Optional.ofNullable(inferredMessage);
  }

  public Optional<String> getInnerExceptionStackTrace() {
    return Optional.ofNullable(inferredStackTrace);
  }

  /** Name of the inner exception log the failure was read from, once a failure is resolved. */
  public Optional<String> getSecondaryFilename() {
    return Optional.ofNullable(secondaryFilename);
  }
}
