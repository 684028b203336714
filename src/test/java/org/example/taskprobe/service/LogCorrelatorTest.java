package org.example.taskprobe.service;

import static org.example.taskprobe.service.EventLogs.end;
import static org.example.taskprobe.service.EventLogs.exception;
import static org.example.taskprobe.service.EventLogs.lines;
import static org.example.taskprobe.service.EventLogs.log;
import static org.example.taskprobe.service.EventLogs.start;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.example.taskprobe.error.InputValidationException;
import org.example.taskprobe.error.MalformedLogException;
import org.example.taskprobe.error.MandatoryEvidenceMissingException;
import org.example.taskprobe.error.MissingStartEventException;
import org.example.taskprobe.model.Verdict;
import org.junit.jupiter.api.*;

/**
 * Tests for the verdict state machine of {@link LogCorrelator}.
 *
 * <p>Primary logs use namespace {@code com.example.job}, so start events come from source
 * {@code job}. Correlation ids embed the timestamp token {@code 202401151030}.
 */
public class LogCorrelatorTest {

  private static final String NS = "com.example.job";
  private static final String RUN = "abc-202401151030-xyz";

  private static LogCorrelator unfinishedRun() {
    return new LogCorrelator(NS, log(start(1, "job", RUN)));
  }

  private static LogCorrelator finishedRun() {
    return new LogCorrelator(NS, log(start(1, "job", RUN), end(2, "job", RUN)));
  }

  // ---------- construction ----------

  @Test
  @DisplayName("Namespace is split into parent and leaf")
  void namespace_split() {
    LogCorrelator c = finishedRun();
    assertEquals("job", c.getLeaf());
    assertEquals("com.example", c.getParent());
    assertEquals(NS, c.getNamespace());
    assertEquals(Verdict.UNINITIALIZED, c.getVerdict());
  }

  @Test
  @DisplayName("Undotted namespace is its own leaf")
  void namespace_withoutDots() {
    LogCorrelator c = new LogCorrelator("job", log(start(1, "job", RUN)));
    assertEquals("job", c.getLeaf());
    assertEquals("", c.getParent());
  }

  @Test
  @DisplayName("Blank namespace and empty primary log are rejected")
  void construction_rejectsMissingInput() {
    assertThrows(InputValidationException.class, () -> new LogCorrelator(" ", log(start(1, "job", RUN))));
    assertThrows(InputValidationException.class, () -> new LogCorrelator(NS, log()));
    assertThrows(InputValidationException.class, () -> new LogCorrelator(NS, ""));
  }

  @Test
  @DisplayName("Non-XML primary log fails with MalformedLogException")
  void construction_rejectsMalformedLog() {
    assertThrows(MalformedLogException.class, () -> new LogCorrelator(NS, "not xml at all"));
  }

  // ---------- preliminary verdicts ----------

  @Test
  @DisplayName("Start without end: preliminary failure, inner exception required")
  void startWithoutEnd_isPreliminaryFailure() {
    LogCorrelator c = unfinishedRun();

    assertEquals(LogCorrelator.PRELIMINARY_FAILURE, c.getLastRunResult());
    assertEquals(Verdict.PRELIMINARY_FAILURE, c.getVerdict());
    assertTrue(c.isInnerExceptionRequired());
    assertEquals(RUN, c.getLastCorrelationId().orElseThrow());
  }

  @Test
  @DisplayName("Confirm does not resolve a preliminary failure")
  void confirm_isNoOpForFailure() {
    LogCorrelator c = unfinishedRun();
    c.evaluate();
    c.confirmLastRunResult();
    assertEquals(Verdict.PRELIMINARY_FAILURE, c.getVerdict());
    assertTrue(c.isInnerExceptionRequired());
  }

  @Test
  @DisplayName("Start/end pair: preliminary success, confirmed to 0, confirm is idempotent")
  void startAndEnd_confirmsToSuccess() {
    LogCorrelator c = finishedRun();

    assertEquals(Verdict.PRELIMINARY_SUCCESS, c.evaluate());
    assertEquals(LogCorrelator.PRELIMINARY_SUCCESS, c.getLastRunResult());
    assertTrue(c.isInnerExceptionRequired(), "a successful run may still have logged exceptions");

    c.confirmLastRunResult();
    assertEquals(Verdict.CONFIRMED_SUCCESS, c.getVerdict());
    assertEquals(LogCorrelator.SUCCESS, c.getLastRunResult());

    c.confirmLastRunResult();
    assertEquals(LogCorrelator.SUCCESS, c.getLastRunResult());
    assertFalse(c.isInnerExceptionRequired());
    assertTrue(c.isSuccess());
  }

  @Test
  @DisplayName("Evaluate is idempotent without new evidence")
  void evaluate_isIdempotent() {
    LogCorrelator c = unfinishedRun();
    assertEquals(Verdict.PRELIMINARY_FAILURE, c.evaluate());
    assertEquals(Verdict.PRELIMINARY_FAILURE, c.evaluate());

    LogCorrelator s = finishedRun();
    assertEquals(Verdict.PRELIMINARY_SUCCESS, s.evaluate());
    assertEquals(Verdict.PRELIMINARY_SUCCESS, s.evaluate());
  }

  @Test
  @DisplayName("Only the most recent start event counts")
  void latestStartWins() {
    String older = "abc-202401141030-old";
    LogCorrelator c =
        new LogCorrelator(
            NS, log(start(1, "job", older), end(2, "job", older), start(3, "job", RUN)));

    assertEquals(LogCorrelator.PRELIMINARY_FAILURE, c.getLastRunResult());
    assertEquals(RUN, c.getLastCorrelationId().orElseThrow());
  }

  @Test
  @DisplayName("End events of other runs and start events of other sources are ignored")
  void foreignEventsIgnored() {
    String other = "abc-202401151100-zzz";
    LogCorrelator c =
        new LogCorrelator(
            NS,
            log(start(1, "job", RUN), start(5, "otherjob", other), end(6, "job", other)));

    assertEquals(LogCorrelator.PRELIMINARY_FAILURE, c.getLastRunResult());
    assertEquals(RUN, c.getLastCorrelationId().orElseThrow());
  }

  @Test
  @DisplayName("No start event for the leaf source fails evaluation")
  void noStartEvent() {
    LogCorrelator c = new LogCorrelator(NS, log(start(1, "other", RUN), end(2, "job", RUN)));
    assertThrows(MissingStartEventException.class, c::evaluate);
    assertThrows(MissingStartEventException.class, c::getLastRunResult);
  }

  @Test
  @DisplayName("Start event without correlation id is malformed")
  void startWithoutCorrelationId() {
    LogCorrelator c = new LogCorrelator(NS, log(start(1, "job", null)));
    assertThrows(MalformedLogException.class, c::evaluate);
  }

  // ---------- inner exception evidence ----------

  @Test
  @DisplayName("One inner exception record supplies code and message, no stack trace")
  void singleInnerRecord() {
    LogCorrelator c = unfinishedRun();
    c.evaluate();

    assertEquals(Verdict.FAILURE, c.importInnerException(lines(exception(1, 42, "X", null))));
    assertEquals(42, c.getLastRunResult());
    assertEquals("X", c.getInnerExceptionMessage().orElseThrow());
    assertTrue(c.getInnerExceptionStackTrace().isEmpty());
    assertFalse(c.isInnerExceptionRequired());
    assertEquals("com.example.job.20240115_1030.xml", c.getSecondaryFilename().orElseThrow());
  }

  @Test
  @DisplayName("Two records: second newest supplies code/message, newest supplies stack trace")
  void twoInnerRecords() {
    LogCorrelator c = unfinishedRun();
    c.evaluate();

    // file order is oldest last on purpose; the correlator must sort by record id
    c.importInnerException(lines(exception(11, null, "M2", "D"), exception(10, 7, "M1", null)));

    assertEquals(7, c.getLastRunResult());
    assertEquals("M1", c.getInnerExceptionMessage().orElseThrow());
    assertEquals("D -- M2", c.getInnerExceptionStackTrace().orElseThrow());
  }

  @Test
  @DisplayName("Records beyond the two newest are ignored")
  void extraInnerRecordsIgnored() {
    LogCorrelator c = unfinishedRun();
    c.importInnerException(
        lines(
            exception(1, 99, "ancient", null),
            exception(2, 7, "M1", null),
            exception(3, null, "M2", "D")));

    assertEquals(7, c.getLastRunResult());
    assertEquals("M1", c.getInnerExceptionMessage().orElseThrow());
  }

  @Test
  @DisplayName("Decisive record without error code fails with the unspecified code")
  void innerRecordWithoutCode() {
    LogCorrelator c = unfinishedRun();
    c.importInnerException(lines(exception(1, null, "no code here", null)));
    assertEquals(LogCorrelator.UNSPECIFIED_ERROR_CODE, c.getLastRunResult());
  }

  @Test
  @DisplayName("Inner exception after a preliminary success turns the verdict into a failure")
  void innerExceptionOverridesPreliminarySuccess() {
    LogCorrelator c = finishedRun();
    assertEquals(Verdict.PRELIMINARY_SUCCESS, c.evaluate());

    c.importInnerException(lines(exception(1, 3, "sub-process warning", null)));

    assertEquals(Verdict.FAILURE, c.getVerdict());
    assertEquals(3, c.getLastRunResult());
    assertFalse(c.isSuccess());
  }

  @Test
  @DisplayName("Import before any evaluation establishes the preliminary verdict first")
  void importBeforeEvaluate() {
    LogCorrelator c = finishedRun();
    c.importInnerException(lines(exception(1, 5, "late warning", null)));
    assertEquals(5, c.getLastRunResult());
  }

  @Test
  @DisplayName("Re-evaluation after a terminal verdict is a no-op")
  void terminalVerdictIsStable() {
    LogCorrelator c = unfinishedRun();
    c.importInnerException(lines(exception(1, 42, "X", null)));

    assertEquals(Verdict.FAILURE, c.evaluate());
    assertEquals(Verdict.FAILURE, c.evaluate());
    c.confirmLastRunResult();
    assertEquals(42, c.getLastRunResult());
  }

  @Test
  @DisplayName("A second import is rejected")
  void secondImportRejected() {
    LogCorrelator c = unfinishedRun();
    c.importInnerException(lines(exception(1, 42, "X", null)));
    assertThrows(
        IllegalStateException.class,
        () -> c.importInnerException(lines(exception(2, 43, "Y", null))));
  }

  @Test
  @DisplayName("Empty inner exception log: mandatory after failure, confirms a success")
  void emptyInnerLog() {
    LogCorrelator failed = unfinishedRun();
    assertThrows(MandatoryEvidenceMissingException.class, () -> failed.importInnerException(lines()));

    LogCorrelator succeeded = finishedRun();
    assertEquals(Verdict.CONFIRMED_SUCCESS, succeeded.importInnerException(lines()));
    assertEquals(LogCorrelator.SUCCESS, succeeded.getLastRunResult());
  }

  @Test
  @DisplayName("Import of no lines at all is an input error")
  void importRejectsNoLines() {
    LogCorrelator c = unfinishedRun();
    assertThrows(InputValidationException.class, () -> c.importInnerException(List.of()));
  }

  // ---------- file name ----------

  @Test
  @DisplayName("Inner exception file name comes from namespace and correlation timestamp")
  void innerExceptionFilename() {
    LogCorrelator c = unfinishedRun();
    c.evaluate();
    assertEquals("com.example.job.20240115_1030.xml", c.getInnerExceptionLogFilename());
  }

  @Test
  @DisplayName("File name needs a located start event")
  void innerExceptionFilename_beforeEvaluate() {
    assertThrows(IllegalStateException.class, () -> unfinishedRun().getInnerExceptionLogFilename());
  }

  @Test
  @DisplayName("Correlation id without a timestamp field cannot produce a file name")
  void innerExceptionFilename_malformedCorrelationId() {
    LogCorrelator c = new LogCorrelator(NS, log(start(1, "job", "abc-2024")));
    c.evaluate();
    assertThrows(MalformedLogException.class, c::getInnerExceptionLogFilename);
  }
}
