package org.example.taskprobe.error;

/**
 * A log file the verdict depends on could not be found.
 *
 * <p>Raised when the job is known to have failed but the inner exception log that explains the
 * failure is absent, or when the primary event log itself is missing.
 */
public class MandatoryEvidenceMissingException extends ProbeException {

  public MandatoryEvidenceMissingException(String message) {
    super(message);
  }
}
