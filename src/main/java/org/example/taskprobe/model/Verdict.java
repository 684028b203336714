package org.example.taskprobe.model;

/**
 * Lifecycle of the last-run verdict held by a {@link org.example.taskprobe.service.LogCorrelator}.
 *
 * <h2>Transitions</h2>
 *
 * <ul>
 *   <li>{@code UNINITIALIZED} → {@code PRELIMINARY_SUCCESS} | {@code PRELIMINARY_FAILURE}
 *   <li>{@code PRELIMINARY_SUCCESS} → {@code CONFIRMED_SUCCESS} | {@code FAILURE}
 *   <li>{@code PRELIMINARY_FAILURE} → {@code FAILURE} (only through inner exception evidence)
 * </ul>
 *
 * <p>{@code CONFIRMED_SUCCESS} and {@code FAILURE} are terminal.
 */
public enum Verdict {
  /** Nothing evaluated yet. */
  UNINITIALIZED,

  /** Start and end events of the last run were found; inner exceptions not checked yet. */
  PRELIMINARY_SUCCESS,

  /** The last run has a start event without a matching end event; its cause is still unknown. */
  PRELIMINARY_FAILURE,

  /** The last run succeeded and no inner exception log contradicts it. */
  CONFIRMED_SUCCESS,

  /** The last run failed; the failure code comes from the inner exception log. */
  FAILURE;

  public boolean isTerminal() {
    return this == CONFIRMED_SUCCESS || this == FAILURE;
  }

  public boolean isPreliminary() {
    return this == PRELIMINARY_SUCCESS || this == PRELIMINARY_FAILURE;
  }
}
