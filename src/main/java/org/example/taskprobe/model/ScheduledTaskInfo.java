package org.example.taskprobe.model;

import java.time.LocalDateTime;

/**
 * Scheduler metadata of one task.
 *
 * <p>Instances are deserialized with Gson from a task snapshot (see {@code
 * org.example.taskprobe.storage.SnapshotRemoteHost}); fields are public for that reason.
 * {@link #lastRunTime} and {@link #nextRunTime} are {@code null} when the scheduler reports none.
 */
public class ScheduledTaskInfo {
  /** Scheduler name of the task, used to resolve the configured identity. */
  public String taskName;

  /** Human-readable name shown in the status line; falls back to {@link #taskName}. */
  public String displayName;

  /** Start time of the last run. */
  public LocalDateTime lastRunTime;

  /** Start time of the next scheduled run. */
  public LocalDateTime nextRunTime;

  /** Result code the scheduler recorded for the last run ({@code 0} = success). */
  public long lastTaskResult;

  /** Current scheduler state. */
  public TaskState state = TaskState.UNKNOWN;

  /**
   * Returns the name to show in reports.
   *
   * @return {@link #displayName} when set, otherwise {@link #taskName}
   */
  public String displayNameOrTaskName() {
    return (displayName != null && !displayName.isBlank()) ? displayName : taskName;
  }
}
