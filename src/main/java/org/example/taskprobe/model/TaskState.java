package org.example.taskprobe.model;

import com.google.gson.annotations.SerializedName;

/** Scheduler state of a task, as reported by the Windows task scheduler. */
public enum TaskState {
  @SerializedName(value = "Unknown", alternate = {"UNKNOWN"})
  UNKNOWN,

  @SerializedName(value = "Disabled", alternate = {"DISABLED"})
  DISABLED,

  @SerializedName(value = "Queued", alternate = {"QUEUED"})
  QUEUED,

  @SerializedName(value = "Ready", alternate = {"READY"})
  READY,

  @SerializedName(value = "Running", alternate = {"RUNNING"})
  RUNNING;

  public boolean isEnabled() {
    return this != DISABLED;
  }
}
