package org.example.taskprobe.sensor;

import java.util.List;

/** Selects the fixed set of channels a {@link SensorAggregate} reserves. */
public enum SensorKind {
  /** Scheduler metadata only. */
  GENERIC(
      List.of(
          ChannelTemplate.HOURS_SINCE_LAST_RUN,
          ChannelTemplate.LAST_TASK_RESULT,
          ChannelTemplate.TASK_ENABLED)),

  /** Scheduler metadata plus the job result read from its event logs. */
  SCHEDULED_JOB_WITH_LOG(
      List.of(
          ChannelTemplate.HOURS_SINCE_LAST_RUN,
          ChannelTemplate.LAST_TASK_RESULT,
          ChannelTemplate.TASK_ENABLED,
          ChannelTemplate.LAST_JOB_RESULT));

  private final List<ChannelTemplate> channels;

  SensorKind(List<ChannelTemplate> channels) {
    this.channels = channels;
  }

  /** Channel templates in slot order. */
  public List<ChannelTemplate> channels() {
    return channels;
  }

  public int capacity() {
    return channels.size();
  }

  public boolean usesEventLog() {
    return this == SCHEDULED_JOB_WITH_LOG;
  }
}
