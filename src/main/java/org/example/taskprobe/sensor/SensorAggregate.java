package org.example.taskprobe.sensor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.example.taskprobe.error.ChannelCapacityException;
import org.example.taskprobe.error.InputValidationException;
import org.example.taskprobe.model.ScheduledTaskInfo;
import org.example.taskprobe.service.LogCorrelator;
import org.example.taskprobe.util.TimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A PRTG sensor: a fixed number of channel slots, determined by its {@link SensorKind}, and the
 * status text summarising them.
 *
 * <p>Each template channel of the kind owns the slot matching its position in {@link
 * SensorKind#channels()}, so the rendered order does not depend on which channel was touched
 * first. Other channels take the first free slot. Adding a channel whose name is already present
 * returns the existing channel; adding a new one after all slots are taken fails with {@link
 * ChannelCapacityException}.
 *
 * <p>{@link #mergeTaskAndLogData(ScheduledTaskInfo, LocalDateTime)} fills the kind's template
 * channels from scheduler metadata and, for {@link SensorKind#SCHEDULED_JOB_WITH_LOG}, from the
 * {@link LogCorrelator}. {@link #toReport()} then produces the document.
 *
 * <p><b>Thread-safety:</b> not thread-safe; one instance serves one probe invocation.
 */
public class SensorAggregate {
  private static final Logger log = LoggerFactory.getLogger(SensorAggregate.class);

  private static final DateTimeFormatter DISPLAY_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final String name;
  private final SensorKind kind;
  private final LogCorrelator correlator;
  private final MetricChannel[] slots;
  private final Map<String, MetricChannel> byName = new HashMap<>();
  private int used;

  private ScheduledTaskInfo task;

  /**
   * Creates a sensor that does not read job event logs.
   *
   * @param name sensor name, non-blank
   * @param kind must be {@link SensorKind#GENERIC}
   */
  public SensorAggregate(String name, SensorKind kind) {
    this(name, kind, null);
  }

  /**
   * Creates a sensor.
   *
   * @param name sensor name, non-blank
   * @param kind channel layout
   * @param correlator job log correlator; required for {@link SensorKind#SCHEDULED_JOB_WITH_LOG},
   *     ignored otherwise
   */
  public SensorAggregate(String name, SensorKind kind, LogCorrelator correlator) {
    if (name == null || name.isBlank()) {
      throw new InputValidationException("Sensor name must not be empty");
    }
    if (kind == null) {
      throw new InputValidationException("Sensor kind must be set");
    }
    if (kind.usesEventLog() && correlator == null) {
      throw new InputValidationException("Sensor kind " + kind + " needs a log correlator");
    }
    this.name = name;
    this.kind = kind;
    this.correlator = kind.usesEventLog() ? correlator : null;
    this.slots = new MetricChannel[kind.capacity()];
  }

  // ---------- Channels ----------

  /**
   * Adds a channel to the first free slot.
   *
   * @param channel channel to add
   * @return the channel now registered under that name; the existing one on a name collision
   * @throws ChannelCapacityException if every slot is taken
   */
  public MetricChannel addChannel(MetricChannel channel) {
    MetricChannel existing = byName.get(channel.getName());
    if (existing != null) {
      return existing;
    }
    for (int i = 0; i < slots.length; i++) {
      if (slots[i] == null) {
        return place(i, channel);
      }
    }
    throw new ChannelCapacityException(name, slots.length);
  }

  private MetricChannel place(int slot, MetricChannel channel) {
    slots[slot] = channel;
    used++;
    byName.put(channel.getName(), channel);
    return channel;
  }

  public Optional<MetricChannel> channel(String channelName) {
    return Optional.ofNullable(byName.get(channelName));
  }

  /** Channels in slot order, without empty slots. */
  public List<MetricChannel> channels() {
    List<MetricChannel> out = new ArrayList<>(used);
    for (MetricChannel c : slots) {
      if (c != null) out.add(c);
    }
    return out;
  }

  /**
   * Applies configured attribute overrides to this kind's template channels.
   *
   * @param settings channel name → attribute name → value
   * @throws InputValidationException if a channel name is not part of this kind, or an attribute
   *     name or value is invalid
   */
  public void applyChannelSettings(Map<String, Map<String, String>> settings) {
    if (settings == null) return;
    for (Map.Entry<String, Map<String, String>> e : settings.entrySet()) {
      ChannelTemplate template = templateFor(e.getKey());
      if (e.getValue() != null) {
        ensureChannel(template).setAttributes(e.getValue());
      }
    }
  }

  private ChannelTemplate templateFor(String channelName) {
    for (ChannelTemplate t : kind.channels()) {
      if (t.channelName().equals(channelName)) return t;
    }
    throw new InputValidationException(
        "Sensor kind " + kind + " has no channel named '" + channelName + "'");
  }

  /** Returns the template's channel, creating it in the template's own slot when it is free. */
  private MetricChannel ensureChannel(ChannelTemplate template) {
    MetricChannel existing = byName.get(template.channelName());
    if (existing != null) {
      return existing;
    }
    int slot = kind.channels().indexOf(template);
    if (slots[slot] == null) {
      return place(slot, template.create());
    }
    return addChannel(template.create());
  }

  // ---------- Merge ----------

  /** Same as {@link #mergeTaskAndLogData(ScheduledTaskInfo, LocalDateTime)} at the current time. */
  public void mergeTaskAndLogData(ScheduledTaskInfo taskInfo) {
    mergeTaskAndLogData(taskInfo, LocalDateTime.now());
  }

  /**
   * Populates the template channels.
   *
   * <ul>
   *   <li>hours since the last run, see {@link TimeUtils#elapsedHours};
   *   <li>the scheduler's last result code, verbatim;
   *   <li>{@code 1} if the task is enabled, {@code 0} if disabled;
   *   <li>for the job kind, {@link LogCorrelator#getLastRunResult()}.
   * </ul>
   *
   * @param taskInfo scheduler metadata
   * @param now reference time for the elapsed hours
   * @throws InputValidationException if the task has never run
   */
  public void mergeTaskAndLogData(ScheduledTaskInfo taskInfo, LocalDateTime now) {
    if (taskInfo == null) {
      throw new InputValidationException("Scheduled task metadata is missing");
    }
    if (taskInfo.lastRunTime == null) {
      throw new InputValidationException(
          "Task '" + taskInfo.displayNameOrTaskName() + "' has never run");
    }
    this.task = taskInfo;

    ensureChannel(ChannelTemplate.HOURS_SINCE_LAST_RUN)
        .setValue(TimeUtils.elapsedHours(taskInfo.lastRunTime, now).toPlainString());
    ensureChannel(ChannelTemplate.LAST_TASK_RESULT)
        .setValue(String.valueOf(taskInfo.lastTaskResult));
    ensureChannel(ChannelTemplate.TASK_ENABLED).setValue(taskInfo.state.isEnabled() ? "1" : "0");
    if (kind.usesEventLog()) {
      ensureChannel(ChannelTemplate.LAST_JOB_RESULT)
          .setValue(String.valueOf(correlator.getLastRunResult()));
    }
    log.debug("Merged task '{}' into sensor '{}'", taskInfo.taskName, name);
  }

  // ---------- Render ----------

  /**
   * Builds the sensor document.
   *
   * @return the OK report if no channel holds a value, otherwise one result per populated channel
   *     in slot order followed by the status text
   */
  public PrtgReport toReport() {
    List<PrtgReport.Result> results = new ArrayList<>();
    for (MetricChannel c : channels()) {
      if (c.hasValue()) results.add(new PrtgReport.Result(c));
    }
    if (results.isEmpty()) {
      return PrtgReport.ok();
    }
    return PrtgReport.of(results, statusText());
  }

  private String statusText() {
    String taskName = task == null ? name : task.displayNameOrTaskName();
    if (!kind.usesEventLog() || correlator.isSuccess()) {
      return "Task '"
          + taskName
          + "' last run "
          + format(task == null ? null : task.lastRunTime)
          + ", next run "
          + format(task == null ? null : task.nextRunTime);
    }
    StringBuilder sb =
        new StringBuilder("Task '")
            .append(taskName)
            .append("' failed with code ")
            .append(correlator.getLastRunResult())
            .append(": ")
            .append(correlator.getInnerExceptionMessage().orElse("no message"));
    correlator
        .getInnerExceptionStackTrace()
        .ifPresent(t -> sb.append(LogCorrelator.STACK_TRACE_SEPARATOR).append(t));
    String file =
        correlator.getSecondaryFilename().orElseGet(correlator::getInnerExceptionLogFilename);
    sb.append(" (details: ").append(file).append(')');
    return sb.toString();
  }

  private static String format(LocalDateTime t) {
    return t == null ? "n/a" : DISPLAY_TIME.format(t);
  }

  public String getName() {
    return name;
  }

  public SensorKind getKind() {
    return kind;
  }

  public int capacity() {
    return slots.length;
  }
}
