package org.example.taskprobe.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.example.taskprobe.error.InputValidationException;
import org.example.taskprobe.sensor.ChannelAttribute;
import org.example.taskprobe.sensor.ChannelTemplate;
import org.example.taskprobe.sensor.SensorKind;
import org.example.taskprobe.util.JsonUtils;

/**
 * Probe configuration holder with a load helper.
 *
 * <p>This class holds everything one probe invocation needs to know: which task to inspect, how
 * to find the job's event logs and how to decorate the resulting channels. It is read from a JSON
 * file, {@code data/probe.json} by default.
 *
 * <p><b>File format:</b> JSON read by Gson. All fields are public for simple deserialization.
 *
 * <p><b>Typical usage:</b>
 *
 * <pre>{@code
 * ProbeConfig cfg = ProbeConfig.load(ProbeConfig.getDefaultPath()).validate();
 * System.out.println(cfg.taskName);
 * }</pre>
 */
public class ProbeConfig {

  /** Name of the sensor; defaults to {@link #taskName} when blank. */
  public String sensorName;

  /** Scheduled task identity; {@code *} wildcards are allowed but must match exactly one task. */
  public String taskName;

  /** Dotted job namespace, e.g. {@code com.example.job}. Required for the job sensor kind. */
  public String namespace;

  /** Channel layout of the sensor. */
  public SensorKind sensorKind = SensorKind.SCHEDULED_JOB_WITH_LOG;

  /** Location of the scheduled task snapshot. */
  public String taskSnapshotPath = DataPaths.TASKS_JSON.toString();

  /** Directory holding the job's event logs (a mounted share for remote hosts). */
  public String logDirectory = DataPaths.LOGS_DIR.toString();

  /** Primary event log file name; {@code <namespace>.xml} when blank. */
  public String eventLogFile;

  /**
   * Attribute overrides per channel.
   *
   * <p>Outer key: channel name (e.g. {@code "Hours since last run"}); inner map: attribute
   * element name (e.g. {@code "LimitMaxWarning"}) to value.
   */
  public Map<String, Map<String, String>> channelSettings = new LinkedHashMap<>();

  /** Shared Gson instance configured by {@link JsonUtils#gson()}. */
  private static final Gson GSON = JsonUtils.gson();

  /**
   * Returns the default configuration path, {@code data/probe.json}.
   *
   * @return relative {@link Path} resolved against the working directory
   */
  public static Path getDefaultPath() {
    return DataPaths.PROBE_JSON;
  }

  /**
   * Loads a configuration file.
   *
   * @param path JSON file to read
   * @return the parsed configuration, not yet validated
   * @throws InputValidationException if the file is missing, unreadable, empty or not valid JSON
   */
  public static ProbeConfig load(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new InputValidationException("Probe configuration not found: " + path);
    }
    try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      ProbeConfig cfg = GSON.fromJson(br, ProbeConfig.class);
      if (cfg == null) {
        throw new InputValidationException("Probe configuration is empty: " + path);
      }
      return cfg;
    } catch (IOException | JsonParseException e) {
      throw new InputValidationException(
          "Failed to read probe configuration " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Checks required values and channel settings.
   *
   * <p>Channel names must belong to the configured sensor kind and attribute names must be
   * known {@link ChannelAttribute}s, so a typo fails here rather than while rendering.
   *
   * @return this configuration
   * @throws InputValidationException on the first invalid value
   */
  public ProbeConfig validate() {
    requireText(taskName, "taskName");
    requireText(taskSnapshotPath, "taskSnapshotPath");
    if (sensorKind == null) {
      throw new InputValidationException("sensorKind must be one of GENERIC, SCHEDULED_JOB_WITH_LOG");
    }
    if (sensorKind.usesEventLog()) {
      requireText(namespace, "namespace");
      requireText(logDirectory, "logDirectory");
    }
    if (channelSettings != null) {
      for (Map.Entry<String, Map<String, String>> e : channelSettings.entrySet()) {
        boolean known =
            sensorKind.channels().stream()
                .map(ChannelTemplate::channelName)
                .anyMatch(n -> n.equals(e.getKey()));
        if (!known) {
          throw new InputValidationException(
              "channelSettings: sensor kind " + sensorKind + " has no channel '" + e.getKey() + "'");
        }
        if (e.getValue() != null) {
          e.getValue().keySet().forEach(ChannelAttribute::fromName);
        }
      }
    }
    return this;
  }

  /** Sensor name, falling back to the task name. */
  public String sensorNameOrDefault() {
    return (sensorName != null && !sensorName.isBlank()) ? sensorName : taskName;
  }

  /** Primary event log file name, falling back to {@code <namespace>.xml}. */
  public String eventLogFileOrDefault() {
    return (eventLogFile != null && !eventLogFile.isBlank()) ? eventLogFile : namespace + ".xml";
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InputValidationException(field + " must not be empty");
    }
  }
}
