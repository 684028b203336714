package org.example.taskprobe.storage;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default file-system locations used by the probe.
 *
 * <p>All paths are relative to the working directory:
 *
 * <ul>
 *   <li>{@link #DATA_DIR} – root data folder.
 *   <li>{@link #PROBE_JSON} – probe configuration.
 *   <li>{@link #TASKS_JSON} – scheduled task snapshot.
 *   <li>{@link #LOGS_DIR} – job event logs.
 * </ul>
 *
 * <p>This class is a non-instantiable constants holder.
 */
public final class DataPaths {
  private DataPaths() {}

  /** Root directory for probe data files: {@code data/}. */
  public static final Path DATA_DIR = Paths.get("data");

  /** Probe configuration: {@code data/probe.json}. */
  public static final Path PROBE_JSON = DATA_DIR.resolve("probe.json");

  /** Scheduled task snapshot: {@code data/tasks.json}. */
  public static final Path TASKS_JSON = DATA_DIR.resolve("tasks.json");

  /** Directory holding the job's event logs: {@code data/logs}. */
  public static final Path LOGS_DIR = DATA_DIR.resolve("logs");
}
