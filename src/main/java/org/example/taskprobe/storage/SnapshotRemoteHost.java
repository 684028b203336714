package org.example.taskprobe.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.BufferedReader;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import org.example.taskprobe.error.InputValidationException;
import org.example.taskprobe.error.MultipleMatchException;
import org.example.taskprobe.error.TransportException;
import org.example.taskprobe.model.ScheduledTaskInfo;
import org.example.taskprobe.remote.RemoteHost;
import org.example.taskprobe.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RemoteHost} backed by files: a JSON snapshot of the scheduler's task list and a directory
 * holding the job's logs.
 *
 * <p>The snapshot is a JSON array of {@link ScheduledTaskInfo}, for example exported from the task
 * scheduler by a collection script. The log directory is typically a share of the job host mounted
 * locally. The snapshot is read once, on first lookup.
 *
 * <h2>Error handling</h2>
 *
 * Any failure to read the snapshot or a log file raises {@link TransportException}, including an
 * unreachable log directory. Only a log file the file system reports as nonexistent is an empty
 * result.
 */
public class SnapshotRemoteHost implements RemoteHost {
  private static final Logger log = LoggerFactory.getLogger(SnapshotRemoteHost.class);

  /** Gson type token describing a {@code List<ScheduledTaskInfo>}. */
  private static final Type LIST_TYPE = new TypeToken<List<ScheduledTaskInfo>>() {}.getType();

  private static final Gson GSON = JsonUtils.gson();

  private final Path taskSnapshot;
  private final Path logDirectory;
  private List<ScheduledTaskInfo> tasks;

  public SnapshotRemoteHost(Path taskSnapshot, Path logDirectory) {
    this.taskSnapshot = taskSnapshot;
    this.logDirectory = logDirectory;
  }

  /**
   * Opens a host for the given configuration.
   *
   * @param config validated configuration
   * @return a host reading {@link ProbeConfig#taskSnapshotPath} and {@link
   *     ProbeConfig#logDirectory}
   */
  public static SnapshotRemoteHost open(ProbeConfig config) {
    try {
      Path logs =
          (config.logDirectory == null || config.logDirectory.isBlank())
              ? DataPaths.LOGS_DIR
              : Paths.get(config.logDirectory);
      return new SnapshotRemoteHost(Paths.get(config.taskSnapshotPath), logs);
    } catch (InvalidPathException e) {
      throw new InputValidationException("Invalid path in probe configuration: " + e.getMessage(), e);
    }
  }

  @Override
  public ScheduledTaskInfo fetchScheduledTask(String identity) {
    if (identity == null || identity.isBlank()) {
      throw new InputValidationException("Task identity must not be empty");
    }
    Pattern pattern = wildcard(identity.trim());
    List<ScheduledTaskInfo> matches = new ArrayList<>();
    for (ScheduledTaskInfo t : loadTasks()) {
      if (t != null && t.taskName != null && pattern.matcher(t.taskName).matches()) matches.add(t);
    }
    if (matches.isEmpty()) {
      throw new InputValidationException("No scheduled task matches '" + identity + "'");
    }
    if (matches.size() > 1) {
      throw new MultipleMatchException(identity, matches.size());
    }
    return matches.get(0);
  }

  @Override
  public Optional<List<String>> fetchFileLines(String path) {
    Path file;
    try {
      file = logDirectory.resolve(path);
    } catch (InvalidPathException e) {
      throw new InputValidationException("Invalid log file name '" + path + "'", e);
    }
    // an unmounted share is not "file not found"
    if (!Files.isDirectory(logDirectory)) {
      throw new TransportException("Log directory " + logDirectory + " is not reachable");
    }
    try {
      List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
      log.debug("Read {} line(s) from {}", lines.size(), file);
      return Optional.of(lines);
    } catch (NoSuchFileException e) {
      log.debug("Log file {} not found", file);
      return Optional.empty();
    } catch (IOException e) {
      throw new TransportException("Failed to read " + file + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    tasks = null;
    log.debug("Closed snapshot host for {}", taskSnapshot);
  }

  private List<ScheduledTaskInfo> loadTasks() {
    if (tasks != null) return tasks;
    if (!Files.exists(taskSnapshot)) {
      throw new TransportException("Scheduled task snapshot not found: " + taskSnapshot);
    }
    try (BufferedReader br = Files.newBufferedReader(taskSnapshot, StandardCharsets.UTF_8)) {
      List<ScheduledTaskInfo> data = GSON.fromJson(br, LIST_TYPE);
      tasks = (data != null) ? data : List.of();
      return tasks;
    } catch (IOException | JsonParseException e) {
      throw new TransportException(
          "Failed to read scheduled task snapshot " + taskSnapshot + ": " + e.getMessage(), e);
    }
  }

  /** Case-insensitive pattern where {@code *} matches any run of characters. */
  private static Pattern wildcard(String identity) {
    StringJoiner regex = new StringJoiner(".*");
    for (String part : identity.split("\\*", -1)) {
      regex.add(Pattern.quote(part));
    }
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
