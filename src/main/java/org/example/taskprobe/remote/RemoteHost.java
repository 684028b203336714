package org.example.taskprobe.remote;

import java.util.List;
import java.util.Optional;
import org.example.taskprobe.model.ScheduledTaskInfo;

/**
 * Session with the host that runs the monitored job.
 *
 * <p>Implementations own whatever the session needs (connections, mounted shares, credentials)
 * and release it in {@link #close()}, which the probe calls unconditionally.
 *
 * <p>A clean "not found" answer and a failed call are different outcomes: the former is an
 * empty {@link Optional}, the latter a {@link org.example.taskprobe.error.TransportException}.
 */
public interface RemoteHost extends AutoCloseable {

  /**
   * Looks up one scheduled task.
   *
   * @param identity task name; may contain {@code *} wildcards
   * @return metadata of the single matching task
   * @throws org.example.taskprobe.error.InputValidationException if no task matches
   * @throws org.example.taskprobe.error.MultipleMatchException if more than one task matches
   * @throws org.example.taskprobe.error.TransportException if the scheduler cannot be queried
   */
  ScheduledTaskInfo fetchScheduledTask(String identity);

  /**
   * Reads a text file line by line.
   *
   * @param path file path; relative paths resolve against the job's log directory
   * @return the lines, or empty if the file does not exist
   * @throws org.example.taskprobe.error.TransportException if the file exists but cannot be read
   */
  Optional<List<String>> fetchFileLines(String path);

  @Override
  void close();
}
