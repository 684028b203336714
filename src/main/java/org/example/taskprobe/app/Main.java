package org.example.taskprobe.app;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.example.taskprobe.cli.ProbeRunner;
import org.example.taskprobe.storage.ProbeConfig;
import org.example.taskprobe.storage.SnapshotRemoteHost;

/**
 * Entry point of the scheduled task probe.
 *
 * <p>The probe is meant to be called by a PRTG "EXE/Script Advanced" sensor:
 *
 * <ol>
 *   <li>Resolves the configuration file: the first argument when given, otherwise {@code
 *       data/probe.json} (see {@link ProbeConfig#getDefaultPath()}).
 *   <li>Runs one probe through {@link ProbeRunner} against a {@link SnapshotRemoteHost}.
 *   <li>Prints the resulting document to standard output.
 * </ol>
 *
 * <p><b>Console I/O:</b> standard output carries only the sensor document; diagnostics go to
 * standard error through the logging backend. The exit code is always {@code 0}: failures are
 * reported inside the document.
 *
 * @see ProbeRunner
 */
public class Main {

  /**
   * Runs the probe once.
   *
   * @param args optional path of the configuration file
   */
  public static void main(String[] args) {
    Path configPath = (args.length > 0) ? Paths.get(args[0]) : ProbeConfig.getDefaultPath();
    ProbeRunner runner = new ProbeRunner(SnapshotRemoteHost::open);
    System.out.println(runner.run(configPath));
  }
}
