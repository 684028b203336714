package org.example.taskprobe.cli;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.example.taskprobe.error.MandatoryEvidenceMissingException;
import org.example.taskprobe.error.ProbeException;
import org.example.taskprobe.model.ScheduledTaskInfo;
import org.example.taskprobe.model.Verdict;
import org.example.taskprobe.remote.RemoteHost;
import org.example.taskprobe.remote.RemoteHostFactory;
import org.example.taskprobe.sensor.PrtgReport;
import org.example.taskprobe.sensor.PrtgXmlWriter;
import org.example.taskprobe.sensor.SensorAggregate;
import org.example.taskprobe.service.LogCorrelator;
import org.example.taskprobe.storage.ProbeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one probe invocation and renders exactly one sensor document.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Load and validate the configuration.
 *   <li>Open a {@link RemoteHost} session and fetch the task's scheduler metadata.
 *   <li>For the job sensor kind, fetch the primary event log, evaluate it with a {@link
 *       LogCorrelator} and, when the preliminary verdict asks for it, fetch and import the inner
 *       exception log.
 *   <li>Merge everything into a {@link SensorAggregate} and render it.
 * </ol>
 *
 * <p>A missing inner exception log is acceptable after a preliminary success (the success is
 * confirmed) but fatal after a preliminary failure. A log file holding only blank lines is
 * treated as missing.
 *
 * <p><b>Error handling:</b> this is the only place where probe failures are caught. Any failure
 * yields an error document and nothing else; the host session is closed in every case.
 */
public class ProbeRunner {
  private static final Logger log = LoggerFactory.getLogger(ProbeRunner.class);

  private final RemoteHostFactory hosts;
  private final Clock clock;

  public ProbeRunner(RemoteHostFactory hosts) {
    this(hosts, Clock.systemDefaultZone());
  }

  public ProbeRunner(RemoteHostFactory hosts, Clock clock) {
    this.hosts = hosts;
    this.clock = clock;
  }

  /**
   * Loads the configuration from {@code configPath} and runs the probe.
   *
   * @param configPath JSON configuration file
   * @return the rendered sensor or error document
   */
  public String run(Path configPath) {
    ProbeConfig config;
    try {
      config = ProbeConfig.load(configPath);
    } catch (ProbeException e) {
      return failed(e);
    }
    return run(config);
  }

  /**
   * Runs the probe with an already loaded configuration.
   *
   * @param config configuration; validated here
   * @return the rendered sensor or error document
   */
  public String run(ProbeConfig config) {
    PrtgReport report;
    try {
      config.validate();
      try (RemoteHost host = hosts.open(config)) {
        report = probe(config, host);
      }
    } catch (ProbeException e) {
      return failed(e);
    } catch (RuntimeException e) {
      log.error("Probe failed unexpectedly", e);
      String message = e.getClass().getSimpleName() + ": " + e.getMessage();
      return PrtgXmlWriter.write(PrtgReport.error(message));
    }
    return PrtgXmlWriter.write(report);
  }

  private PrtgReport probe(ProbeConfig config, RemoteHost host) {
    ScheduledTaskInfo task = host.fetchScheduledTask(config.taskName);
    log.debug("Resolved task '{}' (state {})", task.taskName, task.state);

    LogCorrelator correlator = config.sensorKind.usesEventLog() ? correlate(config, host) : null;

    SensorAggregate sensor =
        new SensorAggregate(config.sensorNameOrDefault(), config.sensorKind, correlator);
    sensor.applyChannelSettings(config.channelSettings);
    sensor.mergeTaskAndLogData(task, LocalDateTime.now(clock));
    return sensor.toReport();
  }

  private LogCorrelator correlate(ProbeConfig config, RemoteHost host) {
    String primaryFile = config.eventLogFileOrDefault();
    List<String> primary =
        host.fetchFileLines(primaryFile)
            .filter(ProbeRunner::hasContent)
            .orElseThrow(
                () ->
                    new MandatoryEvidenceMissingException(
                        "Event log "
                            + primaryFile
                            + " of '"
                            + config.namespace
                            + "' not found or empty"));

    LogCorrelator correlator = new LogCorrelator(config.namespace, String.join("\n", primary));
    correlator.evaluate();
    if (!correlator.isInnerExceptionRequired()) {
      return correlator;
    }

    String innerFile = correlator.getInnerExceptionLogFilename();
    Optional<List<String>> inner = host.fetchFileLines(innerFile).filter(ProbeRunner::hasContent);
    if (inner.isPresent()) {
      correlator.importInnerException(inner.get());
    } else if (correlator.getVerdict() == Verdict.PRELIMINARY_SUCCESS) {
      log.debug("No inner exception log {}, confirming success", innerFile);
      correlator.confirmLastRunResult();
    } else {
      throw new MandatoryEvidenceMissingException(
          "Last run of '"
              + config.namespace
              + "' did not finish and its inner exception log "
              + innerFile
              + " is missing or empty");
    }
    return correlator;
  }

  /** A log holding only blank lines counts as empty. */
  private static boolean hasContent(List<String> lines) {
    return lines.stream().anyMatch(l -> l != null && !l.isBlank());
  }

  private static String failed(ProbeException e) {
    log.warn("Probe failed: {}", e.getMessage());
    return PrtgXmlWriter.write(PrtgReport.error(e.getMessage()));
  }
}
