package org.example.taskprobe.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.LocalDateTime;
import java.util.List;
import org.example.taskprobe.error.InputValidationException;
import org.example.taskprobe.error.MultipleMatchException;
import org.example.taskprobe.error.TransportException;
import org.example.taskprobe.model.ScheduledTaskInfo;
import org.example.taskprobe.model.TaskState;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/** File-backed collaborator: task snapshot lookup and log file reads. */
public class SnapshotRemoteHostTest {

  @TempDir Path tempDir;

  private Path snapshot;
  private Path logs;
  private SnapshotRemoteHost host;

  @BeforeEach
  void setUp() throws Exception {
    snapshot = tempDir.resolve("tasks.json");
    logs = Files.createDirectories(tempDir.resolve("logs"));
    Files.writeString(
        snapshot,
        "[\n"
            + "  {\"taskName\": \"NightlyImport\", \"displayName\": \"Nightly import\",\n"
            + "   \"lastRunTime\": \"2024-01-15T10:30:00\", \"nextRunTime\": \"2024-01-16T10:30:00\",\n"
            + "   \"lastTaskResult\": 0, \"state\": \"Ready\"},\n"
            + "  {\"taskName\": \"NightlyExport\", \"lastRunTime\": \"\",\n"
            + "   \"lastTaskResult\": 267011, \"state\": \"Disabled\"}\n"
            + "]\n",
        StandardCharsets.UTF_8);
    host = new SnapshotRemoteHost(snapshot, logs);
  }

  @AfterEach
  void tearDown() {
    host.close();
  }

  @Test
  @DisplayName("Exact name resolves one task with all fields")
  void exactMatch() {
    ScheduledTaskInfo t = host.fetchScheduledTask("NightlyImport");

    assertEquals("Nightly import", t.displayNameOrTaskName());
    assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30), t.lastRunTime);
    assertEquals(LocalDateTime.of(2024, 1, 16, 10, 30), t.nextRunTime);
    assertEquals(0, t.lastTaskResult);
    assertEquals(TaskState.READY, t.state);
  }

  @Test
  @DisplayName("Matching ignores case; blank run time means never ran")
  void caseInsensitiveAndBlankTime() {
    ScheduledTaskInfo t = host.fetchScheduledTask("nightlyexport");
    assertEquals("NightlyExport", t.displayNameOrTaskName());
    assertNull(t.lastRunTime);
    assertEquals(TaskState.DISABLED, t.state);
    assertFalse(t.state.isEnabled());
  }

  @Test
  @DisplayName("Wildcards must resolve to exactly one task")
  void wildcardMatching() {
    assertEquals("NightlyImport", host.fetchScheduledTask("*Import").taskName);
    assertThrows(MultipleMatchException.class, () -> host.fetchScheduledTask("Nightly*"));
    assertThrows(InputValidationException.class, () -> host.fetchScheduledTask("Weekly*"));
    assertThrows(InputValidationException.class, () -> host.fetchScheduledTask(" "));
  }

  @Test
  @DisplayName("Unavailable or corrupt snapshot is a transport failure")
  void snapshotFailures() throws Exception {
    SnapshotRemoteHost missing = new SnapshotRemoteHost(tempDir.resolve("nope.json"), logs);
    assertThrows(TransportException.class, () -> missing.fetchScheduledTask("NightlyImport"));

    Files.writeString(snapshot, "[{\"taskName\": ", StandardCharsets.UTF_8);
    SnapshotRemoteHost corrupt = new SnapshotRemoteHost(snapshot, logs);
    assertThrows(TransportException.class, () -> corrupt.fetchScheduledTask("NightlyImport"));
  }

  @Test
  @DisplayName("Missing log file is empty, existing file is read line by line")
  void fileLines() throws Exception {
    assertTrue(host.fetchFileLines("com.example.job.xml").isEmpty());

    Files.writeString(logs.resolve("com.example.job.xml"), "<Events>\n</Events>\n");
    assertEquals(List.of("<Events>", "</Events>"), host.fetchFileLines("com.example.job.xml").orElseThrow());
  }

  @Test
  @DisplayName("Unreadable log path is a transport failure, not absence")
  void unreadableFile() throws Exception {
    Files.createDirectories(logs.resolve("com.example.job.xml"));
    assertThrows(TransportException.class, () -> host.fetchFileLines("com.example.job.xml"));
  }

  @Test
  @DisplayName("Symlink loop is a transport failure, not absence")
  void symlinkLoop() throws Exception {
    Path loop = logs.resolve("loop.xml");
    Files.createSymbolicLink(loop, loop);
    assertThrows(TransportException.class, () -> host.fetchFileLines("loop.xml"));
  }

  @Test
  @DisplayName("Missing log directory is a transport failure, not absence")
  void missingLogDirectory() {
    SnapshotRemoteHost unmounted = new SnapshotRemoteHost(snapshot, tempDir.resolve("share"));
    assertThrows(TransportException.class, () -> unmounted.fetchFileLines("com.example.job.xml"));
  }

  @Test
  @DisplayName("Opening from configuration uses its paths")
  void openFromConfig() {
    ProbeConfig cfg = new ProbeConfig();
    cfg.taskSnapshotPath = snapshot.toString();
    cfg.logDirectory = logs.toString();
    try (SnapshotRemoteHost opened = SnapshotRemoteHost.open(cfg)) {
      assertEquals("NightlyImport", opened.fetchScheduledTask("NightlyImport").taskName);
    }
  }
}
