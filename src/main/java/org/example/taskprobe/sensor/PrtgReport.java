package org.example.taskprobe.sensor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable sensor document, ready to be written by {@link PrtgXmlWriter}.
 *
 * <p>A report is one of three shapes:
 *
 * <ul>
 *   <li><b>results</b> — one entry per populated channel plus one status text;
 *   <li><b>ok</b> — no channel entries, status {@value #OK_TEXT};
 *   <li><b>error</b> — no channel entries, an error marker and the error message.
 * </ul>
 */
public final class PrtgReport {
  public static final String OK_TEXT = "OK";

  /** Snapshot of one rendered channel. */
  public static final class Result {
    public final String channel;
    public final String value;
    public final Map<ChannelAttribute, String> attributes;

    Result(MetricChannel source) {
      this.channel = source.getName();
      this.value = source.getValue().orElseThrow();
      this.attributes = Collections.unmodifiableMap(new EnumMap<>(source.presentAttributes()));
    }
  }

  private final List<Result> results;
  private final String text;
  private final boolean error;

  private PrtgReport(List<Result> results, String text, boolean error) {
    this.results = List.copyOf(results);
    this.text = text;
    this.error = error;
  }

  public static PrtgReport ok() {
    return new PrtgReport(List.of(), OK_TEXT, false);
  }

  public static PrtgReport error(String message) {
    return new PrtgReport(List.of(), message == null ? "" : message, true);
  }

  static PrtgReport of(List<Result> results, String text) {
    return new PrtgReport(results, text, false);
  }

  public List<Result> results() {
    return results;
  }

  public String text() {
    return text;
  }

  public boolean isError() {
    return error;
  }
}
