package org.example.taskprobe.service;

import java.util.ArrayList;
import java.util.List;
import org.example.taskprobe.error.InputValidationException;

/**
 * Repairs raw inner exception log lines before they are parsed.
 *
 * <p>Jobs write exception messages into {@code <Message>} without escaping line breaks, so a
 * single message may be spread over several physical lines, only the first of which starts with a
 * tag. The importer reassembles those lines with one pass over the input:
 *
 * <ul>
 *   <li>a blank line, an XML declaration or a line starting with a tag begins a new logical line;
 *   <li>a line starting with {@code </Message>} closes the message held in the current logical
 *       line: that line is cut to {@value #MESSAGE_LIMIT} characters, {@code &apos;} becomes
 *       {@code '}, any remaining {@code &} becomes {@code .}, NUL characters are dropped, then
 *       {@value #ELLIPSIS} and the closing tag are appended;
 *   <li>any other line is appended to the current logical line as is.
 * </ul>
 *
 * <p>The result uses {@code \n} between logical lines.
 */
public final class ExceptionContentImporter {
  /** Maximum length kept of a reassembled message line, tag and indentation included. */
  public static final int MESSAGE_LIMIT = 250;

  /** Marker appended to every reassembled message. */
  public static final String ELLIPSIS = "...";

  private static final String MESSAGE_CLOSE = "</" + EventLogParser.MESSAGE + ">";

  private ExceptionContentImporter() {}

  /**
   * Reassembles the given physical lines into well-formed log text.
   *
   * @param lines raw lines of the inner exception log, without terminators
   * @return repaired log text
   * @throws InputValidationException if {@code lines} is null or empty
   */
  public static String repair(List<String> lines) {
    if (lines == null || lines.isEmpty()) {
      throw new InputValidationException("Inner exception log is empty");
    }
    List<String> out = new ArrayList<>();
    StringBuilder current = null;
    for (String raw : lines) {
      String line = (raw == null) ? "" : raw;
      String trimmed = line.strip();
      if (trimmed.startsWith(MESSAGE_CLOSE)) {
        String head = (current == null) ? "" : current.toString();
        current = new StringBuilder(normalize(truncate(head))).append(ELLIPSIS).append(trimmed);
      } else if (isStructural(trimmed)) {
        if (current != null) out.add(current.toString());
        current = new StringBuilder(line);
      } else if (current == null) {
        current = new StringBuilder(line);
      } else {
        current.append(line);
      }
    }
    if (current != null) out.add(current.toString());
    return String.join("\n", out);
  }

  private static boolean isStructural(String trimmed) {
    return trimmed.isEmpty() || trimmed.startsWith("<?xml") || trimmed.startsWith("<");
  }

  private static String truncate(String s) {
    return s.length() > MESSAGE_LIMIT ? s.substring(0, MESSAGE_LIMIT) : s;
  }

  private static String normalize(String s) {
    return s.replace("&apos;", "'").replace("&", ".").replace("\u0000", "");
  }
}
