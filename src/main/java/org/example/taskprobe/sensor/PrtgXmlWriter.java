package org.example.taskprobe.sensor;

import java.io.StringWriter;
import java.util.Map;
import java.util.Objects;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Writes {@link PrtgReport}s in the PRTG "EXE/Script Advanced" XML format.
 *
 * <pre>{@code
 * <prtg>
 *   <result><channel>Task enabled</channel><value>1</value><Unit>Custom</Unit>...</result>
 *   <text>Task 'Nightly import' last run ...</text>
 * </prtg>
 * }</pre>
 *
 * <p>OK and error reports carry an {@code <error>} element ({@code 0} / {@code 1}) instead of
 * results. Error text is flattened to one line: line breaks become {@value #LINE_SEPARATOR} and
 * angle brackets become square brackets.
 */
public final class PrtgXmlWriter {
  public static final String LINE_SEPARATOR = " | ";

  private PrtgXmlWriter() {}

  public static String write(PrtgReport report) {
    Objects.requireNonNull(report, "report");
    StringWriter out = new StringWriter();
    try {
      XMLStreamWriter xw = XMLOutputFactory.newFactory().createXMLStreamWriter(out);
      xw.writeStartElement("prtg");
      if (report.isError()) {
        element(xw, "error", "1");
        element(xw, "text", sanitizeErrorText(report.text()));
      } else if (report.results().isEmpty()) {
        element(xw, "error", "0");
        element(xw, "text", report.text());
      } else {
        for (PrtgReport.Result r : report.results()) {
          xw.writeStartElement("result");
          element(xw, "channel", r.channel);
          element(xw, "value", r.value);
          for (Map.Entry<ChannelAttribute, String> a : r.attributes.entrySet()) {
            element(xw, a.getKey().elementName(), a.getValue());
          }
          xw.writeEndElement();
        }
        element(xw, "text", report.text());
      }
      xw.writeEndElement();
      xw.writeEndDocument();
      xw.flush();
      xw.close();
      return out.toString();
    } catch (XMLStreamException e) {
      throw new IllegalStateException("Failed to write sensor document", e);
    }
  }

  /**
   * Flattens an error message for the {@code <text>} element.
   *
   * @param message raw message, may span several lines
   * @return single-line message without angle brackets
   */
  public static String sanitizeErrorText(String message) {
    if (message == null) return "";
    String[] lines = message.strip().split("\\R");
    return String.join(LINE_SEPARATOR, lines).replace('<', '[').replace('>', ']');
  }

  private static void element(XMLStreamWriter xw, String name, String text)
      throws XMLStreamException {
    xw.writeStartElement(name);
    xw.writeCharacters(text);
    xw.writeEndElement();
  }
}
