package org.example.taskprobe.service;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.example.taskprobe.error.InputValidationException;
import org.example.taskprobe.error.MalformedLogException;
import org.example.taskprobe.model.EventRecord;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Parses job event logs into {@link EventRecord}s.
 *
 * <p>Expected layout:
 *
 * <pre>{@code
 * <Events>
 *   <Event>
 *     <RecordId>17</RecordId>
 *     <EventId>200</EventId>
 *     <Source>job</Source>
 *     <CorrelationId>run-202401151030-7f3a</CorrelationId>
 *     <TimeCreated>2024-01-15T10:30:00</TimeCreated>
 *     <ErrorCode>42</ErrorCode>
 *     <Message>...</Message>
 *     <DataObject>...</DataObject>
 *   </Event>
 * </Events>
 * }</pre>
 *
 * <p>{@code RecordId} and {@code EventId} are required; every other child is optional. DOCTYPE
 * declarations are rejected and external entities are never resolved.
 */
public final class EventLogParser {
  static final String ROOT = "Events";
  static final String EVENT = "Event";
  static final String MESSAGE = "Message";

  private EventLogParser() {}

  /**
   * Parses the given log text.
   *
   * @param xml full log content
   * @return records in document order (possibly empty)
   * @throws InputValidationException if {@code xml} is null or blank
   * @throws MalformedLogException if the text is not an event log
   */
  public static List<EventRecord> parse(String xml) {
    if (xml == null || xml.isBlank()) {
      throw new InputValidationException("Event log content is empty");
    }
    Element root = parseDocument(xml.strip()).getDocumentElement();
    if (root == null || !ROOT.equals(root.getTagName())) {
      throw new MalformedLogException("Event log root element must be <" + ROOT + ">");
    }

    List<EventRecord> out = new ArrayList<>();
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node node = children.item(i);
      if (node instanceof Element && EVENT.equals(((Element) node).getTagName())) {
        out.add(toRecord((Element) node, out.size()));
      }
    }
    return out;
  }

  private static EventRecord toRecord(Element event, int index) {
    String where = "event #" + (index + 1);
    return new EventRecord(
        requiredLong(event, "RecordId", where),
        requiredInt(event, "EventId", where),
        text(event, "Source"),
        text(event, "CorrelationId"),
        timestamp(event, where),
        errorCode(event, where),
        text(event, MESSAGE),
        text(event, "DataObject"));
  }

  private static long requiredLong(Element event, String name, String where) {
    String raw = text(event, name);
    if (raw == null || raw.isBlank()) {
      throw new MalformedLogException("Missing <" + name + "> in " + where);
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new MalformedLogException("Invalid <" + name + "> '" + raw + "' in " + where, e);
    }
  }

  private static int requiredInt(Element event, String name, String where) {
    long value = requiredLong(event, name, where);
    try {
      return Math.toIntExact(value);
    } catch (ArithmeticException e) {
      throw new MalformedLogException("<" + name + "> " + value + " out of range in " + where, e);
    }
  }

  private static Integer errorCode(Element event, String where) {
    String raw = text(event, "ErrorCode");
    if (raw == null || raw.isBlank()) return null;
    try {
      return Integer.valueOf(raw.trim());
    } catch (NumberFormatException e) {
      throw new MalformedLogException("Invalid <ErrorCode> '" + raw + "' in " + where, e);
    }
  }

  private static LocalDateTime timestamp(Element event, String where) {
    String raw = text(event, "TimeCreated");
    if (raw == null || raw.isBlank()) return null;
    try {
      return LocalDateTime.parse(raw.trim());
    } catch (DateTimeParseException e) {
      throw new MalformedLogException("Invalid <TimeCreated> '" + raw + "' in " + where, e);
    }
  }

  /** Text of the first direct child with the given name, or {@code null} if there is none. */
  private static String text(Element parent, String name) {
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node node = children.item(i);
      if (node instanceof Element && name.equals(((Element) node).getTagName())) {
        return node.getTextContent();
      }
    }
    return null;
  }

  private static Document parseDocument(String xml) {
    try {
      DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
      dbf.setNamespaceAware(false);
      DocumentBuilder builder = dbf.newDocumentBuilder();
      // the built-in handler prints fatal errors to stderr before throwing
      builder.setErrorHandler(new DefaultHandler());
      return builder.parse(new InputSource(new StringReader(xml)));
    } catch (SAXException e) {
      throw new MalformedLogException("Event log is not well-formed XML: " + e.getMessage(), e);
    } catch (ParserConfigurationException | IOException e) {
      throw new MalformedLogException("Failed to parse event log", e);
    }
  }
}
