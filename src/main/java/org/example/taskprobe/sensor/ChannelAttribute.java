package org.example.taskprobe.sensor;

import java.util.Locale;
import org.example.taskprobe.error.InputValidationException;

/**
 * Closed set of optional descriptive attributes a PRTG result channel may carry.
 *
 * <p>Each constant knows the element name used in the rendered document. Channel name and value
 * are deliberately absent: they are mandatory parts of every channel, not generic attributes.
 */
public enum ChannelAttribute {
  UNIT("Unit"),
  CUSTOM_UNIT("CustomUnit"),
  SPEED_SIZE("SpeedSize"),
  VOLUME_SIZE("VolumeSize"),
  SPEED_TIME("SpeedTime"),
  MODE("Mode"),
  FLOAT("Float"),
  DECIMAL_MODE("DecimalMode"),
  WARNING("Warning"),
  SHOW_CHART("ShowChart"),
  SHOW_TABLE("ShowTable"),
  LIMIT_MAX_ERROR("LimitMaxError"),
  LIMIT_MAX_WARNING("LimitMaxWarning"),
  LIMIT_MIN_WARNING("LimitMinWarning"),
  LIMIT_MIN_ERROR("LimitMinError"),
  LIMIT_ERROR_MSG("LimitErrorMsg"),
  LIMIT_WARNING_MSG("LimitWarningMsg"),
  LIMIT_MODE("LimitMode"),
  VALUE_LOOKUP("ValueLookup"),
  NOTIFY_CHANGED("NotifyChanged");

  private final String elementName;

  ChannelAttribute(String elementName) {
    this.elementName = elementName;
  }

  /** Element name in the rendered document, e.g. {@code LimitMaxError}. */
  public String elementName() {
    return elementName;
  }

  /**
   * Resolves an attribute by its element name, ignoring case.
   *
   * <p>This is the boundary where attribute names from configuration are checked.
   *
   * @param name element name such as {@code "LimitMaxError"}
   * @return the matching attribute
   * @throws InputValidationException if the name is blank, names the channel itself or its value,
   *     or is not a known attribute
   */
  public static ChannelAttribute fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new InputValidationException("Channel attribute name must not be empty");
    }
    String n = name.trim();
    String lower = n.toLowerCase(Locale.ROOT);
    if (lower.equals("name") || lower.equals("channel") || lower.equals("value")) {
      throw new InputValidationException("'" + n + "' is not a generic channel attribute");
    }
    for (ChannelAttribute a : values()) {
      if (a.elementName.equalsIgnoreCase(n)) return a;
    }
    throw new InputValidationException("Unknown channel attribute '" + n + "'");
  }
}
