package org.example.taskprobe.sensor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.example.taskprobe.error.InputValidationException;

/**
 * One named result channel of a sensor: a value plus optional {@link ChannelAttribute}s.
 *
 * <p>Every setter rejects blank input with {@link InputValidationException}. Assigning a value
 * lookup forces the unit to {@value #CUSTOM_UNIT}, and the unit cannot be changed away from it
 * while a lookup is set.
 *
 * <p><b>Thread-safety:</b> not thread-safe.
 */
public class MetricChannel {
  /** Unit a channel must use when its value is mapped through a lookup table. */
  public static final String CUSTOM_UNIT = "Custom";

  private final String name;
  private String value;
  private final EnumMap<ChannelAttribute, String> attributes =
      new EnumMap<>(ChannelAttribute.class);

  public MetricChannel(String name) {
    this.name = requireText(name, "Channel name");
  }

  public String getName() {
    return name;
  }

  public void setValue(String value) {
    this.value = requireText(value, "Value of channel '" + name + "'");
  }

  public Optional<String> getValue() {
    return Optional.ofNullable(value);
  }

  public boolean hasValue() {
    return value != null;
  }

  /**
   * Maps the channel value through a lookup table.
   *
   * @param lookupId lookup table id, e.g. {@code prtg.standardlookups.yesno.stateyesok}
   */
  public void setLookup(String lookupId) {
    attributes.put(
        ChannelAttribute.VALUE_LOOKUP, requireText(lookupId, "Lookup id of channel '" + name + "'"));
    attributes.put(ChannelAttribute.UNIT, CUSTOM_UNIT);
  }

  public void setAttribute(ChannelAttribute attribute, String attrValue) {
    if (attribute == ChannelAttribute.VALUE_LOOKUP) {
      setLookup(attrValue);
      return;
    }
    String v = requireText(attrValue, attribute.elementName() + " of channel '" + name + "'");
    if (attribute == ChannelAttribute.UNIT
        && attributes.containsKey(ChannelAttribute.VALUE_LOOKUP)
        && !CUSTOM_UNIT.equalsIgnoreCase(v)) {
      throw new InputValidationException(
          "Channel '" + name + "' uses a value lookup, its unit must stay " + CUSTOM_UNIT);
    }
    attributes.put(attribute, v);
  }

  /**
   * Sets an attribute given by its element name.
   *
   * @param attributeName element name, see {@link ChannelAttribute#fromName(String)}
   * @param attrValue non-blank value
   */
  public void setAttribute(String attributeName, String attrValue) {
    setAttribute(ChannelAttribute.fromName(attributeName), attrValue);
  }

  /** Sets several attributes given by element name; stops at the first invalid entry. */
  public void setAttributes(Map<String, String> values) {
    for (Map.Entry<String, String> e : values.entrySet()) {
      setAttribute(e.getKey(), e.getValue());
    }
  }

  public Optional<String> getAttribute(ChannelAttribute attribute) {
    return Optional.ofNullable(attributes.get(attribute));
  }

  public Optional<String> getAttribute(String attributeName) {
    return getAttribute(ChannelAttribute.fromName(attributeName));
  }

  /** Attributes that currently hold a value, in {@link ChannelAttribute} order. */
  public Map<ChannelAttribute, String> presentAttributes() {
    return Collections.unmodifiableMap(new EnumMap<>(attributes));
  }

  private static String requireText(String s, String what) {
    if (s == null || s.isBlank()) {
      throw new InputValidationException(what + " must not be empty");
    }
    return s;
  }
}
