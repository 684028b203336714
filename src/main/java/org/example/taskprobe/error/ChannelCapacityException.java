package org.example.taskprobe.error;

/** More channels were added to a sensor than its kind reserves. */
public class ChannelCapacityException extends ProbeException {

  public ChannelCapacityException(String sensorName, int capacity) {
    super("Sensor '" + sensorName + "' already holds its " + capacity + " reserved channels");
  }
}
