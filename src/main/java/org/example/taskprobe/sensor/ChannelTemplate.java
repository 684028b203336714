package org.example.taskprobe.sensor;

/**
 * The channels a sensor can reserve, with the attributes each starts out with.
 *
 * <p>Limits are expressed so that PRTG raises an error on any non-zero task or job result. The
 * job result channel tolerates the preliminary success sentinel ({@code -2}) but not the
 * preliminary failure one ({@code -3}).
 */
public enum ChannelTemplate {
  HOURS_SINCE_LAST_RUN("Hours since last run") {
    @Override
    void configure(MetricChannel c) {
      c.setAttribute(ChannelAttribute.UNIT, "TimeHours");
      c.setAttribute(ChannelAttribute.FLOAT, "1");
      c.setAttribute(ChannelAttribute.DECIMAL_MODE, "Auto");
    }
  },
  LAST_TASK_RESULT("Last task result") {
    @Override
    void configure(MetricChannel c) {
      c.setAttribute(ChannelAttribute.UNIT, "Count");
      c.setAttribute(ChannelAttribute.LIMIT_MODE, "1");
      c.setAttribute(ChannelAttribute.LIMIT_MAX_ERROR, "0");
      c.setAttribute(ChannelAttribute.LIMIT_ERROR_MSG, "Scheduler reports a failed last run");
    }
  },
  TASK_ENABLED("Task enabled") {
    @Override
    void configure(MetricChannel c) {
      c.setLookup("prtg.standardlookups.yesno.stateyesok");
    }
  },
  LAST_JOB_RESULT("Last job result") {
    @Override
    void configure(MetricChannel c) {
      c.setLookup("taskprobe.jobresult");
      c.setAttribute(ChannelAttribute.LIMIT_MODE, "1");
      c.setAttribute(ChannelAttribute.LIMIT_MAX_ERROR, "0");
      c.setAttribute(ChannelAttribute.LIMIT_MIN_ERROR, "-2");
      c.setAttribute(ChannelAttribute.NOTIFY_CHANGED, "1");
    }
  };

  private final String channelName;

  ChannelTemplate(String channelName) {
    this.channelName = channelName;
  }

  public String channelName() {
    return channelName;
  }

  abstract void configure(MetricChannel channel);

  /** Creates a fresh, value-less channel with this template's attributes. */
  public MetricChannel create() {
    MetricChannel channel = new MetricChannel(channelName);
    configure(channel);
    return channel;
  }
}
