package org.example.taskprobe.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import org.junit.jupiter.api.*;

public class TimeUtilsTest {

  private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 15, 12, 0);

  private static String hoursAgo(long minutes) {
    return TimeUtils.elapsedHours(NOW.minusMinutes(minutes), NOW).toPlainString();
  }

  @Test
  @DisplayName("Below one hour: two decimals")
  void belowOneHour() {
    assertEquals("0.25", hoursAgo(15));
    assertEquals("0.00", hoursAgo(0));
    assertEquals("0.98", hoursAgo(59));
  }

  @Test
  @DisplayName("From one hour on: whole hours, half up")
  void wholeHours() {
    assertEquals("1", hoursAgo(60));
    assertEquals("1", hoursAgo(89));
    assertEquals("2", hoursAgo(90));
    assertEquals("48", hoursAgo(48 * 60));
  }

  @Test
  @DisplayName("Just under an hour rounds to a whole hour, never 1.00")
  void justUnderOneHour() {
    LocalDateTime since = NOW.minusSeconds(3599);
    assertEquals("1", TimeUtils.elapsedHours(since, NOW).toPlainString());
  }

  @Test
  @DisplayName("A last run in the future counts as zero")
  void futureIsZero() {
    assertEquals("0.00", TimeUtils.elapsedHours(NOW.plusHours(1), NOW).toPlainString());
  }
}
