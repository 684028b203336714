package org.example.taskprobe.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Time-related helper methods used by the probe.
 *
 * <p><b>Design notes:</b>
 * <ul>
 *   <li>The class is {@code final} and has a private constructor to prevent instantiation.</li>
 *   <li>All members are static and stateless.</li>
 * </ul>
 */
public final class TimeUtils {
    private TimeUtils() {}

    /**
     * Returns the hours elapsed between {@code since} and {@code now}, rounded for display.
     *
     * <p>Below one hour the value keeps two decimals (e.g. {@code 0.25}); from one hour on it is
     * rounded to whole hours. Both roundings are {@link RoundingMode#HALF_UP}. A {@code since}
     * later than {@code now} (scheduler clock ahead of ours) yields {@code 0}.
     *
     * @param since start of the interval (must not be {@code null})
     * @param now end of the interval (must not be {@code null})
     * @return rounded elapsed hours, never negative
     */
    public static BigDecimal elapsedHours(LocalDateTime since, LocalDateTime now) {
        long seconds = Math.max(0L, Duration.between(since, now).getSeconds());
        BigDecimal hours =
                BigDecimal.valueOf(seconds).divide(BigDecimal.valueOf(3600), 6, RoundingMode.HALF_UP);
        BigDecimal fractional = hours.setScale(2, RoundingMode.HALF_UP);
        if (fractional.compareTo(BigDecimal.ONE) < 0) {
            return fractional;
        }
        return hours.setScale(0, RoundingMode.HALF_UP);
    }
}
