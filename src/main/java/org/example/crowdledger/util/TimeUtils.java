package org.example.crowdledger.util;

/**
 * Period arithmetic for the monthly-active-user histogram.
 *
 * <p>Time is measured in epoch seconds. A period is a fixed 30-day window counted from the
 * network genesis; period {@code k} covers {@code [genesis + k*30d, genesis + (k+1)*30d)}.
 *
 * <p>The class is {@code final} with a private constructor; all members are static.
 */
public final class TimeUtils {
    private TimeUtils() {}

    /** Length of one MAU period: 30 days, in seconds. */
    public static final long PERIOD_SECONDS = 30L * 24 * 60 * 60;

    /**
     * Number of whole periods elapsed between genesis and {@code now}.
     *
     * @param now current epoch seconds
     * @param genesis genesis epoch seconds
     * @return {@code floor((now - genesis) / 30 days)}
     * @throws IllegalArgumentException if {@code now} precedes genesis
     */
    public static long elapsedPeriods(long now, long genesis) {
        if (now < genesis) {
            throw new IllegalArgumentException(
                    "Timestamp " + now + " precedes genesis " + genesis);
        }
        return (now - genesis) / PERIOD_SECONDS;
    }

    /**
     * Start of period {@code k} in epoch seconds.
     *
     * @param genesis genesis epoch seconds
     * @param k zero-based period number
     * @return {@code genesis + k * 30 days}
     */
    public static long periodStart(long genesis, long k) {
        return genesis + PERIOD_SECONDS * k;
    }
}
