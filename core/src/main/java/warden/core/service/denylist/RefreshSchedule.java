package warden.core.service.denylist;

import java.time.Clock;

/**
 * Validity of a freshly fetched IP deny-list.
 *
 * <p>The list stays valid until the next 02:00 UTC, so instances refresh around the time the
 * feed publishes its daily update instead of at a fixed interval after their own last
 * refresh.
 */
public final class RefreshSchedule {

    static final long DAY_MILLIS = 86_400_000L;
    static final long OFFSET_MILLIS = 7_200_000L;

    private RefreshSchedule() {}

    /**
     * Milliseconds from {@code nowMillis} until the next refresh, between 1 and one day.
     *
     * @param nowMillis epoch millis
     * @return time to live of the freshness marker
     */
    public static long millisUntilNextRefresh(long nowMillis) {
        return DAY_MILLIS - Math.floorMod(nowMillis - OFFSET_MILLIS, DAY_MILLIS);
    }

    public static long millisUntilNextRefresh(Clock clock) {
        return millisUntilNextRefresh(clock.millis());
    }
}
