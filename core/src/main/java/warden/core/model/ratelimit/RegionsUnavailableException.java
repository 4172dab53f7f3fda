package warden.core.model.ratelimit;

import java.util.List;

/**
 * Raised when no region of a multi-region limiter produced a response.
 *
 * <p>Each region failure is attached as a suppressed exception.
 */
public class RegionsUnavailableException extends RuntimeException {

    private final int regionCount;

    public RegionsUnavailableException(int regionCount, List<Throwable> failures) {
        super("All " + regionCount + " regions failed");
        this.regionCount = regionCount;
        failures.forEach(this::addSuppressed);
    }

    /** Returns how many regions were asked. */
    public int getRegionCount() {
        return regionCount;
    }
}
