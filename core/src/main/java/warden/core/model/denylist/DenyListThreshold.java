package warden.core.model.denylist;

import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;

/**
 * Severity threshold of the IP feed. Level {@code n} lists addresses reported by at least
 * {@code n} blacklists, so higher levels are smaller and stricter.
 *
 * @param level 1 to 8
 */
public record DenyListThreshold(int level) {

    public static final int MIN = 1;
    public static final int MAX = 8;
    public static final DenyListThreshold DEFAULT = new DenyListThreshold(6);

    public DenyListThreshold {
        if (level < MIN || level > MAX) {
            throw new InvalidRateLimitConfigurationException(
                    "Deny-list threshold must be between " + MIN + " and " + MAX + ", got " + level);
        }
    }
}
