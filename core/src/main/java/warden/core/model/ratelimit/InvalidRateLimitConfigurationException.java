package warden.core.model.ratelimit;

/**
 * Thrown for configuration mistakes: non-positive windows or limits, unparsable
 * durations, out-of-range deny-list thresholds and algorithms used without the
 * collaborators they need.
 *
 * <p>These are programming or deployment errors and are never retried.
 */
public class InvalidRateLimitConfigurationException extends IllegalArgumentException {

    public InvalidRateLimitConfigurationException(String message) {
        super(message);
    }

    public InvalidRateLimitConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
