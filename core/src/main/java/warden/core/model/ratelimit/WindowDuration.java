package warden.core.model.ratelimit;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * A positive window or refill interval in milliseconds.
 *
 * <p>Parses the compact {@code "<amount> <unit>"} form used in configuration, where unit is
 * one of {@code ms}, {@code s}, {@code m}, {@code h} or {@code d} and the separating space is
 * optional: {@code "10 s"}, {@code "1m"}, {@code "24 h"}.
 *
 * @param millis the duration in milliseconds
 */
public record WindowDuration(long millis) {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)\\s?(ms|s|m|h|d)$");

    public WindowDuration {
        if (millis <= 0) {
            throw new InvalidRateLimitConfigurationException("window must be positive, got " + millis + "ms");
        }
    }

    /**
     * Parse a compact duration string.
     *
     * @param value the duration, e.g. {@code "10 s"}
     * @return the parsed duration
     * @throws InvalidRateLimitConfigurationException if the value cannot be parsed or is not positive
     */
    public static WindowDuration parse(String value) {
        if (value == null) {
            throw new InvalidRateLimitConfigurationException("window must not be null");
        }
        final var matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            throw new InvalidRateLimitConfigurationException("Unable to parse window size: " + value);
        }

        final long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new InvalidRateLimitConfigurationException("Unable to parse window size: " + value, e);
        }

        final var unitMillis =
                switch (matcher.group(2)) {
                    case "ms" -> 1L;
                    case "s" -> 1_000L;
                    case "m" -> 60_000L;
                    case "h" -> 3_600_000L;
                    case "d" -> 86_400_000L;
                    default -> throw new InvalidRateLimitConfigurationException("Unsupported unit in " + value);
                };
        return new WindowDuration(Math.multiplyExact(amount, unitMillis));
    }

    /**
     * Create a window from milliseconds.
     *
     * @param millis the window length
     * @return the window
     */
    public static WindowDuration ofMillis(long millis) {
        return new WindowDuration(millis);
    }

    /**
     * Create a window from a {@link Duration}.
     *
     * @param duration the window length
     * @return the window
     */
    public static WindowDuration of(Duration duration) {
        return new WindowDuration(duration.toMillis());
    }

    /**
     * Return the index of the window containing the given instant.
     *
     * @param nowMillis epoch millis
     * @return {@code floor(now / window)}
     */
    public long bucketOf(long nowMillis) {
        return Math.floorDiv(nowMillis, millis);
    }

    /**
     * Return the epoch millis at which the window containing {@code nowMillis} ends.
     *
     * @param nowMillis epoch millis
     * @return the window-aligned reset time, strictly after {@code nowMillis}
     */
    public long resetAfter(long nowMillis) {
        return (bucketOf(nowMillis) + 1) * millis;
    }

    /**
     * Return how far into its window {@code nowMillis} lies, between 0 inclusive and 1 exclusive.
     *
     * @param nowMillis epoch millis
     * @return the elapsed fraction of the current window
     */
    public double elapsedFraction(long nowMillis) {
        return (double) Math.floorMod(nowMillis, millis) / millis;
    }

    public Duration toDuration() {
        return Duration.ofMillis(millis);
    }
}
