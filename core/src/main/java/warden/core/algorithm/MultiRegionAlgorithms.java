package warden.core.algorithm;

import warden.core.model.ratelimit.WindowDuration;

/**
 * Factories for multi-region algorithms.
 */
public final class MultiRegionAlgorithms {

    private MultiRegionAlgorithms() {}

    public static MultiRegionFixedWindow fixedWindow(long tokens, String window) {
        return fixedWindow(tokens, WindowDuration.parse(window));
    }

    public static MultiRegionFixedWindow fixedWindow(long tokens, WindowDuration window) {
        return new MultiRegionFixedWindow(Algorithms.requirePositive(tokens, "tokens"), window);
    }

    public static MultiRegionSlidingWindow slidingWindow(long tokens, String window) {
        return slidingWindow(tokens, WindowDuration.parse(window));
    }

    public static MultiRegionSlidingWindow slidingWindow(long tokens, WindowDuration window) {
        return new MultiRegionSlidingWindow(Algorithms.requirePositive(tokens, "tokens"), window);
    }
}
