package warden.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("WindowDuration")
class WindowDurationTest {

    @ParameterizedTest
    @CsvSource({"250 ms, 250", "10 s, 10000", "10s, 10000", "1 m, 60000", "24 h, 86400000", "1d, 86400000"})
    @DisplayName("should parse compact durations")
    void shouldParseCompactDurations(String value, long millis) {
        assertEquals(millis, WindowDuration.parse(value).millis());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "10", "ten s", "10 w", "10  s", "-1 s", "0 s"})
    @DisplayName("should reject malformed or non-positive durations")
    void shouldRejectMalformedDurations(String value) {
        assertThrows(InvalidRateLimitConfigurationException.class, () -> WindowDuration.parse(value));
    }

    @Test
    @DisplayName("should align buckets and resets to the window")
    void shouldAlignBucketsAndResets() {
        var window = WindowDuration.ofMillis(1_000);

        assertEquals(2, window.bucketOf(2_999));
        assertEquals(3_000, window.resetAfter(2_999));
        assertEquals(3_000, window.resetAfter(2_000));
        assertEquals(0.5, window.elapsedFraction(2_500));
    }
}
