package warden.core.model.analytics;

/**
 * Geographic context recorded with an analytics event. Any field may be null.
 *
 * @param country country code
 * @param region region or state
 * @param city city name
 * @param ip client IP address
 */
public record Geo(String country, String region, String city, String ip) {

    public static Geo ofCountry(String country) {
        return new Geo(country, null, null, null);
    }
}
