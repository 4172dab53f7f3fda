package warden.core.model.ratelimit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import warden.core.model.analytics.Geo;

/**
 * Optional per-call context for {@code limit}.
 *
 * <p>{@code ip}, {@code userAgent} and {@code country} are checked against the deny-list
 * together with the identifier but never get counters of their own.
 *
 * @param rate how many tokens this call consumes, at least 1
 * @param ip client IP address
 * @param userAgent client user agent
 * @param country client country code
 * @param geo geo fields recorded with the analytics event
 */
public record LimitRequest(
        long rate, Optional<String> ip, Optional<String> userAgent, Optional<String> country, Optional<Geo> geo) {

    private static final LimitRequest EMPTY =
            new LimitRequest(1, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public LimitRequest {
        rate = Math.max(1, rate);
        ip = Objects.requireNonNullElse(ip, Optional.empty());
        userAgent = Objects.requireNonNullElse(userAgent, Optional.empty());
        country = Objects.requireNonNullElse(country, Optional.empty());
        geo = Objects.requireNonNullElse(geo, Optional.empty());
    }

    /**
     * Return a request that consumes one token and carries no extra context.
     *
     * @return the empty request
     */
    public static LimitRequest empty() {
        return EMPTY;
    }

    public LimitRequest withRate(long newRate) {
        return new LimitRequest(newRate, ip, userAgent, country, geo);
    }

    public LimitRequest withIp(String newIp) {
        return new LimitRequest(rate, Optional.ofNullable(newIp), userAgent, country, geo);
    }

    public LimitRequest withUserAgent(String newUserAgent) {
        return new LimitRequest(rate, ip, Optional.ofNullable(newUserAgent), country, geo);
    }

    public LimitRequest withCountry(String newCountry) {
        return new LimitRequest(rate, ip, userAgent, Optional.ofNullable(newCountry), geo);
    }

    public LimitRequest withGeo(Geo newGeo) {
        return new LimitRequest(rate, ip, userAgent, country, Optional.ofNullable(newGeo));
    }

    /**
     * Build the deny-list candidates for an identifier: the identifier itself followed by
     * every non-blank context value.
     *
     * @param identifier the rate-limited identifier
     * @return the candidates in check order
     */
    public List<String> candidates(String identifier) {
        final var candidates = new ArrayList<String>(4);
        candidates.add(identifier);
        ip.filter(value -> !value.isBlank()).ifPresent(candidates::add);
        userAgent.filter(value -> !value.isBlank()).ifPresent(candidates::add);
        country.filter(value -> !value.isBlank()).ifPresent(candidates::add);
        return List.copyOf(candidates);
    }
}
