package warden.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.algorithm.RateLimitAlgorithm;
import warden.core.algorithm.RegionContext;
import warden.core.model.analytics.AnalyticsEvent;
import warden.core.model.analytics.BucketAggregate;
import warden.core.model.analytics.EventOutcome;
import warden.core.model.analytics.MostAllowedBlocked;
import warden.core.model.analytics.UsageCounts;
import warden.core.model.denylist.DenyListCheck;
import warden.core.model.denylist.DenyListThreshold;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.core.model.ratelimit.LimitRequest;
import warden.core.model.ratelimit.RateLimitReason;
import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.model.ratelimit.RemainingTokens;
import warden.core.port.out.RateLimitMetrics;
import warden.core.service.analytics.UsageAnalytics;
import warden.core.service.denylist.DenyListService;
import warden.core.util.Pending;

/**
 * Public rate limiting surface.
 *
 * <p>A call to {@link #limit(String, LimitRequest)} goes through these steps:
 * <ol>
 *   <li>Reject at once if a candidate (identifier, ip, user agent, country) is denied in the
 *       local cache.</li>
 *   <li>Otherwise run the algorithm and, with protection on, the remote deny-list check
 *       concurrently. A denied candidate overrides the algorithm's verdict. An expired IP
 *       deny-list is refreshed in the background.</li>
 *   <li>Allow the request with reason {@code timeout} if the store does not answer within
 *       the configured timeout. The store call keeps running.</li>
 *   <li>Record the outcome as an analytics event in the background when analytics is on.</li>
 * </ol>
 *
 * <p>Background work is attached to {@link RateLimitResponse#pending()}.
 *
 * @param <C> the context the algorithm runs against
 */
public abstract class RateLimiter<C extends RegionContext> {

    private static final Logger LOG = Logger.getLogger(RateLimiter.class);

    private final RateLimitAlgorithm<C> algorithm;
    private final C context;
    private final RateLimiterOptions options;
    private final UsageAnalytics analytics;
    private final DenyListService denyList;
    private final RateLimitMetrics metrics;
    private final Clock clock;

    protected RateLimiter(
            RateLimitAlgorithm<C> algorithm,
            C context,
            RateLimiterOptions options,
            UsageAnalytics analytics,
            DenyListService denyList,
            RateLimitMetrics metrics) {
        if (algorithm.requiresCache() && context.cache().isEmpty()) {
            throw new InvalidRateLimitConfigurationException(
                    algorithm.getClass().getSimpleName() + " requires an ephemeral cache");
        }
        this.algorithm = algorithm;
        this.context = context;
        this.options = options;
        this.analytics = analytics;
        this.denyList = denyList;
        this.metrics = metrics;
        this.clock = context.clock();
    }

    public Uni<RateLimitResponse> limit(String identifier) {
        return limit(identifier, LimitRequest.empty());
    }

    /**
     * Decide whether a request of {@code identifier} may proceed.
     *
     * @param identifier the rate-limited subject
     * @param request rate and deny-list candidates of this call
     * @return the decision; fails only when the store fails before the timeout
     */
    public Uni<RateLimitResponse> limit(String identifier, LimitRequest request) {
        return Uni.createFrom().deferred(() -> {
            final var candidates = request.candidates(identifier);

            final var cached = denyList.findCached(candidates);
            final Uni<RateLimitResponse> decision = cached.isPresent()
                    ? Uni.createFrom()
                            .item(RateLimitResponse.denied(
                                    algorithm.maxRequests(), cached.get().until(), cached.get().value()))
                    : decide(key(identifier), candidates, request.rate());

            return withTimeout(decision)
                    .map(response -> recordAnalytics(identifier, request, response))
                    .invoke(response -> metrics.recordDecision(options.prefix(), response));
        });
    }

    /**
     * Retry {@link #limit(String)} until it succeeds or {@code timeout} has passed, waiting for
     * the window to reset between attempts.
     *
     * @param identifier the rate-limited subject
     * @param timeout how long to keep trying; must be positive
     * @return the first successful response, or the last rejection once the deadline passed
     */
    public Uni<RateLimitResponse> blockUntilReady(String identifier, Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new InvalidRateLimitConfigurationException("timeout must be positive, got " + timeout);
        }
        return Uni.createFrom().deferred(() -> attempt(identifier, clock.millis() + timeout.toMillis()));
    }

    public Uni<RemainingTokens> getRemaining(String identifier) {
        return algorithm.getRemaining(context, key(identifier));
    }

    /**
     * Delete every stored window of the identifier and its local cache entries.
     */
    public Uni<Void> resetUsedTokens(String identifier) {
        final var key = key(identifier);
        LOG.debugv("Resetting used tokens of {0}", key);
        return algorithm.resetTokens(context, key);
    }

    public Uni<Map<String, UsageCounts>> getUsage(long sinceMillis) {
        return analytics.getUsage(sinceMillis);
    }

    public Uni<List<BucketAggregate>> getUsageOverTime(int bucketCount) {
        return analytics.getUsageOverTime(bucketCount);
    }

    public Uni<MostAllowedBlocked> getMostAllowedBlocked(int bucketCount) {
        return analytics.getMostAllowedBlocked(bucketCount);
    }

    public Uni<MostAllowedBlocked> getMostAllowedBlocked(int bucketCount, int top, int checkAtMost) {
        return analytics.getMostAllowedBlocked(bucketCount, top, checkAtMost);
    }

    /**
     * Replace the IP deny-list with the feed's list at {@code threshold}.
     *
     * @param threshold feed severity, 1 to 8
     * @return completion signal; fails when the feed or the store fails
     * @throws InvalidRateLimitConfigurationException if the threshold is out of range
     */
    public Uni<Void> updateDenyList(int threshold) {
        return denyList.updateIpDenyList(new DenyListThreshold(threshold));
    }

    public Uni<Void> disableDenyList() {
        return denyList.disableIpDenyList();
    }

    public Uni<Void> addToDenyList(String... values) {
        return denyList.add(Arrays.asList(values));
    }

    public Uni<Void> removeFromDenyList(String... values) {
        return denyList.remove(Arrays.asList(values));
    }

    public RateLimiterOptions options() {
        return options;
    }

    public C context() {
        return context;
    }

    public long maxRequests() {
        return algorithm.maxRequests();
    }

    private String key(String identifier) {
        return options.prefix() + ":" + identifier;
    }

    private Uni<RateLimitResponse> decide(String key, List<String> candidates, long rate) {
        final var verdict = algorithm.limit(context, key, rate);
        if (!options.protection()) {
            return verdict;
        }
        return Uni.combine()
                .all()
                .unis(verdict, denyList.check(candidates))
                .asTuple()
                .map(tuple -> applyDenyList(tuple.getItem1(), tuple.getItem2()));
    }

    private RateLimitResponse applyDenyList(RateLimitResponse verdict, DenyListCheck check) {
        var response = check.denied() ? verdict.deniedBy(check.firstDenied()) : verdict;
        if (check.refreshNeeded()) {
            LOG.debugv("IP deny-list of {0} expired, refreshing", options.prefix());
            final var refresh = denyList.refreshInBackground(options.denyListThreshold());
            response = response.withPending(Pending.all(response.pending(), refresh));
        }
        return response;
    }

    private Uni<RateLimitResponse> withTimeout(Uni<RateLimitResponse> decision) {
        if (options.timeout().isZero()) {
            return decision;
        }
        // the store call runs to completion even when the timeout wins
        final var inFlight = decision.memoize().indefinitely();
        inFlight.subscribe()
                .with(
                        response -> LOG.tracev("Decision for {0} settled", options.prefix()),
                        e -> LOG.debugv(e, "Decision for {0} failed", options.prefix()));
        return inFlight.ifNoItem().after(options.timeout()).recoverWithItem(() -> {
            metrics.recordTimeout(options.prefix());
            return RateLimitResponse.timedOut(algorithm.maxRequests(), algorithm.nextReset(clock.millis()));
        });
    }

    private RateLimitResponse recordAnalytics(String identifier, LimitRequest request, RateLimitResponse response) {
        if (!options.analytics()) {
            return response;
        }
        final var denied = response.hasReason(RateLimitReason.DENY_LIST);
        final var outcome =
                denied ? EventOutcome.DENIED : response.success() ? EventOutcome.ALLOWED : EventOutcome.RATE_LIMITED;
        final var event = new AnalyticsEvent(
                denied ? response.deniedValue().orElse(identifier) : identifier, clock.millis(), outcome, request.geo());

        final var recording = Uni.createFrom()
                .deferred(() -> analytics.record(event))
                .onFailure()
                .invoke(e -> metrics.recordAnalyticsFailure(options.prefix()));
        return response.withPending(Pending.all(response.pending(), Pending.start(recording, "analytics recording")));
    }

    private Uni<RateLimitResponse> attempt(String identifier, long deadline) {
        return limit(identifier).flatMap(response -> {
            if (response.success()) {
                return Uni.createFrom().item(response);
            }
            final var now = clock.millis();
            if (now >= deadline) {
                return Uni.createFrom().item(response);
            }
            final var wait = Math.max(1, Math.min(response.reset(), deadline) - now);
            return Uni.createFrom()
                    .voidItem()
                    .onItem()
                    .delayIt()
                    .by(Duration.ofMillis(wait))
                    .flatMap(ignored -> attempt(identifier, deadline));
        });
    }
}
