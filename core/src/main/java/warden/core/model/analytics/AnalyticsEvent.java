package warden.core.model.analytics;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single usage event.
 *
 * <p>The time is only used to pick the bucket; it is not part of the stored member, so
 * identical events in the same bucket collapse into one member with a higher score.
 *
 * @param identifier the rate-limited identifier, or the denied value for deny-list rejections
 * @param time epoch millis of the decision
 * @param outcome the decision outcome
 * @param geo optional geo context
 */
public record AnalyticsEvent(String identifier, long time, EventOutcome outcome, Optional<Geo> geo) {

    public AnalyticsEvent {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        geo = Objects.requireNonNullElse(geo, Optional.empty());
    }

    /**
     * Serialize the event without its time field.
     *
     * @param mapper the mapper creating the node
     * @return the member node
     */
    public ObjectNode toMember(ObjectMapper mapper) {
        final var node = mapper.createObjectNode();
        node.put("identifier", identifier);
        outcome.writeTo(node);
        geo.ifPresent(g -> {
            putIfPresent(node, "country", g.country());
            putIfPresent(node, "region", g.region());
            putIfPresent(node, "city", g.city());
            putIfPresent(node, "ip", g.ip());
        });
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
