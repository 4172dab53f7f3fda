package warden.core.model.analytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of a {@code limit} call as stored in analytics events.
 *
 * <p>The serialized {@code success} field is {@code true}, {@code false} or the string
 * {@code "denied"}.
 */
public enum EventOutcome {
    ALLOWED,
    RATE_LIMITED,
    DENIED;

    /** Field name of the outcome inside a serialized event. */
    public static final String FIELD = "success";

    /**
     * Write this outcome into an event node.
     *
     * @param node the event node
     */
    public void writeTo(ObjectNode node) {
        switch (this) {
            case ALLOWED -> node.put(FIELD, true);
            case RATE_LIMITED -> node.put(FIELD, false);
            case DENIED -> node.put(FIELD, "denied");
        }
    }

    /**
     * Read an outcome from a serialized {@code success} value.
     *
     * @param value the JSON value, or null when absent
     * @return the outcome; anything unrecognized counts as rate limited
     */
    public static EventOutcome fromJson(JsonNode value) {
        if (value == null || value.isNull()) {
            return RATE_LIMITED;
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? ALLOWED : RATE_LIMITED;
        }
        return "denied".equals(value.asText()) ? DENIED : RATE_LIMITED;
    }

    /**
     * Blocked outcomes are everything except {@link #ALLOWED}.
     *
     * @return true if the request was not allowed
     */
    public boolean blocked() {
        return this != ALLOWED;
    }
}
