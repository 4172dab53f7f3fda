package warden.adapter.out.redis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.vertx.mutiny.redis.client.Response;

/**
 * Conversions of Redis replies.
 */
final class RedisResponses {

    private RedisResponses() {}

    /**
     * Read an integer reply; nil reads as 0.
     */
    static long toLong(Response response) {
        if (response == null) {
            return 0;
        }
        final var text = response.toString();
        return text.contains(".") || text.contains("e") ? (long) Double.parseDouble(text) : Long.parseLong(text);
    }

    /**
     * Read a flat {@code field, value, field, value...} reply into a map.
     */
    static Map<String, Long> toLongMap(Response response) {
        final var map = new LinkedHashMap<String, Long>();
        if (response == null) {
            return map;
        }
        for (var i = 0; i + 1 < response.size(); i += 2) {
            map.put(response.get(i).toString(), toLong(response.get(i + 1)));
        }
        return map;
    }

    static List<String> toStrings(Response response) {
        final var strings = new ArrayList<String>();
        if (response == null) {
            return strings;
        }
        for (var i = 0; i < response.size(); i++) {
            strings.add(response.get(i).toString());
        }
        return strings;
    }
}
