package warden.adapter.out.redis;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * A Lua script with the SHA-1 digest Redis caches it under.
 *
 * @param name short name for log messages
 * @param source the Lua source
 * @param sha1 lowercase hex SHA-1 of the source
 */
public record RedisScript(String name, String source, String sha1) {

    /**
     * Create a script, computing its digest.
     *
     * @param name short name for log messages
     * @param source the Lua source
     * @return the script
     */
    public static RedisScript of(String name, String source) {
        return new RedisScript(name, source, sha1(source));
    }

    static String sha1(String source) {
        try {
            final var digest = MessageDigest.getInstance("SHA-1").digest(source.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
