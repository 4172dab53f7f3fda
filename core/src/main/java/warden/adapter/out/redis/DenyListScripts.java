package warden.adapter.out.redis;

/**
 * Lua procedures of {@link RedisDenyListStore}.
 */
final class DenyListScripts {

    private DenyListScripts() {}

    /**
     * KEYS status, all; ARGV candidates. Returns {denied candidates, status TTL}.
     */
    static final RedisScript CHECK = RedisScript.of(
            "denyListCheck",
            """
            local statusKey = KEYS[1]
            local allKey = KEYS[2]

            local denied = {}
            for i = 1, #ARGV do
              if redis.call("SISMEMBER", allKey, ARGV[i]) == 1 then
                table.insert(denied, ARGV[i])
              end
            end

            local ttl = redis.call("TTL", statusKey)
            if ttl == -2 then
              redis.call("SET", statusKey, "pending", "EX", 30)
            end
            return {denied, ttl}
            """);

    /**
     * KEYS all, ip, status; ARGV ttl millis, then the fetched addresses.
     */
    static final RedisScript REPLACE_IP = RedisScript.of(
            "denyListReplaceIp",
            """
            local allKey = KEYS[1]
            local ipKey = KEYS[2]
            local statusKey = KEYS[3]
            local ttl = ARGV[1]

            redis.call("SDIFFSTORE", allKey, allKey, ipKey)
            redis.call("DEL", ipKey)
            for i = 2, #ARGV, 5000 do
              redis.call("SADD", ipKey, unpack(ARGV, i, math.min(i + 4999, #ARGV)))
            end
            redis.call("SDIFFSTORE", ipKey, ipKey, allKey)
            redis.call("SUNIONSTORE", allKey, allKey, ipKey)
            redis.call("SET", statusKey, "valid", "PX", ttl)
            return 1
            """);

    /**
     * KEYS all, ip, status.
     */
    static final RedisScript DISABLE_IP = RedisScript.of(
            "denyListDisableIp",
            """
            redis.call("SDIFFSTORE", KEYS[1], KEYS[1], KEYS[2])
            redis.call("DEL", KEYS[2])
            redis.call("SET", KEYS[3], "disabled")
            return 1
            """);

    /**
     * KEYS all, ip; ARGV values. Adds to all and makes the values manual.
     */
    static final RedisScript ADD = RedisScript.of(
            "denyListAdd",
            """
            for i = 1, #ARGV, 5000 do
              local last = math.min(i + 4999, #ARGV)
              redis.call("SADD", KEYS[1], unpack(ARGV, i, last))
              redis.call("SREM", KEYS[2], unpack(ARGV, i, last))
            end
            return #ARGV
            """);

    /**
     * KEYS all, ip; ARGV values.
     */
    static final RedisScript REMOVE = RedisScript.of(
            "denyListRemove",
            """
            for i = 1, #ARGV, 5000 do
              local last = math.min(i + 4999, #ARGV)
              redis.call("SREM", KEYS[1], unpack(ARGV, i, last))
              redis.call("SREM", KEYS[2], unpack(ARGV, i, last))
            end
            return #ARGV
            """);
}
