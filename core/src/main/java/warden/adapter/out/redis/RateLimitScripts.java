package warden.adapter.out.redis;

/**
 * Lua procedures of {@link RedisRateLimitStore}.
 */
final class RateLimitScripts {

    private RateLimitScripts() {}

    /**
     * KEYS[1] window key; ARGV window millis, increment. Returns the counter.
     */
    static final RedisScript FIXED_WINDOW = RedisScript.of(
            "fixedWindow",
            """
            local key = KEYS[1]
            local window = ARGV[1]
            local incrementBy = ARGV[2]

            local used = redis.call("INCRBY", key, incrementBy)
            if used == tonumber(incrementBy) then
              redis.call("PEXPIRE", key, window)
            end
            return used
            """);

    /**
     * KEYS current, previous; ARGV tokens, now, window, increment. Returns the remaining
     * tokens, or -1 when rejected.
     */
    static final RedisScript SLIDING_WINDOW = RedisScript.of(
            "slidingWindow",
            """
            local currentKey = KEYS[1]
            local previousKey = KEYS[2]
            local tokens = tonumber(ARGV[1])
            local now = tonumber(ARGV[2])
            local window = tonumber(ARGV[3])
            local incrementBy = tonumber(ARGV[4])

            local current = tonumber(redis.call("GET", currentKey) or "0")
            local previous = tonumber(redis.call("GET", previousKey) or "0")
            local elapsed = (now % window) / window
            previous = math.floor((1 - elapsed) * previous)

            if previous + current + incrementBy > tokens then
              return -1
            end

            local updated = redis.call("INCRBY", currentKey, incrementBy)
            if updated == incrementBy then
              redis.call("PEXPIRE", currentKey, window * 2 + 1000)
            end
            return tokens - (updated + previous)
            """);

    /**
     * KEYS[1] bucket key; ARGV max tokens, interval, refill rate, now, increment.
     * Returns {remaining, next refill}; remaining is -1 for an empty bucket.
     */
    static final RedisScript TOKEN_BUCKET = RedisScript.of(
            "tokenBucket",
            """
            local key = KEYS[1]
            local maxTokens = tonumber(ARGV[1])
            local interval = tonumber(ARGV[2])
            local refillRate = tonumber(ARGV[3])
            local now = tonumber(ARGV[4])
            local incrementBy = tonumber(ARGV[5])

            local bucket = redis.call("HMGET", key, "refilledAt", "tokens")
            local refilledAt = now
            local tokens = maxTokens
            if bucket[1] and bucket[2] then
              refilledAt = tonumber(bucket[1])
              tokens = tonumber(bucket[2])
            end

            if now >= refilledAt + interval then
              local refills = math.floor((now - refilledAt) / interval)
              tokens = math.min(maxTokens, tokens + refills * refillRate)
              refilledAt = refilledAt + refills * interval
            end

            if tokens <= 0 and incrementBy > 0 then
              return {-1, refilledAt + interval}
            end

            local remaining = tokens - incrementBy
            local missing = math.max(0, maxTokens - remaining)
            local ttl = math.max(1, math.ceil(missing / refillRate)) * interval
            redis.call("HSET", key, "refilledAt", refilledAt, "tokens", remaining)
            redis.call("PEXPIRE", key, ttl)
            return {remaining, refilledAt + interval}
            """);

    /**
     * KEYS[1] window hash; ARGV request id, window, increment. Returns every field.
     */
    static final RedisScript RECORD_REQUEST = RedisScript.of(
            "recordRequest",
            """
            local key = KEYS[1]
            local requestId = ARGV[1]
            local window = ARGV[2]
            local incrementBy = ARGV[3]

            redis.call("HSET", key, requestId, incrementBy)
            local fields = redis.call("HGETALL", key)
            if #fields == 2 then
              redis.call("PEXPIRE", key, window)
            end
            return fields
            """);

    /**
     * KEYS current, previous hash; ARGV tokens, now, window, request id, increment.
     * Returns {current fields, previous fields, accepted 0/1}.
     */
    static final RedisScript RECORD_SLIDING_REQUEST = RedisScript.of(
            "recordSlidingRequest",
            """
            local currentKey = KEYS[1]
            local previousKey = KEYS[2]
            local tokens = tonumber(ARGV[1])
            local now = tonumber(ARGV[2])
            local window = tonumber(ARGV[3])
            local requestId = ARGV[4]
            local incrementBy = tonumber(ARGV[5])

            local function total(fields)
              local sum = 0
              for i = 2, #fields, 2 do
                sum = sum + tonumber(fields[i])
              end
              return sum
            end

            local current = redis.call("HGETALL", currentKey)
            local previous = redis.call("HGETALL", previousKey)
            local elapsed = (now % window) / window
            local weighted = math.floor((1 - elapsed) * total(previous))

            if weighted + total(current) + incrementBy > tokens then
              return {current, previous, 0}
            end

            redis.call("HSET", currentKey, requestId, incrementBy)
            if #current == 0 then
              redis.call("PEXPIRE", currentKey, window * 2 + 1000)
            end
            return {redis.call("HGETALL", currentKey), previous, 1}
            """);

    /**
     * KEYS[1] window hash; ARGV ttl, then field/value pairs.
     */
    static final RedisScript REPLICATE = RedisScript.of(
            "replicateRequests",
            """
            local key = KEYS[1]
            local ttl = ARGV[1]

            local existed = redis.call("EXISTS", key)
            for i = 2, #ARGV, 2 do
              redis.call("HSET", key, ARGV[i], ARGV[i + 1])
            end
            if existed == 0 then
              redis.call("PEXPIRE", key, ttl)
            end
            return existed
            """);

    /**
     * KEYS[1] glob pattern. Deletes every matching key.
     */
    static final RedisScript DELETE_MATCHING = RedisScript.of(
            "deleteMatching",
            """
            local pattern = KEYS[1]
            local cursor = "0"
            local deleted = 0
            repeat
              local result = redis.call("SCAN", cursor, "MATCH", pattern)
              cursor = result[1]
              for _, key in ipairs(result[2]) do
                redis.call("DEL", key)
                deleted = deleted + 1
              end
            until cursor == "0"
            return deleted
            """);
}
