package warden.adapter.out.redis;

/**
 * Lua procedures of {@link RedisAnalyticsStore}. Members are JSON objects decoded with
 * {@code cjson}; undecodable members are skipped.
 */
final class AnalyticsScripts {

    private AnalyticsScripts() {}

    static final RedisScript INCREMENT = RedisScript.of(
            "analyticsIncrement",
            """
            redis.call("ZINCRBY", KEYS[1], 1, ARGV[1])
            redis.call("PEXPIRE", KEYS[1], ARGV[2])
            return 1
            """);

    /**
     * KEYS[1] bucket; ARGV[1] field. Returns flat value/count pairs.
     */
    static final RedisScript AGGREGATE = RedisScript.of(
            "analyticsAggregate",
            """
            local key = KEYS[1]
            local field = ARGV[1]

            local data = redis.call("ZRANGE", key, 0, -1, "WITHSCORES")
            local counts = {}
            for i = 1, #data, 2 do
              local ok, obj = pcall(cjson.decode, data[i])
              if ok and type(obj) == "table" then
                local value = obj[field]
                if value ~= nil and value ~= cjson.null then
                  local group = tostring(value)
                  counts[group] = (counts[group] or 0) + tonumber(data[i + 1])
                end
              end
            end

            local result = {}
            for group, count in pairs(counts) do
              table.insert(result, group)
              table.insert(result, tostring(count))
            end
            return result
            """);

    /**
     * KEYS buckets. Returns flat identifier/allowed/blocked triples.
     */
    static final RedisScript ALLOWED_BLOCKED = RedisScript.of(
            "analyticsAllowedBlocked",
            """
            local usage = {}
            for _, key in ipairs(KEYS) do
              local data = redis.call("ZRANGE", key, 0, -1, "WITHSCORES")
              for i = 1, #data, 2 do
                local ok, obj = pcall(cjson.decode, data[i])
                if ok and type(obj) == "table" and obj["identifier"] ~= nil then
                  local id = tostring(obj["identifier"])
                  local entry = usage[id] or {0, 0}
                  local score = tonumber(data[i + 1])
                  if obj["success"] == true then
                    entry[1] = entry[1] + score
                  else
                    entry[2] = entry[2] + score
                  end
                  usage[id] = entry
                end
              end
            end

            local result = {}
            for id, entry in pairs(usage) do
              table.insert(result, id)
              table.insert(result, tostring(entry[1]))
              table.insert(result, tostring(entry[2]))
            end
            return result
            """);

    /**
     * KEYS buckets; ARGV top, check at most. Returns three flat member/score lists:
     * allowed, rate limited, denied.
     */
    static final RedisScript CLASSIFY = RedisScript.of(
            "analyticsClassify",
            """
            local top = tonumber(ARGV[1])
            local checkAtMost = tonumber(ARGV[2])

            local scores = {}
            for _, key in ipairs(KEYS) do
              local data = redis.call("ZRANGE", key, 0, -1, "WITHSCORES")
              for i = 1, #data, 2 do
                scores[data[i]] = (scores[data[i]] or 0) + tonumber(data[i + 1])
              end
            end

            local members = {}
            for member, score in pairs(scores) do
              table.insert(members, {member, score})
            end
            table.sort(members, function(a, b)
              if a[2] == b[2] then
                return a[1] < b[1]
              end
              return a[2] > b[2]
            end)

            local allowed, rateLimited, denied = {}, {}, {}
            local checked = 0
            for _, entry in ipairs(members) do
              if checked >= checkAtMost then
                break
              end
              if #allowed >= top * 2 and #rateLimited >= top * 2 and #denied >= top * 2 then
                break
              end
              checked = checked + 1

              local member = entry[1]
              local target = nil
              if string.find(member, '"success":true', 1, true) then
                target = allowed
              elseif string.find(member, '"success":false', 1, true) then
                target = rateLimited
              elseif string.find(member, '"success":"denied"', 1, true) then
                target = denied
              end
              if target ~= nil and #target < top * 2 then
                table.insert(target, member)
                table.insert(target, tostring(entry[2]))
              end
            end
            return {allowed, rateLimited, denied}
            """);
}
