package warden.adapter.out.redis;

import java.util.ArrayList;
import java.util.List;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

/**
 * Runs {@link RedisScript}s as prepared procedures.
 *
 * <p>Scripts are invoked by digest with {@code EVALSHA}. When Redis answers
 * {@code NOSCRIPT} (first use, restart, {@code SCRIPT FLUSH}) the call is repeated with
 * {@code EVAL}, which also caches the script again.
 */
public class RedisScriptExecutor {

    private static final Logger LOG = Logger.getLogger(RedisScriptExecutor.class);

    private final ReactiveRedisDataSource redis;

    public RedisScriptExecutor(ReactiveRedisDataSource redis) {
        this.redis = redis;
    }

    /**
     * Run a script.
     *
     * @param script the script
     * @param keys values of {@code KEYS}
     * @param args values of {@code ARGV}
     * @return the script's reply
     */
    public Uni<Response> eval(RedisScript script, List<String> keys, List<String> args) {
        return redis.execute("EVALSHA", arguments(script.sha1(), keys, args))
                .onFailure(RedisScriptExecutor::isNoScript)
                .recoverWithUni(() -> {
                    LOG.debugv("Script {0} not cached by Redis, sending its source", script.name());
                    return redis.execute("EVAL", arguments(script.source(), keys, args));
                });
    }

    /**
     * Make sure Redis has a script cached, e.g. before pipelining {@code EVALSHA} calls.
     *
     * @param script the script
     * @return completion signal
     */
    public Uni<Void> load(RedisScript script) {
        return redis.execute("SCRIPT", "LOAD", script.source()).replaceWithVoid();
    }

    /**
     * Build an {@code EVALSHA} request for {@link #batch}.
     */
    public Request evalShaRequest(RedisScript script, List<String> keys, List<String> args) {
        final var request = Request.cmd(Command.EVALSHA);
        for (var argument : arguments(script.sha1(), keys, args)) {
            request.arg(argument);
        }
        return request;
    }

    /**
     * Send requests in one round trip.
     *
     * @param requests the requests
     * @return replies in request order
     */
    public Uni<List<Response>> batch(List<Request> requests) {
        return redis.getRedis().batch(requests);
    }

    /**
     * Run a plain command.
     */
    public Uni<Response> execute(String command, String... args) {
        return redis.execute(command, args);
    }

    static boolean isNoScript(Throwable failure) {
        return failure.getMessage() != null && failure.getMessage().contains("NOSCRIPT");
    }

    private static String[] arguments(String script, List<String> keys, List<String> args) {
        final var arguments = new ArrayList<String>(2 + keys.size() + args.size());
        arguments.add(script);
        arguments.add(String.valueOf(keys.size()));
        arguments.addAll(keys);
        arguments.addAll(args);
        return arguments.toArray(new String[0]);
    }
}
