package warden.adapter.out.http;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.core.model.denylist.DenyListFeedException;
import warden.core.model.denylist.DenyListThreshold;
import warden.core.port.out.DenyListFeed;

/**
 * Fetches denied IP addresses from a plain-text feed with one address per line, such as
 * the ipsum lists.
 *
 * <p>The URL template contains {@code {threshold}}, replaced with the severity level.
 * Blank lines and {@code #} comments are skipped.
 */
public class IpsumDenyListFeed implements DenyListFeed {

    private static final Logger LOG = Logger.getLogger(IpsumDenyListFeed.class);

    public static final String DEFAULT_URL =
            "https://raw.githubusercontent.com/stamparm/ipsum/master/levels/{threshold}.txt";

    private final WebClient webClient;
    private final String urlTemplate;
    private final Duration timeout;

    public IpsumDenyListFeed(Vertx vertx, String urlTemplate, Duration timeout) {
        this(WebClient.create(vertx), urlTemplate, timeout);
    }

    public IpsumDenyListFeed(WebClient webClient, String urlTemplate, Duration timeout) {
        this.webClient = webClient;
        this.urlTemplate = urlTemplate;
        this.timeout = timeout;
    }

    @Override
    public Uni<List<String>> fetch(DenyListThreshold threshold) {
        final var url = urlTemplate.replace("{threshold}", String.valueOf(threshold.level()));
        LOG.debugf("Fetching deny-list from %s", url);

        return webClient
                .getAbs(url)
                .timeout(timeout.toMillis())
                .send()
                .onFailure()
                .transform(error -> error instanceof DenyListFeedException ? error : new DenyListFeedException(url, error))
                .flatMap(response -> parse(url, response));
    }

    private Uni<List<String>> parse(String url, HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.warnf("Deny-list feed %s returned status %d", url, response.statusCode());
            return Uni.createFrom().failure(new DenyListFeedException(url, response.statusCode()));
        }
        final var body = response.bodyAsString();
        if (body == null) {
            return Uni.createFrom().item(List.of());
        }
        return Uni.createFrom().item(parseLines(body));
    }

    static List<String> parseLines(String body) {
        return Arrays.stream(body.split("\\r?\\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
    }
}
