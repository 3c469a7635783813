package gamefleet.spoke;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import gamefleet.protocol.AnnounceRequest;
import gamefleet.security.RequestSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tells the hub the agent is up, so it is probed right away instead of on the next tick.
 * POST {hubUrl}/internal/v1/spokes/{id}/announce (signed)
 */
public final class HubAnnouncer {

    private static final Logger log = LoggerFactory.getLogger(HubAnnouncer.class);

    static final String VERSION = "1.0.0";
    private static final int ATTEMPTS = 3;

    private final HttpClient httpClient;
    private final RequestSigner signer;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final Duration retryDelay;

    public HubAnnouncer(HttpClient httpClient, RequestSigner signer, ObjectMapper mapper,
            Duration timeout, Duration retryDelay) {
        this.httpClient = httpClient;
        this.signer = signer;
        this.mapper = mapper;
        this.timeout = timeout;
        this.retryDelay = retryDelay;
    }

    /**
     * @return completes with true once the hub accepted the announcement, false after the last failed attempt
     */
    public CompletableFuture<Boolean> announce(String hubUrl, String spokeId, String apiKeyHash, int port) {
        if (hubUrl == null || hubUrl.isBlank() || spokeId == null || spokeId.isBlank()) {
            log.info("HUB_URL or SPOKE_ID not set; skipping announcement");
            return CompletableFuture.completedFuture(false);
        }
        String path = "/internal/v1/spokes/" + spokeId + "/announce";
        String base = hubUrl.endsWith("/") ? hubUrl.substring(0, hubUrl.length() - 1) : hubUrl;
        String body;
        try {
            body = mapper.writeValueAsString(new AnnounceRequest(VERSION, port));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode announcement", e);
        }
        return attempt(URI.create(base + path), path, spokeId, apiKeyHash, body, 1);
    }

    private CompletableFuture<Boolean> attempt(URI uri, String path, String spokeId, String apiKeyHash,
            String body, int attempt) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        signer.headers(apiKeyHash, spokeId, "POST", path).forEach(builder::header);

        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error == null && response.statusCode() / 100 == 2) {
                        log.info("Announced to hub at {}", uri.getHost());
                        return CompletableFuture.completedFuture(true);
                    }
                    String reason = error != null ? error.getMessage() : "HTTP " + response.statusCode();
                    if (attempt >= ATTEMPTS) {
                        log.warn("Hub announcement failed after {} attempts: {}", attempt, reason);
                        return CompletableFuture.completedFuture(false);
                    }
                    log.debug("Hub announcement attempt {} failed: {}", attempt, reason);
                    return CompletableFuture.supplyAsync(() -> null,
                                    CompletableFuture.delayedExecutor(retryDelay.toMillis(), TimeUnit.MILLISECONDS))
                            .thenCompose(ignored -> attempt(uri, path, spokeId, apiKeyHash, body, attempt + 1));
                })
                .thenCompose(next -> next);
    }
}
