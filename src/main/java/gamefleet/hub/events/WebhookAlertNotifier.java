package gamefleet.hub.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import gamefleet.hub.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Posts transitions to the configured webhook (Discord compatible {@code content} field).
 * Sends asynchronously and never retries.
 */
public final class WebhookAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertNotifier.class);

    private final SettingsService settings;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public WebhookAlertNotifier(SettingsService settings, HttpClient httpClient, ObjectMapper mapper, Duration timeout) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public void notify(TransitionEvent event) {
        send(event);
    }

    /**
     * @return the pending delivery, or a completed {@code false} when no webhook is configured
     */
    CompletableFuture<Boolean> send(TransitionEvent event) {
        Optional<String> url = settings.webhookUrl();
        if (url.isEmpty()) {
            log.debug("No webhook configured, skipping alert for spoke {}", event.spokeId());
            return CompletableFuture.completedFuture(false);
        }

        String body;
        try {
            body = mapper.writeValueAsString(payload(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize alert for spoke {}", event.spokeId(), e);
            return CompletableFuture.completedFuture(false);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url.get()))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        log.warn("Webhook rejected alert for spoke {}: HTTP {}", event.spokeId(), status);
                        return false;
                    }
                    return true;
                })
                .exceptionally(e -> {
                    log.warn("Webhook delivery failed for spoke {}: {}", event.spokeId(), e.getMessage());
                    return false;
                });
    }

    static Map<String, Object> payload(TransitionEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", message(event));
        payload.put("spokeId", event.spokeId());
        payload.put("spokeName", event.spokeName());
        payload.put("from", event.from().name());
        payload.put("to", event.to().name());
        payload.put("timestamp", event.timestamp().toString());
        return payload;
    }

    static String message(TransitionEvent event) {
        String prefix = switch (event.to()) {
            case OFFLINE -> "Spoke CRITICAL";
            case DEGRADED -> "Spoke Alert";
            case ONLINE, PENDING -> "Spoke Recovered";
        };
        String detail = event.to() == SpokeStatus.ONLINE && event.from() == SpokeStatus.PENDING
                ? "is ONLINE for the first time"
                : "went " + event.from() + " -> " + event.to();
        return prefix + ": " + event.spokeName() + " (" + event.spokeId() + ") " + detail;
    }
}
