package gamefleet.hub.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import gamefleet.hub.model.Command;
import gamefleet.hub.model.Spoke;
import gamefleet.protocol.CommandReport;
import gamefleet.protocol.CommandRequest;
import gamefleet.protocol.StatusReport;
import gamefleet.security.RequestSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link SpokeClient} over the JDK HTTP client. Requests carry signed headers
 * derived from the spoke's API key hash.
 */
public final class HttpSpokeClient implements SpokeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpSpokeClient.class);

    private final HttpClient httpClient;
    private final RequestSigner signer;
    private final ObjectMapper mapper;

    public HttpSpokeClient(HttpClient httpClient, RequestSigner signer, ObjectMapper mapper) {
        this.httpClient = httpClient;
        this.signer = signer;
        this.mapper = mapper;
    }

    @Override
    public StatusReport status(Spoke spoke, Duration timeout) throws SpokeCallException {
        String body = call(spoke, "GET", "/v1/status", null, timeout);
        return parse(body, StatusReport.class);
    }

    @Override
    public CommandReport sendCommand(Spoke spoke, Command command, Duration timeout) throws SpokeCallException {
        CommandRequest request = new CommandRequest(command.id(), command.targetInstance(), command.action());
        String json;
        try {
            json = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize command " + command.id(), e);
        }
        String body = call(spoke, "POST", "/v1/commands", json, timeout);
        return parse(body, CommandReport.class);
    }

    @Override
    public CommandReport commandStatus(Spoke spoke, String commandId, Duration timeout) throws SpokeCallException {
        String path = "/v1/commands/" + URLEncoder.encode(commandId, StandardCharsets.UTF_8);
        String body = call(spoke, "GET", path, null, timeout);
        return parse(body, CommandReport.class);
    }

    private String call(Spoke spoke, String method, String path, String json, Duration timeout)
            throws SpokeCallException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(spoke.baseUrl() + path))
                .timeout(timeout)
                .header("Accept", "application/json");
        signer.headers(spoke.apiKeyHash(), spoke.id(), method, path).forEach(builder::header);
        if (json != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(json));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SpokeCallException(SpokeCallException.Reason.TIMEOUT,
                    method + " " + path + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new SpokeCallException(SpokeCallException.Reason.CONNECTION,
                    method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpokeCallException(SpokeCallException.Reason.CONNECTION,
                    method + " " + path + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String message = errorMessage(response.body());
            log.debug("Spoke {} rejected {} {}: {} {}", spoke.id(), method, path, status, message);
            throw new SpokeCallException(status, message);
        }
        return response.body();
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node.hasNonNull("message")) {
                return node.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            // not JSON, use the raw text
        }
        return body.length() > 512 ? body.substring(0, 512) : body;
    }

    private <T> T parse(String body, Class<T> type) throws SpokeCallException {
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new SpokeCallException(SpokeCallException.Reason.CONNECTION,
                    "unreadable " + type.getSimpleName() + " from spoke", e);
        }
    }
}
